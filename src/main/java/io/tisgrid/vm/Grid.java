package io.tisgrid.vm;

import io.tisgrid.vm.AstNode.Program;
import io.tisgrid.vm.AstNode.SingleNodeProgram;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The grid of programmed nodes. One {@link #tick()} steps every node once,
 * in ascending id order. The order is part of the semantics: a value sent
 * during a tick reaches a receiver in that same tick only if the receiver
 * was already parked and is stepped after the sender.
 */
public class Grid {
    private static final Logger logger = LogManager.getLogger();

    private final int height;
    private final int width;
    private final Map<Integer, Node> nodes;
    private long tickCount;

    /**
     * Builds one node per programmed id. Cells without a program have no
     * node and never accept a value.
     *
     * @throws SemanticException if any node's program does not validate
     */
    public Grid(Program program, int height, int width) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Grid must be at least 1x1, got " + height + "x" + width);
        }
        this.height = height;
        this.width = width;
        Map<Integer, Node> built = new TreeMap<>();
        for (Map.Entry<Integer, SingleNodeProgram> e : program.nodesById().entrySet()) {
            int id = e.getKey();
            if (id >= height * width) {
                throw new TisException("Node @" + id + " is outside the " + height + "x" + width + " grid");
            }
            built.put(id, new Node(id, height, width, e.getValue()));
        }
        this.nodes = Collections.unmodifiableMap(built);
        logger.info("Built {}x{} grid with {} programmed node(s)", height, width, nodes.size());
    }

    public void tick() {
        for (Node node : nodes.values()) {
            node.step(nodes);
        }
        tickCount++;
        logger.trace("Tick {} done", tickCount);
    }

    public void run(long ticks) {
        for (long i = 0; i < ticks; i++) {
            tick();
        }
    }

    /** The node with the given id, or null if that cell has no program. */
    public Node node(int id) {
        return nodes.get(id);
    }

    /** Programmed nodes in visitation order. */
    public Map<Integer, Node> nodes() {
        return nodes;
    }

    public long tickCount() { return tickCount; }

    public int height() { return height; }

    public int width() { return width; }

    /** True when every node is parked on a port. */
    public boolean allBlocked() {
        for (Node node : nodes.values()) {
            if (!node.isBlocked()) {
                return false;
            }
        }
        return true;
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Grid ").append(height).append('x').append(width)
          .append(" after ").append(tickCount).append(" tick(s)");
        for (Node node : nodes.values()) {
            sb.append('\n').append(node.describe());
        }
        return sb.toString();
    }
}
