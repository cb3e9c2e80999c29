package io.tisgrid.vm;

import io.tisgrid.vm.AstNode.*;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * One grid cell: a program, eight accumulator/backup register pairs, an
 * instruction pointer and the state of the port handshake.
 *
 * <p>Each call to {@link #step(Map)} either completes one instruction or
 * makes no progress because the node is parked on a port. Transfers are
 * unbuffered: a send only completes when the neighbor is already parked
 * receiving from the matching direction (or from ANY). A send that finds
 * its receiver not yet parked is retried on the sender's next step.
 */
public class Node {
    private static final Logger logger = LogManager.getLogger();

    public static final int REGISTER_PAIRS = 8;

    /** A value travelling through a port. */
    public static final class Transfer {
        private final Port port;
        private final long value;

        public Transfer(Port port, long value) {
            this.port = port;
            this.value = value;
        }

        public Port port() { return port; }

        public long value() { return value; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Transfer)) return false;
            Transfer other = (Transfer) o;
            return port == other.port && value == other.value;
        }

        @Override public int hashCode() { return 31 * port.hashCode() + Long.hashCode(value); }

        @Override public String toString() { return "(" + port + ", " + value + ")"; }
    }

    private final int id;
    private final Map<Port, Integer> neighbors = new EnumMap<>(Port.class);

    private final List<AstNode> statements;
    private final Map<String, Integer> labels;
    // instruction ordinal -> statement index, and back (-1 for labels)
    private final int[] instructionIndex;
    private final int[] instructionOrdinal;

    private int ip;
    private final long[] accs = new long[REGISTER_PAIRS];
    private final long[] baks = new long[REGISTER_PAIRS];
    private int registerCursor;

    private Transfer pendingSend;
    private Port pendingReceive;
    private Transfer delivered;
    private Port lastPort;

    // The grid being stepped, valid for the duration of one step call
    private Map<Integer, Node> nodes;

    /**
     * @throws SemanticException if the program does not validate
     */
    public Node(int id, int gridHeight, int gridWidth, SingleNodeProgram program) {
        this.id = id;
        int cells = gridWidth * gridHeight;
        neighbors.put(Port.UP, id - gridWidth >= 0 ? id - gridWidth : null);
        neighbors.put(Port.DOWN, id + gridWidth < cells ? id + gridWidth : null);
        neighbors.put(Port.LEFT, id > 0 && id % gridWidth != 0 ? id - 1 : null);
        neighbors.put(Port.RIGHT, id + 1 < cells && (id + 1) % gridWidth != 0 ? id + 1 : null);

        this.statements = program.statements();
        this.instructionOrdinal = new int[statements.size()];
        int count = 0;
        for (int i = 0; i < statements.size(); i++) {
            instructionOrdinal[i] = statements.get(i).kind() == AstNode.Kind.INSTRUCTION ? count++ : -1;
        }
        this.instructionIndex = new int[count];
        for (int i = 0; i < statements.size(); i++) {
            if (instructionOrdinal[i] >= 0) {
                instructionIndex[instructionOrdinal[i]] = i;
            }
        }

        try {
            this.labels = Validator.labelTable(program);
            Validator.validate(program, labels);
        } catch (SemanticException e) {
            throw e.atNode(id);
        }
    }

    // --- Stepping ---

    /**
     * Runs one tick of this node against the given grid. Labels cost no
     * time: they are skipped within the same call, at most once around the
     * program, so a program of only labels makes no progress.
     */
    public void step(Map<Integer, Node> nodes) {
        this.nodes = nodes;
        if (pendingReceive != null) {
            if (delivered != null && execute(currentInstruction())) {
                advance();
            }
            return;
        }
        if (pendingSend != null) {
            if (trySend(pendingSend.port, pendingSend.value)) {
                logger.trace("Node {} delivered pending {}", id, pendingSend);
                pendingSend = null;
                advance();
            }
            return;
        }
        for (int i = 0; i < statements.size(); i++) {
            AstNode statement = statements.get(ip);
            if (statement.kind() == AstNode.Kind.LABEL) {
                advance();
            } else if (statement.kind() == AstNode.Kind.INSTRUCTION) {
                if (execute((Instruction) statement)) {
                    advance();
                }
                return;
            } else {
                throw new ExecutionException("Invalid code: " + statement, id, ip);
            }
        }
    }

    private Instruction currentInstruction() {
        AstNode statement = statements.get(ip);
        if (statement.kind() != AstNode.Kind.INSTRUCTION) {
            throw new ExecutionException("Parked on a statement that is not an instruction: " + statement, id, ip);
        }
        return (Instruction) statement;
    }

    private void advance() {
        ip++;
        if (ip >= statements.size()) {
            ip = 0;
        }
    }

    /** Runs one instruction. Returns false if it is parked on a port. */
    private boolean execute(Instruction instr) {
        return switch (instr.op()) {
            case MOV -> mov(instr);
            case ADD -> add(instr);
            case SUB -> sub(instr);
            case SWT -> swt(instr);
            case JRO -> jro(instr);
            case SAV -> {
                baks[registerCursor] = accs[registerCursor];
                yield true;
            }
            case SWP -> {
                long tmp = accs[registerCursor];
                accs[registerCursor] = baks[registerCursor];
                baks[registerCursor] = tmp;
                yield true;
            }
            case NEG -> {
                accs[registerCursor] = -accs[registerCursor];
                yield true;
            }
            case NOP -> true;
            case JMP -> jump(instr);
            case JEZ -> accs[registerCursor] == 0 ? jump(instr) : true;
            case JNZ -> accs[registerCursor] != 0 ? jump(instr) : true;
            case JGZ -> accs[registerCursor] > 0 ? jump(instr) : true;
            case JLZ -> accs[registerCursor] < 0 ? jump(instr) : true;
            case HCF -> throw new ExecutionException("hcf reached execution", id, ip);
        };
    }

    // --- Instructions ---

    private boolean mov(Instruction instr) {
        Long value = read(instr.arg(0));
        if (value == null) {
            return false;
        }
        AstNode dst = instr.arg(1);
        if (dst.kind() == AstNode.Kind.PORT_LITERAL) {
            return send(((PortLiteral) dst).port(), value);
        }
        accs[registerCursor] = value;
        return true;
    }

    private boolean add(Instruction instr) {
        if (instr.arg(0).kind() == AstNode.Kind.REGISTER_LITERAL) {
            accs[registerCursor] *= 2;
            return true;
        }
        Long value = read(instr.arg(0));
        if (value == null) {
            return false;
        }
        accs[registerCursor] += value;
        return true;
    }

    private boolean sub(Instruction instr) {
        if (instr.arg(0).kind() == AstNode.Kind.REGISTER_LITERAL) {
            accs[registerCursor] = 0;
            return true;
        }
        Long value = read(instr.arg(0));
        if (value == null) {
            return false;
        }
        accs[registerCursor] -= value;
        return true;
    }

    private boolean swt(Instruction instr) {
        Long value = read(instr.arg(0));
        if (value == null) {
            return false;
        }
        if (value < 0 || value >= REGISTER_PAIRS) {
            throw new SemanticException(String.format(
                    "SWT operand was not in the valid range of registers. Range is 0-%d inclusive, operand was %d.",
                    REGISTER_PAIRS - 1, value), id, ip);
        }
        registerCursor = value.intValue();
        return true;
    }

    private boolean jump(Instruction instr) {
        // Land on the label; the completion step moves past it
        ip = labels.get(((LabelReference) instr.arg(0)).name());
        return true;
    }

    private boolean jro(Instruction instr) {
        Long value = read(instr.arg(0));
        if (value == null) {
            return false;
        }
        // Clamp the offset first so that adding it cannot overflow
        long offset = Math.max(-instructionIndex.length, Math.min(instructionIndex.length, value));
        long target = Math.max(0, Math.min(instructionIndex.length - 1, instructionOrdinal[ip] + offset));
        // One before the target: the completion step advances onto it
        ip = instructionIndex[(int) target] - 1;
        return true;
    }

    // --- Ports ---

    /** Value of a source operand, or null if the node is now parked waiting for it. */
    private Long read(AstNode operand) {
        switch (operand.kind()) {
            case INTEGER_LITERAL:
                return ((IntegerLiteral) operand).value();
            case REGISTER_LITERAL:
                return accs[registerCursor];
            case PORT_LITERAL:
                return receive(((PortLiteral) operand).port());
            default:
                throw new ExecutionException("Not a source operand: " + operand, id, ip);
        }
    }

    private Long receive(Port port) {
        if (pendingReceive != null) {
            if (delivered == null) {
                return null;
            }
            long value = delivered.value;
            lastPort = delivered.port;
            logger.trace("Node {} received {} from {}", id, value, lastPort);
            pendingReceive = null;
            delivered = null;
            return value;
        }
        if (port == Port.NIL) {
            return 0L;
        }
        if (port == Port.LAST && lastPort != null) {
            port = lastPort;
        }
        // An unresolved LAST parks for good: no sender ever matches it
        pendingReceive = port;
        logger.trace("Node {} parked receiving on {}", id, port);
        return null;
    }

    /** Sends a value, recording it as pending if it cannot be delivered now. */
    private boolean send(Port port, long value) {
        if (trySend(port, value)) {
            return true;
        }
        pendingSend = new Transfer(port, value);
        logger.trace("Node {} parked sending {}", id, pendingSend);
        return false;
    }

    private boolean trySend(Port port, long value) {
        switch (port) {
            case NIL:
                return true;
            case LAST:
                return lastPort != null && trySend(lastPort, value);
            case ANY:
                for (Port direction : Port.ANY_ORDER) {
                    if (deliver(direction, value)) {
                        return true;
                    }
                }
                return false;
            default:
                return deliver(port, value);
        }
    }

    private boolean deliver(Port direction, long value) {
        Integer targetId = neighbors.get(direction);
        if (targetId == null || nodes == null) {
            return false;
        }
        Node target = nodes.get(targetId);
        if (target == null || target.delivered != null) {
            return false;
        }
        Port from = direction.mirror();
        if (target.pendingReceive == Port.ANY || target.pendingReceive == from) {
            target.delivered = new Transfer(from, value);
            return true;
        }
        return false;
    }

    // --- State for display and drivers ---

    public int id() { return id; }

    /** Neighbor id in a direction, or null at the grid edge. */
    public Integer neighborId(Port direction) {
        if (!direction.isDirection()) {
            throw new IllegalArgumentException(direction + " is not a direction");
        }
        return neighbors.get(direction);
    }

    public int instructionPointer() { return ip; }

    /** The statement at the instruction pointer, or null for an empty program. */
    public AstNode currentStatement() {
        return statements.isEmpty() ? null : statements.get(ip);
    }

    public List<AstNode> statements() { return statements; }

    public Map<String, Integer> labelTable() { return labels; }

    public int registerCursor() { return registerCursor; }

    /** Accumulator of the active register pair. */
    public long acc() { return accs[registerCursor]; }

    /** Backup register of the active register pair. */
    public long bak() { return baks[registerCursor]; }

    public long[] accs() { return accs.clone(); }

    public long[] baks() { return baks.clone(); }

    public Transfer pendingSend() { return pendingSend; }

    public Port pendingReceive() { return pendingReceive; }

    public Transfer deliveredValue() { return delivered; }

    public Port lastPort() { return lastPort; }

    public boolean isBlocked() {
        return pendingSend != null || pendingReceive != null;
    }

    public String describe() {
        return "Node " + id
                + "\n\tport ids: up: " + neighbors.get(Port.UP) + ", down: " + neighbors.get(Port.DOWN)
                + ", left: " + neighbors.get(Port.LEFT) + ", right: " + neighbors.get(Port.RIGHT)
                + "\n\taccs: " + Arrays.toString(accs)
                + "\n\tbaks: " + Arrays.toString(baks)
                + "\n\tregister cursor: " + registerCursor
                + "\n\tpending send: " + pendingSend
                + "\n\tpending receive: " + pendingReceive
                + "\n\tdelivered: " + delivered
                + "\n\tlast port: " + lastPort
                + "\n\tinstruction pointer: " + ip
                + "\n\tcurrent statement: " + currentStatement();
    }

    @Override
    public String toString() {
        return "Node " + id + " [ip=" + ip + ", acc=" + acc() + ", bak=" + bak() + "]";
    }
}
