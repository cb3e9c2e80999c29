package io.tisgrid.vm;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Arrays;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Headless driver: loads a source file, builds the grid and steps it.
 *
 * Usage:
 *   java -cp target/classes io.tisgrid.vm.GridRunner \
 *     --source program.tis [--width 5] [--height 4] [--ticks 100] [--quiet] [--dump-ast]
 *
 * By default every tick prints each node's registers. With --quiet only a
 * final summary and the tick rate are printed.
 */
public class GridRunner {
    private static final Logger logger = LogManager.getLogger();

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /** Runs the driver and returns the process exit code. */
    static int run(String[] args, PrintStream out) {
        String sourcePath = null;
        int width = TisVM.DEFAULT_WIDTH;
        int height = TisVM.DEFAULT_HEIGHT;
        long ticks = 100;
        boolean quiet = false;
        boolean dumpAst = false;

        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--source":
                        sourcePath = args[++i];
                        break;
                    case "--width":
                        width = Integer.parseInt(args[++i]);
                        break;
                    case "--height":
                        height = Integer.parseInt(args[++i]);
                        break;
                    case "--ticks":
                        ticks = Long.parseLong(args[++i]);
                        break;
                    case "--quiet":
                        quiet = true;
                        break;
                    case "--dump-ast":
                        dumpAst = true;
                        break;
                    default:
                        System.err.println("Unknown argument: " + args[i]);
                        printUsage();
                        return 1;
                }
            }
        } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
            System.err.println("Bad or missing argument value: " + e.getMessage());
            printUsage();
            return 1;
        }

        if (width <= 0 || height <= 0) {
            System.err.println("Grid must be at least 1x1, got " + height + "x" + width);
            printUsage();
            return 1;
        }

        if (sourcePath == null) {
            printUsage();
            return 1;
        }

        String source;
        try {
            source = new String(Files.readAllBytes(Paths.get(sourcePath)), StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.error("File {} could not be opened", sourcePath, e);
            return 1;
        }

        Grid grid;
        try {
            if (dumpAst) {
                out.println(AstJson.toJson(TisVM.parse(source)));
                return 0;
            }
            grid = TisVM.load(source, height, width);
        } catch (TisException e) {
            logger.error("Program rejected: {}", e.getMessage());
            return 2;
        }

        out.println("Node grid shape is: " + height + " * " + width);
        for (int row = 0; row < height; row++) {
            StringBuilder line = new StringBuilder();
            for (int col = 0; col < width; col++) {
                if (col > 0) line.append(", ");
                line.append(row * width + col);
            }
            out.println(line);
        }

        long start = System.nanoTime();
        try {
            for (long t = 0; t < ticks; t++) {
                grid.tick();
                if (!quiet) {
                    printTick(grid, out);
                }
            }
        } catch (TisException e) {
            logger.error("Stopped at tick {}: {}", grid.tickCount() + 1, e.getMessage());
            out.println(grid.describe());
            return 3;
        }
        double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;

        out.println(grid.describe());
        out.printf("%d tick(s) took %.2f ms (%.0f Hz)%n", grid.tickCount(), elapsedMs,
                elapsedMs > 0 ? grid.tickCount() / (elapsedMs / 1000.0) : 0.0);
        if (grid.allBlocked()) {
            out.println("Every node is parked on a port.");
        }
        return 0;
    }

    private static void printTick(Grid grid, PrintStream out) {
        out.println("Tick " + grid.tickCount() + ":");
        for (Node node : grid.nodes().values()) {
            out.println("  Accs and baks in node " + node.id() + ": " + Arrays.toString(node.accs())
                    + " | " + Arrays.toString(node.baks())
                    + "  current: " + node.acc() + " | " + node.bak()
                    + (node.isBlocked() ? "  (blocked)" : ""));
        }
    }

    private static void printUsage() {
        System.err.println("Usage: java io.tisgrid.vm.GridRunner --source <file> [--width <n>] [--height <n>]"
                + " [--ticks <n>] [--quiet] [--dump-ast]");
    }
}
