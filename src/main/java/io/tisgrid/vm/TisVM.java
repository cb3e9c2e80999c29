package io.tisgrid.vm;

import io.tisgrid.vm.AstNode.Program;

/**
 * Entry point: parses source text and builds a runnable grid from it.
 */
public class TisVM {

    public static final int DEFAULT_HEIGHT = 4;
    public static final int DEFAULT_WIDTH = 5;

    /**
     * Parse source text into one program per node. Never returns a partially
     * valid program.
     *
     * @throws LexException on characters no token rule matches
     * @throws ParseException on grammar violations
     */
    public static Program parse(String source) {
        return Parser.parse(source);
    }

    /**
     * Parse and validate source text and build the grid of nodes.
     *
     * @throws SemanticException if any node's program does not validate
     */
    public static Grid load(String source, int height, int width) {
        return new Grid(parse(source), height, width);
    }

    public static Grid load(String source) {
        return load(source, DEFAULT_HEIGHT, DEFAULT_WIDTH);
    }
}
