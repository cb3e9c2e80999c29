package io.tisgrid.vm;

/**
 * The engine reached a state a validated program cannot produce. This is a
 * defect in the engine, not an error in the user's program.
 */
public class ExecutionException extends TisException {
    private final int nodeId;
    private final int instructionPointer;

    public ExecutionException(String message, int nodeId, int instructionPointer) {
        super("Node " + nodeId + ", instruction pointer " + instructionPointer + ": " + message);
        this.nodeId = nodeId;
        this.instructionPointer = instructionPointer;
    }

    public int nodeId() { return nodeId; }

    public int instructionPointer() { return instructionPointer; }
}
