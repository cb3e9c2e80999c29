package io.tisgrid.vm;

/**
 * Valid syntax with invalid meaning: wrong operand count or kind, an
 * unresolved label, {@code hcf}, or an out of range {@code swt} target.
 */
public class SemanticException extends TisException {
    public static final int UNKNOWN_NODE = -1;

    private final int nodeId;
    private final int statementIndex;
    private final String reason;

    public SemanticException(String reason, int statementIndex) {
        this(reason, UNKNOWN_NODE, statementIndex);
    }

    public SemanticException(String reason, int nodeId, int statementIndex) {
        super(format(reason, nodeId, statementIndex));
        this.reason = reason;
        this.nodeId = nodeId;
        this.statementIndex = statementIndex;
    }

    /** Same error, attributed to the node whose program raised it. */
    public SemanticException atNode(int nodeId) {
        SemanticException e = new SemanticException(reason, nodeId, statementIndex);
        e.initCause(this);
        return e;
    }

    public int nodeId() { return nodeId; }

    public int statementIndex() { return statementIndex; }

    public String reason() { return reason; }

    private static String format(String reason, int nodeId, int statementIndex) {
        StringBuilder sb = new StringBuilder();
        if (nodeId != UNKNOWN_NODE) {
            sb.append("Node ").append(nodeId).append(", ");
        }
        sb.append("statement ").append(statementIndex).append(": ").append(reason);
        return sb.toString();
    }
}
