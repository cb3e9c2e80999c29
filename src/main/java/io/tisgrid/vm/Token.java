package io.tisgrid.vm;

/**
 * A lexed token. The value is already converted: a {@link Long} for
 * INTEGER, an {@link Integer} node id for NODE_SPECIFIER, an {@link Opcode},
 * a {@link Port}, the string "ACC" for REGISTER, the label name (without the
 * colon) for LABEL and LABEL_REF, and the raw text otherwise.
 */
public final class Token {
    private final TokenKind kind;
    private final Object value;
    private final SourceSpan span;

    public Token(TokenKind kind, Object value, SourceSpan span) {
        this.kind = kind;
        this.value = value;
        this.span = span;
    }

    public TokenKind kind() { return kind; }

    public Object value() { return value; }

    public SourceSpan span() { return span; }

    public long longValue() { return (Long) value; }

    public int nodeId() { return (Integer) value; }

    public Opcode opcode() { return (Opcode) value; }

    public Port port() { return (Port) value; }

    public String text() { return (String) value; }

    @Override
    public String toString() {
        return kind + "(" + value + ")@" + span;
    }
}
