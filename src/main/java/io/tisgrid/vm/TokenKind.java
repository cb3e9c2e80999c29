package io.tisgrid.vm;

public enum TokenKind {
    INSTRUCTION,
    REGISTER,
    INTEGER,
    PORT,
    NODE_SPECIFIER,
    SEPARATOR,
    LABEL,
    LABEL_REF,
    WHITESPACE,
    COMMENT;

    /** Kinds that win an equal-length tie against LABEL_REF. */
    boolean outranksLabelRef() {
        return this == INSTRUCTION || this == PORT || this == REGISTER || this == INTEGER;
    }

    /** Kinds the parser never sees. */
    boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT;
    }
}
