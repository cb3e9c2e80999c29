package io.tisgrid.vm;

/**
 * No token rule matched at some position, or the matched tokens do not
 * cover the whole source.
 */
public class LexException extends TisException {
    private final int offset;

    public LexException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    /** Character offset where lexing stopped. */
    public int offset() { return offset; }
}
