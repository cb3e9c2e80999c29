package io.tisgrid.vm;

/**
 * A grammar violation. The message is prefixed with the character range of
 * the offending token.
 */
public class ParseException extends TisException {
    private final SourceSpan span;

    public ParseException(String message, Token token) {
        super(format(message, token.span()));
        this.span = token.span();
    }

    public SourceSpan span() { return span; }

    private static String format(String message, SourceSpan span) {
        return "Characters " + span.start() + " - " + (span.end() - 1) + ": " + message;
    }
}
