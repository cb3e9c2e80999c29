package io.tisgrid.vm;

/** Root of every error raised while lexing, parsing, validating or running a program. */
public class TisException extends RuntimeException {
    public TisException(String message) {
        super(message);
    }
}
