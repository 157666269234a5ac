package com.flowcheck.core.parser;

/**
 * Raised when workflow source cannot be tokenized or parsed.
 *
 * <p>The validator turns this into a fatal {@code SYN001} diagnostic; it never
 * escapes the public facade.</p>
 */
public class PythonSyntaxException extends RuntimeException {

    private final int line;
    private final int column;

    public PythonSyntaxException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
