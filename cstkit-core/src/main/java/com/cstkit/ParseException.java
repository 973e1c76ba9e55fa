package com.cstkit;

/**
 * Thrown when source text is not valid for {@link ModuleParser}.
 */
public class ParseException extends RuntimeException {

    private final int line;
    private final int column;

    public ParseException(String message, int line, int column) {
        super(message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
    }

    /**
     * One-based line of the offending text.
     */
    public int line() {
        return line;
    }

    /**
     * Zero-based column of the offending text.
     */
    public int column() {
        return column;
    }
}
