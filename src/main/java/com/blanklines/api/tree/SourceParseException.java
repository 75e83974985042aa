package com.blanklines.api.tree;

/**
 * Thrown when source text cannot be turned into a syntax tree.
 */
public class SourceParseException extends Exception {
    private final int line;
    private final int column;

    public SourceParseException(String message, int line, int column) {
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
