package com.mathtext.parser;

/**
 * Structural error in markup source: unmatched or unterminated delimiters,
 * missing mandatory arguments, excessive nesting.
 */
public class MarkupParseException extends Exception {

    private static final long serialVersionUID = 1L;
    private final int line;
    private final int column;

    public MarkupParseException(String message, int line, int column) {
        super(message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
    }

    public MarkupParseException(String message, MarkupToken token) {
        this(message, token.getLine(), token.getColumn());
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
