package com.mathtext.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the markup tokenizer.
 */
@Data
@AllArgsConstructor
public class MarkupToken {
    private TokenType type;
    private String value;
    private int line;
    private int column;

    public enum TokenType {
        CONTROL_WORD,
        CONTROL_SYMBOL,
        ESCAPED_CHAR,
        BEGIN_GROUP,
        END_GROUP,
        MATH_SHIFT,
        DISPLAY_MATH_SHIFT,
        MATH_OPEN,
        MATH_CLOSE,
        SUBSCRIPT,
        SUPERSCRIPT,
        COMMENT,
        CHAR,
        EOF
    }

    public boolean isChar(char c) {
        return type == TokenType.CHAR && value.length() == 1 && value.charAt(0) == c;
    }

    public boolean isWhitespace() {
        return type == TokenType.CHAR && !value.isEmpty() && Character.isWhitespace(value.charAt(0));
    }

    public boolean isControlSequence() {
        return type == TokenType.CONTROL_WORD || type == TokenType.CONTROL_SYMBOL;
    }

    public boolean isScript() {
        return type == TokenType.SUBSCRIPT || type == TokenType.SUPERSCRIPT;
    }

    public String describe() {
        return switch (type) {
            case CONTROL_WORD, CONTROL_SYMBOL -> "'\\" + value + "'";
            case EOF -> "end of input";
            default -> "'" + value + "'";
        };
    }
}
