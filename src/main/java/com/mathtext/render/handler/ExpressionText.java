package com.mathtext.render.handler;

import lombok.experimental.UtilityClass;

/**
 * Text predicates shared by handlers that build operator expressions.
 */
@UtilityClass
public class ExpressionText {

    private static final String COMPOUND_MARKERS = "+-*/^ ";

    /**
     * True when the text contains an arithmetic operator or a space, so it
     * has to be parenthesized before an operator is applied to it.
     */
    public boolean needsParentheses(String text) {
        if (text == null) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (COMPOUND_MARKERS.indexOf(text.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    public String parenthesizeIfNeeded(String text) {
        return needsParentheses(text) ? "(" + text + ")" : text;
    }
}
