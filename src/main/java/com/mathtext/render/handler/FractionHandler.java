package com.mathtext.render.handler;

import com.mathtext.render.registry.MacroArguments;
import com.mathtext.render.registry.MacroHandler;
import com.mathtext.render.registry.RenderContext;

/**
 * {@code \frac{a+1}{b}} becomes {@code (a+1)/b}. Each side is parenthesized
 * on its own when, trimmed, it is a compound expression.
 */
public class FractionHandler implements MacroHandler {

    @Override
    public String render(MacroArguments arguments, RenderContext context) {
        String numerator = arguments.required(0);
        String denominator = arguments.required(1);
        return wrap(numerator) + "/" + wrap(denominator);
    }

    private static String wrap(String side) {
        return ExpressionText.needsParentheses(side.trim()) ? "(" + side + ")" : side;
    }
}
