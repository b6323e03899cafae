package com.mathtext.render.handler;

import com.mathtext.render.registry.MacroArguments;
import com.mathtext.render.registry.RenderContext;
import lombok.experimental.UtilityClass;

/**
 * Single-argument constructs that strip, add or keep markers around their
 * content. Each method matches {@link com.mathtext.render.registry.MacroHandler}.
 */
@UtilityClass
public class WrapperHandlers {

    /**
     * Content with no added formatting ({@code \text}, {@code \textbf}, ...).
     */
    public String passThrough(MacroArguments arguments, RenderContext context) {
        return arguments.last();
    }

    /**
     * {@code \mathrm}: formatting stripped. A lone {@code e} is Euler's number
     * and comes back as exactly {@code e}.
     */
    public String roman(MacroArguments arguments, RenderContext context) {
        String content = arguments.last();
        if ("e".equals(content.trim())) {
            return "e";
        }
        return content;
    }

    /**
     * {@code \boxed{x}} becomes {@code [x]}; nested boxes nest brackets.
     */
    public String boxed(MacroArguments arguments, RenderContext context) {
        return "[" + arguments.last() + "]";
    }

    public String subscript(MacroArguments arguments, RenderContext context) {
        return "_(" + arguments.last() + ")";
    }

    public String superscript(MacroArguments arguments, RenderContext context) {
        String content = arguments.last();
        return "^" + (ExpressionText.needsParentheses(content.trim()) ? "(" + content + ")" : content);
    }

    /**
     * Suppressed output, for {@code \left} and {@code \right}.
     */
    public String suppressed(MacroArguments arguments, RenderContext context) {
        return "";
    }
}
