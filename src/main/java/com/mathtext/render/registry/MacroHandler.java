package com.mathtext.render.registry;

/**
 * Produces the text for one construct occurrence.
 */
@FunctionalInterface
public interface MacroHandler {
    String render(MacroArguments arguments, RenderContext context);
}
