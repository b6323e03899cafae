package com.mathtext.render.handler;

import com.mathtext.render.registry.MacroArguments;
import com.mathtext.render.registry.MacroHandler;
import com.mathtext.render.registry.RenderContext;

/**
 * {@code \binom{n}{k}} in function-call notation {@code C(n,k)}. Never
 * stochastic.
 */
public class BinomialHandler implements MacroHandler {

    @Override
    public String render(MacroArguments arguments, RenderContext context) {
        return "C(" + arguments.required(0) + "," + arguments.required(1) + ")";
    }
}
