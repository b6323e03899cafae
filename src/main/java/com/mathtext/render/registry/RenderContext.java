package com.mathtext.render.registry;

import com.mathtext.model.MarkupNode;
import com.mathtext.render.style.StyleSelector;
import com.mathtext.render.style.StyleWeights;

import java.util.List;

/**
 * What a handler sees of the render call it runs in: a callback to render
 * sub-trees and the call's stochastic state.
 */
public interface RenderContext {

    /**
     * Renders a node list with the same renderer, depth guard and random
     * source as the current call.
     */
    String render(List<MarkupNode> nodes);

    StyleSelector getSelector();

    StyleWeights getWeights();
}
