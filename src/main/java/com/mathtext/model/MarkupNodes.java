package com.mathtext.model;

import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Shorthand factories for building node trees in code.
 */
@UtilityClass
public class MarkupNodes {

    public TextNode text(String content) {
        return new TextNode(content);
    }

    public SpecialNode special(String symbol) {
        return new SpecialNode(symbol);
    }

    public CommentNode comment(String text) {
        return new CommentNode(text);
    }

    public ConstructNode construct(String name, ArgumentSlot... arguments) {
        return new ConstructNode(name, List.of(arguments));
    }

    /**
     * A construct whose arguments are all mandatory, each holding a single node.
     */
    public ConstructNode macro(String name, MarkupNode... mandatoryArguments) {
        ArgumentSlot[] slots = new ArgumentSlot[mandatoryArguments.length];
        for (int i = 0; i < mandatoryArguments.length; i++) {
            slots[i] = ArgumentSlot.mandatory(mandatoryArguments[i]);
        }
        return construct(name, slots);
    }

    public GroupNode braces(MarkupNode... children) {
        return GroupNode.braces(List.of(children));
    }

    public GroupNode group(String open, String close, MarkupNode... children) {
        return new GroupNode(open, close, List.of(children));
    }
}
