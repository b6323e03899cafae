package com.mathtext.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * A source comment. Carries no visible text.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class CommentNode extends MarkupNode {
    private final String text;

    public CommentNode(String text) {
        this(text, 0, 0);
    }

    public CommentNode(String text, int sourceLine, int sourceColumn) {
        super(sourceLine, sourceColumn);
        this.text = Objects.requireNonNull(text, "text");
    }

    @Override
    public <R> R accept(MarkupNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
