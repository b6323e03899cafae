package com.mathtext.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Literal characters, rendered verbatim.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class TextNode extends MarkupNode {
    private final String content;

    public TextNode(String content) {
        this(content, 0, 0);
    }

    public TextNode(String content, int sourceLine, int sourceColumn) {
        super(sourceLine, sourceColumn);
        this.content = Objects.requireNonNull(content, "content");
    }

    @Override
    public <R> R accept(MarkupNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
