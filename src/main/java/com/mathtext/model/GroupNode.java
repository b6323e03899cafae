package com.mathtext.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Objects;

/**
 * Represents a delimited scope: braces, math-mode delimiters, or an
 * embellishment ({@code _} / {@code ^}) whose children form the annotation.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class GroupNode extends MarkupNode {
    public static final String OPEN_BRACE = "{";
    public static final String CLOSE_BRACE = "}";
    public static final String DOLLAR = "$";
    public static final String DOUBLE_DOLLAR = "$$";
    public static final String OPEN_INLINE_MATH = "\\(";
    public static final String CLOSE_INLINE_MATH = "\\)";
    public static final String OPEN_DISPLAY_MATH = "\\[";
    public static final String CLOSE_DISPLAY_MATH = "\\]";
    public static final String SUBSCRIPT = "_";
    public static final String SUPERSCRIPT = "^";

    private final String openDelimiter;
    private final String closeDelimiter;
    private final List<MarkupNode> children;

    @Builder
    public GroupNode(String openDelimiter, String closeDelimiter, List<MarkupNode> children,
                     int sourceLine, int sourceColumn) {
        super(sourceLine, sourceColumn);
        this.openDelimiter = Objects.requireNonNull(openDelimiter, "openDelimiter");
        this.closeDelimiter = closeDelimiter != null ? closeDelimiter : "";
        this.children = children != null ? List.copyOf(children) : List.of();
    }

    public GroupNode(String openDelimiter, String closeDelimiter, List<MarkupNode> children) {
        this(openDelimiter, closeDelimiter, children, 0, 0);
    }

    public static GroupNode braces(List<MarkupNode> children) {
        return new GroupNode(OPEN_BRACE, CLOSE_BRACE, children);
    }

    public boolean isBraces() {
        return OPEN_BRACE.equals(openDelimiter) && CLOSE_BRACE.equals(closeDelimiter);
    }

    public boolean isInlineMath() {
        return (DOLLAR.equals(openDelimiter) && DOLLAR.equals(closeDelimiter))
                || (OPEN_INLINE_MATH.equals(openDelimiter) && CLOSE_INLINE_MATH.equals(closeDelimiter));
    }

    public boolean isDisplayMath() {
        return (DOUBLE_DOLLAR.equals(openDelimiter) && DOUBLE_DOLLAR.equals(closeDelimiter))
                || (OPEN_DISPLAY_MATH.equals(openDelimiter) && CLOSE_DISPLAY_MATH.equals(closeDelimiter));
    }

    public boolean isEmbellishment() {
        return SUBSCRIPT.equals(openDelimiter) || SUPERSCRIPT.equals(openDelimiter);
    }

    @Override
    public <R> R accept(MarkupNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
