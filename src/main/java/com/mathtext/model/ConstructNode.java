package com.mathtext.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Objects;

/**
 * A macro invocation such as {@code \frac{a}{b}}. The name excludes the
 * leading backslash; sub- and superscripts use the names {@code _} and
 * {@code ^}.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class ConstructNode extends MarkupNode {
    private final String name;
    private final List<ArgumentSlot> arguments;

    @Builder
    public ConstructNode(String name, List<ArgumentSlot> arguments, int sourceLine, int sourceColumn) {
        super(sourceLine, sourceColumn);
        this.name = Objects.requireNonNull(name, "name");
        this.arguments = arguments != null ? List.copyOf(arguments) : List.of();
    }

    public ConstructNode(String name, List<ArgumentSlot> arguments) {
        this(name, arguments, 0, 0);
    }

    public ConstructNode(String name) {
        this(name, List.of(), 0, 0);
    }

    @Override
    public <R> R accept(MarkupNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
