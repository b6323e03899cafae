package com.mathtext.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Base class for all markup AST nodes.
 * Nodes are immutable once built; source positions are informational and
 * take no part in equality.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class MarkupNode {
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private final int sourceLine;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private final int sourceColumn;

    protected MarkupNode(int sourceLine, int sourceColumn) {
        this.sourceLine = sourceLine;
        this.sourceColumn = sourceColumn;
    }

    public abstract <R> R accept(MarkupNodeVisitor<R> visitor);
}
