package com.mathtext.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * A special character sequence that is not a macro, such as {@code ~},
 * {@code &} or {@code \langle}.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class SpecialNode extends MarkupNode {
    private final String symbol;

    public SpecialNode(String symbol) {
        this(symbol, 0, 0);
    }

    public SpecialNode(String symbol, int sourceLine, int sourceColumn) {
        super(sourceLine, sourceColumn);
        this.symbol = Objects.requireNonNull(symbol, "symbol");
    }

    @Override
    public <R> R accept(MarkupNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
