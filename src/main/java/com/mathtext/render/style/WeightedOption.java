package com.mathtext.render.style;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One candidate rendering and its selection weight.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(staticName = "of")
public final class WeightedOption {
    private final String text;
    private final double weight;
}
