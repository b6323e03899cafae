package com.mathtext.render.style;

import java.util.List;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Picks one of several textually distinct renderings by weight.
 *
 * <p>Each call is an independent trial drawing exactly one value from the
 * supplied random source, so two selectors over sources in the same state
 * produce the same sequence of choices. A selector is not thread-safe when its
 * source is not; give each concurrent render its own.
 */
public final class StyleSelector {
    private final RandomGenerator random;

    public StyleSelector(RandomGenerator random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public String choose(List<WeightedOption> options) {
        if (options == null || options.isEmpty()) {
            throw new IllegalArgumentException("No options to choose from");
        }
        double max = 0;
        for (WeightedOption option : options) {
            double weight = option.getWeight();
            if (weight < 0 || Double.isNaN(weight) || Double.isInfinite(weight)) {
                throw new IllegalArgumentException("Negative or non-finite weight: " + option);
            }
            max = Math.max(max, weight);
        }
        if (max == 0) {
            throw new IllegalArgumentException("All weights are zero: " + options);
        }

        // Scaled by the largest weight so the sum stays finite
        double total = 0;
        for (WeightedOption option : options) {
            total += option.getWeight() / max;
        }

        double point = random.nextDouble() * total;
        double cumulative = 0;
        WeightedOption lastEligible = null;
        for (WeightedOption option : options) {
            if (option.getWeight() == 0) {
                continue;
            }
            cumulative += option.getWeight() / max;
            lastEligible = option;
            if (point < cumulative) {
                return option.getText();
            }
        }
        // Rounding can leave point at the very top of the range
        return lastEligible.getText();
    }

    public String choose(WeightTable weights, String... texts) {
        return choose(weights.pair(texts));
    }
}
