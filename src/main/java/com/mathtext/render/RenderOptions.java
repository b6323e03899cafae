package com.mathtext.render;

import com.mathtext.render.style.StyleWeights;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Random;
import java.util.random.RandomGenerator;

/**
 * Per-call rendering options.
 *
 * <p>The random source is consumed by the call it is passed to. For
 * reproducible output supply a seeded source; for concurrent calls supply one
 * source per call.
 */
@Getter
@ToString
public class RenderOptions {
    public static final int DEFAULT_MAX_DEPTH = 512;
    public static final String DEFAULT_DISPLAY_MATH_INDENT = "    ";

    @ToString.Exclude
    private final RandomGenerator randomSource;
    private final StyleWeights weights;
    private final String commentSeparator;
    private final String displayMathIndent;
    private final int maxDepth;

    @Builder(toBuilder = true)
    private RenderOptions(RandomGenerator randomSource, StyleWeights weights, String commentSeparator,
                          String displayMathIndent, Integer maxDepth) {
        if (maxDepth != null && maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive. Got: " + maxDepth);
        }
        this.randomSource = randomSource != null ? randomSource : new Random();
        this.weights = weights != null ? weights : StyleWeights.defaults();
        this.commentSeparator = commentSeparator != null ? commentSeparator : "";
        this.displayMathIndent = displayMathIndent != null ? displayMathIndent : DEFAULT_DISPLAY_MATH_INDENT;
        this.maxDepth = maxDepth != null ? maxDepth : DEFAULT_MAX_DEPTH;
    }

    public static RenderOptions defaults() {
        return builder().build();
    }

    public static RenderOptions seeded(long seed) {
        return builder().randomSource(new Random(seed)).build();
    }
}
