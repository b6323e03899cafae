package com.mathtext.render.style;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StyleSelector.
 */
class StyleSelectorTest {

    @Test
    void testSameSeedSameChoices() {
        StyleSelector first = new StyleSelector(new Random(99));
        StyleSelector second = new StyleSelector(new Random(99));

        List<String> a = new ArrayList<>();
        List<String> b = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            a.add(first.choose(StyleWeights.DEFAULT_INFINITY, "infinity", "inf", "∞"));
            b.add(second.choose(StyleWeights.DEFAULT_INFINITY, "infinity", "inf", "∞"));
        }

        assertThat(a).isEqualTo(b);
    }

    @Test
    void testGreekSymbolFrequencyMatchesWeight() {
        StyleSelector selector = new StyleSelector(new Random(42));
        int draws = 10_000;
        int symbols = 0;
        for (int i = 0; i < draws; i++) {
            if ("α".equals(selector.choose(StyleWeights.DEFAULT_GREEK_LETTER, "alpha", "α"))) {
                symbols++;
            }
        }

        assertThat(symbols / (double) draws).isBetween(0.18, 0.22);
    }

    @Test
    void testHugeWeightsKeepTheirRatio() {
        StyleSelector selector = new StyleSelector(new Random(42));
        WeightTable huge = WeightTable.parse("1e308,1e308");
        int draws = 10_000;
        int names = 0;
        for (int i = 0; i < draws; i++) {
            if ("name".equals(selector.choose(huge, "name", "symbol"))) {
                names++;
            }
        }

        assertThat(names / (double) draws).isBetween(0.47, 0.53);
    }

    @Test
    void testScaledWeightsMatchUnscaledChoices() {
        StyleSelector small = new StyleSelector(new Random(17));
        StyleSelector large = new StyleSelector(new Random(17));

        for (int i = 0; i < 500; i++) {
            assertThat(large.choose(WeightTable.of(8e307, 2e307), "a", "b"))
                    .isEqualTo(small.choose(WeightTable.of(0.8, 0.2), "a", "b"));
        }
    }

    @Test
    void testZeroWeightIsNeverChosen() {
        StyleSelector selector = new StyleSelector(new Random(5));

        for (int i = 0; i < 1_000; i++) {
            assertThat(selector.choose(WeightTable.of(0, 1, 0), "a", "b", "c")).isEqualTo("b");
        }
    }

    @Test
    void testTopOfRangeFallsBackToLastEligibleOption() {
        StyleSelector selector = new StyleSelector(new FixedRandom(1.0));

        assertThat(selector.choose(WeightTable.of(0.5, 0.5, 0), "a", "b", "c")).isEqualTo("b");
    }

    @Test
    void testEachCallDrawsExactlyOneValue() {
        Random source = new Random(11);
        Random mirror = new Random(11);
        StyleSelector selector = new StyleSelector(source);

        selector.choose(StyleWeights.DEFAULT_PI, "pi", "π");
        selector.choose(StyleWeights.DEFAULT_INFINITY, "infinity", "inf", "∞");
        mirror.nextDouble();
        mirror.nextDouble();

        assertThat(source.nextDouble()).isEqualTo(mirror.nextDouble());
    }

    @Test
    void testInvalidOptionsAreRejected() {
        StyleSelector selector = new StyleSelector(new Random());

        assertThatThrownBy(() -> selector.choose(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> selector.choose(List.of(WeightedOption.of("a", 0), WeightedOption.of("b", 0))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> selector.choose(List.of(WeightedOption.of("a", -1), WeightedOption.of("b", 2))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> selector.choose(List.of(
                WeightedOption.of("a", Double.POSITIVE_INFINITY), WeightedOption.of("b", 1))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Random source that always returns the same double.
     */
    private static final class FixedRandom extends Random {
        private static final long serialVersionUID = 1L;
        private final double value;

        FixedRandom(double value) {
            this.value = value;
        }

        @Override
        public double nextDouble() {
            return value;
        }
    }
}
