package com.mathtext;

import com.mathtext.parser.MarkupParseException;
import com.mathtext.render.RenderOptions;
import com.mathtext.render.style.StyleWeights;
import com.mathtext.render.style.WeightTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for MathTextConverter: markup in, plain text out.
 */
class MathTextConverterTest {

    private static final MathTextConverter CONVERTER = MathTextConverter.standard();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "\\frac{a}{b}                | a/b",
            "\\frac{a+1}{b}              | (a+1)/b",
            "\\binom{n}{k}               | C(n,k)",
            "\\boxed{\\boxed{5}}         | [[5]]",
            "\\foo                       | foo",
            "x^{n+1}                     | x^(n+1)",
            "x_i                         | x_(i)",
            "a \\times b \\leq c         | a * b <= c",
            "\\left( x \\right)          | ( x )",
            "\\mathrm{e}^{x}             | e^x",
            "\\{x\\}                     | {x}",
            "\\text{if}\\,x              | if x",
            "50\\%                       | 50%",
            "\\sum_{i=1}^n i             | \\sum_(i=1)^n i",
            "\\sin x \\cdot \\cos y      | sin x * cos y",
            "\\langle u,v \\rangle       | < u,v >"
    })
    void testDeterministicConstructs(String source, String expected) throws Exception {
        assertThat(CONVERTER.renderToText(source, RenderOptions.seeded(1))).isEqualTo(expected);
    }

    @Test
    void testPlainTextIsUnchanged() throws Exception {
        String source = "The quick brown fox.";

        assertThat(CONVERTER.renderToText(source, RenderOptions.defaults())).isEqualTo(source);
    }

    @Test
    void testSeededRenderingIsReproducible() throws Exception {
        String source = "\\alpha + \\beta \\cdot \\sqrt[3]{\\pi r^2} - \\infty";

        String first = CONVERTER.renderToText(source, RenderOptions.seeded(12345));
        String second = CONVERTER.renderToText(source, RenderOptions.seeded(12345));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void testRepeatedRenderingsVary() throws Exception {
        RenderOptions options = RenderOptions.seeded(6);
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < 30; i++) {
            seen.add(CONVERTER.renderToText("\\alpha \\infty \\sqrt{x}", options));
        }

        assertThat(seen).hasSizeGreaterThan(1);
    }

    @Test
    void testPinnedWeightsEndToEnd() throws Exception {
        RenderOptions options = RenderOptions.builder()
                .randomSource(new Random(0))
                .weights(StyleWeights.builder()
                        .greekLetter(WeightTable.of(1, 0))
                        .pi(WeightTable.of(0, 1))
                        .infinity(WeightTable.of(0, 0, 1))
                        .rootStyle(WeightTable.of(0, 1))
                        .exponentOperator(WeightTable.of(1, 0))
                        .build())
                .build();

        String rendered = CONVERTER.renderToText(
                "\\lim_{n \\to \\infty} \\theta \\pi \\sqrt[3]{x}", options);

        assertThat(rendered).isEqualTo("\\lim_(n → ∞) theta π x^(1/3)");
    }

    @Test
    void testDisplayMathBlock() throws Exception {
        assertThat(CONVERTER.renderToText("Solve $$x^2 = 4$$", RenderOptions.defaults()))
                .isEqualTo("Solve \n    x^2 = 4\n");
    }

    @Test
    void testParseErrorsPropagate() {
        assertThatThrownBy(() -> CONVERTER.renderToText("\\frac{a}", RenderOptions.defaults()))
                .isInstanceOf(MarkupParseException.class);
        MarkupParseException unterminated = catchThrowableOfType(
                () -> CONVERTER.renderToText("{x", RenderOptions.defaults()), MarkupParseException.class);
        assertThat(unterminated).isNotNull();
        assertThat(unterminated.getLine()).isEqualTo(1);
        assertThat(unterminated.getColumn()).isEqualTo(3);
    }

    @Test
    void testPreparsedTreeMatchesSourceRendering() throws Exception {
        String source = "\\frac{1}{2} + \\binom{4}{2}";

        assertThat(CONVERTER.renderToText(CONVERTER.parse(source), RenderOptions.seeded(2)))
                .isEqualTo(CONVERTER.renderToText(source, RenderOptions.seeded(2)));
    }
}
