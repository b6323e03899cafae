package com.mathtext.render.handler;

import com.mathtext.model.MarkupNode;
import com.mathtext.render.MathTextRenderer;
import com.mathtext.render.RenderOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.mathtext.model.MarkupNodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FractionHandler.
 */
class FractionHandlerTest {

    private static final MathTextRenderer RENDERER = MathTextRenderer.standard();

    @Test
    void testSimpleFraction() {
        assertThat(render(macro("frac", text("a"), text("b")))).isEqualTo("a/b");
    }

    @Test
    void testCompoundSidesAreParenthesizedSeparately() {
        assertThat(render(macro("frac", text("a+1"), text("b")))).isEqualTo("(a+1)/b");
        assertThat(render(macro("dfrac", text("a"), text("b c")))).isEqualTo("a/(b c)");
        assertThat(render(macro("tfrac", text(" a "), text("b")))).isEqualTo(" a /b");
    }

    @Test
    void testExpressionTextOperators() {
        assertThat(ExpressionText.needsParentheses("x")).isFalse();
        assertThat(ExpressionText.needsParentheses("2x")).isFalse();
        assertThat(ExpressionText.needsParentheses("x*y")).isTrue();
        assertThat(ExpressionText.parenthesizeIfNeeded("a-b")).isEqualTo("(a-b)");
    }

    private static String render(MarkupNode node) {
        return RENDERER.render(List.of(node), RenderOptions.seeded(1));
    }
}
