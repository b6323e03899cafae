package com.mathtext.render;

import com.mathtext.model.ArgumentKind;
import com.mathtext.model.ArgumentSlot;
import com.mathtext.model.ConstructNode;
import com.mathtext.model.MarkupNode;
import com.mathtext.render.registry.MacroRegistry;
import com.mathtext.render.style.StyleWeights;
import com.mathtext.render.style.WeightTable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.mathtext.model.MarkupNodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MathTextRenderer.
 */
class MathTextRendererTest {

    private static final MathTextRenderer RENDERER = MathTextRenderer.standard();

    @Test
    void testTextOnlyTreeRendersVerbatim() {
        List<MarkupNode> nodes = List.of(text("hello "), text("world\n"));

        assertThat(RENDERER.render(nodes, RenderOptions.defaults())).isEqualTo("hello world\n");
    }

    @Test
    void testEmptyTreeRendersEmptyString() {
        assertThat(RENDERER.render(List.of(), RenderOptions.defaults())).isEmpty();
    }

    @Test
    void testSameSeedSameOutput() {
        List<MarkupNode> nodes = List.of(
                macro("alpha"), text(" + "), macro("infty"), text(" + "),
                macro("sqrt", text("x")), text(" + "), macro("pi"));

        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        RenderOptions a = RenderOptions.seeded(77);
        RenderOptions b = RenderOptions.seeded(77);
        for (int i = 0; i < 20; i++) {
            first.add(RENDERER.render(nodes, a));
            second.add(RENDERER.render(nodes, b));
        }

        assertThat(first).isEqualTo(second);
    }

    @Test
    void testUnknownConstructRendersItsName() {
        assertThat(RENDERER.render(List.of(new ConstructNode("foo")), RenderOptions.defaults())).isEqualTo("foo");
    }

    @Test
    void testPinnedWeightsSelectSingleForm() {
        RenderOptions options = RenderOptions.builder()
                .randomSource(new Random(4))
                .weights(StyleWeights.builder()
                        .greekLetter(WeightTable.of(0, 1))
                        .infinity(WeightTable.of(0, 1, 0))
                        .pi(WeightTable.of(1, 0))
                        .build())
                .build();

        String rendered = RENDERER.render(
                List.of(macro("alpha"), text(" "), macro("infty"), text(" "), macro("pi")), options);

        assertThat(rendered).isEqualTo("α inf pi");
    }

    @Test
    void testSpecialsUseSubstitutionTable() {
        List<MarkupNode> nodes = List.of(
                special("\\langle"), text("x"), special("\\rangle"),
                special("~"), text("a"), special("&"), text("b"), special("@"));

        assertThat(RENDERER.render(nodes, RenderOptions.defaults())).isEqualTo("<x> a   b@");
    }

    @Test
    void testCommentsUseSeparator() {
        List<MarkupNode> nodes = List.of(text("a"), comment("ignored"), text("b"));

        assertThat(RENDERER.render(nodes, RenderOptions.defaults())).isEqualTo("ab");
        assertThat(RENDERER.render(nodes, RenderOptions.builder().commentSeparator(" ").build()))
                .isEqualTo("a b");
    }

    @Test
    void testGroupsRenderTheirContent() {
        List<MarkupNode> nodes = List.of(
                braces(text("a")),
                group("$", "$", text("b")),
                group("\\(", "\\)", text("c")),
                group("(", ")", text("d")));

        assertThat(RENDERER.render(nodes, RenderOptions.defaults())).isEqualTo("abc(d)");
    }

    @Test
    void testDisplayMathIsIndentedBlock() {
        List<MarkupNode> nodes = List.of(text("see"), group("\\[", "\\]", text(" x+1 \\\\ y ")));

        assertThat(RENDERER.render(nodes, RenderOptions.defaults())).isEqualTo("see\n    x+1 \\\\ y\n");
        assertThat(RENDERER.render(List.of(group("$$", "$$", text("a\nb"))),
                RenderOptions.builder().displayMathIndent("  ").build()))
                .isEqualTo("\n  a\n  b\n");
    }

    @Test
    void testEmbellishmentGroupDispatchesToScriptHandler() {
        assertThat(RENDERER.render(List.of(group("_", "", text("i"))), RenderOptions.defaults()))
                .isEqualTo("_(i)");
    }

    @Test
    void testDepthLimitFailsWholeCall() {
        List<MarkupNode> nodes = List.of(braces(braces(braces(braces(text("x"))))));
        RenderOptions options = RenderOptions.builder().maxDepth(3).build();

        assertThatThrownBy(() -> RENDERER.render(nodes, options))
                .isInstanceOf(RenderDepthExceededException.class)
                .hasMessageContaining("3");
        assertThat(RENDERER.render(nodes, RenderOptions.defaults())).isEqualTo("x");
    }

    @Test
    void testInvalidMaxDepthRejected() {
        assertThatThrownBy(() -> RenderOptions.builder().maxDepth(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testHandlersReceiveArgumentsRenderedInOrder() {
        MacroRegistry registry = MacroRegistry.builder()
                .register("pair", "[{", (arguments, context) ->
                        arguments.text(0).orElse("none") + "|" + arguments.required(1))
                .build();
        MathTextRenderer renderer = new MathTextRenderer(registry, Map.of());

        String withOptional = renderer.render(List.of(construct("pair",
                ArgumentSlot.optional(text("o")),
                ArgumentSlot.mandatory(text("m")))), RenderOptions.defaults());
        String withoutOptional = renderer.render(List.of(construct("pair",
                ArgumentSlot.absent(ArgumentKind.OPTIONAL),
                ArgumentSlot.mandatory(text("m")))), RenderOptions.defaults());

        assertThat(withOptional).isEqualTo("o|m");
        assertThat(withoutOptional).isEqualTo("none|m");
    }
}
