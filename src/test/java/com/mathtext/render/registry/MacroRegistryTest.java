package com.mathtext.render.registry;

import com.mathtext.model.ArgumentKind;
import com.mathtext.model.ArgumentSignature;
import com.mathtext.render.handler.StandardMacros;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MacroRegistry.
 */
class MacroRegistryTest {

    @Test
    void testLaterRegistrationReplacesEarlier() {
        MacroRegistry registry = MacroRegistry.builder()
                .literal("times", "×")
                .literal("times", "*")
                .build();

        assertThat(registry.size()).isEqualTo(1);
        assertThat(render(registry, "times")).isEqualTo("*");
    }

    @Test
    void testUnknownNameResolvesToBareName() {
        MacroRegistry registry = MacroRegistry.builder().build();

        MacroRegistryEntry entry = registry.resolve("foo");

        assertThat(registry.contains("foo")).isFalse();
        assertThat(entry.getSignature().isEmpty()).isTrue();
        assertThat(render(registry, "foo")).isEqualTo("foo");
    }

    @Test
    void testSignatureNotationIsParsed() {
        MacroRegistry registry = MacroRegistry.builder()
                .register("sqrt", "[{", (arguments, context) -> arguments.last())
                .build();

        assertThat(registry.resolve("sqrt").getSignature().getKinds())
                .containsExactly(ArgumentKind.OPTIONAL, ArgumentKind.MANDATORY);
    }

    @Test
    void testToBuilderLeavesSourceRegistryUntouched() {
        MacroRegistry base = MacroRegistry.builder().literal("a", "1").build();

        MacroRegistry extended = base.toBuilder().literal("b", "2").build();

        assertThat(base.names()).containsExactly("a");
        assertThat(extended.names()).containsExactly("a", "b");
    }

    @Test
    void testStandardRegistryPrefersCustomLayer() {
        MacroRegistry registry = StandardMacros.registry();

        assertThat(render(registry, "times")).isEqualTo("*");
        assertThat(render(registry, "leq")).isEqualTo("<=");
        assertThat(render(registry, "forall")).isEqualTo("∀");
        assertThat(render(registry, "sum")).isEqualTo("\\sum");
        assertThat(render(registry, "sin")).isEqualTo("sin");
        assertThat(registry.resolve("frac").getSignature()).isEqualTo(ArgumentSignature.parse("{{"));
    }

    @Test
    void testBaselineLayerAloneUsesGenericSymbols() {
        MacroRegistry.Builder builder = MacroRegistry.builder();
        StandardMacros.installBaseline(builder);
        MacroRegistry baselineOnly = builder.build();

        assertThat(render(baselineOnly, "times")).isEqualTo("×");
        assertThat(render(StandardMacros.registry(), "times")).isEqualTo("*");
        assertThat(baselineOnly.contains("sqrt")).isFalse();
        assertThat(baselineOnly.contains("frac")).isFalse();
    }

    @Test
    void testNullRegistrationPartsAreRejected() {
        MacroRegistry.Builder builder = MacroRegistry.builder();

        assertThatThrownBy(() -> builder.register(null, ArgumentSignature.none(), (a, c) -> ""))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> builder.register("x", ArgumentSignature.none(), null))
                .isInstanceOf(NullPointerException.class);
    }

    private static String render(MacroRegistry registry, String name) {
        MacroArguments arguments = new MacroArguments(name, List.of(), List.<Optional<String>>of());
        return registry.resolve(name).getHandler().render(arguments, null);
    }
}
