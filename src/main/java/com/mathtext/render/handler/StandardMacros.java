package com.mathtext.render.handler;

import com.mathtext.model.ArgumentSignature;
import com.mathtext.render.registry.MacroHandler;
import com.mathtext.render.registry.MacroRegistry;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Map;

/**
 * Builds the standard registry in two layers.
 *
 * <p>The baseline layer holds generic LaTeX-to-text defaults (Unicode
 * operators, font and accent wrappers, spacing control symbols). The custom
 * layer is registered afterwards and replaces any baseline entry with the
 * same name, so {@code \times} ends up as {@code *} rather than {@code ×}.
 */
@UtilityClass
public class StandardMacros {

    private static final List<String> FONT_WRAPPERS = List.of(
            "emph", "textrm", "textsf", "texttt", "textup", "textsl", "textsc", "textnormal",
            "mathbf", "mathit", "mathsf", "mathtt", "mathcal", "mathfrak", "mathrm", "mathbb",
            "boldsymbol", "operatorname", "mbox", "hbox", "text", "textbf", "textit");

    private static final List<String> ACCENTS = List.of(
            "hat", "widehat", "bar", "overline", "underline", "vec", "tilde", "widetilde", "dot", "ddot");

    private static final List<String> SILENT = List.of(
            "displaystyle", "textstyle", "scriptstyle", "limits", "nolimits", "hline", "noindent");

    private static final Map<String, String> BASELINE_SYMBOLS = Map.ofEntries(
            Map.entry("times", "×"),
            Map.entry("cdot", "·"),
            Map.entry("pm", "±"),
            Map.entry("mp", "∓"),
            Map.entry("leq", "≤"),
            Map.entry("le", "≤"),
            Map.entry("geq", "≥"),
            Map.entry("ge", "≥"),
            Map.entry("neq", "≠"),
            Map.entry("ne", "≠"),
            Map.entry("approx", "≈"),
            Map.entry("sim", "∼"),
            Map.entry("equiv", "≡"),
            Map.entry("infty", "∞"),
            Map.entry("pi", "π"),
            Map.entry("to", "→"),
            Map.entry("rightarrow", "→"),
            Map.entry("leftarrow", "←"),
            Map.entry("Rightarrow", "⇒"),
            Map.entry("Leftrightarrow", "⇔"),
            Map.entry("forall", "∀"),
            Map.entry("exists", "∃"),
            Map.entry("partial", "∂"),
            Map.entry("ldots", "…"),
            Map.entry("cdots", "⋯"),
            Map.entry("quad", " "),
            Map.entry("qquad", "  "),
            Map.entry(",", " "),
            Map.entry(";", " "),
            Map.entry(":", " "),
            Map.entry(" ", " "),
            Map.entry("!", ""),
            Map.entry("\\", "\n"));

    public MacroRegistry registry() {
        MacroRegistry.Builder builder = MacroRegistry.builder();
        installBaseline(builder);
        installCustom(builder);
        return builder.build();
    }

    public void installBaseline(MacroRegistry.Builder builder) {
        FONT_WRAPPERS.forEach(name -> builder.register(name, "{", WrapperHandlers::passThrough));
        ACCENTS.forEach(name -> builder.register(name, "{", WrapperHandlers::passThrough));
        SILENT.forEach(name -> builder.register(name, ArgumentSignature.none(), WrapperHandlers::suppressed));
        BASELINE_SYMBOLS.forEach(builder::literal);
    }

    public void installCustom(MacroRegistry.Builder builder) {
        builder.register("sqrt", "[{", new RootHandler());

        MacroHandler fraction = new FractionHandler();
        for (String name : List.of("frac", "dfrac", "tfrac")) {
            builder.register(name, "{{", fraction);
        }

        MacroHandler binomial = new BinomialHandler();
        for (String name : List.of("binom", "dbinom", "tbinom")) {
            builder.register(name, "{{", binomial);
        }

        builder.register("mathrm", "{", WrapperHandlers::roman);
        builder.register("boxed", "{", WrapperHandlers::boxed);
        for (String name : List.of("text", "textbf", "textit", "mathbb")) {
            builder.register(name, "{", WrapperHandlers::passThrough);
        }
        builder.register("_", "{", WrapperHandlers::subscript);
        builder.register("^", "{", WrapperHandlers::superscript);

        SymbolChoiceHandlers.GREEK_LETTERS.forEach((name, symbol) ->
                builder.register(name, ArgumentSignature.none(), SymbolChoiceHandlers.greekLetter(name, symbol)));
        builder.register("infty", ArgumentSignature.none(), SymbolChoiceHandlers.infinity());
        builder.register("pi", ArgumentSignature.none(), SymbolChoiceHandlers.pi());

        LiteralSymbols.SYMBOLS.forEach(builder::literal);
        LiteralSymbols.OPERATOR_NAMES.forEach(name -> builder.literal(name, "\\" + name));
        LiteralSymbols.FUNCTION_NAMES.forEach(name -> builder.literal(name, name));

        builder.register("left", ArgumentSignature.none(), WrapperHandlers::suppressed);
        builder.register("right", ArgumentSignature.none(), WrapperHandlers::suppressed);
    }
}
