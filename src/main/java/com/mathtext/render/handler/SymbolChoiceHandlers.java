package com.mathtext.render.handler;

import com.mathtext.render.registry.MacroHandler;
import lombok.experimental.UtilityClass;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Zero-argument constructs that render as either a spelled-out name or a
 * Unicode symbol, drawn independently on every occurrence.
 */
@UtilityClass
public class SymbolChoiceHandlers {

    public static final String INFINITY_SYMBOL = "∞";
    public static final String PI_SYMBOL = "π";

    /** {@code \pi} lives in {@link #pi()}; {@code \Pi} and {@code \varpi} are here. */
    public static final Map<String, String> GREEK_LETTERS = greekLetters();

    /**
     * Name or symbol, weighted by {@code StyleWeights#getGreekLetter()}.
     */
    public MacroHandler greekLetter(String name, String symbol) {
        return (arguments, context) -> context.getSelector()
                .choose(context.getWeights().getGreekLetter(), name, symbol);
    }

    public MacroHandler infinity() {
        return (arguments, context) -> context.getSelector()
                .choose(context.getWeights().getInfinity(), "infinity", "inf", INFINITY_SYMBOL);
    }

    public MacroHandler pi() {
        return (arguments, context) -> context.getSelector()
                .choose(context.getWeights().getPi(), "pi", PI_SYMBOL);
    }

    private Map<String, String> greekLetters() {
        Map<String, String> letters = new LinkedHashMap<>();
        letters.put("alpha", "α");
        letters.put("beta", "β");
        letters.put("gamma", "γ");
        letters.put("delta", "δ");
        letters.put("epsilon", "ε");
        letters.put("varepsilon", "ϵ");
        letters.put("zeta", "ζ");
        letters.put("eta", "η");
        letters.put("theta", "θ");
        letters.put("vartheta", "ϑ");
        letters.put("iota", "ι");
        letters.put("kappa", "κ");
        letters.put("varkappa", "ϰ");
        letters.put("lambda", "λ");
        letters.put("mu", "μ");
        letters.put("nu", "ν");
        letters.put("xi", "ξ");
        letters.put("varpi", "ϖ");
        letters.put("rho", "ρ");
        letters.put("varrho", "ϱ");
        letters.put("sigma", "σ");
        letters.put("varsigma", "ς");
        letters.put("tau", "τ");
        letters.put("upsilon", "υ");
        letters.put("phi", "φ");
        letters.put("varphi", "ϕ");
        letters.put("chi", "χ");
        letters.put("psi", "ψ");
        letters.put("omega", "ω");
        letters.put("Gamma", "Γ");
        letters.put("Delta", "Δ");
        letters.put("Theta", "Θ");
        letters.put("Lambda", "Λ");
        letters.put("Xi", "Ξ");
        letters.put("Pi", "Π");
        letters.put("Sigma", "Σ");
        letters.put("Upsilon", "Υ");
        letters.put("Phi", "Φ");
        letters.put("Psi", "Ψ");
        letters.put("Omega", "Ω");
        return Collections.unmodifiableMap(letters);
    }
}
