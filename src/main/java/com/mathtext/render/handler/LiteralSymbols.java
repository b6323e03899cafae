package com.mathtext.render.handler;

import lombok.experimental.UtilityClass;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed one-to-one substitutions for zero-argument constructs. No randomness.
 */
@UtilityClass
public class LiteralSymbols {

    /** Rendered with their backslash kept, e.g. {@code \sum}. */
    public static final List<String> OPERATOR_NAMES =
            List.of("sum", "int", "lim", "prod", "nabla", "iint", "iiint", "oint");

    /** Rendered as the bare name, e.g. {@code sin}. */
    public static final List<String> FUNCTION_NAMES = List.of("sin", "cos", "tan", "log", "ln");

    public static final Map<String, String> SYMBOLS = symbols();

    private Map<String, String> symbols() {
        Map<String, String> table = new LinkedHashMap<>();
        // operators
        table.put("times", "*");
        table.put("cdot", "*");
        table.put("pm", "+/-");
        table.put("mp", "-/+");
        table.put("div", "÷");
        // relations
        table.put("approx", "~");
        table.put("sim", "~=");
        table.put("equiv", "===");
        table.put("leq", "<=");
        table.put("geq", ">=");
        table.put("neq", "!=");
        // sets and logic
        table.put("subseteq", "subset=");
        table.put("subset", "⊂");
        table.put("in", "∈");
        table.put("cup", "∪");
        table.put("cap", "∩");
        table.put("emptyset", "∅");
        table.put("iff", "<=>");
        table.put("mapsto", "|->");
        table.put("to", "→");
        // dots
        table.put("ldots", "...");
        table.put("cdots", "...");
        table.put("dots", "...");
        // spacing and layout
        table.put("quad", "    ");
        table.put("qquad", "        ");
        table.put("\\", "\n");
        table.put("n", "\n");
        // escaped braces
        table.put("{", "{");
        table.put("}", "}");
        return Collections.unmodifiableMap(table);
    }
}
