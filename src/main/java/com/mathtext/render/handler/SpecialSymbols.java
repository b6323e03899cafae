package com.mathtext.render.handler;

import lombok.experimental.UtilityClass;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Substitutions for special (non-macro) sequences. Unmapped specials render
 * verbatim.
 */
@UtilityClass
public class SpecialSymbols {

    public static final Map<String, String> DEFAULTS = defaults();

    private Map<String, String> defaults() {
        Map<String, String> table = new LinkedHashMap<>();
        table.put("\\langle", "<");
        table.put("\\rangle", ">");
        table.put("~", " ");
        table.put("&", "   ");
        return Collections.unmodifiableMap(table);
    }
}
