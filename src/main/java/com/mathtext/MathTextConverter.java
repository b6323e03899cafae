package com.mathtext;

import com.mathtext.model.MarkupNode;
import com.mathtext.parser.MarkupParseException;
import com.mathtext.parser.MarkupParser;
import com.mathtext.parser.MarkupTokenizer;
import com.mathtext.render.MathTextRenderer;
import com.mathtext.render.RenderOptions;
import com.mathtext.render.handler.SpecialSymbols;
import com.mathtext.render.handler.StandardMacros;
import com.mathtext.render.registry.MacroRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Entry point for converting math markup to plain text.
 *
 * <p>Parsing and rendering share one {@link MacroRegistry}, so the argument
 * signatures the parser reads are the ones the handlers expect. Instances are
 * immutable and may be shared; randomness comes from the {@link RenderOptions}
 * of each call.
 */
public class MathTextConverter {
    private static final Logger log = LoggerFactory.getLogger(MathTextConverter.class);

    private final MacroRegistry registry;
    private final Map<String, String> specialSymbols;
    private final MathTextRenderer renderer;

    public MathTextConverter(MacroRegistry registry, Map<String, String> specialSymbols) {
        this.registry = registry;
        this.specialSymbols = Map.copyOf(specialSymbols);
        this.renderer = new MathTextRenderer(registry, this.specialSymbols);
    }

    public static MathTextConverter standard() {
        return new MathTextConverter(StandardMacros.registry(), SpecialSymbols.DEFAULTS);
    }

    public List<MarkupNode> parse(String source) throws MarkupParseException {
        MarkupTokenizer tokenizer = new MarkupTokenizer(source);
        return new MarkupParser(tokenizer.tokenize(), registry, specialSymbols.keySet()).parse();
    }

    /**
     * Parses and renders the source. Parse failures propagate unchanged.
     */
    public String renderToText(String source, RenderOptions options) throws MarkupParseException {
        List<MarkupNode> nodes = parse(source);
        log.debug("Rendering {} top-level nodes", nodes.size());
        return renderer.render(nodes, options);
    }

    public String renderToText(List<MarkupNode> nodes, RenderOptions options) {
        return renderer.render(nodes, options);
    }

    public MacroRegistry getRegistry() {
        return registry;
    }
}
