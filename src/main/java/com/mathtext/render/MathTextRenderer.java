package com.mathtext.render;

import com.mathtext.model.ArgumentSlot;
import com.mathtext.model.CommentNode;
import com.mathtext.model.ConstructNode;
import com.mathtext.model.GroupNode;
import com.mathtext.model.MarkupNode;
import com.mathtext.model.MarkupNodeVisitor;
import com.mathtext.model.SpecialNode;
import com.mathtext.model.TextNode;
import com.mathtext.render.handler.SpecialSymbols;
import com.mathtext.render.handler.StandardMacros;
import com.mathtext.render.registry.MacroArguments;
import com.mathtext.render.registry.MacroRegistry;
import com.mathtext.render.registry.MacroRegistryEntry;
import com.mathtext.render.registry.RenderContext;
import com.mathtext.render.style.StyleSelector;
import com.mathtext.render.style.StyleWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Walks a node tree and concatenates the text of every node in document
 * order. Constructs are dispatched through the {@link MacroRegistry}.
 *
 * <p>The renderer itself holds only read-only state and can be shared across
 * threads; everything that changes during a call (random source, depth)
 * lives in a per-call session.
 */
public class MathTextRenderer {
    private static final Logger log = LoggerFactory.getLogger(MathTextRenderer.class);

    private final MacroRegistry registry;
    private final Map<String, String> specialSymbols;

    public MathTextRenderer(MacroRegistry registry, Map<String, String> specialSymbols) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.specialSymbols = Map.copyOf(specialSymbols);
    }

    public MathTextRenderer(MacroRegistry registry) {
        this(registry, SpecialSymbols.DEFAULTS);
    }

    public static MathTextRenderer standard() {
        return new MathTextRenderer(StandardMacros.registry());
    }

    public String render(List<MarkupNode> nodes, RenderOptions options) {
        return new Session(options).render(nodes);
    }

    public MacroRegistry getRegistry() {
        return registry;
    }

    /**
     * State of a single render call.
     */
    private final class Session implements RenderContext, MarkupNodeVisitor<String> {
        private final RenderOptions options;
        private final StyleSelector selector;
        private int depth;

        Session(RenderOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            this.selector = new StyleSelector(options.getRandomSource());
        }

        @Override
        public String render(List<MarkupNode> nodes) {
            if (depth >= options.getMaxDepth()) {
                log.debug("Render depth limit {} reached", options.getMaxDepth());
                throw new RenderDepthExceededException(options.getMaxDepth());
            }
            depth++;
            try {
                StringBuilder sb = new StringBuilder();
                for (MarkupNode node : nodes) {
                    sb.append(node.accept(this));
                }
                return sb.toString();
            } finally {
                depth--;
            }
        }

        @Override
        public StyleSelector getSelector() {
            return selector;
        }

        @Override
        public StyleWeights getWeights() {
            return options.getWeights();
        }

        @Override
        public String visit(TextNode text) {
            return text.getContent();
        }

        @Override
        public String visit(CommentNode comment) {
            return options.getCommentSeparator();
        }

        @Override
        public String visit(SpecialNode special) {
            return specialSymbols.getOrDefault(special.getSymbol(), special.getSymbol());
        }

        @Override
        public String visit(GroupNode group) {
            if (group.isEmbellishment()) {
                ArgumentSlot body = ArgumentSlot.mandatory(group.getChildren().toArray(new MarkupNode[0]));
                return invoke(group.getOpenDelimiter(), List.of(body));
            }
            String content = render(group.getChildren());
            if (group.isBraces() || group.isInlineMath()) {
                return content;
            }
            if (group.isDisplayMath()) {
                return displayBlock(content);
            }
            return group.getOpenDelimiter() + content + group.getCloseDelimiter();
        }

        @Override
        public String visit(ConstructNode construct) {
            return invoke(construct.getName(), construct.getArguments());
        }

        private String invoke(String name, List<ArgumentSlot> slots) {
            MacroRegistryEntry entry = registry.resolve(name);
            if (!registry.contains(name)) {
                log.debug("No handler registered for '{}', rendering its name", name);
            }
            List<Optional<String>> rendered = new ArrayList<>(slots.size());
            for (ArgumentSlot slot : slots) {
                rendered.add(slot.getContent().map(this::render));
            }
            return entry.getHandler().render(new MacroArguments(name, slots, rendered), this);
        }

        private String displayBlock(String content) {
            String indent = options.getDisplayMathIndent();
            return "\n" + indent + content.strip().replace("\n", "\n" + indent) + "\n";
        }
    }
}
