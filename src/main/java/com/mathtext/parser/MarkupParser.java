package com.mathtext.parser;

import com.mathtext.model.ArgumentKind;
import com.mathtext.model.ArgumentSignature;
import com.mathtext.model.ArgumentSlot;
import com.mathtext.model.CommentNode;
import com.mathtext.model.ConstructNode;
import com.mathtext.model.GroupNode;
import com.mathtext.model.MarkupNode;
import com.mathtext.model.SpecialNode;
import com.mathtext.model.TextNode;
import com.mathtext.parser.MarkupToken.TokenType;
import com.mathtext.render.registry.MacroRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Parser for LaTeX-style math markup.
 * Converts tokens into an immutable node tree.
 *
 * <p>Construct arguments are read according to the signatures in the
 * {@link MacroRegistry}; names the registry does not know take no arguments.
 * Sequences listed as specials ({@code ~}, {@code \langle}, ...) become
 * {@link SpecialNode}s instead of constructs.
 *
 * <p>Every structural problem is fatal and reported as a
 * {@link MarkupParseException}; the parser does not try to recover.
 */
public class MarkupParser {
    private static final Logger log = LoggerFactory.getLogger(MarkupParser.class);

    public static final int DEFAULT_MAX_NESTING = 512;

    private final List<MarkupToken> tokens;
    private final MacroRegistry registry;
    private final Set<String> specials;
    private final int maxNesting;
    private int pos = 0;
    private int nesting = 0;

    public MarkupParser(List<MarkupToken> tokens, MacroRegistry registry, Set<String> specials, int maxNesting) {
        this.tokens = tokens;
        this.registry = registry;
        this.specials = Set.copyOf(specials);
        this.maxNesting = maxNesting;
    }

    public MarkupParser(List<MarkupToken> tokens, MacroRegistry registry, Set<String> specials) {
        this(tokens, registry, specials, DEFAULT_MAX_NESTING);
    }

    public List<MarkupNode> parse() throws MarkupParseException {
        List<MarkupNode> nodes = parseNodes(token -> token.getType() == TokenType.EOF, "end of input", peek());
        log.debug("Parsed {} top-level nodes", nodes.size());
        return nodes;
    }

    /**
     * Parses nodes up to, but not including, the first token matching
     * {@code isEnd}. Running out of input first is an error naming the opener.
     */
    private List<MarkupNode> parseNodes(Predicate<MarkupToken> isEnd, String expected, MarkupToken opener)
            throws MarkupParseException {
        enterNesting(peek());
        List<MarkupNode> nodes = new ArrayList<>();
        TextRun text = new TextRun();

        while (!isEnd.test(peek())) {
            MarkupToken token = peek();
            switch (token.getType()) {
                case EOF ->
                    throw new MarkupParseException("Expected " + expected + " to close "
                            + opener.describe() + " opened at line " + opener.getLine()
                            + ", column " + opener.getColumn() + " but reached end of input", token);
                case CHAR -> {
                    advance();
                    if (specials.contains(token.getValue())) {
                        text.flushInto(nodes);
                        nodes.add(new SpecialNode(token.getValue(), token.getLine(), token.getColumn()));
                    } else {
                        text.append(token);
                    }
                }
                case ESCAPED_CHAR -> {
                    advance();
                    text.append(token);
                }
                case COMMENT -> {
                    advance();
                    text.flushInto(nodes);
                    nodes.add(new CommentNode(token.getValue(), token.getLine(), token.getColumn()));
                }
                case BEGIN_GROUP -> {
                    text.flushInto(nodes);
                    nodes.add(parseBraceGroup());
                }
                case MATH_SHIFT, DISPLAY_MATH_SHIFT, MATH_OPEN -> {
                    text.flushInto(nodes);
                    nodes.add(parseMath());
                }
                case CONTROL_WORD, CONTROL_SYMBOL, SUBSCRIPT, SUPERSCRIPT -> {
                    text.flushInto(nodes);
                    nodes.add(parseControlSequence());
                }
                case END_GROUP, MATH_CLOSE ->
                    throw new MarkupParseException("Unmatched " + token.describe(), token);
            }
        }

        text.flushInto(nodes);
        nesting--;
        return nodes;
    }

    private GroupNode parseBraceGroup() throws MarkupParseException {
        MarkupToken open = advance();
        List<MarkupNode> children = parseBraceContent(open);
        return new GroupNode(GroupNode.OPEN_BRACE, GroupNode.CLOSE_BRACE, children, open.getLine(), open.getColumn());
    }

    private List<MarkupNode> parseBraceContent(MarkupToken open) throws MarkupParseException {
        List<MarkupNode> children = parseNodes(t -> t.getType() == TokenType.END_GROUP, "'}'", open);
        advance();
        return children;
    }

    private GroupNode parseMath() throws MarkupParseException {
        MarkupToken open = advance();
        String close = switch (open.getType()) {
            case MATH_SHIFT -> GroupNode.DOLLAR;
            case DISPLAY_MATH_SHIFT -> GroupNode.DOUBLE_DOLLAR;
            default -> GroupNode.OPEN_INLINE_MATH.equals(open.getValue())
                    ? GroupNode.CLOSE_INLINE_MATH
                    : GroupNode.CLOSE_DISPLAY_MATH;
        };
        TokenType closeType = open.getType() == TokenType.MATH_OPEN ? TokenType.MATH_CLOSE : open.getType();

        List<MarkupNode> children = parseNodes(
                t -> t.getType() == closeType && t.getValue().equals(close), "'" + close + "'", open);
        advance();
        return new GroupNode(open.getValue(), close, children, open.getLine(), open.getColumn());
    }

    /**
     * A control word, control symbol, or sub/superscript marker together with
     * the arguments its signature declares.
     */
    private MarkupNode parseControlSequence() throws MarkupParseException {
        MarkupToken token = advance();
        String name = token.getValue();

        if (token.isControlSequence() && specials.contains("\\" + name)) {
            return new SpecialNode("\\" + name, token.getLine(), token.getColumn());
        }

        ArgumentSignature signature = registry.resolve(name).getSignature();
        List<ArgumentSlot> slots = new ArrayList<>(signature.size());
        // Unbraced arguments (\boxed\boxed x) nest without passing through parseNodes
        enterNesting(token);
        for (ArgumentKind kind : signature.getKinds()) {
            slots.add(parseArgument(kind, token));
        }
        nesting--;
        log.debug("Parsed construct '{}' with {} argument(s) at line {}", name, slots.size(), token.getLine());
        return new ConstructNode(name, slots, token.getLine(), token.getColumn());
    }

    private ArgumentSlot parseArgument(ArgumentKind kind, MarkupToken owner) throws MarkupParseException {
        return switch (kind) {
            case MANDATORY -> ArgumentSlot.present(kind, parseMandatory(owner));
            case OPTIONAL -> parseOptional(owner);
            case STAR -> parseStar();
            case EMBELLISHMENT -> parseEmbellishment(owner);
            case ANY_DELIMITED -> parseDelimited(owner);
        };
    }

    /**
     * A brace group's content, or a single control sequence or character.
     */
    private List<MarkupNode> parseMandatory(MarkupToken owner) throws MarkupParseException {
        skipWhitespace();
        MarkupToken token = peek();
        switch (token.getType()) {
            case BEGIN_GROUP -> {
                advance();
                return parseBraceContent(token);
            }
            case CONTROL_WORD, CONTROL_SYMBOL -> {
                return List.of(parseControlSequence());
            }
            case CHAR, ESCAPED_CHAR -> {
                advance();
                if (token.getType() == TokenType.CHAR && specials.contains(token.getValue())) {
                    return List.of(new SpecialNode(token.getValue(), token.getLine(), token.getColumn()));
                }
                return List.of(new TextNode(token.getValue(), token.getLine(), token.getColumn()));
            }
            default -> throw new MarkupParseException("Missing argument for " + owner.describe()
                    + ", found " + token.describe(), token);
        }
    }

    private ArgumentSlot parseOptional(MarkupToken owner) throws MarkupParseException {
        int saved = pos;
        skipWhitespace();
        MarkupToken open = peek();
        if (!open.isChar('[')) {
            pos = saved;
            return ArgumentSlot.absent(ArgumentKind.OPTIONAL);
        }
        advance();
        List<MarkupNode> content = parseNodes(t -> t.isChar(']'), "']' for the optional argument of "
                + owner.describe(), open);
        advance();
        return ArgumentSlot.present(ArgumentKind.OPTIONAL, content);
    }

    private ArgumentSlot parseStar() {
        if (peek().isChar('*')) {
            advance();
            return ArgumentSlot.present(ArgumentKind.STAR, List.of());
        }
        return ArgumentSlot.absent(ArgumentKind.STAR);
    }

    private ArgumentSlot parseEmbellishment(MarkupToken owner) throws MarkupParseException {
        int saved = pos;
        skipWhitespace();
        MarkupToken marker = peek();
        if (!marker.isScript()) {
            pos = saved;
            return ArgumentSlot.absent(ArgumentKind.EMBELLISHMENT);
        }
        advance();
        List<MarkupNode> annotation = parseMandatory(marker);
        GroupNode group = new GroupNode(marker.getValue(), "", annotation, marker.getLine(), marker.getColumn());
        return ArgumentSlot.present(ArgumentKind.EMBELLISHMENT, List.of(group));
    }

    private ArgumentSlot parseDelimited(MarkupToken owner) throws MarkupParseException {
        skipWhitespace();
        MarkupToken open = peek();
        if (open.getType() != TokenType.CHAR) {
            throw new MarkupParseException("Missing delimited argument for " + owner.describe()
                    + ", found " + open.describe(), open);
        }
        advance();
        char close = closingDelimiter(open.getValue().charAt(0));
        List<MarkupNode> content = parseNodes(t -> t.isChar(close), "'" + close + "'", open);
        advance();
        return ArgumentSlot.present(ArgumentKind.ANY_DELIMITED, content);
    }

    private static char closingDelimiter(char open) {
        return switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            case '<' -> '>';
            default -> open;
        };
    }

    private void enterNesting(MarkupToken token) throws MarkupParseException {
        if (++nesting > maxNesting) {
            throw new MarkupParseException("Nesting deeper than " + maxNesting + " levels", token);
        }
    }

    private void skipWhitespace() {
        while (peek().isWhitespace()) {
            advance();
        }
    }

    private MarkupToken peek() {
        return tokens.get(pos);
    }

    private MarkupToken advance() {
        MarkupToken token = tokens.get(pos);
        if (token.getType() != TokenType.EOF) {
            pos++;
        }
        return token;
    }

    /**
     * Consecutive characters collected into one text node.
     */
    private static final class TextRun {
        private final StringBuilder sb = new StringBuilder();
        private int line;
        private int column;

        void append(MarkupToken token) {
            if (sb.length() == 0) {
                line = token.getLine();
                column = token.getColumn();
            }
            sb.append(token.getValue());
        }

        void flushInto(List<MarkupNode> nodes) {
            if (sb.length() > 0) {
                nodes.add(new TextNode(sb.toString(), line, column));
                sb.setLength(0);
            }
        }
    }
}
