package com.mathtext.parser;

import com.mathtext.parser.MarkupToken.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Tokenizer for LaTeX-style math markup.
 *
 * <p>Ordinary characters, whitespace included, come out one per
 * {@code CHAR} token; the parser merges them back into text runs. A trailing
 * lone backslash is kept as a character.
 */
public class MarkupTokenizer {
    private static final Logger log = LoggerFactory.getLogger(MarkupTokenizer.class);

    // \% \& \$ \# \_ stand for the character itself
    private static final Set<Character> ESCAPABLE = Set.of('%', '&', '$', '#', '_');

    private final String source;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public MarkupTokenizer(String source) {
        this.source = source != null ? source : "";
    }

    /**
     * Tokenize the entire source.
     */
    public List<MarkupToken> tokenize() {
        List<MarkupToken> tokens = new ArrayList<>();
        while (pos < source.length()) {
            tokens.add(nextToken());
        }
        tokens.add(new MarkupToken(TokenType.EOF, "", line, column));
        log.debug("Tokenized {} characters into {} tokens", source.length(), tokens.size());
        return tokens;
    }

    private MarkupToken nextToken() {
        char c = source.charAt(pos);
        int startLine = line;
        int startCol = column;

        switch (c) {
            case '\\':
                return readControlSequence(startLine, startCol);
            case '{':
                advance();
                return new MarkupToken(TokenType.BEGIN_GROUP, "{", startLine, startCol);
            case '}':
                advance();
                return new MarkupToken(TokenType.END_GROUP, "}", startLine, startCol);
            case '$':
                advance();
                if (pos < source.length() && source.charAt(pos) == '$') {
                    advance();
                    return new MarkupToken(TokenType.DISPLAY_MATH_SHIFT, "$$", startLine, startCol);
                }
                return new MarkupToken(TokenType.MATH_SHIFT, "$", startLine, startCol);
            case '_':
                advance();
                return new MarkupToken(TokenType.SUBSCRIPT, "_", startLine, startCol);
            case '^':
                advance();
                return new MarkupToken(TokenType.SUPERSCRIPT, "^", startLine, startCol);
            case '%':
                return readComment(startLine, startCol);
            default:
                advance();
                return new MarkupToken(TokenType.CHAR, String.valueOf(c), startLine, startCol);
        }
    }

    private MarkupToken readControlSequence(int startLine, int startCol) {
        advance(); // backslash
        if (pos >= source.length()) {
            return new MarkupToken(TokenType.CHAR, "\\", startLine, startCol);
        }

        char c = source.charAt(pos);
        if (isAsciiLetter(c)) {
            StringBuilder sb = new StringBuilder();
            while (pos < source.length() && isAsciiLetter(source.charAt(pos))) {
                sb.append(source.charAt(pos));
                advance();
            }
            return new MarkupToken(TokenType.CONTROL_WORD, sb.toString(), startLine, startCol);
        }

        advance();
        if (c == '(' || c == '[') {
            return new MarkupToken(TokenType.MATH_OPEN, "\\" + c, startLine, startCol);
        }
        if (c == ')' || c == ']') {
            return new MarkupToken(TokenType.MATH_CLOSE, "\\" + c, startLine, startCol);
        }
        if (ESCAPABLE.contains(c)) {
            return new MarkupToken(TokenType.ESCAPED_CHAR, String.valueOf(c), startLine, startCol);
        }
        return new MarkupToken(TokenType.CONTROL_SYMBOL, String.valueOf(c), startLine, startCol);
    }

    private MarkupToken readComment(int startLine, int startCol) {
        advance(); // percent sign
        StringBuilder sb = new StringBuilder();
        while (pos < source.length() && source.charAt(pos) != '\n') {
            sb.append(source.charAt(pos));
            advance();
        }
        return new MarkupToken(TokenType.COMMENT, sb.toString(), startLine, startCol);
    }

    private void advance() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
