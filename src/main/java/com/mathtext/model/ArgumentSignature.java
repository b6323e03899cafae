package com.mathtext.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered declaration of the argument kinds a construct accepts.
 *
 * <p>Signatures are usually written in compact notation, one character per
 * argument: '&#123;' mandatory, '[' optional, '*' star, 'e' embellishment,
 * 'r' any-delimited pair. "[&#123;" is an optional argument followed by a
 * mandatory one.
 */
@Getter
@EqualsAndHashCode
public final class ArgumentSignature {
    private static final ArgumentSignature NONE = new ArgumentSignature(List.of());

    private final List<ArgumentKind> kinds;

    private ArgumentSignature(List<ArgumentKind> kinds) {
        this.kinds = List.copyOf(kinds);
    }

    public static ArgumentSignature none() {
        return NONE;
    }

    public static ArgumentSignature of(ArgumentKind... kinds) {
        return kinds.length == 0 ? NONE : new ArgumentSignature(List.of(kinds));
    }

    public static ArgumentSignature parse(String notation) {
        if (notation == null || notation.isEmpty()) {
            return NONE;
        }
        List<ArgumentKind> kinds = new ArrayList<>();
        for (char c : notation.toCharArray()) {
            kinds.add(ArgumentKind.fromNotation(c)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown argument kind '" + c + "' in signature \"" + notation + "\"")));
        }
        return new ArgumentSignature(kinds);
    }

    public int size() {
        return kinds.size();
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public ArgumentKind get(int index) {
        return kinds.get(index);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (ArgumentKind kind : kinds) {
            sb.append(kind.getNotation());
        }
        return sb.toString();
    }
}
