package com.mathtext.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of argument a construct may declare, with the character used for
 * each in the compact signature notation.
 */
public enum ArgumentKind {
    MANDATORY('{'),
    OPTIONAL('['),
    STAR('*'),
    EMBELLISHMENT('e'),
    ANY_DELIMITED('r');

    private final char notation;

    ArgumentKind(char notation) {
        this.notation = notation;
    }

    public char getNotation() {
        return notation;
    }

    public boolean isRequired() {
        return this == MANDATORY;
    }

    public static Optional<ArgumentKind> fromNotation(char c) {
        return Arrays.stream(values())
                .filter(kind -> kind.notation == c)
                .findFirst();
    }
}
