package com.mathtext.render.style;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Weight tables for every stochastic construct. Any table left unset keeps
 * its default.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class StyleWeights {
    /** Spelled-out name, symbol. */
    public static final WeightTable DEFAULT_GREEK_LETTER = WeightTable.of(0.8, 0.2);
    /** {@code infinity}, {@code inf}, symbol. */
    public static final WeightTable DEFAULT_INFINITY = WeightTable.of(0.4, 0.4, 0.2);
    /** {@code pi}, symbol. */
    public static final WeightTable DEFAULT_PI = WeightTable.of(0.8, 0.2);
    /** Radical form {@code sqrt(x)}, power form. */
    public static final WeightTable DEFAULT_ROOT_STYLE = WeightTable.of(0.5, 0.5);
    /** {@code ^}, {@code **}. */
    public static final WeightTable DEFAULT_EXPONENT_OPERATOR = WeightTable.of(0.5, 0.5);
    /** Decimal exponent, fraction exponent. */
    public static final WeightTable DEFAULT_EXPONENT_FORM = WeightTable.of(0.5, 0.5);

    private final WeightTable greekLetter;
    private final WeightTable infinity;
    private final WeightTable pi;
    private final WeightTable rootStyle;
    private final WeightTable exponentOperator;
    private final WeightTable exponentForm;

    @Builder(toBuilder = true)
    private StyleWeights(WeightTable greekLetter, WeightTable infinity, WeightTable pi,
                         WeightTable rootStyle, WeightTable exponentOperator, WeightTable exponentForm) {
        this.greekLetter = checked("greekLetter", greekLetter, DEFAULT_GREEK_LETTER);
        this.infinity = checked("infinity", infinity, DEFAULT_INFINITY);
        this.pi = checked("pi", pi, DEFAULT_PI);
        this.rootStyle = checked("rootStyle", rootStyle, DEFAULT_ROOT_STYLE);
        this.exponentOperator = checked("exponentOperator", exponentOperator, DEFAULT_EXPONENT_OPERATOR);
        this.exponentForm = checked("exponentForm", exponentForm, DEFAULT_EXPONENT_FORM);
    }

    public static StyleWeights defaults() {
        return builder().build();
    }

    private static WeightTable checked(String name, WeightTable value, WeightTable fallback) {
        if (value == null) {
            return fallback;
        }
        if (value.size() != fallback.size()) {
            throw new IllegalArgumentException(name + " weights need " + fallback.size()
                    + " entries but got " + value.size() + ": " + value);
        }
        return value;
    }
}
