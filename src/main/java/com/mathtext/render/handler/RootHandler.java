package com.mathtext.render.handler;

import com.mathtext.render.registry.MacroArguments;
import com.mathtext.render.registry.MacroHandler;
import com.mathtext.render.registry.RenderContext;
import com.mathtext.render.style.StyleSelector;
import com.mathtext.render.style.StyleWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;

/**
 * Renders {@code \sqrt[n]{x}} either in radical form {@code sqrt(x)} or as a
 * power {@code x^e} / {@code x**e}.
 *
 * <p>Without an index the exponent is {@code 0.5} or {@code (1/2)}. With an
 * index the exponent is the reciprocal of the index, written as a short
 * decimal when it has at most {@value #MAX_DECIMAL_DIGITS} fractional digits
 * and chosen that way, otherwise as {@code (1/n)} with the index text as
 * written. The radical form is only reachable with an index equal to 2.
 *
 * <p>Choices are drawn in a fixed order: root style, exponent operator, then
 * exponent form (the last only when a short decimal exists).
 */
public class RootHandler implements MacroHandler {
    private static final Logger log = LoggerFactory.getLogger(RootHandler.class);

    static final int MAX_DECIMAL_DIGITS = 5;

    private static final String RADICAL = "radical";
    private static final String POWER = "power";
    private static final String DECIMAL = "decimal";
    private static final String FRACTION = "fraction";
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    @Override
    public String render(MacroArguments arguments, RenderContext context) {
        String radicand = arguments.last();
        Optional<String> index = arguments.size() > 1 ? arguments.text(0) : Optional.empty();

        StyleSelector selector = context.getSelector();
        StyleWeights weights = context.getWeights();
        boolean radical = RADICAL.equals(selector.choose(weights.getRootStyle(), RADICAL, POWER));

        if (index.isEmpty()) {
            if (radical) {
                return radical(radicand);
            }
            String operator = chooseOperator(selector, weights);
            String exponent = selector.choose(weights.getExponentForm(), "0.5", "(1/2)");
            return power(radicand, operator, exponent);
        }

        String indexText = index.get();
        Optional<BigDecimal> indexValue = parseIndex(indexText);
        if (radical && indexValue.isPresent() && indexValue.get().compareTo(TWO) == 0) {
            return radical(radicand);
        }

        String operator = chooseOperator(selector, weights);
        String fraction = "(1/" + indexText + ")";
        Optional<String> decimal = indexValue.flatMap(RootHandler::shortReciprocal);
        String exponent = fraction;
        if (decimal.isPresent()) {
            exponent = DECIMAL.equals(selector.choose(weights.getExponentForm(), DECIMAL, FRACTION))
                    ? decimal.get()
                    : fraction;
        }
        return power(radicand, operator, exponent);
    }

    static Optional<BigDecimal> parseIndex(String indexText) {
        try {
            return Optional.of(new BigDecimal(indexText.trim()));
        } catch (NumberFormatException e) {
            log.debug("Root index '{}' is not a number, using fraction exponent", indexText);
            return Optional.empty();
        }
    }

    /**
     * The reciprocal as plain decimal text with at least one fractional digit,
     * or empty when it is undefined or too long.
     */
    static Optional<String> shortReciprocal(BigDecimal index) {
        if (index.signum() == 0) {
            log.debug("Root index is zero, using fraction exponent");
            return Optional.empty();
        }
        BigDecimal reciprocal = BigDecimal.ONE.divide(index, MathContext.DECIMAL64).stripTrailingZeros();
        if (reciprocal.scale() > MAX_DECIMAL_DIGITS) {
            return Optional.empty();
        }
        if (reciprocal.scale() <= 0) {
            reciprocal = reciprocal.setScale(1);
        }
        return Optional.of(reciprocal.toPlainString());
    }

    private static String chooseOperator(StyleSelector selector, StyleWeights weights) {
        return selector.choose(weights.getExponentOperator(), "^", "**");
    }

    private static String radical(String radicand) {
        return "sqrt(" + radicand + ")";
    }

    private static String power(String radicand, String operator, String exponent) {
        return ExpressionText.parenthesizeIfNeeded(radicand) + operator + exponent;
    }
}
