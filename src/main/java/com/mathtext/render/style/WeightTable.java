package com.mathtext.render.style;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An ordered list of non-negative selection weights. Weights need not sum to
 * one; at least one must be positive.
 */
@EqualsAndHashCode
public final class WeightTable {
    private final List<Double> weights;

    private WeightTable(List<Double> weights) {
        if (weights.isEmpty()) {
            throw new IllegalArgumentException("Weight table must not be empty");
        }
        double max = 0;
        for (double w : weights) {
            if (Double.isNaN(w) || Double.isInfinite(w) || w < 0) {
                throw new IllegalArgumentException("Weights must be finite and non-negative: " + weights);
            }
            max = Math.max(max, w);
        }
        if (max == 0) {
            throw new IllegalArgumentException("At least one weight must be positive: " + weights);
        }
        this.weights = List.copyOf(weights);
    }

    public static WeightTable of(double... weights) {
        List<Double> list = new ArrayList<>(weights.length);
        for (double w : weights) {
            list.add(w);
        }
        return new WeightTable(list);
    }

    /**
     * Parses a comma-separated list such as {@code "0.8,0.2"}.
     */
    public static WeightTable parse(String csv) {
        if (csv == null || csv.isBlank()) {
            throw new IllegalArgumentException("Weight list is empty");
        }
        List<Double> list = new ArrayList<>();
        for (String part : csv.split(",")) {
            String trimmed = part.trim();
            try {
                list.add(Double.parseDouble(trimmed));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a number in weight list \"" + csv + "\": " + trimmed, e);
            }
        }
        return new WeightTable(list);
    }

    public int size() {
        return weights.size();
    }

    public double get(int index) {
        return weights.get(index);
    }

    public List<Double> asList() {
        return weights;
    }

    /**
     * Pairs each text with the weight at the same position.
     */
    public List<WeightedOption> pair(String... texts) {
        if (texts.length != weights.size()) {
            throw new IllegalArgumentException("Expected " + weights.size() + " options but got "
                    + texts.length + ": " + Arrays.toString(texts));
        }
        List<WeightedOption> options = new ArrayList<>(texts.length);
        for (int i = 0; i < texts.length; i++) {
            options.add(WeightedOption.of(texts[i], weights.get(i)));
        }
        return options;
    }

    @Override
    public String toString() {
        return weights.toString();
    }
}
