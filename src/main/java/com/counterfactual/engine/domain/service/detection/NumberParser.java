package com.counterfactual.engine.domain.service.detection;

import java.util.OptionalDouble;

public final class NumberParser {

    private NumberParser() {
    }

    /**
     * Finite double from a number or numeric text; empty for blanks, NaN, infinities and non-numbers.
     */
    public static OptionalDouble parse(Object raw) {
        if (raw == null || raw instanceof Boolean) return OptionalDouble.empty();
        double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else {
            String text = raw.toString().trim();
            if (text.isEmpty()) return OptionalDouble.empty();
            try {
                value = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    public static boolean isBlank(Object raw) {
        return raw == null || raw.toString().isBlank();
    }
}
