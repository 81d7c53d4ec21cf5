package com.counterfactual.engine.domain.model;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;

public enum CyclePeriod {
    HOUR, DAY, WEEK, MONTH;

    private static final Duration ONE_DAY = Duration.ofDays(1);
    private static final Duration TWO_DAYS = Duration.ofDays(2);
    private static final Duration FOUR_WEEKS = Duration.ofDays(28);

    /**
     * Phase bucket of a local timestamp: hour 0-23, day-of-week 0-6 (Monday = 0),
     * ISO week 1-53, month 1-12.
     */
    public int phaseOf(ZonedDateTime time) {
        return switch (this) {
            case HOUR -> time.getHour();
            case DAY -> time.getDayOfWeek().getValue() - 1;
            case WEEK -> time.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
            case MONTH -> time.getMonthValue();
        };
    }

    public static CyclePeriod forFrequency(Duration frequency) {
        if (frequency.compareTo(ONE_DAY) < 0) return HOUR;
        if (frequency.compareTo(TWO_DAYS) < 0) return DAY;
        if (frequency.compareTo(FOUR_WEEKS) < 0) return WEEK;
        return MONTH;
    }

    public static CyclePeriod fromLabel(String label) {
        if (label == null || label.isBlank() || "auto".equalsIgnoreCase(label.trim())) {
            return null;
        }
        try {
            return valueOf(label.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "unsupported cycle period '" + label + "', expected hour, day, week, month or auto", e);
        }
    }
}
