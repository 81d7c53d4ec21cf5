package com.counterfactual.engine.domain.model;

import com.counterfactual.engine.domain.model.ComparisonReport.DifferencePoint;

import java.time.Instant;
import java.util.Locale;

/**
 * Narrows the differences of a comparison before they are summarized. Every bound is optional;
 * {@code entity} is a case-insensitive substring of the entity id, {@code from} and {@code to} are
 * inclusive.
 */
public record DifferenceFilter(String entity, Instant from, Instant to) {

    public static final DifferenceFilter NONE = new DifferenceFilter(null, null, null);

    public DifferenceFilter {
        entity = entity == null || entity.isBlank() ? null : entity.trim();
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("filter range is inverted: from " + from + " is after to " + to);
        }
    }

    public boolean isEmpty() {
        return entity == null && from == null && to == null;
    }

    public boolean matches(DifferencePoint point) {
        if (from != null && point.timestamp().isBefore(from)) return false;
        if (to != null && point.timestamp().isAfter(to)) return false;
        if (entity == null) return true;
        return point.entityId() != null
                && point.entityId().toLowerCase(Locale.ROOT).contains(entity.toLowerCase(Locale.ROOT));
    }
}
