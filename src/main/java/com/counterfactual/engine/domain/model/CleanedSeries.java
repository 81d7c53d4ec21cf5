package com.counterfactual.engine.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Sorted, de-duplicated points of a single entity with its inferred sampling frequency.
 */
public final class CleanedSeries {

    private final String entityId;
    private final List<SeriesPoint> points;
    private final Duration frequency;

    public CleanedSeries(String entityId, List<SeriesPoint> points, Duration frequency) {
        if (points == null || points.size() < 2) {
            throw new IllegalArgumentException("a cleaned series needs at least 2 points");
        }
        if (frequency == null || frequency.isZero() || frequency.isNegative()) {
            throw new IllegalArgumentException("frequency must be strictly positive");
        }
        for (int i = 1; i < points.size(); i++) {
            if (!points.get(i).timestamp().isAfter(points.get(i - 1).timestamp())) {
                throw new IllegalArgumentException("timestamps must be strictly increasing at index " + i);
            }
        }
        this.entityId = entityId;
        this.points = List.copyOf(points);
        this.frequency = frequency;
    }

    public String entityId() {
        return entityId;
    }

    public List<SeriesPoint> points() {
        return points;
    }

    public Duration frequency() {
        return frequency;
    }

    public int size() {
        return points.size();
    }

    /**
     * Points strictly before {@code cutoff}, in time order.
     */
    public List<SeriesPoint> before(Instant cutoff) {
        int lo = 0;
        int hi = points.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (points.get(mid).timestamp().isBefore(cutoff)) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo == 0 ? Collections.emptyList() : points.subList(0, lo);
    }

    @Override
    public String toString() {
        return "CleanedSeries{entity=" + entityId + ", points=" + points.size() + ", frequency=" + frequency + "}";
    }
}
