package com.counterfactual.engine.domain.model;

import java.time.Instant;

public record SeriesPoint(Instant timestamp, double value, String entityId) {

    public SeriesPoint {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite");
        }
    }
}
