package com.counterfactual.engine.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

public record Event(String name, Instant start, Instant end, Map<String, Object> metadata) {

    public Event {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("event name must not be blank");
        }
        if (start == null || end == null) {
            throw new IllegalArgumentException("event " + name + " needs both start and end");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException(
                    "invalid event dates for " + name + ": start " + start + " is after end " + end);
        }
        name = name.trim();
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public Event(String name, Instant start, Instant end) {
        this(name, start, end, Map.of());
    }

    /**
     * Last timestamp a counterfactual is produced for: end of the event plus the trailing horizon.
     */
    public Instant horizonEnd(int forecastDays) {
        return end.plus(Duration.ofDays(forecastDays));
    }
}
