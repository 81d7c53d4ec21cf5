package com.counterfactual.engine.domain.model;

import java.time.Instant;

public record ForecastPoint(Instant timestamp, String entityId, String eventName, double value) {
}
