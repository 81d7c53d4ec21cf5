package com.counterfactual.engine.domain.model;

public record SkippedPair(String entityId, String eventName, Reason reason, String message) {

    public enum Reason {
        INSUFFICIENT_DATA,
        FORECAST_FAILED
    }
}
