package com.counterfactual.engine.domain.service.forecast;

public enum NoiseMode {
    /** Seed derived from the configured seed, entity and event name; reruns reproduce the same draws. */
    SEEDED,
    RANDOM
}
