package com.counterfactual.engine.domain.model;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;

/**
 * Baseline level plus per-phase additive offsets, fit on one entity's pre-event window.
 */
public final class CyclicalModel {

    private final CyclePeriod period;
    private final ZoneId zone;
    private final double baseline;
    private final Map<Integer, Double> offsets;

    public CyclicalModel(CyclePeriod period, ZoneId zone, double baseline, Map<Integer, Double> offsets) {
        this.period = period;
        this.zone = zone;
        this.baseline = baseline;
        this.offsets = Map.copyOf(offsets);
    }

    public CyclePeriod period() {
        return period;
    }

    public double baseline() {
        return baseline;
    }

    public Map<Integer, Double> offsets() {
        return offsets;
    }

    public int phaseOf(Instant timestamp) {
        return period.phaseOf(timestamp.atZone(zone));
    }

    public double offsetAt(Instant timestamp) {
        return offsets.getOrDefault(phaseOf(timestamp), 0.0);
    }

    public double residual(SeriesPoint point) {
        return point.value() - baseline - offsetAt(point.timestamp());
    }
}
