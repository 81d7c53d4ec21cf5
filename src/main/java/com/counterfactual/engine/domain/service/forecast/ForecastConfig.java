package com.counterfactual.engine.domain.service.forecast;

import com.counterfactual.engine.domain.model.CyclePeriod;
import com.counterfactual.engine.domain.service.CounterfactualProperties;
import lombok.Builder;
import lombok.Getter;

import java.time.ZoneId;

/**
 * Per-run settings. Defaults come from {@link CounterfactualProperties}; requests may override them.
 */
@Getter
@Builder(toBuilder = true)
public class ForecastConfig {

    private final String timeCol;
    private final String targetCol;
    private final String entityCol;

    @Builder.Default
    private final boolean autoDetect = true;

    @Builder.Default
    private final int detectionSampleSize = 20;

    @Builder.Default
    private final int arOrder = 1;

    /** Null selects the period from the series frequency. */
    private final CyclePeriod cyclePeriod;

    @Builder.Default
    private final int forecastDays = 5;

    private final Double minValue;
    private final Double maxValue;

    @Builder.Default
    private final double noiseFactor = 0.5;

    @Builder.Default
    private final NoiseMode noiseMode = NoiseMode.SEEDED;

    @Builder.Default
    private final long noiseSeed = 0L;

    @Builder.Default
    private final String outputPrefix = "counterfactual";

    @Builder.Default
    private final ZoneId zone = ZoneId.of("UTC");

    @Builder.Default
    private final int parallelism = 1;

    public static ForecastConfig from(CounterfactualProperties properties) {
        return ForecastConfig.builder()
                .timeCol(properties.getTimeCol())
                .targetCol(properties.getTargetCol())
                .entityCol(properties.getEntityCol())
                .autoDetect(properties.isAutoDetect())
                .detectionSampleSize(properties.getDetectionSampleSize())
                .arOrder(properties.getArOrder())
                .cyclePeriod(CyclePeriod.fromLabel(properties.getCyclePeriod()))
                .forecastDays(properties.getForecastDays())
                .minValue(properties.getMinValue())
                .maxValue(properties.getMaxValue())
                .noiseFactor(properties.getNoiseFactor())
                .noiseMode(properties.getNoiseMode())
                .noiseSeed(properties.getNoiseSeed())
                .outputPrefix(properties.getOutputPrefix())
                .zone(ZoneId.of(properties.getZone()))
                .parallelism(properties.getParallelism())
                .build();
    }

    /**
     * Minimum cleaned points an entity needs before any of its events is attempted.
     */
    public int minEntityPoints() {
        return Math.max(2 * arOrder, 4);
    }

    /**
     * Minimum points strictly before an event's start for that pair to be forecast.
     */
    public int minPreEventPoints() {
        return Math.max(2 * arOrder, 2);
    }

    public String columnFor(String eventName) {
        return outputPrefix + "_" + eventName;
    }

    public double clamp(double value) {
        double clamped = value;
        if (minValue != null) clamped = Math.max(clamped, minValue);
        if (maxValue != null) clamped = Math.min(clamped, maxValue);
        return clamped;
    }

    public void validate() {
        if (arOrder < 0) {
            throw new IllegalArgumentException("arOrder must not be negative");
        }
        if (forecastDays < 0) {
            throw new IllegalArgumentException("forecastDays must not be negative");
        }
        if (!(noiseFactor >= 0.0 && noiseFactor <= 1.0)) {
            throw new IllegalArgumentException("noiseFactor must be within [0, 1]");
        }
        if (minValue != null && maxValue != null && minValue > maxValue) {
            throw new IllegalArgumentException("minValue must not exceed maxValue");
        }
        if (detectionSampleSize <= 0) {
            throw new IllegalArgumentException("detectionSampleSize must be positive");
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
        if (outputPrefix == null || outputPrefix.isBlank()) {
            throw new IllegalArgumentException("outputPrefix must not be blank");
        }
    }
}
