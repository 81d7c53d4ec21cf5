package com.counterfactual.engine.api.dto;

import com.counterfactual.engine.domain.service.forecast.NoiseMode;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Per-request overrides. A null field keeps the configured default.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ForecastOptions(
        String timeCol,
        String targetCol,
        String entityCol,
        Boolean autoDetect,
        Integer arOrder,
        String cyclePeriod,
        Integer forecastDays,
        Double minValue,
        Double maxValue,
        Double noiseFactor,
        NoiseMode noiseMode,
        Long noiseSeed,
        String outputPrefix,
        String zone,
        Integer parallelism) {
}
