package com.counterfactual.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Forecast of one (entity, event) pair plus the fitted model summary it came from.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CounterfactualResult {

    private String entityId;
    private String eventName;
    private List<ForecastPoint> points;
    private ModelSummary model;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelSummary {
        private CyclePeriod cyclePeriod;
        private String frequency;
        private int preEventPoints;
        private double baseline;
        private int observedPhases;
        private double[] arCoefficients;
        private double arIntercept;
        private double residualStd;
        private boolean arDegenerate;
    }
}
