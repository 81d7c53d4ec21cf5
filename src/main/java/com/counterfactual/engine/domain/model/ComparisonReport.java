package com.counterfactual.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Actual minus counterfactual, per event, over the event window plus its trailing horizon.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ComparisonReport {

    private ColumnMapping columns;
    private DifferenceFilter filter;
    private List<EventComparison> events;
    private List<SkippedEvent> skipped;
    private long timestamp;

    public record SkippedEvent(String eventName, String reason) {
    }

    public record DifferencePoint(Instant timestamp, String entityId, double actual,
                                  double counterfactual, double difference) {
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EventComparison {
        private String eventName;
        private String column;
        private Instant windowStart;
        private Instant windowEnd;
        private DifferenceSummary summary;
        private List<DifferencePoint> differences;
        private List<TimeAggregate> timeAggregated;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DifferenceSummary {
        private int count;
        private double mean;
        private double median;
        private double std;
        private double min;
        private double max;
        private double q25;
        private double q75;
        private int numPositive;
        private int numNegative;
        private int numZero;
        private double pctPositive;
        private double pctNegative;
        private double pctZero;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TimeAggregate {
        private Instant timestamp;
        private int count;
        private double mean;
        private double median;
        private double std;
        private double min;
        private double max;
        private int numPositive;
        private int numNegative;
        private int numZero;
    }
}
