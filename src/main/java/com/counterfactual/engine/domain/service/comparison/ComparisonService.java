package com.counterfactual.engine.domain.service.comparison;

import com.counterfactual.engine.domain.model.CleanedSeries;
import com.counterfactual.engine.domain.model.ColumnMapping;
import com.counterfactual.engine.domain.model.ComparisonReport;
import com.counterfactual.engine.domain.model.ComparisonReport.DifferencePoint;
import com.counterfactual.engine.domain.model.ComparisonReport.DifferenceSummary;
import com.counterfactual.engine.domain.model.ComparisonReport.EventComparison;
import com.counterfactual.engine.domain.model.ComparisonReport.SkippedEvent;
import com.counterfactual.engine.domain.model.ComparisonReport.TimeAggregate;
import com.counterfactual.engine.domain.model.DifferenceFilter;
import com.counterfactual.engine.domain.model.Event;
import com.counterfactual.engine.domain.model.RawTable;
import com.counterfactual.engine.domain.model.SeriesPoint;
import com.counterfactual.engine.domain.service.cleaning.CleaningResult;
import com.counterfactual.engine.domain.service.cleaning.SeriesCleaner;
import com.counterfactual.engine.domain.service.detection.NumberParser;
import com.counterfactual.engine.domain.service.detection.SchemaDetector;
import com.counterfactual.engine.domain.service.detection.TimestampParser;
import com.counterfactual.engine.domain.service.forecast.ForecastConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Aligns observed values with a counterfactual table by time (and entity) and summarizes
 * {@code actual - counterfactual} per event. Pure arithmetic over produced output.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComparisonService {

    private static final int MIN_ACTUAL_POINTS = 2;

    private final SchemaDetector schemaDetector;
    private final SeriesCleaner seriesCleaner;

    public ComparisonReport compare(RawTable actual, RawTable counterfactual,
                                    List<Event> events, ForecastConfig config) {
        return compare(actual, counterfactual, events, config, DifferenceFilter.NONE);
    }

    public ComparisonReport compare(RawTable actual, RawTable counterfactual, List<Event> events,
                                    ForecastConfig config, DifferenceFilter filter) {
        config.validate();
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("at least one event is required");
        }

        ColumnMapping mapping = schemaDetector.detect(actual, config);
        CleaningResult cleaning = seriesCleaner.clean(actual, mapping, config.getZone(), MIN_ACTUAL_POINTS);

        Map<PointKey, Double> observed = new HashMap<>();
        for (CleanedSeries series : cleaning.series()) {
            for (SeriesPoint point : series.points()) {
                observed.put(new PointKey(point.timestamp(), point.entityId()), point.value());
            }
        }

        String cfTimeCol = counterfactual.hasColumn(mapping.timeColumn())
                ? mapping.timeColumn()
                : counterfactual.columns().get(0);
        String cfEntityCol = mapping.entity().filter(counterfactual::hasColumn).orElse(null);

        List<EventComparison> comparisons = new ArrayList<>();
        List<SkippedEvent> skipped = new ArrayList<>();

        for (Event event : events) {
            String column = config.columnFor(event.name());
            if (!counterfactual.hasColumn(column)) {
                skipped.add(new SkippedEvent(event.name(), "counterfactual column '" + column + "' not found"));
                log.warn("[Compare] column missing, event skipped: event={}, column={}", event.name(), column);
                continue;
            }

            Instant windowEnd = event.horizonEnd(config.getForecastDays());
            List<DifferencePoint> differences = new ArrayList<>();
            for (Map<String, Object> row : counterfactual.rows()) {
                Optional<Instant> time = TimestampParser.parse(row.get(cfTimeCol), config.getZone());
                OptionalDouble cfValue = NumberParser.parse(row.get(column));
                if (time.isEmpty() || cfValue.isEmpty()) continue;
                if (time.get().isBefore(event.start()) || time.get().isAfter(windowEnd)) continue;

                String entityId = cfEntityCol == null ? null : stringOrNull(row.get(cfEntityCol));
                Double actualValue = observed.get(new PointKey(time.get(), entityId));
                if (actualValue == null) continue;

                double cf = cfValue.getAsDouble();
                differences.add(new DifferencePoint(time.get(), entityId, actualValue, cf, actualValue - cf));
            }

            if (differences.isEmpty()) {
                skipped.add(new SkippedEvent(event.name(), "no aligned actual/counterfactual points in window"));
                log.warn("[Compare] no aligned points, event skipped: event={}", event.name());
                continue;
            }
            if (!filter.isEmpty()) {
                differences.removeIf(point -> !filter.matches(point));
                if (differences.isEmpty()) {
                    skipped.add(new SkippedEvent(event.name(), "no aligned points match " + filter));
                    log.warn("[Compare] filter left no points, event skipped: event={}, filter={}", event.name(), filter);
                    continue;
                }
            }

            differences.sort(Comparator.comparing(DifferencePoint::timestamp)
                    .thenComparing(DifferencePoint::entityId, Comparator.nullsFirst(Comparator.naturalOrder())));

            EventComparison comparison = EventComparison.builder()
                    .eventName(event.name())
                    .column(column)
                    .windowStart(event.start())
                    .windowEnd(windowEnd)
                    .summary(summarize(differences))
                    .differences(differences)
                    .timeAggregated(aggregateByTime(differences))
                    .build();
            comparisons.add(comparison);

            log.info("[Compare] event={}, points={}, mean={}, median={}",
                    event.name(), differences.size(),
                    String.format("%.3f", comparison.getSummary().getMean()),
                    String.format("%.3f", comparison.getSummary().getMedian()));
        }

        return ComparisonReport.builder()
                .columns(mapping)
                .filter(filter)
                .events(comparisons)
                .skipped(skipped)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    DifferenceSummary summarize(List<DifferencePoint> differences) {
        DescriptiveStats stats = new DescriptiveStats(values(differences));
        int n = stats.count();
        return DifferenceSummary.builder()
                .count(n)
                .mean(stats.mean())
                .median(stats.median())
                .std(stats.std())
                .min(stats.min())
                .max(stats.max())
                .q25(stats.percentile(25))
                .q75(stats.percentile(75))
                .numPositive(stats.positives())
                .numNegative(stats.negatives())
                .numZero(stats.zeros())
                .pctPositive(stats.positives() * 100.0 / n)
                .pctNegative(stats.negatives() * 100.0 / n)
                .pctZero(stats.zeros() * 100.0 / n)
                .build();
    }

    List<TimeAggregate> aggregateByTime(List<DifferencePoint> differences) {
        Map<Instant, List<DifferencePoint>> byTime = new TreeMap<>();
        for (DifferencePoint point : differences) {
            byTime.computeIfAbsent(point.timestamp(), k -> new ArrayList<>()).add(point);
        }
        List<TimeAggregate> aggregates = new ArrayList<>(byTime.size());
        for (Map.Entry<Instant, List<DifferencePoint>> entry : byTime.entrySet()) {
            DescriptiveStats stats = new DescriptiveStats(values(entry.getValue()));
            aggregates.add(TimeAggregate.builder()
                    .timestamp(entry.getKey())
                    .count(stats.count())
                    .mean(stats.mean())
                    .median(stats.median())
                    .std(stats.std())
                    .min(stats.min())
                    .max(stats.max())
                    .numPositive(stats.positives())
                    .numNegative(stats.negatives())
                    .numZero(stats.zeros())
                    .build());
        }
        return aggregates;
    }

    private static double[] values(List<DifferencePoint> points) {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).difference();
        }
        return values;
    }

    private static String stringOrNull(Object raw) {
        return NumberParser.isBlank(raw) ? null : raw.toString().trim();
    }

    private record PointKey(Instant timestamp, String entityId) {
    }
}
