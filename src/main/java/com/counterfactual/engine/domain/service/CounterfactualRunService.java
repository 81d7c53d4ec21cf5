package com.counterfactual.engine.domain.service;

import com.counterfactual.engine.api.dto.CompareRequest;
import com.counterfactual.engine.api.dto.ForecastOptions;
import com.counterfactual.engine.api.dto.GenerateRequest;
import com.counterfactual.engine.domain.exception.SchemaException;
import com.counterfactual.engine.domain.model.ComparisonReport;
import com.counterfactual.engine.domain.model.CounterfactualRunRecord;
import com.counterfactual.engine.domain.model.CounterfactualRunReport;
import com.counterfactual.engine.domain.model.CyclePeriod;
import com.counterfactual.engine.domain.model.DifferenceFilter;
import com.counterfactual.engine.domain.model.Event;
import com.counterfactual.engine.domain.model.RawTable;
import com.counterfactual.engine.domain.repository.CounterfactualRunRepository;
import com.counterfactual.engine.domain.service.comparison.ComparisonService;
import com.counterfactual.engine.domain.service.detection.TimestampParser;
import com.counterfactual.engine.domain.service.event.EventDefinition;
import com.counterfactual.engine.domain.service.event.EventParser;
import com.counterfactual.engine.domain.service.forecast.ForecastConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Request-facing facade: merges overrides into the configured defaults, resolves events,
 * runs the engine and keeps the most recent report.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CounterfactualRunService {

    private final CounterfactualEngine engine;
    private final ComparisonService comparisonService;
    private final EventParser eventParser;
    private final CounterfactualProperties properties;
    private final CounterfactualRunLogger runLogger;
    private final CounterfactualRunRepository runRepository;

    private final AtomicReference<CounterfactualRunReport> latestRun = new AtomicReference<>();

    public CounterfactualRunReport generate(GenerateRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        ForecastConfig config = configFor(request.options());
        RawTable table = toTable(request.rows(), "rows");
        List<Event> events = resolveEvents(request.events(), request.eventSpec(), config.getZone());

        log.info("[Run] generate requested: rows={}, events={}", table.rowCount(), events.size());
        CounterfactualRunReport report = engine.run(table, events, config);

        runLogger.logRun(report);
        latestRun.set(report);
        return report;
    }

    public ComparisonReport compare(CompareRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        ForecastConfig config = configFor(request.options());
        RawTable actual = toTable(request.actualRows(), "actualRows");
        RawTable counterfactual = toTable(request.counterfactualRows(), "counterfactualRows");
        List<Event> events = resolveEvents(request.events(), request.eventSpec(), config.getZone());
        DifferenceFilter filter = filterFor(request, config.getZone());

        log.info("[Run] compare requested: actualRows={}, counterfactualRows={}, events={}, filter={}",
                actual.rowCount(), counterfactual.rowCount(), events.size(), filter);
        return comparisonService.compare(actual, counterfactual, events, config, filter);
    }

    public Optional<CounterfactualRunReport> getLatest() {
        return Optional.ofNullable(latestRun.get());
    }

    public List<CounterfactualRunRecord> recentRuns() {
        return runRepository.findTop20ByOrderByCreatedEpochMsDesc();
    }

    ForecastConfig configFor(ForecastOptions options) {
        ForecastConfig defaults = ForecastConfig.from(properties);
        if (options == null) {
            return defaults;
        }

        ForecastConfig.ForecastConfigBuilder builder = defaults.toBuilder();
        if (options.timeCol() != null) builder.timeCol(options.timeCol());
        if (options.targetCol() != null) builder.targetCol(options.targetCol());
        if (options.entityCol() != null) builder.entityCol(options.entityCol());
        if (options.autoDetect() != null) builder.autoDetect(options.autoDetect());
        if (options.arOrder() != null) builder.arOrder(options.arOrder());
        if (options.cyclePeriod() != null) builder.cyclePeriod(CyclePeriod.fromLabel(options.cyclePeriod()));
        if (options.forecastDays() != null) builder.forecastDays(options.forecastDays());
        if (options.minValue() != null) builder.minValue(options.minValue());
        if (options.maxValue() != null) builder.maxValue(options.maxValue());
        if (options.noiseFactor() != null) builder.noiseFactor(options.noiseFactor());
        if (options.noiseMode() != null) builder.noiseMode(options.noiseMode());
        if (options.noiseSeed() != null) builder.noiseSeed(options.noiseSeed());
        if (options.outputPrefix() != null) builder.outputPrefix(options.outputPrefix());
        if (options.parallelism() != null) builder.parallelism(options.parallelism());
        if (options.zone() != null) {
            try {
                builder.zone(ZoneId.of(options.zone()));
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("unknown zone: " + options.zone(), e);
            }
        }

        ForecastConfig config = builder.build();
        config.validate();
        return config;
    }

    /**
     * A {@code to} bound on local midnight covers that whole day.
     */
    DifferenceFilter filterFor(CompareRequest request, ZoneId zone) {
        Instant from = hasText(request.from()) ? TimestampParser.parseRequired(request.from(), zone) : null;
        Instant to = null;
        if (hasText(request.to())) {
            to = TimestampParser.parseRequired(request.to(), zone);
            if (to.atZone(zone).toLocalTime().equals(LocalTime.MIDNIGHT)) {
                to = to.plus(Duration.ofDays(1)).minusSeconds(1);
            }
        }
        return new DifferenceFilter(request.entity(), from, to);
    }

    private List<Event> resolveEvents(List<EventDefinition> definitions, String eventSpec, ZoneId zone) {
        if (definitions != null && !definitions.isEmpty()) {
            return eventParser.fromDefinitions(definitions, zone);
        }
        if (eventSpec != null && !eventSpec.isBlank()) {
            return eventParser.parse(eventSpec, zone);
        }
        throw new IllegalArgumentException("either events or eventSpec is required");
    }

    private static RawTable toTable(List<Map<String, Object>> rows, String field) {
        if (rows == null || rows.isEmpty()) {
            throw new SchemaException(SchemaException.Reason.EMPTY_TABLE, field + " must contain at least one row");
        }
        return RawTable.of(rows);
    }

    private static boolean hasText(String text) {
        return text != null && !text.isBlank();
    }
}
