package com.counterfactual.engine.domain.service;

import com.counterfactual.engine.domain.exception.InsufficientDataException;
import com.counterfactual.engine.domain.exception.SchemaException;
import com.counterfactual.engine.domain.model.CleanedSeries;
import com.counterfactual.engine.domain.model.CleaningDiagnostics;
import com.counterfactual.engine.domain.model.ColumnMapping;
import com.counterfactual.engine.domain.model.CounterfactualResult;
import com.counterfactual.engine.domain.model.CounterfactualRunReport;
import com.counterfactual.engine.domain.model.CounterfactualTable;
import com.counterfactual.engine.domain.model.Event;
import com.counterfactual.engine.domain.model.ForecastPoint;
import com.counterfactual.engine.domain.model.RawTable;
import com.counterfactual.engine.domain.model.SkippedPair;
import com.counterfactual.engine.domain.model.SkippedPair.Reason;
import com.counterfactual.engine.domain.service.cleaning.CleaningResult;
import com.counterfactual.engine.domain.service.cleaning.SeriesCleaner;
import com.counterfactual.engine.domain.service.detection.SchemaDetector;
import com.counterfactual.engine.domain.service.forecast.ForecastConfig;
import com.counterfactual.engine.domain.service.forecast.ForecastGenerator;
import com.counterfactual.engine.infra.monitor.CounterfactualMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every (entity, event) pair independently and merges the forecasts into one table. Only a
 * schema failure aborts a run; anything scoped to one pair is recorded as a skipped pair.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CounterfactualEngine {

    private static final Comparator<String> ENTITY_ORDER = Comparator.nullsFirst(Comparator.naturalOrder());

    private final SchemaDetector schemaDetector;
    private final SeriesCleaner seriesCleaner;
    private final ForecastGenerator forecastGenerator;
    private final CounterfactualMetrics metrics;

    public CounterfactualRunReport run(RawTable table, List<Event> events, ForecastConfig config) {
        config.validate();
        validateEvents(events);
        long startNano = System.nanoTime();

        ColumnMapping mapping = schemaDetector.detect(table, config);
        CleaningResult cleaning = seriesCleaner.clean(table, mapping, config.getZone(), config.minEntityPoints());
        if (cleaning.series().isEmpty() && cleaning.rejected().isEmpty()) {
            throw new SchemaException(SchemaException.Reason.NO_USABLE_ROWS,
                    "no row carries a value in entity column '" + mapping.entityColumn() + "' ("
                            + cleaning.rowsWithoutEntity() + " of " + table.rowCount() + " rows dropped)");
        }

        List<SkippedPair> skipped = new ArrayList<>();
        for (InsufficientDataException rejected : cleaning.rejected()) {
            for (Event event : events) {
                skipped.add(new SkippedPair(rejected.getEntityId(), event.name(),
                        Reason.INSUFFICIENT_DATA, rejected.getMessage()));
            }
        }

        return execute(mapping, cleaning.series(), events, config, skipped,
                cleaning.diagnostics(), cleaning.rowsWithoutEntity(), cleaning.droppedRows(), startNano);
    }

    /**
     * Entry point for callers that already hold cleaned series.
     */
    public CounterfactualRunReport run(List<CleanedSeries> series, List<Event> events,
                                       ColumnMapping mapping, ForecastConfig config) {
        config.validate();
        validateEvents(events);
        return execute(mapping, series, events, config, new ArrayList<>(), List.of(), 0, 0, System.nanoTime());
    }

    private CounterfactualRunReport execute(ColumnMapping mapping, List<CleanedSeries> series, List<Event> events,
                                            ForecastConfig config, List<SkippedPair> skipped,
                                            List<CleaningDiagnostics> diagnostics, int rowsWithoutEntity, int droppedRows,
                                            long startNano) {
        List<PairTask> tasks = new ArrayList<>(series.size() * events.size());
        for (CleanedSeries s : series) {
            for (Event event : events) {
                tasks.add(new PairTask(s, event, config));
            }
        }

        List<PairOutcome> outcomes = config.getParallelism() > 1 && tasks.size() > 1
                ? runParallel(tasks, config.getParallelism())
                : runSequential(tasks);

        List<CounterfactualResult> results = new ArrayList<>();
        for (PairOutcome outcome : outcomes) {
            if (outcome.result() != null) {
                results.add(outcome.result());
            } else {
                skipped.add(outcome.skipped());
            }
        }

        CounterfactualTable table = assemble(mapping, events, results, config);
        long elapsedNanos = System.nanoTime() - startNano;
        metrics.recordRun(results.size(), skipped.size(), droppedRows, elapsedNanos);

        log.info("[Engine] run complete: entities={}, events={}, forecast={}, skipped={}, rows={}, dropped={}, elapsed={}μs",
                series.size(), events.size(), results.size(), skipped.size(), table.size(),
                droppedRows, elapsedNanos / 1_000);

        return CounterfactualRunReport.builder()
                .runId(UUID.randomUUID().toString())
                .columns(mapping)
                .entityCount(series.size() + countRejectedEntities(skipped, series))
                .eventCount(events.size())
                .table(table)
                .results(results)
                .skipped(skipped)
                .diagnostics(diagnostics)
                .rowsWithoutEntity(rowsWithoutEntity)
                .droppedRows(droppedRows)
                .timestamp(System.currentTimeMillis())
                .calcDurationMicros(elapsedNanos / 1_000)
                .build();
    }

    private List<PairOutcome> runSequential(List<PairTask> tasks) {
        List<PairOutcome> outcomes = new ArrayList<>(tasks.size());
        for (PairTask task : tasks) {
            outcomes.add(forecastPair(task));
        }
        return outcomes;
    }

    private List<PairOutcome> runParallel(List<PairTask> tasks, int parallelism) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, tasks.size()),
                namedThreadFactory("counterfactual-pair"));
        try {
            List<Future<PairOutcome>> futures = new ArrayList<>(tasks.size());
            for (PairTask task : tasks) {
                futures.add(pool.submit(() -> forecastPair(task)));
            }
            List<PairOutcome> outcomes = new ArrayList<>(tasks.size());
            for (Future<PairOutcome> future : futures) {
                outcomes.add(future.get());
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("counterfactual run interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("pair worker failed unexpectedly", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private PairOutcome forecastPair(PairTask task) {
        String entityId = task.series().entityId();
        String eventName = task.event().name();
        try {
            return new PairOutcome(forecastGenerator.generate(task.series(), task.event(), task.config()), null);
        } catch (InsufficientDataException e) {
            log.warn("[Engine] pair skipped: entity={}, event={}, reason={}", entityId, eventName, e.getMessage());
            return new PairOutcome(null, new SkippedPair(entityId, eventName, Reason.INSUFFICIENT_DATA, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("[Engine] pair failed: entity={}, event={}", entityId, eventName, e);
            return new PairOutcome(null, new SkippedPair(entityId, eventName, Reason.FORECAST_FAILED,
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    private CounterfactualTable assemble(ColumnMapping mapping, List<Event> events,
                                         List<CounterfactualResult> results, ForecastConfig config) {
        List<String> valueColumns = new ArrayList<>(events.size());
        for (Event event : events) {
            valueColumns.add(config.columnFor(event.name()));
        }

        Comparator<RowKey> order = Comparator.comparing(RowKey::timestamp)
                .thenComparing(RowKey::entityId, ENTITY_ORDER);
        Map<RowKey, Map<String, Double>> cells = new TreeMap<>(order);
        for (CounterfactualResult result : results) {
            String column = config.columnFor(result.getEventName());
            for (ForecastPoint point : result.getPoints()) {
                cells.computeIfAbsent(new RowKey(point.timestamp(), point.entityId()), k -> new LinkedHashMap<>())
                        .put(column, point.value());
            }
        }

        List<CounterfactualTable.Row> rows = new ArrayList<>(cells.size());
        for (Map.Entry<RowKey, Map<String, Double>> entry : cells.entrySet()) {
            Map<String, Double> values = new LinkedHashMap<>();
            for (String column : valueColumns) {
                values.put(column, entry.getValue().get(column));
            }
            rows.add(new CounterfactualTable.Row(entry.getKey().timestamp(), entry.getKey().entityId(), values));
        }
        return new CounterfactualTable(mapping.timeColumn(), mapping.entityColumn(), valueColumns, rows);
    }

    private void validateEvents(List<Event> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("at least one event is required");
        }
        Set<String> names = new HashSet<>();
        for (Event event : events) {
            Objects.requireNonNull(event, "event must not be null");
            if (!names.add(event.name())) {
                throw new IllegalArgumentException("duplicate event name: " + event.name());
            }
        }
    }

    private int countRejectedEntities(List<SkippedPair> skipped, List<CleanedSeries> series) {
        Set<String> forecastable = new HashSet<>();
        for (CleanedSeries s : series) forecastable.add(s.entityId());
        Set<String> rejected = new HashSet<>();
        for (SkippedPair pair : skipped) {
            if (!forecastable.contains(pair.entityId())) rejected.add(pair.entityId());
        }
        return rejected.size();
    }

    private record PairTask(CleanedSeries series, Event event, ForecastConfig config) {
    }

    private record PairOutcome(CounterfactualResult result, SkippedPair skipped) {
    }

    private record RowKey(Instant timestamp, String entityId) {
    }
}
