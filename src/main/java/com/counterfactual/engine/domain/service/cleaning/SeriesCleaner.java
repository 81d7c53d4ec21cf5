package com.counterfactual.engine.domain.service.cleaning;

import com.counterfactual.engine.domain.exception.InsufficientDataException;
import com.counterfactual.engine.domain.model.CleanedSeries;
import com.counterfactual.engine.domain.model.CleaningDiagnostics;
import com.counterfactual.engine.domain.model.ColumnMapping;
import com.counterfactual.engine.domain.model.RawTable;
import com.counterfactual.engine.domain.model.SeriesPoint;
import com.counterfactual.engine.domain.service.detection.NumberParser;
import com.counterfactual.engine.domain.service.detection.TimestampParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Splits a raw table into per-entity series: parse, sort, drop duplicate timestamps (first kept),
 * infer frequency. Unparseable rows are counted, never thrown.
 */
@Slf4j
@Component
public class SeriesCleaner {

    public CleaningResult clean(RawTable table, ColumnMapping mapping, ZoneId zone, int minPoints) {
        Map<String, EntityRows> grouped = new LinkedHashMap<>();
        int rowsWithoutEntity = 0;
        String entityCol = mapping.entityColumn();

        for (Map<String, Object> row : table.rows()) {
            String entityId = null;
            if (entityCol != null) {
                Object rawEntity = row.get(entityCol);
                if (NumberParser.isBlank(rawEntity)) {
                    rowsWithoutEntity++;
                    continue;
                }
                entityId = rawEntity.toString().trim();
            }
            EntityRows rows = grouped.computeIfAbsent(entityId, EntityRows::new);
            rows.inputRows++;

            Optional<Instant> timestamp = TimestampParser.parse(row.get(mapping.timeColumn()), zone);
            if (timestamp.isEmpty()) {
                rows.unparseableTimestamps++;
                continue;
            }
            OptionalDouble value = NumberParser.parse(row.get(mapping.targetColumn()));
            if (value.isEmpty()) {
                rows.nonNumericValues++;
                continue;
            }
            rows.points.add(new SeriesPoint(timestamp.get(), value.getAsDouble(), entityId));
        }

        List<CleanedSeries> series = new ArrayList<>();
        List<InsufficientDataException> rejected = new ArrayList<>();
        List<CleaningDiagnostics> diagnostics = new ArrayList<>();

        for (EntityRows rows : grouped.values()) {
            List<SeriesPoint> points = sortAndDeduplicate(rows);
            diagnostics.add(rows.toDiagnostics(points.size()));

            if (points.size() < Math.max(minPoints, 2)) {
                int required = Math.max(minPoints, 2);
                rejected.add(new InsufficientDataException(rows.entityId, points.size(), required,
                        "entity " + describe(rows.entityId) + " has " + points.size()
                                + " usable points after cleaning, needs at least " + required));
                log.warn("[Cleaner] entity rejected: entity={}, points={}, required={}",
                        rows.entityId, points.size(), required);
                continue;
            }

            Duration frequency = FrequencyInference.infer(points);
            series.add(new CleanedSeries(rows.entityId, points, frequency));
            log.debug("[Cleaner] entity={}, input={}, kept={}, frequency={}",
                    rows.entityId, rows.inputRows, points.size(), frequency);
        }

        if (rowsWithoutEntity > 0) {
            log.warn("[Cleaner] {} rows dropped with blank entity column '{}'", rowsWithoutEntity, entityCol);
        }

        return new CleaningResult(series, rejected, diagnostics, rowsWithoutEntity);
    }

    private List<SeriesPoint> sortAndDeduplicate(EntityRows rows) {
        List<SeriesPoint> sorted = new ArrayList<>(rows.points);
        // stable sort keeps input order among equal timestamps, so the first occurrence survives
        sorted.sort(Comparator.comparing(SeriesPoint::timestamp));

        List<SeriesPoint> unique = new ArrayList<>(sorted.size());
        Instant previous = null;
        for (SeriesPoint point : sorted) {
            if (point.timestamp().equals(previous)) {
                rows.duplicateTimestamps++;
                continue;
            }
            unique.add(point);
            previous = point.timestamp();
        }
        return unique;
    }

    private static String describe(String entityId) {
        return entityId == null ? "<all rows>" : "'" + entityId + "'";
    }

    private static final class EntityRows {
        private final String entityId;
        private final List<SeriesPoint> points = new ArrayList<>();
        private int inputRows;
        private int unparseableTimestamps;
        private int nonNumericValues;
        private int duplicateTimestamps;

        private EntityRows(String entityId) {
            this.entityId = entityId;
        }

        private CleaningDiagnostics toDiagnostics(int kept) {
            return CleaningDiagnostics.builder()
                    .entityId(entityId)
                    .inputRows(inputRows)
                    .unparseableTimestamps(unparseableTimestamps)
                    .nonNumericValues(nonNumericValues)
                    .duplicateTimestamps(duplicateTimestamps)
                    .keptPoints(kept)
                    .build();
        }
    }
}
