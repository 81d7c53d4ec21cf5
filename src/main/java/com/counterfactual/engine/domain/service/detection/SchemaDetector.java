package com.counterfactual.engine.domain.service.detection;

import com.counterfactual.engine.domain.exception.SchemaException;
import com.counterfactual.engine.domain.exception.SchemaException.Reason;
import com.counterfactual.engine.domain.model.ColumnMapping;
import com.counterfactual.engine.domain.model.RawTable;
import com.counterfactual.engine.domain.service.forecast.ForecastConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves time, target and entity columns. Each role is an ordered rule list; the first column
 * in table order that satisfies a rule wins. Explicit overrides skip the heuristics and are not
 * checked against the data.
 */
@Slf4j
@Component
public class SchemaDetector {

    static final Set<String> TIME_TOKENS = Set.of("timestamp", "date", "time", "datetime");
    static final Set<String> TARGET_EXCLUSIONS = Set.of(
            "id", "name", "latitude", "longitude", "lat", "lon", "lng", "long", "index");

    public ColumnMapping detect(RawTable table, ForecastConfig config) {
        if (table == null || table.rowCount() == 0) {
            throw new SchemaException(Reason.EMPTY_TABLE, "input table has no rows");
        }

        if (!config.isAutoDetect()) {
            return explicitMapping(config);
        }

        String timeCol = hasText(config.getTimeCol())
                ? config.getTimeCol()
                : detectTimeColumn(table, config.getZone(), config.getDetectionSampleSize())
                        .orElseThrow(() -> new SchemaException(Reason.NO_TIME_COLUMN,
                                "no column name matches " + TIME_TOKENS
                                        + " and no column holds parseable timestamps; columns=" + table.columns()));

        String overrideEntity = hasText(config.getEntityCol()) ? config.getEntityCol() : null;

        String targetCol = hasText(config.getTargetCol())
                ? config.getTargetCol()
                : detectTargetColumn(table, timeCol, overrideEntity)
                        .orElseThrow(() -> new SchemaException(Reason.NO_TARGET_COLUMN,
                                "no numeric, non-metadata column left besides time='" + timeCol
                                        + "'; columns=" + table.columns()));

        String entityCol = overrideEntity != null
                ? overrideEntity
                : detectEntityColumn(table, timeCol, targetCol).orElse(null);

        ColumnMapping mapping = new ColumnMapping(timeCol, targetCol, entityCol);
        log.info("[Schema] columns resolved: time={}, target={}, entity={}", timeCol, targetCol, entityCol);
        return mapping;
    }

    Optional<String> detectTimeColumn(RawTable table, ZoneId zone, int sampleSize) {
        for (String column : table.columns()) {
            if (nameMatchesTimeToken(column)) {
                log.debug("[Schema] time column by name: {}", column);
                return Optional.of(column);
            }
        }
        for (String column : table.columns()) {
            if (allSampledValuesParse(table.values(column), zone, sampleSize)) {
                log.debug("[Schema] time column by parseable values: {}", column);
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    Optional<String> detectTargetColumn(RawTable table, String timeCol, String entityCol) {
        for (String column : table.columns()) {
            if (column.equals(timeCol) || column.equals(entityCol)) continue;
            if (TARGET_EXCLUSIONS.contains(column.trim().toLowerCase(Locale.ROOT))) continue;
            if (isNumericColumn(table.values(column))) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    /**
     * First column whose distinct count lies strictly between 1 and the row count. When several
     * qualify the earliest one is taken; this is a heuristic, not a guarantee of intent.
     */
    Optional<String> detectEntityColumn(RawTable table, String timeCol, String targetCol) {
        int rows = table.rowCount();
        for (String column : table.columns()) {
            if (column.equals(timeCol) || column.equals(targetCol)) continue;
            Set<String> distinct = new HashSet<>();
            for (Object value : table.values(column)) {
                distinct.add(value == null ? null : value.toString().trim());
            }
            if (distinct.size() > 1 && distinct.size() < rows) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    private ColumnMapping explicitMapping(ForecastConfig config) {
        if (!hasText(config.getTimeCol()) || !hasText(config.getTargetCol())) {
            throw new SchemaException(Reason.MISSING_REQUIRED_COLUMN,
                    "auto-detection is disabled: timeCol and targetCol must both be provided");
        }
        String entityCol = hasText(config.getEntityCol()) ? config.getEntityCol() : null;
        return new ColumnMapping(config.getTimeCol(), config.getTargetCol(), entityCol);
    }

    private boolean nameMatchesTimeToken(String column) {
        for (String token : column.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (TIME_TOKENS.contains(token)) return true;
        }
        return false;
    }

    private boolean allSampledValuesParse(List<Object> values, ZoneId zone, int sampleSize) {
        int sampled = 0;
        for (Object value : values) {
            if (NumberParser.isBlank(value)) continue;
            if (TimestampParser.parse(value, zone).isEmpty()) return false;
            if (++sampled >= sampleSize) break;
        }
        return sampled > 0;
    }

    private boolean isNumericColumn(List<Object> values) {
        boolean seen = false;
        for (Object value : values) {
            if (NumberParser.isBlank(value)) continue;
            if (NumberParser.parse(value).isEmpty()) return false;
            seen = true;
        }
        return seen;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
