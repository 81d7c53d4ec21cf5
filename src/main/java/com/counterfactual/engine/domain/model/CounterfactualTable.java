package com.counterfactual.engine.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merged output: time, optional entity and one value column per event. Missing cells are null.
 */
public final class CounterfactualTable {

    private final String timeColumn;
    private final String entityColumn;
    private final List<String> valueColumns;
    private final List<Row> rows;

    public CounterfactualTable(String timeColumn, String entityColumn,
                               List<String> valueColumns, List<Row> rows) {
        this.timeColumn = timeColumn;
        this.entityColumn = entityColumn;
        this.valueColumns = List.copyOf(valueColumns);
        this.rows = List.copyOf(rows);
    }

    public String getTimeColumn() {
        return timeColumn;
    }

    public String getEntityColumn() {
        return entityColumn;
    }

    public List<String> getValueColumns() {
        return valueColumns;
    }

    public List<Row> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    /**
     * Rows as column-name maps in output column order, ready for an external writer.
     */
    public List<Map<String, Object>> getRecords() {
        List<Map<String, Object>> records = new ArrayList<>(rows.size());
        for (Row row : rows) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put(timeColumn, row.timestamp());
            if (entityColumn != null) {
                record.put(entityColumn, row.entityId());
            }
            for (String column : valueColumns) {
                record.put(column, row.values().get(column));
            }
            records.add(Collections.unmodifiableMap(record));
        }
        return records;
    }

    public record Row(Instant timestamp, String entityId, Map<String, Double> values) {

        public Row {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        public Double value(String column) {
            return values.get(column);
        }
    }
}
