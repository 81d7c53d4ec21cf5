package com.counterfactual.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered rows of named fields as handed over by an external loader.
 * Column order is the first-seen order of keys across rows.
 */
public final class RawTable {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    private RawTable(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = Collections.unmodifiableList(columns);
        this.rows = Collections.unmodifiableList(rows);
    }

    public static RawTable of(List<? extends Map<String, ?>> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("raw table must contain at least one row");
        }
        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, Object>> copies = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            Objects.requireNonNull(row, "row must not be null");
            columns.addAll(row.keySet());
            copies.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        return new RawTable(new ArrayList<>(columns), copies);
    }

    public List<String> columns() {
        return columns;
    }

    public List<Map<String, Object>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public List<Object> values(String column) {
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }
}
