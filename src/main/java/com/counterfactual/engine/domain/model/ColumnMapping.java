package com.counterfactual.engine.domain.model;

import java.util.Optional;

/**
 * Resolved column roles of a raw table. {@code entityColumn} is null when the table is one series.
 */
public record ColumnMapping(String timeColumn, String targetColumn, String entityColumn) {

    public ColumnMapping {
        if (timeColumn == null || targetColumn == null) {
            throw new IllegalArgumentException("time and target columns must be resolved");
        }
    }

    public Optional<String> entity() {
        return Optional.ofNullable(entityColumn);
    }
}
