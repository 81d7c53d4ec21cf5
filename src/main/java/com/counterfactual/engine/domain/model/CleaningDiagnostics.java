package com.counterfactual.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Rows dropped while building one entity's series. {@code entityId} is null for an un-keyed table.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CleaningDiagnostics {

    private String entityId;
    private int inputRows;
    private int unparseableTimestamps;
    private int nonNumericValues;
    private int duplicateTimestamps;
    private int keptPoints;

    public int droppedRows() {
        return unparseableTimestamps + nonNumericValues + duplicateTimestamps;
    }
}
