package com.counterfactual.engine.domain.service.cleaning;

import com.counterfactual.engine.domain.exception.InsufficientDataException;
import com.counterfactual.engine.domain.model.CleanedSeries;
import com.counterfactual.engine.domain.model.CleaningDiagnostics;

import java.util.List;

/**
 * Cleaned series per entity in first-appearance order, plus entities rejected for lack of data.
 */
public record CleaningResult(List<CleanedSeries> series,
                             List<InsufficientDataException> rejected,
                             List<CleaningDiagnostics> diagnostics,
                             int rowsWithoutEntity) {

    public CleaningResult {
        series = List.copyOf(series);
        rejected = List.copyOf(rejected);
        diagnostics = List.copyOf(diagnostics);
    }

    public int droppedRows() {
        int dropped = rowsWithoutEntity;
        for (CleaningDiagnostics d : diagnostics) {
            dropped += d.droppedRows();
        }
        return dropped;
    }
}
