package com.counterfactual.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CounterfactualRunReport {

    private String runId;
    private ColumnMapping columns;
    private int entityCount;
    private int eventCount;
    @JsonIgnore
    private CounterfactualTable table;
    private List<CounterfactualResult> results;
    private List<SkippedPair> skipped;
    private List<CleaningDiagnostics> diagnostics;
    private int rowsWithoutEntity;
    private int droppedRows;
    private long timestamp;
    private long calcDurationMicros;

    public List<String> getOutputColumns() {
        return table == null ? List.of() : table.getValueColumns();
    }

    public List<Map<String, Object>> getRows() {
        return table == null ? List.of() : table.getRecords();
    }

    public int forecastedPairs() {
        return results == null ? 0 : results.size();
    }

    public int skippedPairs() {
        return skipped == null ? 0 : skipped.size();
    }
}
