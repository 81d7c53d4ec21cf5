package com.counterfactual.engine.domain.service;

import com.counterfactual.engine.domain.model.CounterfactualRunRecord;
import com.counterfactual.engine.domain.model.CounterfactualRunReport;
import com.counterfactual.engine.domain.repository.CounterfactualRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class CounterfactualRunLogger {

    private final CounterfactualRunRepository repository;

    public CounterfactualRunRecord logRun(CounterfactualRunReport report) {
        if (report == null) return null;

        CounterfactualRunRecord record = CounterfactualRunRecord.builder()
                .runId(report.getRunId())
                .timeColumn(report.getColumns().timeColumn())
                .targetColumn(report.getColumns().targetColumn())
                .entityColumn(report.getColumns().entityColumn())
                .entityCount(report.getEntityCount())
                .eventCount(report.getEventCount())
                .forecastedPairs(report.forecastedPairs())
                .skippedPairs(report.skippedPairs())
                .outputRows(report.getRows().size())
                .droppedRows(report.getDroppedRows())
                .createdEpochMs(report.getTimestamp())
                .calcDurationMicros(report.getCalcDurationMicros())
                .build();

        CounterfactualRunRecord saved = repository.save(record);
        log.debug("[RunLog] recorded run: runId={}, pairs={}/{}", report.getRunId(),
                report.forecastedPairs(), report.forecastedPairs() + report.skippedPairs());
        return saved;
    }
}
