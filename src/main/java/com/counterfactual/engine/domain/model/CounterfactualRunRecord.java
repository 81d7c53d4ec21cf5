package com.counterfactual.engine.domain.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "counterfactual_run_record", indexes = {
        @Index(name = "idx_cf_run_id", columnList = "runId"),
        @Index(name = "idx_cf_run_created", columnList = "createdEpochMs")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CounterfactualRunRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String runId;
    private String timeColumn;
    private String targetColumn;
    private String entityColumn;

    private int entityCount;
    private int eventCount;
    private int forecastedPairs;
    private int skippedPairs;
    private int outputRows;
    private int droppedRows;

    private long createdEpochMs;
    private long calcDurationMicros;
}
