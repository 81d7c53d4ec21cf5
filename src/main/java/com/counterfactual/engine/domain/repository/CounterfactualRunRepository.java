package com.counterfactual.engine.domain.repository;

import com.counterfactual.engine.domain.model.CounterfactualRunRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CounterfactualRunRepository extends JpaRepository<CounterfactualRunRecord, Long> {

    List<CounterfactualRunRecord> findTop20ByOrderByCreatedEpochMsDesc();
}
