package com.counterfactual.engine.api.dto;

import com.counterfactual.engine.domain.service.event.EventDefinition;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CompareRequest(
        List<Map<String, Object>> actualRows,
        List<Map<String, Object>> counterfactualRows,
        List<EventDefinition> events,
        String eventSpec,
        ForecastOptions options,
        String entity,
        String from,
        String to) {
}
