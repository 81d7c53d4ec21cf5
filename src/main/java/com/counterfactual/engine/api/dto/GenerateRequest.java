package com.counterfactual.engine.api.dto;

import com.counterfactual.engine.domain.service.event.EventDefinition;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * Events come either as {@code events} objects or as a compact/JSON {@code eventSpec} string.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GenerateRequest(
        List<Map<String, Object>> rows,
        List<EventDefinition> events,
        String eventSpec,
        ForecastOptions options) {
}
