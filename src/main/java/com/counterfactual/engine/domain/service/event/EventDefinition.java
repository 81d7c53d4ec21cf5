package com.counterfactual.engine.domain.service.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Unparsed event record as it appears in a JSON event file or request body.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventDefinition(String name, String start, String end, Map<String, Object> metadata) {
}
