package com.counterfactual.engine.domain.service.event;

import com.counterfactual.engine.domain.model.Event;
import com.counterfactual.engine.domain.service.detection.TimestampParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds {@link Event}s from the compact {@code name:start:end[,...]} form or a JSON array of
 * {@code {name, start, end, metadata}} objects.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventParser {

    private static final TypeReference<List<EventDefinition>> DEFINITION_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public List<Event> parse(String spec, ZoneId zone) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("event specification must not be blank");
        }
        String trimmed = spec.trim();
        return trimmed.startsWith("[") ? parseJson(trimmed, zone) : parseCompact(trimmed, zone);
    }

    public List<Event> parseCompact(String spec, ZoneId zone) {
        List<Event> events = new ArrayList<>();
        for (String entry : spec.split(",")) {
            String item = entry.trim();
            if (item.isEmpty()) continue;
            events.add(parseCompactEntry(item, zone));
        }
        if (events.isEmpty()) {
            throw new IllegalArgumentException("no events found in '" + spec + "'");
        }
        log.debug("[Events] parsed {} compact event(s)", events.size());
        return events;
    }

    public List<Event> parseJson(String json, ZoneId zone) {
        List<EventDefinition> definitions;
        try {
            definitions = objectMapper.readValue(json, DEFINITION_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("events JSON must be an array of {name, start, end}: "
                    + e.getOriginalMessage(), e);
        }
        return fromDefinitions(definitions, zone);
    }

    public List<Event> fromDefinitions(List<EventDefinition> definitions, ZoneId zone) {
        if (definitions == null || definitions.isEmpty()) {
            throw new IllegalArgumentException("at least one event definition is required");
        }
        List<Event> events = new ArrayList<>(definitions.size());
        for (EventDefinition definition : definitions) {
            if (definition == null || definition.start() == null || definition.end() == null) {
                throw new IllegalArgumentException("event definition needs name, start and end: " + definition);
            }
            events.add(new Event(definition.name(),
                    TimestampParser.parseRequired(definition.start(), zone),
                    TimestampParser.parseRequired(definition.end(), zone),
                    definition.metadata()));
        }
        return events;
    }

    /**
     * Timestamps may contain ':' themselves, so the start/end boundary is the first colon at
     * which both sides parse.
     */
    private Event parseCompactEntry(String item, ZoneId zone) {
        int nameEnd = item.indexOf(':');
        if (nameEnd <= 0) {
            throw new IllegalArgumentException("invalid event format: '" + item + "', expected 'name:start:end'");
        }
        String name = item.substring(0, nameEnd).trim();
        String range = item.substring(nameEnd + 1);

        for (int split = range.indexOf(':'); split >= 0; split = range.indexOf(':', split + 1)) {
            Optional<Instant> start = TimestampParser.parse(range.substring(0, split).trim(), zone);
            Optional<Instant> end = TimestampParser.parse(range.substring(split + 1).trim(), zone);
            if (start.isPresent() && end.isPresent()) {
                return new Event(name, start.get(), end.get());
            }
        }
        throw new IllegalArgumentException("invalid event format: '" + item + "', expected 'name:start:end'");
    }
}
