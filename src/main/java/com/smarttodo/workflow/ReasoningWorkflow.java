package com.smarttodo.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smarttodo.ai.ReasoningClient;
import com.smarttodo.ai.ReasoningClientFactory;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared plumbing for the workflows: a fresh client per invocation and pretty JSON for the
 * data blocks embedded in prompts. Payload maps are built from strings and numbers only,
 * in insertion order, so the rendered prompt is stable for the same inputs.
 */
@Slf4j
public abstract class ReasoningWorkflow {

    private final ReasoningClientFactory clientFactory;
    private final ObjectMapper objectMapper;
    protected final ZoneId zone;

    protected ReasoningWorkflow(ReasoningClientFactory clientFactory, ObjectMapper objectMapper, Clock clock) {
        this.clientFactory = clientFactory;
        this.objectMapper = objectMapper;
        this.zone = clock.getZone();
    }

    protected ReasoningClient clientFor(Long userId, String entityRef) {
        return clientFactory.forJob(userId, entityRef);
    }

    protected String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not render prompt data as JSON, using toString(): {}", e.getOriginalMessage());
            return String.valueOf(value);
        }
    }

    /**
     * False, with a warning, when {@code value} is longer than the column it is headed for.
     */
    protected static boolean fits(String value, int maxLength, String field, String entityRef) {
        if (value.length() <= maxLength) {
            return true;
        }
        log.warn("Dropping {} of {} characters (limit {}) for {}", field, value.length(), maxLength, entityRef);
        return false;
    }

    protected static List<String> withinLength(List<String> values, int maxLength, String field, String entityRef) {
        List<String> kept = new ArrayList<>(values.size());
        for (String value : values) {
            if (fits(value, maxLength, field, entityRef)) {
                kept.add(value);
            }
        }
        return kept;
    }

    protected static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
