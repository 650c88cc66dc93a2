package com.smarttodo.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.smarttodo.enums.Priorities;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Field-by-field reader over a model response object. Every accessor tolerates a missing,
 * null or wrongly typed field by reporting "absent"; the caller supplies the default.
 */
public final class PayloadReader {

    private final JsonNode node;

    private PayloadReader(JsonNode node) {
        this.node = node;
    }

    public static PayloadReader of(JsonNode node) {
        return new PayloadReader(node);
    }

    public Optional<String> text(String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(value.asText().strip());
    }

    public Optional<String> nonBlankText(String field) {
        return text(field).filter(s -> !s.isEmpty());
    }

    /**
     * Textual elements of an array field, trimmed, blanks skipped.
     */
    public List<String> strings(String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>(value.size());
        for (JsonNode element : value) {
            if (element.isTextual() && !element.asText().isBlank()) {
                result.add(element.asText().strip());
            }
        }
        return result;
    }

    public List<JsonNode> objects(String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            return Collections.emptyList();
        }
        List<JsonNode> result = new ArrayList<>(value.size());
        for (JsonNode element : value) {
            if (element.isObject()) {
                result.add(element);
            }
        }
        return result;
    }

    /**
     * A priority ordinal in 1..3, given either as a whole number or a numeric string.
     */
    public OptionalInt priority(String field) {
        JsonNode value = node.get(field);
        if (value == null) {
            return OptionalInt.empty();
        }
        int candidate;
        if (value.isIntegralNumber()) {
            candidate = value.asInt();
        } else if (value.isTextual()) {
            try {
                candidate = Integer.parseInt(value.asText().strip());
            } catch (NumberFormatException e) {
                return OptionalInt.empty();
            }
        } else {
            return OptionalInt.empty();
        }
        return Priorities.isValid(candidate) ? OptionalInt.of(candidate) : OptionalInt.empty();
    }

    /**
     * A numeric score clamped into [0, 1].
     */
    public OptionalDouble score(String field) {
        JsonNode value = node.get(field);
        double candidate;
        if (value == null) {
            return OptionalDouble.empty();
        }
        if (value.isNumber()) {
            candidate = value.asDouble();
        } else if (value.isTextual()) {
            try {
                candidate = Double.parseDouble(value.asText().strip());
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        } else {
            return OptionalDouble.empty();
        }
        if (Double.isNaN(candidate)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.max(0.0, Math.min(1.0, candidate)));
    }
}
