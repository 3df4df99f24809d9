package com.javacpi.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.javacpi.shared.error.MalformedOutputException;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes {@code ConvertTo-Json} output, plus the typed-default field readers every
 * payload mapper uses.
 */
public final class JsonDecoder {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonDecoder() {}

    public static JsonNode object(String text) {
        var trimmed = text.strip();
        if (trimmed.isEmpty()) {
            throw new MalformedOutputException("expected a JSON object, got no output", text);
        }
        var node = parse(trimmed, text);
        if (!node.isObject()) {
            throw new MalformedOutputException("expected a JSON object", text);
        }
        return node;
    }

    /**
     * {@code ConvertTo-Json} emits a bare object for one item and an array for several;
     * blank output means no items.
     */
    public static List<JsonNode> oneOrMany(String text) {
        var trimmed = text.strip();
        if (trimmed.isEmpty()) return List.of();
        return switch (trimmed.charAt(0)) {
            case '{' -> List.of(parse(trimmed, text));
            case '[' -> {
                var items = new ArrayList<JsonNode>();
                parse(trimmed, text).forEach(items::add);
                yield items;
            }
            default -> throw new MalformedOutputException("expected a JSON object or array", text);
        };
    }

    private static JsonNode parse(String trimmed, String raw) {
        try {
            return MAPPER.readTree(trimmed);
        } catch (JsonProcessingException e) {
            throw new MalformedOutputException("invalid JSON: " + e.getOriginalMessage(), raw, e);
        }
    }

    public static String text(JsonNode node, String field, String fallback) {
        var value = node.path(field);
        // Windows PowerShell may serialize a Guid as {"Guid": "..."}
        if (value.isObject() && value.has("Guid")) {
            value = value.get("Guid");
        }
        return value.isValueNode() && !value.isNull() ? value.asText() : fallback;
    }

    public static long integer(JsonNode node, String field, long fallback) {
        var value = node.path(field);
        if (value.isIntegralNumber()) return value.asLong();
        if (value.isNumber()) return (long) value.asDouble();
        if (value.isTextual()) {
            try {
                return Long.parseLong(value.asText().strip());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
}
