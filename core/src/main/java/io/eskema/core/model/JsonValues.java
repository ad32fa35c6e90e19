package io.eskema.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;

/**
 * Bridges the JSON world and the plain value model the engine validates: {@code Map}, {@code List},
 * {@code String}, {@code Number}, {@code Boolean} and {@code null}.
 *
 * <p>
 * Thread-safe: the shared {@link ObjectMapper} is only used for reads and writes after
 * construction.
 */
public final class JsonValues {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonValues() {}

    /**
     * Converts a Jackson tree into plain values ({@code LinkedHashMap}, {@code ArrayList}, boxed
     * scalars). A {@code null} or missing node becomes {@code null}.
     */
    public static Object fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return MAPPER.convertValue(node, Object.class);
    }

    /**
     * Parses JSON text into plain values.
     *
     * @throws IllegalArgumentException if the text is not valid JSON
     */
    public static Object parse(String json) {
        try {
            return MAPPER.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses JSON text, returning empty instead of failing on malformed input. */
    public static Optional<Object> tryParse(String json) {
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(MAPPER.readValue(json, Object.class));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * Renders a value for messages: JSON when it can be encoded (so {@code "10"} and {@code 10} stay
     * distinguishable), {@link String#valueOf} otherwise.
     */
    public static String prettify(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    /** Short type name used in messages and formatted reports. */
    public static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
