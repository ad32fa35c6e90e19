package io.eskema.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One failed constraint: a human-readable message, the offending value and, optionally, where it
 * sits inside a nested structure ({@code .user[2].age}), a namespaced machine-readable code and a
 * structured data payload.
 *
 * <p>
 * Immutable. Structural validators never mutate an expectation; they copy it with a longer path
 * as the failure propagates upward.
 *
 * @param message human-readable description of what was expected
 * @param value   the value that failed (may be {@code null})
 * @param path    location inside the validated structure, or {@code null} at the root
 * @param code    namespaced code (see {@link ExpectationCodes}), or {@code null}
 * @param data    structured context (limits, expected/found types), never {@code null}
 */
public record Expectation(String message, Object value, String path, String code, Map<String, Object> data) {

    public Expectation {
        Objects.requireNonNull(message, "message must not be null");
        data = data == null || data.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /** Creates an expectation with only a message and the failing value. */
    public static Expectation of(String message, Object value) {
        return new Expectation(message, value, null, null, null);
    }

    /** Creates an expectation carrying a code. */
    public static Expectation of(String message, Object value, String code) {
        return new Expectation(message, value, null, code, null);
    }

    /** Creates an expectation carrying a code and structured data. */
    public static Expectation of(String message, Object value, String code, Map<String, Object> data) {
        return new Expectation(message, value, null, code, data);
    }

    public Expectation withMessage(String newMessage) {
        return new Expectation(newMessage, value, path, code, data);
    }

    public Expectation withValue(Object newValue) {
        return new Expectation(message, newValue, path, code, data);
    }

    public Expectation withPath(String newPath) {
        return new Expectation(message, value, newPath, code, data);
    }

    public Expectation withCode(String newCode) {
        return new Expectation(message, value, path, newCode, data);
    }

    public Expectation withData(Map<String, Object> newData) {
        return new Expectation(message, value, path, code, newData);
    }

    /**
     * Returns a copy whose path is {@code segment} followed by the current path. Segments carry
     * their own separator ({@code .name} or {@code [3]}).
     */
    public Expectation prependPath(String segment) {
        return withPath(path == null ? segment : segment + path);
    }

    /** Returns a copy with {@code code} filled in when this expectation has none. */
    public Expectation withDefaultCode(String defaultCode) {
        return code != null ? this : withCode(defaultCode);
    }

    /** {@code <path>: <message>} when a path is present, otherwise just the message. */
    public String description() {
        if (path != null && !path.isEmpty()) {
            return path + ": " + message;
        }
        return message;
    }

    /** Map form for serialization; absent parts are omitted. */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("message", message);
        if (code != null) {
            out.put("code", code);
        }
        if (path != null) {
            out.put("path", path);
        }
        if (value != null) {
            out.put("value", value);
        }
        if (!data.isEmpty()) {
            out.put("data", data);
        }
        return out;
    }

    @Override
    public String toString() {
        return description();
    }
}
