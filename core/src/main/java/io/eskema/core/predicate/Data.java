package io.eskema.core.predicate;

import java.util.LinkedHashMap;
import java.util.Map;

/** Builds expectation data maps; values may be {@code null}. */
final class Data {

    private Data() {}

    static Map<String, Object> of(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("keys and values must come in pairs");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            data.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return data;
    }
}
