package io.eskema.core.predicate;

import io.eskema.core.engine.AllValidator;
import io.eskema.core.engine.FunctionValidator;
import io.eskema.core.model.Expectation;
import io.eskema.core.model.ExpectationCodes;
import io.eskema.core.model.JsonValues;
import io.eskema.core.spi.Validator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Map key and list shape checks. */
public final class CollectionChecks {

    private CollectionChecks() {}

    public static Validator containsKey(String key) {
        return containsKey(key, null);
    }

    public static Validator containsKey(String key, String message) {
        Validator check = FunctionValidator.predicate(
                "containsKey",
                v -> ((Map<?, ?>) v).containsKey(key),
                v -> Expectation.of(
                        message != null ? message : "contains key \"" + key + "\"",
                        v,
                        ExpectationCodes.VALUE_CONTAINS_MISSING,
                        Data.of("key", key)));
        return AllValidator.conjunction(Cached.IS_MAP, check);
    }

    public static Validator containsKeys(List<String> keys) {
        return containsKeys(keys, null);
    }

    /** Reports the missing keys in the expectation data. */
    public static Validator containsKeys(List<String> keys, String message) {
        List<String> required = List.copyOf(keys);
        Validator check = FunctionValidator.predicate(
                "containsKeys",
                v -> required.stream().allMatch(((Map<?, ?>) v)::containsKey),
                v -> Expectation.of(
                        message != null ? message : "contains keys: " + JsonValues.prettify(required),
                        v,
                        ExpectationCodes.VALUE_CONTAINS_MISSING,
                        Data.of("missing", missing(required, v))));
        return AllValidator.conjunction(Cached.IS_MAP, check);
    }

    private static List<String> missing(List<String> keys, Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return keys;
        }
        return keys.stream().filter(k -> !map.containsKey(k)).collect(Collectors.toList());
    }

    public static Validator listLength(List<Validator> validators) {
        return AllValidator.conjunction(Cached.IS_LIST, Comparisons.length(validators));
    }

    public static Validator listIsOfLength(int size) {
        return listLength(List.of(Comparisons.isEq(size)));
    }

    public static Validator listContains(Object item) {
        return AllValidator.conjunction(Cached.IS_LIST, Comparisons.contains(item));
    }

    public static Validator listEmpty() {
        return listLength(List.of(Comparisons.isLte(0)))
                .withExpectation(Expectation.of(
                        "List to be empty", null, ExpectationCodes.VALUE_LENGTH_OUT_OF_RANGE, Data.of("expected", 0)));
    }
}
