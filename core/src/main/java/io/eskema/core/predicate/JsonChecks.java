package io.eskema.core.predicate;

import io.eskema.core.engine.AllValidator;
import io.eskema.core.engine.FunctionValidator;
import io.eskema.core.engine.ListSchemaValidator;
import io.eskema.core.model.Expectation;
import io.eskema.core.model.ExpectationCodes;
import io.eskema.core.model.JsonValues;
import io.eskema.core.spi.Validator;
import java.util.List;
import java.util.Map;

/** Shape checks for decoded JSON: objects are maps, arrays are lists. */
public final class JsonChecks {

    private JsonChecks() {}

    public static Validator isJsonContainer() {
        return TypeChecks.check("JSON object or array", v -> v instanceof Map<?, ?> || v instanceof List<?>);
    }

    public static Validator isJsonObject() {
        return TypeChecks.check("JSON object", v -> v instanceof Map<?, ?>);
    }

    public static Validator isJsonArray() {
        return TypeChecks.check("JSON array", v -> v instanceof List<?>);
    }

    /** A JSON object carrying every one of {@code keys}. */
    public static Validator jsonHasKeys(List<String> keys) {
        List<String> required = List.copyOf(keys);
        Validator check = FunctionValidator.predicate(
                "jsonHasKeys",
                v -> required.stream().allMatch(((Map<?, ?>) v)::containsKey),
                v -> Expectation.of(
                        "JSON object with keys: " + JsonValues.prettify(required),
                        v,
                        ExpectationCodes.VALUE_CONTAINS_MISSING,
                        Data.of("keys", required)));
        return AllValidator.conjunction(isJsonObject(), check);
    }

    /** A JSON array whose size lies within the given bounds; {@code null} leaves a side open. */
    public static Validator jsonArrayLength(Integer min, Integer max) {
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("min must be <= max");
        }
        String message = min != null && max != null
                ? "JSON array length between " + min + " and " + max
                : min != null ? "JSON array length at least " + min : "JSON array length at most " + max;
        Validator check = FunctionValidator.predicate(
                "jsonArrayLength",
                v -> {
                    int size = ((List<?>) v).size();
                    return (min == null || size >= min) && (max == null || size <= max);
                },
                v -> Expectation.of(
                        message,
                        v,
                        ExpectationCodes.VALUE_LENGTH_OUT_OF_RANGE,
                        Data.of("min", min, "max", max, "length", ((List<?>) v).size())));
        return AllValidator.conjunction(isJsonArray(), check);
    }

    /** A JSON array whose every element passes {@code element}. */
    public static Validator jsonArrayEvery(Validator element) {
        return ListSchemaValidator.each(element, null);
    }
}
