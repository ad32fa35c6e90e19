package io.eskema.core.engine;

import io.eskema.core.model.Expectation;
import io.eskema.core.model.ExpectationCodes;
import io.eskema.core.model.Result;
import io.eskema.core.predicate.TypeChecks;
import io.eskema.core.spi.Outcome;
import io.eskema.core.spi.Validator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates a map field by field, in schema declaration order.
 *
 * <p>
 * Every failing field is reported, each expectation prefixed with {@code .key}. Absent keys are
 * checked as {@code null} with {@code exists == false}, so only optional validators accept them. In
 * strict mode a map whose fields all pass must also carry no keys outside the schema. A passing map
 * is returned as given.
 */
public final class MapSchemaValidator extends Validator {

    private static final Logger LOG = LoggerFactory.getLogger(MapSchemaValidator.class);

    private final List<Map.Entry<String, Validator>> fields;
    private final boolean strict;
    private final String message;

    public MapSchemaValidator(Map<String, Validator> schema, boolean strict, String message) {
        this(copy(schema), strict, message, false, false);
    }

    private MapSchemaValidator(
            List<Map.Entry<String, Validator>> fields,
            boolean strict,
            String message,
            boolean nullable,
            boolean optional) {
        super(nullable, optional);
        this.fields = fields;
        this.strict = strict;
        this.message = message;
    }

    private static List<Map.Entry<String, Validator>> copy(Map<String, Validator> schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        List<Map.Entry<String, Validator>> entries = new ArrayList<>();
        schema.forEach((key, validator) -> entries.add(
                Map.entry(key, Objects.requireNonNull(validator, () -> "validator for key '" + key + "'"))));
        return Collections.unmodifiableList(entries);
    }

    /** Schema keys in declaration order. */
    public List<String> keys() {
        return fields.stream().map(Map.Entry::getKey).toList();
    }

    @Override
    protected Outcome run(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return Outcome.of(Result.invalid(value, TypeChecks.mismatch("Map", value)));
        }
        return step(0, map, new ArrayList<>());
    }

    private Outcome step(int from, Map<?, ?> map, List<Expectation> failures) {
        for (int i = from; i < fields.size(); i++) {
            String key = fields.get(i).getKey();
            Validator validator = fields.get(i).getValue();
            Outcome outcome = validator.evaluateField(map.get(key), map, map.containsKey(key));
            if (outcome.isPending()) {
                int next = i + 1;
                return outcome.flatMap(result -> {
                    collect(key, result, failures);
                    return step(next, map, failures);
                });
            }
            collect(key, outcome.resultNow(), failures);
        }
        return Outcome.of(finish(map, failures));
    }

    private void collect(String key, Result result, List<Expectation> failures) {
        for (Expectation failure : result.expectations()) {
            Expectation e = message != null ? failure.withMessage(message) : failure;
            failures.add(e.withDefaultCode(ExpectationCodes.STRUCTURE_MAP_FIELD_FAILED).prependPath("." + key));
        }
    }

    private Result finish(Map<?, ?> map, List<Expectation> failures) {
        if (!failures.isEmpty()) {
            return Result.invalid(map, failures);
        }
        if (strict) {
            List<String> unknown = unknownKeys(map);
            if (!unknown.isEmpty()) {
                LOG.debug("Strict map schema rejected unknown keys {}", unknown);
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("keys", unknown);
                String text = message != null ? message : "has unknown keys: " + String.join(", ", unknown);
                return Result.invalid(map, Expectation.of(text, map, ExpectationCodes.STRUCTURE_UNKNOWN_KEY, data));
            }
        }
        return Result.valid(map);
    }

    private List<String> unknownKeys(Map<?, ?> map) {
        List<String> known = keys();
        List<String> unknown = new ArrayList<>();
        for (Object key : map.keySet()) {
            if (!(key instanceof String name) || !known.contains(name)) {
                unknown.add(String.valueOf(key));
            }
        }
        return unknown;
    }

    @Override
    public Validator copyWith(Boolean nullable, Boolean optional) {
        return new MapSchemaValidator(
                fields,
                strict,
                message,
                nullable != null ? nullable : isNullable(),
                optional != null ? optional : isOptional());
    }

    @Override
    public String toString() {
        return (strict ? "eskemaStrict" : "eskema") + keys();
    }
}
