package io.eskema.core;

import io.eskema.core.engine.AllValidator;
import io.eskema.core.engine.AnyValidator;
import io.eskema.core.engine.ExpectationOverrideValidator;
import io.eskema.core.engine.FunctionValidator;
import io.eskema.core.engine.ListSchemaValidator;
import io.eskema.core.engine.MapSchemaValidator;
import io.eskema.core.engine.NoneValidator;
import io.eskema.core.engine.NotValidator;
import io.eskema.core.engine.ResolveValidator;
import io.eskema.core.engine.ThrowInsteadValidator;
import io.eskema.core.engine.WhenValidator;
import io.eskema.core.model.Expectation;
import io.eskema.core.model.ExpectationCodes;
import io.eskema.core.model.Result;
import io.eskema.core.predicate.Cached;
import io.eskema.core.predicate.CollectionChecks;
import io.eskema.core.spi.Outcome;
import io.eskema.core.spi.Validator;
import io.eskema.core.transform.Transformers;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Entry point for composing validators.
 *
 * <pre>{@code
 * Validator user = eskema(Map.of(
 *         "name", Cached.IS_STRING,
 *         "age", all(Cached.IS_INT, Comparisons.isGte(18)),
 *         "email", optional(StringChecks.isEmail())));
 * Result result = user.validate(input);
 * }</pre>
 *
 * Leaf checks live in {@link io.eskema.core.predicate}, value transformations in
 * {@link Transformers} and the fluent builders in {@link io.eskema.core.builder.Builders}.
 */
public final class Eskema {

    private Eskema() {}

    // factories

    /** Accepts everything, unchanged. */
    public static Validator valid() {
        return FunctionValidator.VALID;
    }

    /** A synchronous check returning its own result. */
    public static Validator validator(Function<Object, Result> fn) {
        return FunctionValidator.sync(fn);
    }

    /** An asynchronous check. Chains containing it must be run with {@code validateAsync}. */
    public static Validator asyncValidator(Function<Object, ? extends CompletionStage<Result>> fn) {
        return FunctionValidator.async(fn);
    }

    /** A leaf check: valid when {@code test} holds, otherwise failing with the given expectation. */
    public static Validator predicate(Predicate<Object> test, Function<Object, Expectation> expectation) {
        return FunctionValidator.predicate("predicate", test, expectation);
    }

    // logical

    public static Validator all(Validator... validators) {
        return new AllValidator(List.of(validators));
    }

    public static Validator all(List<Validator> validators) {
        return new AllValidator(validators);
    }

    /** Conjunction that replaces any failure with {@code message}. */
    public static Validator all(List<Validator> validators, String message) {
        return new AllValidator(validators, false, message);
    }

    /** Conjunction that runs every child on the original input and reports all failures. */
    public static Validator allCollecting(List<Validator> validators) {
        return new AllValidator(validators, true, null);
    }

    public static Validator any(Validator... validators) {
        return new AnyValidator(List.of(validators));
    }

    public static Validator any(List<Validator> validators) {
        return new AnyValidator(validators);
    }

    public static Validator any(List<Validator> validators, String message) {
        return new AnyValidator(validators, message);
    }

    public static Validator none(Validator... validators) {
        return new NoneValidator(List.of(validators));
    }

    public static Validator none(List<Validator> validators) {
        return new NoneValidator(validators);
    }

    public static Validator none(List<Validator> validators, String message) {
        return new NoneValidator(validators, message);
    }

    public static Validator not(Validator child) {
        return new NotValidator(child, null);
    }

    public static Validator not(Validator child, String message) {
        return new NotValidator(child, message);
    }

    // presence

    public static Validator nullable(Validator validator) {
        return validator.nullable();
    }

    public static Validator optional(Validator validator) {
        return validator.optional();
    }

    /** Rejects {@code null} with "is required", then applies {@code validator}. */
    public static Validator required(Validator validator) {
        return AllValidator.conjunction(new NotValidator(Cached.IS_NULL, "is required"), validator);
    }

    // expectations

    public static Validator withExpectation(Validator child, Expectation expectation) {
        return new ExpectationOverrideValidator(child, expectation);
    }

    /** Replaces the failure with {@code message}, keeping {@code code} when given. */
    public static Validator withExpectation(Validator child, String message, String code) {
        return new ExpectationOverrideValidator(child, Expectation.of(message, null, code));
    }

    public static Validator throwInstead(Validator child) {
        return new ThrowInsteadValidator(child);
    }

    // contextual

    /**
     * Map-field validator: checks {@code condition} against the parent map, then validates the field
     * with {@code then} or {@code otherwise}.
     */
    public static Validator when(Validator condition, Validator then, Validator otherwise) {
        return new WhenValidator(condition, then, otherwise, null);
    }

    public static Validator when(Validator condition, Validator then, Validator otherwise, String message) {
        return new WhenValidator(condition, then, otherwise, message);
    }

    /** The field is required when {@code condition} holds on the parent map, optional otherwise. */
    public static Validator requiredWhen(Validator condition, Validator validator) {
        return new WhenValidator(condition, required(validator), validator.optional(), null);
    }

    /** Map-field validator chosen from the parent map; a {@code null} choice accepts the field. */
    public static Validator resolve(Function<Map<?, ?>, Validator> resolver) {
        return new ResolveValidator(resolver);
    }

    /**
     * Validates a whole map with the validator registered for the value of its {@code key}
     * discriminator. Fails with "unknown type" when no branch matches.
     */
    public static Validator switchBy(String key, Map<String, Validator> branches) {
        Map<String, Validator> byType = Map.copyOf(branches);
        Validator dispatch = new FunctionValidator("switchBy", value -> {
            Map<?, ?> map = (Map<?, ?>) value;
            Object type = map.get(key);
            Validator branch = type instanceof String name ? byType.get(name) : null;
            if (branch == null) {
                return Outcome.of(Result.invalid(
                        value,
                        Expectation.of(
                                "unknown type",
                                type,
                                ExpectationCodes.VALUE_MEMBERSHIP_MISMATCH,
                                Map.of("key", key, "options", List.copyOf(byType.keySet())))
                                .withPath("." + key)));
            }
            return branch.evaluate(value).map(result -> result.isValid() ? Result.valid(value) : result);
        });
        return new AllValidator(
                List.of(CollectionChecks.containsKeys(List.of(key), "Missing key: \"" + key + "\""), dispatch));
    }

    // structure

    /** Validates each declared field of a map; iteration follows the schema map's order. */
    public static Validator eskema(Map<String, Validator> schema) {
        return new MapSchemaValidator(schema, false, null);
    }

    public static Validator eskema(Map<String, Validator> schema, String message) {
        return new MapSchemaValidator(schema, false, message);
    }

    /** Like {@link #eskema(Map)}, also rejecting keys outside the schema. */
    public static Validator eskemaStrict(Map<String, Validator> schema) {
        return new MapSchemaValidator(schema, true, null);
    }

    public static Validator eskemaStrict(Map<String, Validator> schema, String message) {
        return new MapSchemaValidator(schema, true, message);
    }

    /** Positional list schema: exactly {@code validators.size()} items, item i checked by validator i. */
    public static Validator eskemaList(List<Validator> validators) {
        return ListSchemaValidator.positional(validators, null);
    }

    public static Validator listEach(Validator validator) {
        return ListSchemaValidator.each(validator, null);
    }

    public static Validator listEach(Validator validator, String message) {
        return ListSchemaValidator.each(validator, message);
    }

    /** See {@link Transformers#getField}. */
    public static Validator getField(String key, Validator inner) {
        return Transformers.getField(key, Objects.requireNonNull(inner, "inner must not be null"));
    }
}
