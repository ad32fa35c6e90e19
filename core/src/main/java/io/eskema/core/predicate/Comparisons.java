package io.eskema.core.predicate;

import io.eskema.core.engine.AllValidator;
import io.eskema.core.engine.FunctionValidator;
import io.eskema.core.model.Expectation;
import io.eskema.core.model.ExpectationCodes;
import io.eskema.core.model.JsonValues;
import io.eskema.core.model.Result;
import io.eskema.core.spi.Outcome;
import io.eskema.core.spi.Validator;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntPredicate;
import java.util.stream.Collectors;

/** Equality, membership, numeric bounds, length and containment. */
public final class Comparisons {

    private Comparisons() {}

    /** Shallow equality; numbers compare by value. */
    public static Validator isEq(Object expected) {
        return FunctionValidator.predicate(
                "isEq",
                v -> Numbers.valueEquals(v, expected),
                v -> Expectation.of(
                        "equal to " + JsonValues.prettify(expected),
                        v,
                        ExpectationCodes.VALUE_EQUAL_MISMATCH,
                        Data.of("expected", expected, "found", v, "mode", "shallow")));
    }

    /** Structural equality over nested maps and lists. */
    public static Validator isDeepEq(Object expected) {
        return FunctionValidator.predicate(
                "isDeepEq",
                v -> Numbers.deepEquals(v, expected),
                v -> Expectation.of(
                        "equal to " + JsonValues.prettify(expected),
                        v,
                        ExpectationCodes.VALUE_DEEP_EQUAL_MISMATCH,
                        Data.of("expected", expected, "found", v, "mode", "deep")));
    }

    public static Validator isOneOf(Collection<?> options) {
        List<?> copy = List.copyOf(options);
        return FunctionValidator.predicate(
                "isOneOf",
                v -> copy.stream().anyMatch(option -> Numbers.valueEquals(v, option)),
                v -> Expectation.of(
                        "one of: " + JsonValues.prettify(copy),
                        v,
                        ExpectationCodes.VALUE_MEMBERSHIP_MISMATCH,
                        Data.of("options", copy)));
    }

    public static Validator isLt(Number max) {
        return bound("<", max, "less than " + max, c -> c < 0);
    }

    public static Validator isLte(Number max) {
        return bound("<=", max, "less than or equal to " + max, c -> c <= 0);
    }

    public static Validator isGt(Number min) {
        return bound(">", min, "greater than " + min, c -> c > 0);
    }

    public static Validator isGte(Number min) {
        return bound(">=", min, "greater than or equal to " + min, c -> c >= 0);
    }

    private static Validator bound(String operator, Number limit, String message, IntPredicate accept) {
        Objects.requireNonNull(limit, "limit must not be null");
        if (Numbers.isNaN(limit)) {
            throw new IllegalArgumentException("limit must be a valid number");
        }
        Validator compare = FunctionValidator.predicate(
                "is" + operator,
                v -> !Numbers.isNaN((Number) v) && accept.test(Numbers.compare((Number) v, limit)),
                v -> Expectation.of(
                        message,
                        v,
                        ExpectationCodes.VALUE_RANGE_OUT_OF_BOUNDS,
                        Data.of("operator", operator, "limit", limit)));
        return AllValidator.conjunction(Cached.IS_NUMBER, compare);
    }

    /** Inclusive range check. */
    public static Validator isInRange(Number min, Number max) {
        if (Numbers.isNaN(min) || Numbers.isNaN(max)) {
            throw new IllegalArgumentException("range bounds must be valid numbers");
        }
        if (Numbers.compare(min, max) > 0) {
            throw new IllegalArgumentException("min must be <= max");
        }
        Validator inRange = FunctionValidator.predicate(
                "isInRange",
                v -> !Numbers.isNaN((Number) v)
                        && Numbers.compare((Number) v, min) >= 0
                        && Numbers.compare((Number) v, max) <= 0,
                v -> Expectation.of(
                        "between " + min + " and " + max + " inclusive",
                        v,
                        ExpectationCodes.VALUE_RANGE_OUT_OF_BOUNDS,
                        Data.of("operator", "between_inclusive", "min", min, "max", max)));
        return AllValidator.conjunction(Cached.IS_NUMBER, inRange);
    }

    /**
     * Applies {@code validators} to the length of a string, collection or map. On failure the
     * expectation reads {@code length [<child messages>]}.
     */
    public static Validator length(List<Validator> validators) {
        AllValidator lengthChecks = new AllValidator(validators);
        return new FunctionValidator("length", value -> {
            Integer size = lengthOf(value);
            if (size == null) {
                return Outcome.of(Result.invalid(
                        value,
                        Expectation.of(
                                JsonValues.typeName(value) + " does not have a length property",
                                value,
                                ExpectationCodes.TYPE_MISMATCH)));
            }
            return lengthChecks.evaluate(size).map(result -> {
                if (result.isValid()) {
                    return result.satisfied().isEmpty()
                            ? Result.valid(value)
                            : Result.valid(value, List.of(lengthExpectation(value, size, result.satisfied())));
                }
                return Result.invalid(value, lengthExpectation(value, size, result.expectations()));
            });
        });
    }

    private static Expectation lengthExpectation(Object value, int size, List<Expectation> parts) {
        String joined = parts.stream().map(Expectation::message).collect(Collectors.joining(", "));
        return Expectation.of(
                "length [" + joined + "]", value, ExpectationCodes.VALUE_LENGTH_OUT_OF_RANGE, Data.of("length", size));
    }

    static Integer lengthOf(Object value) {
        if (value instanceof CharSequence s) {
            return s.length();
        }
        if (value instanceof Collection<?> c) {
            return c.size();
        }
        if (value instanceof Map<?, ?> m) {
            return m.size();
        }
        return null;
    }

    /** Substring for strings, element membership for collections. */
    public static Validator contains(Object item) {
        return new FunctionValidator("contains", value -> {
            if (!(value instanceof String) && !(value instanceof Collection<?>)) {
                return Outcome.of(Result.invalid(
                        value,
                        Expectation.of(
                                JsonValues.typeName(value) + " does not have a contains property",
                                value,
                                ExpectationCodes.TYPE_MISMATCH)));
            }
            boolean found = value instanceof String s
                    ? item != null && s.contains(String.valueOf(item))
                    : ((Collection<?>) value).stream().anyMatch(e -> Numbers.deepEquals(e, item));
            return Outcome.of(Result.of(
                    found,
                    value,
                    Expectation.of(
                            "contains " + JsonValues.prettify(item),
                            value,
                            ExpectationCodes.VALUE_CONTAINS_MISSING,
                            Data.of("needle", item))));
        });
    }
}
