package io.eskema.core.model;

import io.eskema.core.error.ValidatorFailedException;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Outcome of one validation call. Exactly one of two states:
 *
 * <ul>
 * <li><b>valid</b>: no expectations; {@code value} holds the (possibly coerced) value.
 * <li><b>invalid</b>: one or more expectations, in evaluation order.
 * </ul>
 *
 * <p>
 * {@code isValid() == expectations().isEmpty()} holds by construction: there is no way to build
 * an invalid result without expectations, or a valid one with them.
 *
 * <p>
 * A valid result may list {@link #satisfied()} expectations: what a leaf check would have reported
 * had it failed. Negating combinators turn those into "not ..." failures. They are never counted as
 * failures.
 */
public final class Result {

    private final boolean valid;
    private final Object value;
    private final Object originalValue;
    private final List<Expectation> expectations;
    private final List<Expectation> satisfied;

    private Result(
            boolean valid,
            Object value,
            Object originalValue,
            List<Expectation> expectations,
            List<Expectation> satisfied) {
        this.valid = valid;
        this.value = value;
        this.originalValue = originalValue;
        this.expectations = expectations;
        this.satisfied = satisfied;
    }

    /** Creates a valid result. */
    public static Result valid(Object value) {
        return new Result(true, value, value, List.of(), List.of());
    }

    /** Creates a valid result remembering what the passing check verified. */
    public static Result valid(Object value, List<Expectation> satisfied) {
        return new Result(true, value, value, List.of(), List.copyOf(satisfied));
    }

    /** Creates an invalid result with a single expectation. */
    public static Result invalid(Object value, Expectation expectation) {
        Objects.requireNonNull(expectation, "expectation must not be null for an invalid result");
        return new Result(false, value, value, List.of(expectation), List.of());
    }

    /**
     * Creates an invalid result.
     *
     * @throws IllegalArgumentException if {@code expectations} is empty
     */
    public static Result invalid(Object value, List<Expectation> expectations) {
        Objects.requireNonNull(expectations, "expectations must not be null for an invalid result");
        if (expectations.isEmpty()) {
            throw new IllegalArgumentException("an invalid result needs at least one expectation");
        }
        return new Result(false, value, value, List.copyOf(expectations), List.of());
    }

    /** Valid when {@code passed}, otherwise invalid with {@code expectation}. */
    public static Result of(boolean passed, Object value, Expectation expectation) {
        return passed ? valid(value, List.of(expectation)) : invalid(value, expectation);
    }

    public boolean isValid() {
        return valid;
    }

    public boolean isNotValid() {
        return !valid;
    }

    /** The value produced by validation; may differ from the input after coercion. */
    public Object value() {
        return value;
    }

    /** The input that entered the validator which produced this result. */
    public Object originalValue() {
        return originalValue;
    }

    public List<Expectation> expectations() {
        return expectations;
    }

    public List<Expectation> satisfied() {
        return satisfied;
    }

    public int expectationCount() {
        return expectations.size();
    }

    /**
     * Returns the first expectation.
     *
     * @throws IllegalStateException on a valid result
     */
    public Expectation firstExpectation() {
        if (valid) {
            throw new IllegalStateException("a valid result has no expectations");
        }
        return expectations.get(0);
    }

    /** Copy with a different value; the original input is kept. */
    public Result withValue(Object newValue) {
        return new Result(valid, newValue, originalValue, expectations, satisfied);
    }

    /** Copy recording {@code input} as the value this result was computed from. */
    public Result withOriginalValue(Object input) {
        return new Result(valid, value, input, expectations, satisfied);
    }

    /** Copy with every expectation rewritten by {@code fn}. A valid result is returned as is. */
    public Result mapExpectations(UnaryOperator<Expectation> fn) {
        if (valid) {
            return this;
        }
        List<Expectation> mapped = expectations.stream().map(fn).collect(Collectors.toList());
        return new Result(false, value, originalValue, List.copyOf(mapped), List.of());
    }

    /** Copy with {@code segment} prepended to every expectation path. */
    public Result prependPath(String segment) {
        return mapExpectations(e -> e.prependPath(segment));
    }

    /**
     * Returns the value of a valid result.
     *
     * @throws ValidatorFailedException if this result is invalid
     */
    public Object orThrow() {
        if (!valid) {
            throw new ValidatorFailedException(this);
        }
        return value;
    }

    /** Returns the value when valid, otherwise {@code defaultValue}. */
    public Object valueOr(Object defaultValue) {
        return valid ? value : defaultValue;
    }

    /** Comma-separated expectation descriptions, or {@code Valid}. */
    public String shortDescription() {
        if (valid) {
            return "Valid";
        }
        return expectations.stream().map(Expectation::description).collect(Collectors.joining(", "));
    }

    /** {@code <descriptions> (value: <pretty value>)}, or {@code Valid: <pretty value>}. */
    public String description() {
        if (valid) {
            return "Valid: " + JsonValues.prettify(value);
        }
        return shortDescription() + " (value: " + JsonValues.prettify(value) + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Result other)) {
            return false;
        }
        return valid == other.valid
                && Objects.equals(value, other.value)
                && expectations.equals(other.expectations)
                && satisfied.equals(other.satisfied);
    }

    @Override
    public int hashCode() {
        return Objects.hash(valid, value, expectations, satisfied);
    }

    @Override
    public String toString() {
        return description();
    }
}
