package io.eskema.core.spi;

import io.eskema.core.engine.AllValidator;
import io.eskema.core.engine.AnyValidator;
import io.eskema.core.engine.ExpectationOverrideValidator;
import io.eskema.core.error.AsyncValidatorException;
import io.eskema.core.error.ValidatorFailedException;
import io.eskema.core.model.Expectation;
import io.eskema.core.model.Result;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A reusable, immutable check over an arbitrary value.
 *
 * <p>
 * Subclasses implement {@link #run(Object)}. Callers use {@link #validate(Object)} when every step
 * is known to be synchronous and {@link #validateAsync(Object)} otherwise. Combinators call
 * {@link #evaluate(Object, boolean)}, which keeps pending work pending.
 *
 * <p>
 * The two presence flags are checked before {@code run}:
 *
 * <ul>
 * <li>{@code nullable}: a {@code null} value whose key is present passes.
 * <li>{@code optional}: an absent key passes.
 * </ul>
 *
 * A null value under an absent key is only accepted by {@code optional}.
 */
public abstract class Validator {

    private static final Logger LOG = LoggerFactory.getLogger(Validator.class);

    private final boolean nullable;
    private final boolean optional;

    protected Validator(boolean nullable, boolean optional) {
        this.nullable = nullable;
        this.optional = optional;
    }

    /** Checks {@code value}. Never called for values the presence flags already accept. */
    protected abstract Outcome run(Object value);

    /**
     * Checks {@code value} knowing whether its key was present. Wrappers and combinators override
     * this to hand {@code exists} on to their children.
     */
    protected Outcome run(Object value, boolean exists) {
        return run(value);
    }

    /** Returns a copy with the given flags; {@code null} keeps the current setting. */
    public abstract Validator copyWith(Boolean nullable, Boolean optional);

    public final boolean isNullable() {
        return nullable;
    }

    public final boolean isOptional() {
        return optional;
    }

    /** Evaluates a value that is present. */
    public final Outcome evaluate(Object value) {
        return evaluate(value, true);
    }

    /**
     * Evaluates a value, applying the presence short-circuits first.
     *
     * @param exists whether the value was present under its key; {@code true} outside maps
     */
    public final Outcome evaluate(Object value, boolean exists) {
        if (acceptsWithoutRunning(value, exists)) {
            return Outcome.of(Result.valid(value));
        }
        return run(value, exists);
    }

    /**
     * Evaluates the value of one map field. Validators whose decision depends on sibling fields
     * override this to read {@code parent}.
     */
    public Outcome evaluateField(Object value, Map<?, ?> parent, boolean exists) {
        return evaluate(value, exists);
    }

    protected final boolean acceptsWithoutRunning(Object value, boolean exists) {
        return (value == null && nullable && exists) || (!exists && optional);
    }

    /**
     * Validates synchronously.
     *
     * @throws AsyncValidatorException if any step in the chain is asynchronous
     */
    public Result validate(Object value) {
        return validate(value, true);
    }

    public Result validate(Object value, boolean exists) {
        Outcome outcome = evaluate(value, exists);
        if (outcome.isPending()) {
            LOG.debug("Synchronous validate() reached an asynchronous step in {}", this);
            throw new AsyncValidatorException(toString());
        }
        return outcome.resultNow();
    }

    /** Validates, allowing asynchronous steps. Synchronous chains complete immediately. */
    public CompletableFuture<Result> validateAsync(Object value) {
        return validateAsync(value, true);
    }

    public CompletableFuture<Result> validateAsync(Object value, boolean exists) {
        return evaluate(value, exists).toFuture();
    }

    public boolean isValid(Object value) {
        return validate(value).isValid();
    }

    public boolean isNotValid(Object value) {
        return !isValid(value);
    }

    public CompletableFuture<Boolean> isValidAsync(Object value) {
        return validateAsync(value).thenApply(Result::isValid);
    }

    /**
     * Validates and returns the (possibly transformed) value.
     *
     * @throws ValidatorFailedException when validation fails
     */
    public Object validateOrThrow(Object value) {
        return validate(value).orThrow();
    }

    public Validator nullable() {
        return copyWith(true, null);
    }

    public Validator optional() {
        return copyWith(null, true);
    }

    /** Short-circuit conjunction; nested plain conjunctions are flattened. */
    public Validator and(Validator other) {
        return AllValidator.conjunction(this, other);
    }

    /** Disjunction; nested plain disjunctions are flattened. */
    public Validator or(Validator other) {
        return AnyValidator.disjunction(this, other);
    }

    /** Replaces the failure with {@code expectation}, keeping the child's code when it has none. */
    public Validator withExpectation(Expectation expectation) {
        return new ExpectationOverrideValidator(this, expectation);
    }

    public Validator withMessage(String message) {
        return new ExpectationOverrideValidator(this, Expectation.of(message, null));
    }

    @Override
    public String toString() {
        String name = getClass().getSimpleName();
        return name.isEmpty() ? "Validator" : name;
    }
}
