package io.eskema.core.engine;

import io.eskema.core.model.Expectation;
import io.eskema.core.model.Result;
import io.eskema.core.spi.Outcome;
import io.eskema.core.spi.Validator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base for combinators over an ordered list of children.
 *
 * <p>
 * Children run strictly one after another. The loop stays synchronous until a child returns a
 * pending outcome, then resumes from the next child once that outcome completes.
 */
public abstract class MultiValidator extends Validator {

    protected final List<Validator> validators;
    /** Failure message replacing the aggregated expectations, or {@code null}. */
    protected final String message;

    protected MultiValidator(List<Validator> validators, String message, boolean nullable, boolean optional) {
        super(nullable, optional);
        Objects.requireNonNull(validators, "validators must not be null");
        this.validators = List.copyOf(validators);
        this.message = message;
    }

    public List<Validator> validators() {
        return validators;
    }

    /** Whether each child receives the previous child's output instead of the original input. */
    protected abstract boolean threadsValue();

    /**
     * Folds one child result into {@code acc}.
     *
     * @return the final result to stop at, or {@code null} to continue with the next child
     */
    protected abstract Result onChild(Result child, Object input, Accumulator acc);

    /** Builds the result once every child has been folded in. */
    protected abstract Result complete(Object current, Object original, Accumulator acc);

    @Override
    protected Outcome run(Object value) {
        return run(value, true);
    }

    @Override
    protected Outcome run(Object value, boolean exists) {
        return step(0, value, value, exists, new Accumulator());
    }

    /** Children see the key as absent only while they receive the untouched input. */
    private Outcome step(int from, Object current, Object original, boolean exists, Accumulator acc) {
        Object cursor = current;
        for (int i = from; i < validators.size(); i++) {
            Object input = threadsValue() ? cursor : original;
            Outcome outcome = validators.get(i).evaluate(input, exists || input != original);
            if (outcome.isPending()) {
                int next = i + 1;
                Object previous = cursor;
                return outcome.flatMap(r -> {
                    Result stop = onChild(r, input, acc);
                    if (stop != null) {
                        return Outcome.of(stop);
                    }
                    return step(next, advance(previous, r), original, exists, acc);
                });
            }
            Result result = outcome.resultNow();
            Result stop = onChild(result, input, acc);
            if (stop != null) {
                return Outcome.of(stop);
            }
            cursor = advance(cursor, result);
        }
        return Outcome.of(complete(cursor, original, acc));
    }

    private Object advance(Object cursor, Result result) {
        return threadsValue() && result.isValid() ? result.value() : cursor;
    }

    /** Invalid result carrying only the override message. */
    protected final Result failWithMessage(Object value) {
        return Result.invalid(value, Expectation.of(message, value));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + validators;
    }

    /** Mutable state of one evaluation. */
    protected static final class Accumulator {
        final List<Expectation> failures = new ArrayList<>();
        final List<Expectation> satisfied = new ArrayList<>();
    }
}
