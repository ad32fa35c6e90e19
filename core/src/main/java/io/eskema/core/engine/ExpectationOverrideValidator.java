package io.eskema.core.engine;

import io.eskema.core.model.Expectation;
import io.eskema.core.model.Result;
import io.eskema.core.spi.Outcome;
import io.eskema.core.spi.Validator;
import java.util.List;
import java.util.Objects;

/**
 * Replaces whatever a child reports with one fixed expectation.
 *
 * <p>
 * The override's own code and data win; when it has none, the child's first failure supplies them.
 * A passing child's value is kept.
 */
public final class ExpectationOverrideValidator extends Validator {

    private final Validator child;
    private final Expectation expectation;

    public ExpectationOverrideValidator(Validator child, Expectation expectation) {
        this(child, expectation, child.isNullable(), child.isOptional());
    }

    private ExpectationOverrideValidator(
            Validator child, Expectation expectation, boolean nullable, boolean optional) {
        super(nullable, optional);
        this.child = Objects.requireNonNull(child, "child must not be null");
        this.expectation = Objects.requireNonNull(expectation, "expectation must not be null");
    }

    @Override
    protected Outcome run(Object value) {
        return run(value, true);
    }

    @Override
    protected Outcome run(Object value, boolean exists) {
        return child.evaluate(value, exists).map(result -> {
            if (result.isValid()) {
                return Result.valid(result.value(), List.of(resolve(value, null)));
            }
            return Result.invalid(value, resolve(value, result.firstExpectation()));
        });
    }

    private Expectation resolve(Object value, Expectation childFailure) {
        Expectation resolved = expectation.withValue(value);
        if (childFailure == null) {
            return resolved;
        }
        if (resolved.code() == null && childFailure.code() != null) {
            resolved = resolved.withCode(childFailure.code());
        }
        if (resolved.data().isEmpty() && !childFailure.data().isEmpty()) {
            resolved = resolved.withData(childFailure.data());
        }
        return resolved;
    }

    @Override
    public Validator copyWith(Boolean nullable, Boolean optional) {
        return new ExpectationOverrideValidator(
                child,
                expectation,
                nullable != null ? nullable : isNullable(),
                optional != null ? optional : isOptional());
    }

    @Override
    public String toString() {
        return child + " > \"" + expectation.message() + "\"";
    }
}
