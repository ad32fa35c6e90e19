package io.eskema.core.engine;

import io.eskema.core.model.Expectation;
import io.eskema.core.model.ExpectationCodes;
import io.eskema.core.model.Result;
import io.eskema.core.spi.Outcome;
import io.eskema.core.spi.Validator;
import java.util.Objects;

/** Inverts a child. The input value is returned unchanged either way. */
public final class NotValidator extends Validator {

    private final Validator child;
    private final String message;

    public NotValidator(Validator child, String message) {
        this(child, message, false, false);
    }

    private NotValidator(Validator child, String message, boolean nullable, boolean optional) {
        super(nullable, optional);
        this.child = Objects.requireNonNull(child, "child must not be null");
        this.message = message;
    }

    @Override
    protected Outcome run(Object value) {
        return run(value, true);
    }

    @Override
    protected Outcome run(Object value, boolean exists) {
        return child.evaluate(value, exists).map(result -> {
            if (result.isNotValid()) {
                return Result.valid(value, Negation.negateAll(result.expectations(), value));
            }
            if (message != null) {
                return Result.invalid(value, Expectation.of(message, value, ExpectationCodes.LOGIC_NOT_EXPECTED));
            }
            return Result.invalid(value, Negation.ofPassing(result, value));
        });
    }

    @Override
    public Validator copyWith(Boolean nullable, Boolean optional) {
        return new NotValidator(
                child,
                message,
                nullable != null ? nullable : isNullable(),
                optional != null ? optional : isOptional());
    }

    @Override
    public String toString() {
        return "not(" + child + ")";
    }
}
