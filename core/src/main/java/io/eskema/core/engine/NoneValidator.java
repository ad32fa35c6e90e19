package io.eskema.core.engine;

import io.eskema.core.model.Result;
import io.eskema.core.spi.Validator;
import java.util.List;

/** Passes only when no child passes. Every passing child contributes negated expectations. */
public final class NoneValidator extends MultiValidator {

    public NoneValidator(List<Validator> validators) {
        this(validators, null);
    }

    public NoneValidator(List<Validator> validators, String message) {
        this(validators, message, false, false);
    }

    private NoneValidator(List<Validator> validators, String message, boolean nullable, boolean optional) {
        super(validators, message, nullable, optional);
    }

    @Override
    protected boolean threadsValue() {
        return false;
    }

    @Override
    protected Result onChild(Result child, Object input, Accumulator acc) {
        if (child.isValid()) {
            acc.failures.addAll(Negation.ofPassing(child, input));
        } else {
            acc.satisfied.addAll(Negation.negateAll(child.expectations(), input));
        }
        return null;
    }

    @Override
    protected Result complete(Object current, Object original, Accumulator acc) {
        if (acc.failures.isEmpty()) {
            return Result.valid(original, acc.satisfied);
        }
        return message != null ? failWithMessage(original) : Result.invalid(original, acc.failures);
    }

    @Override
    public Validator copyWith(Boolean nullable, Boolean optional) {
        return new NoneValidator(
                validators,
                message,
                nullable != null ? nullable : isNullable(),
                optional != null ? optional : isOptional());
    }
}
