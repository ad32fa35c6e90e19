package io.eskema.core.engine;

import io.eskema.core.model.Expectation;
import io.eskema.core.model.ExpectationCodes;
import io.eskema.core.model.Result;
import io.eskema.core.spi.Validator;
import java.util.ArrayList;
import java.util.List;

/**
 * Disjunction. The first passing child wins and its result is returned unchanged. When every child
 * fails, all of their expectations are reported. Without children nothing can pass.
 */
public final class AnyValidator extends MultiValidator {

    static final String NO_ALTERNATIVES = "at least one alternative to pass";

    public AnyValidator(List<Validator> validators) {
        this(validators, null);
    }

    public AnyValidator(List<Validator> validators, String message) {
        this(validators, message, false, false);
    }

    private AnyValidator(List<Validator> validators, String message, boolean nullable, boolean optional) {
        super(validators, message, nullable, optional);
    }

    /** {@code left | right}, splicing in the children of plain disjunctions. */
    public static AnyValidator disjunction(Validator left, Validator right) {
        List<Validator> parts = new ArrayList<>();
        splice(parts, left);
        splice(parts, right);
        return new AnyValidator(parts);
    }

    private static void splice(List<Validator> parts, Validator v) {
        if (v instanceof AnyValidator any && any.message == null && !any.isNullable() && !any.isOptional()) {
            parts.addAll(any.validators);
        } else {
            parts.add(v);
        }
    }

    @Override
    protected boolean threadsValue() {
        return false;
    }

    @Override
    protected Result onChild(Result child, Object input, Accumulator acc) {
        if (child.isValid()) {
            return child;
        }
        acc.failures.addAll(child.expectations());
        return null;
    }

    @Override
    protected Result complete(Object current, Object original, Accumulator acc) {
        if (message != null) {
            return failWithMessage(original);
        }
        if (acc.failures.isEmpty()) {
            return Result.invalid(
                    original, Expectation.of(NO_ALTERNATIVES, original, ExpectationCodes.LOGIC_PREDICATE_FAILED));
        }
        return Result.invalid(original, acc.failures);
    }

    @Override
    public Validator copyWith(Boolean nullable, Boolean optional) {
        return new AnyValidator(
                validators,
                message,
                nullable != null ? nullable : isNullable(),
                optional != null ? optional : isOptional());
    }
}
