package io.eskema.core.engine;

import io.eskema.core.model.Result;
import io.eskema.core.spi.Validator;
import java.util.ArrayList;
import java.util.List;

/**
 * Conjunction.
 *
 * <p>
 * In the default mode each child receives the previous child's output and the first failure is
 * returned as-is. In collecting mode every child receives the original input and all failures are
 * reported together.
 *
 * <p>
 * A passing conjunction reports what its last descriptive child verified, so negating
 * {@code isInt & isLte(3)} reads "not less than or equal to 3".
 */
public final class AllValidator extends MultiValidator {

    private final boolean collecting;

    public AllValidator(List<Validator> validators) {
        this(validators, false, null);
    }

    public AllValidator(List<Validator> validators, boolean collecting, String message) {
        this(validators, collecting, message, false, false);
    }

    private AllValidator(
            List<Validator> validators, boolean collecting, String message, boolean nullable, boolean optional) {
        super(validators, message, nullable, optional);
        this.collecting = collecting;
    }

    /** {@code left & right}, splicing in the children of plain conjunctions. */
    public static AllValidator conjunction(Validator left, Validator right) {
        List<Validator> parts = new ArrayList<>();
        splice(parts, left);
        splice(parts, right);
        return new AllValidator(parts);
    }

    private static void splice(List<Validator> parts, Validator v) {
        if (v instanceof AllValidator all && all.isPlain()) {
            parts.addAll(all.validators);
        } else {
            parts.add(v);
        }
    }

    private boolean isPlain() {
        return !collecting && message == null && !isNullable() && !isOptional();
    }

    @Override
    protected boolean threadsValue() {
        return !collecting;
    }

    @Override
    protected Result onChild(Result child, Object input, Accumulator acc) {
        if (child.isValid()) {
            if (!child.satisfied().isEmpty()) {
                acc.satisfied.clear();
                acc.satisfied.addAll(child.satisfied());
            }
            return null;
        }
        if (collecting) {
            acc.failures.addAll(child.expectations());
            return null;
        }
        return message != null ? failWithMessage(child.value()) : child;
    }

    @Override
    protected Result complete(Object current, Object original, Accumulator acc) {
        if (acc.failures.isEmpty()) {
            return Result.valid(current, acc.satisfied).withOriginalValue(original);
        }
        return message != null ? failWithMessage(original) : Result.invalid(original, acc.failures);
    }

    @Override
    public Validator copyWith(Boolean nullable, Boolean optional) {
        return new AllValidator(
                validators,
                collecting,
                message,
                nullable != null ? nullable : isNullable(),
                optional != null ? optional : isOptional());
    }
}
