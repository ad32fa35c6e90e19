package io.eskema.core.engine;

import io.eskema.core.model.Expectation;
import io.eskema.core.model.Result;
import io.eskema.core.spi.Outcome;
import io.eskema.core.spi.Validator;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Predicate;

/** Validator backed by a function. Leaves, transformers and user checks are all built on it. */
public final class FunctionValidator extends Validator {

    /** Passes every value through unchanged. */
    public static final Validator VALID = new FunctionValidator("valid", v -> Outcome.of(Result.valid(v)));

    /** One evaluation step. */
    @FunctionalInterface
    public interface Check {
        Outcome apply(Object value);
    }

    private final String name;
    private final Check check;

    public FunctionValidator(String name, Check check) {
        this(name, check, false, false);
    }

    private FunctionValidator(String name, Check check, boolean nullable, boolean optional) {
        super(nullable, optional);
        this.name = Objects.requireNonNull(name, "name");
        this.check = Objects.requireNonNull(check, "check");
    }

    public static FunctionValidator sync(Function<Object, Result> fn) {
        Objects.requireNonNull(fn, "fn");
        return new FunctionValidator("validator", v -> Outcome.of(fn.apply(v)));
    }

    public static FunctionValidator async(Function<Object, ? extends CompletionStage<Result>> fn) {
        Objects.requireNonNull(fn, "fn");
        return new FunctionValidator("asyncValidator", v -> Outcome.pending(fn.apply(v)));
    }

    /** A leaf check: valid when {@code test} holds, otherwise invalid with the built expectation. */
    public static FunctionValidator predicate(
            String name, Predicate<Object> test, Function<Object, Expectation> expectation) {
        return new FunctionValidator(name, v -> Outcome.of(Result.of(test.test(v), v, expectation.apply(v))));
    }

    @Override
    protected Outcome run(Object value) {
        return check.apply(value);
    }

    @Override
    public Validator copyWith(Boolean nullable, Boolean optional) {
        return new FunctionValidator(
                name,
                check,
                nullable != null ? nullable : isNullable(),
                optional != null ? optional : isOptional());
    }

    @Override
    public String toString() {
        return name;
    }
}
