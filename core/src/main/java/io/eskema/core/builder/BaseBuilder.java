package io.eskema.core.builder;

import io.eskema.core.engine.NotValidator;
import io.eskema.core.model.Expectation;
import io.eskema.core.model.Result;
import io.eskema.core.predicate.Comparisons;
import io.eskema.core.spi.Validator;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * Common part of every fluent builder.
 *
 * <p>
 * A builder is mutable: each step changes the shared {@link ChainState} and returns a builder for
 * further steps. {@link #build()} produces the immutable {@link Validator} and freezes the chain.
 * {@code optional()} and {@code nullable()} apply to the whole chain wherever they appear.
 */
public abstract class BaseBuilder<B extends BaseBuilder<B>> implements ChainSteps<B> {

    private final ChainState chain;

    protected BaseBuilder(ChainState chain) {
        this.chain = chain;
    }

    @Override
    public final ChainState state() {
        return chain;
    }

    /** Negates the next added or wrapped constraint. */
    public B not() {
        chain.negateNext();
        return self();
    }

    @Override
    public B add(Validator validator) {
        return add(validator, null);
    }

    @Override
    public B add(Validator validator, String message) {
        chain.add(withMessage(chain.applyNegation(validator), message));
        return self();
    }

    @Override
    public B wrap(UnaryOperator<Validator> fn) {
        return wrap(fn, null);
    }

    public B wrap(UnaryOperator<Validator> fn, String message) {
        boolean negate = chain.takeNegation();
        chain.wrap(current -> {
            Validator wrapped = fn.apply(current);
            return withMessage(negate ? new NotValidator(wrapped, null) : wrapped, message);
        });
        return self();
    }

    private static Validator withMessage(Validator validator, String message) {
        return message == null || message.isEmpty() ? validator : validator.withMessage(message);
    }

    public B optional() {
        chain.markOptional();
        return self();
    }

    public B nullable() {
        chain.markNullable();
        return self();
    }

    /** Replaces the failure of everything added so far with {@code message}, keeping its code. */
    public B error(String message) {
        return wrap(current -> current.withExpectation(Expectation.of(message, null)));
    }

    public B eq(Object value) {
        return add(Comparisons.isEq(value));
    }

    public B eq(Object value, String message) {
        return add(Comparisons.isEq(value), message);
    }

    public B deepEq(Object value) {
        return add(Comparisons.isDeepEq(value));
    }

    public B oneOf(Collection<?> values) {
        return add(Comparisons.isOneOf(values));
    }

    public B oneOf(Collection<?> values, String message) {
        return add(Comparisons.isOneOf(values), message);
    }

    /** Builds the validator. The chain cannot be modified afterwards. */
    public Validator build() {
        return chain.build();
    }

    /** Shorthand for {@code build().validate(value)}. */
    public Result validate(Object value) {
        return build().validate(value);
    }

    public CompletableFuture<Result> validateAsync(Object value) {
        return build().validateAsync(value);
    }
}
