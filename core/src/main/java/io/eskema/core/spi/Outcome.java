package io.eskema.core.spi;

import io.eskema.core.error.AsyncValidatorException;
import io.eskema.core.model.Result;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * What a validator hands back from one evaluation: either a {@link Result} that is already there, or
 * one that will arrive later.
 *
 * <p>
 * Synchronous work stays synchronous. A chain only switches to {@link Pending} from the first child
 * that is itself pending; every later step is then sequenced after it with {@link #flatMap}.
 */
public sealed interface Outcome permits Outcome.Ready, Outcome.Pending {

    static Outcome of(Result result) {
        return new Ready(result);
    }

    static Outcome pending(CompletionStage<Result> stage) {
        return new Pending(stage);
    }

    boolean isPending();

    /**
     * Returns the result of a ready outcome.
     *
     * @throws AsyncValidatorException if the outcome is pending, even when its stage has already
     *     completed
     */
    Result resultNow();

    CompletableFuture<Result> toFuture();

    Outcome map(Function<Result, Result> fn);

    Outcome flatMap(Function<Result, Outcome> fn);

    /** A result that is already available. */
    record Ready(Result result) implements Outcome {

        public Ready {
            Objects.requireNonNull(result, "result must not be null");
        }

        @Override
        public boolean isPending() {
            return false;
        }

        @Override
        public Result resultNow() {
            return result;
        }

        @Override
        public CompletableFuture<Result> toFuture() {
            return CompletableFuture.completedFuture(result);
        }

        @Override
        public Outcome map(Function<Result, Result> fn) {
            return new Ready(fn.apply(result));
        }

        @Override
        public Outcome flatMap(Function<Result, Outcome> fn) {
            return fn.apply(result);
        }
    }

    /** A result that completes later. */
    record Pending(CompletionStage<Result> stage) implements Outcome {

        public Pending {
            Objects.requireNonNull(stage, "stage must not be null");
        }

        @Override
        public boolean isPending() {
            return true;
        }

        @Override
        public Result resultNow() {
            throw new AsyncValidatorException();
        }

        @Override
        public CompletableFuture<Result> toFuture() {
            return stage.toCompletableFuture();
        }

        @Override
        public Outcome map(Function<Result, Result> fn) {
            return new Pending(stage.thenApply(fn));
        }

        @Override
        public Outcome flatMap(Function<Result, Outcome> fn) {
            return new Pending(stage.thenCompose(r -> fn.apply(r).toFuture()));
        }
    }
}
