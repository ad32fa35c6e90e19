package io.eskema.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.eskema.core.Eskema;
import io.eskema.core.error.AsyncValidatorException;
import io.eskema.core.error.EskemaException;
import io.eskema.core.error.ValidatorFailedException;
import io.eskema.core.model.Expectation;
import io.eskema.core.model.Result;
import io.eskema.core.predicate.Cached;
import io.eskema.core.predicate.Comparisons;
import io.eskema.core.spi.Validator;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for mixing synchronous and asynchronous validators. */
class AsyncValidationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Executor LATER = CompletableFuture.delayedExecutor(20, TimeUnit.MILLISECONDS);

    /** Passes strings longer than two characters, after a short delay. */
    private static Validator slowLongString() {
        return Eskema.asyncValidator(value -> CompletableFuture.supplyAsync(
                () -> value instanceof String s && s.length() > 2
                        ? Result.valid(value)
                        : Result.invalid(value, Expectation.of("long string", value)),
                LATER));
    }

    @Test
    @DisplayName("validate() refuses a chain that goes asynchronous")
    void syncEntryPointThrows() {
        Validator v = Cached.IS_STRING.and(slowLongString());

        assertThatThrownBy(() -> v.validate("abcd"))
                .isInstanceOf(AsyncValidatorException.class)
                .hasMessageContaining("validateAsync()")
                .satisfies(e -> assertThat(((EskemaException) e).kind()).isEqualTo(EskemaException.Kind.USAGE));
    }

    @Test
    void syncFailureBeforeAsyncStepStaysSynchronous() {
        Validator v = Cached.IS_STRING.and(slowLongString());

        Result result = v.validate(42);

        assertThat(result.isValid()).isFalse();
        assertThat(result.firstExpectation().message()).isEqualTo("String");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "ab", "abc", "ABC"})
    void syncChainsGiveTheSameResultThroughEitherEntryPoint(String input) throws Exception {
        Validator v = Eskema.all(
                Cached.IS_STRING, Cached.IS_LOWER_CASE, Comparisons.length(List.of(Comparisons.isGte(3))));

        Result sync = v.validate(input);
        Result async = v.validateAsync(input).get(5, TimeUnit.SECONDS);

        assertThat(async).isEqualTo(sync);
    }

    @Test
    void asyncStepsRunInOrder() throws Exception {
        var events = new CopyOnWriteArrayList<String>();
        Validator first = Eskema.asyncValidator(value -> CompletableFuture.supplyAsync(
                () -> {
                    events.add("first");
                    return Result.valid(value);
                },
                LATER));
        Validator second = Eskema.validator(value -> {
            events.add("second");
            return Result.valid(value);
        });
        Validator third = Eskema.asyncValidator(value -> {
            events.add("third");
            return CompletableFuture.completedFuture(Result.valid(value));
        });

        Result result = Eskema.all(first, second, third).validateAsync("x").get(5, TimeUnit.SECONDS);

        assertThat(result.isValid()).isTrue();
        assertThat(events).containsExactly("first", "second", "third");
    }

    @Test
    void asyncFailureStopsConjunction() throws Exception {
        var reached = new CopyOnWriteArrayList<Object>();
        Validator tail = Eskema.validator(value -> {
            reached.add(value);
            return Result.valid(value);
        });

        Result result = Eskema.all(slowLongString(), tail).validateAsync("ab").get(5, TimeUnit.SECONDS);

        assertThat(result.firstExpectation().message()).isEqualTo("long string");
        assertThat(reached).isEmpty();
    }

    @Test
    void asyncFieldInsideMapSchemaKeepsItsPath() throws Exception {
        Map<String, Validator> schema = new LinkedHashMap<>();
        schema.put("id", Cached.IS_INT);
        schema.put("name", slowLongString());
        schema.put("tag", Cached.IS_STRING);
        Validator v = Eskema.eskema(schema);

        Result result = v.validateAsync(Map.of("id", 1, "name", "ab", "tag", 7)).get(5, TimeUnit.SECONDS);

        assertThat(result.expectations()).extracting(Expectation::description)
                .containsExactly(".name: long string", ".tag: String");
    }

    @Test
    void asyncItemsInsideListEach() throws Exception {
        Result result = Eskema.listEach(slowLongString())
                .validateAsync(List.of("abc", "x", "defg"))
                .get(5, TimeUnit.SECONDS);

        assertThat(result.expectations()).extracting(Expectation::path).containsExactly("[1]");
    }

    @Test
    void anyFallsBackAfterAsyncFailure() throws Exception {
        Validator v = Eskema.any(slowLongString(), Cached.IS_INT);

        assertThat(v.validateAsync(5).get(5, TimeUnit.SECONDS).isValid()).isTrue();
        assertThat(v.validateAsync("ab").get(5, TimeUnit.SECONDS).isValid()).isFalse();
    }

    @Test
    void notOverAsyncChild() throws Exception {
        Validator v = Eskema.not(slowLongString());

        assertThat(v.validateAsync("ab").get(5, TimeUnit.SECONDS).isValid()).isTrue();
        assertThat(v.validateAsync("abc").get(5, TimeUnit.SECONDS).isValid()).isFalse();
    }

    @Test
    void throwInsteadCompletesTheFutureExceptionally() {
        CompletableFuture<Result> future = Eskema.throwInstead(slowLongString()).validateAsync("ab");

        assertThat(future)
                .failsWithin(TIMEOUT)
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(ValidatorFailedException.class);
    }

    @Test
    void isValidAsyncReportsValidity() throws Exception {
        assertThat(slowLongString().isValidAsync("abcdef").get(5, TimeUnit.SECONDS)).isTrue();
    }
}
