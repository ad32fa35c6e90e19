package io.eskema.core.engine;

import static io.eskema.core.Eskema.all;
import static io.eskema.core.Eskema.allCollecting;
import static io.eskema.core.Eskema.any;
import static io.eskema.core.Eskema.none;
import static io.eskema.core.Eskema.not;
import static org.assertj.core.api.Assertions.assertThat;

import io.eskema.core.Eskema;
import io.eskema.core.model.Expectation;
import io.eskema.core.model.ExpectationCodes;
import io.eskema.core.model.Result;
import io.eskema.core.predicate.Cached;
import io.eskema.core.predicate.Comparisons;
import io.eskema.core.spi.Validator;
import io.eskema.core.transform.Transformers;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for the logical combinators: all, any, none, not. */
class CombinatorTest {

    /** Records the value it sees and passes or fails as configured. */
    private static Validator recording(List<Object> seen, boolean passes, String message) {
        return Eskema.validator(value -> {
            seen.add(value);
            return passes ? Result.valid(value) : Result.invalid(value, Expectation.of(message, value));
        });
    }

    @Nested
    @DisplayName("all")
    class All {

        @ParameterizedTest
        @ValueSource(strings = {"", "text"})
        void emptyConjunctionIsValid(String input) {
            assertThat(all(List.of()).validate(input).isValid()).isTrue();
            assertThat(all(List.of()).validate(null).isValid()).isTrue();
        }

        @Test
        void shortCircuitsOnFirstFailure() {
            var counter = new AtomicInteger();
            Validator second = Eskema.validator(value -> {
                counter.incrementAndGet();
                return Result.valid(value);
            });

            Result result = all(Cached.IS_INT, second).validate("x");

            assertThat(result.isValid()).isFalse();
            assertThat(result).isEqualTo(Cached.IS_INT.validate("x"));
            assertThat(counter).hasValue(0);
        }

        @Test
        void threadsTransformedValueToNextChild() {
            var seen = new ArrayList<Object>();
            Validator chain = all(
                    Transformers.transform(v -> ((String) v).length(), Eskema.valid()), recording(seen, true, "unused"));

            Result result = chain.validate("abcd");

            assertThat(seen).containsExactly(4);
            assertThat(result.value()).isEqualTo(4);
            assertThat(result.originalValue()).isEqualTo("abcd");
        }

        @Test
        void messageOverrideReplacesChildFailure() {
            Validator minLength = Comparisons.length(List.of(Comparisons.isGte(3)));

            Result result = all(List.of(Cached.IS_STRING, minLength), "too short").validate("ab");

            assertThat(result.expectations()).extracting(Expectation::message).containsExactly("too short");
        }

        @Test
        void messageOverrideDoesNotFailPassingChain() {
            assertThat(all(List.of(Cached.IS_STRING), "never shown").validate("ok").isValid())
                    .isTrue();
        }

        @Test
        void collectingModeReportsEveryFailureAgainstOriginalInput() {
            var seen = new ArrayList<Object>();
            Validator collecting = allCollecting(List.of(
                    Transformers.transform(v -> "changed", recording(seen, false, "first")),
                    recording(seen, false, "second")));

            Result result = collecting.validate("input");

            assertThat(result.expectationCount()).isGreaterThanOrEqualTo(2);
            assertThat(result.expectations()).extracting(Expectation::message).containsExactly("first", "second");
            assertThat(seen).containsExactly("changed", "input");
            assertThat(result.value()).isEqualTo("input");
        }

        @Test
        void andFlattensPlainConjunctions() {
            Validator combined = Cached.IS_STRING.and(Cached.IS_INT).and(Cached.IS_BOOL);

            assertThat(combined).isInstanceOf(AllValidator.class);
            assertThat(((AllValidator) combined).validators()).hasSize(3);
        }

        @Test
        void andKeepsCollectingConjunctionIntact() {
            Validator collecting = allCollecting(List.of(Cached.IS_STRING, Cached.IS_EMAIL));

            Validator combined = collecting.and(Cached.IS_INT);

            assertThat(((AllValidator) combined).validators()).containsExactly(collecting, Cached.IS_INT);
        }
    }

    @Nested
    @DisplayName("any")
    class Any {

        @Test
        void emptyDisjunctionFailsClosed() {
            Result result = any(List.of()).validate("x");

            assertThat(result.isValid()).isFalse();
            assertThat(result.firstExpectation().code()).isEqualTo(ExpectationCodes.LOGIC_PREDICATE_FAILED);
        }

        @Test
        void firstPassingChildWins() {
            var seen = new ArrayList<Object>();
            Result result = any(Cached.IS_INT, Cached.IS_STRING, recording(seen, true, "unused")).validate("x");

            assertThat(result.isValid()).isTrue();
            assertThat(seen).isEmpty();
        }

        @Test
        void allFailuresAreConcatenated() {
            Result result = any(Cached.IS_INT, Cached.IS_BOOL).validate("x");

            assertThat(result.expectations()).extracting(Expectation::message).containsExactly("int", "bool");
        }

        @Test
        void orFlattensPlainDisjunctions() {
            Validator combined = Cached.IS_INT.or(Cached.IS_BOOL).or(Cached.IS_NULL);

            assertThat(((AnyValidator) combined).validators()).hasSize(3);
            assertThat(combined.validate(null).isValid()).isTrue();
        }
    }

    @Nested
    @DisplayName("none")
    class None {

        @Test
        void emptyNoneIsValid() {
            assertThat(none(List.of()).validate(42).isValid()).isTrue();
        }

        @Test
        void passingChildrenBecomeNegatedExpectations() {
            Result result = none(Cached.IS_STRING, Cached.IS_INT, Cached.IS_LOWER_CASE).validate("abc");

            assertThat(result.isValid()).isFalse();
            assertThat(result.expectations())
                    .extracting(Expectation::message)
                    .containsExactly("not String", "not lowercase string");
            assertThat(result.expectations()).allSatisfy(e -> assertThat(e.value()).isEqualTo("abc"));
        }

        @Test
        void validWhenEveryChildFails() {
            assertThat(none(Cached.IS_INT, Cached.IS_BOOL).validate("abc").isValid()).isTrue();
        }
    }

    @Nested
    @DisplayName("not")
    class Not {

        @Test
        void passingChildProducesNotExpectation() {
            Result result = not(Cached.IS_STRING).validate("x");

            assertThat(result.isValid()).isFalse();
            Expectation e = result.firstExpectation();
            assertThat(e.message()).isEqualTo("not String");
            assertThat(e.code()).isEqualTo(ExpectationCodes.TYPE_MISMATCH);
        }

        @Test
        void childWithoutDescriptionFallsBackToNotPassed() {
            Result result = not(Eskema.valid()).validate(1);

            assertThat(result.firstExpectation().message()).isEqualTo("not passed");
            assertThat(result.firstExpectation().code()).isEqualTo(ExpectationCodes.LOGIC_NOT_EXPECTED);
        }

        @Test
        void conjunctionIsDescribedByItsLastCheck() {
            Result result = not(all(Cached.IS_INT, Comparisons.isLte(3))).validate(2);

            assertThat(result.expectations())
                    .extracting(Expectation::message)
                    .containsExactly("not less than or equal to 3");
        }

        @Test
        void failingChildMakesNotValidWithOriginalValue() {
            Result result = not(Cached.IS_INT).validate("x");

            assertThat(result.isValid()).isTrue();
            assertThat(result.value()).isEqualTo("x");
        }

        @Test
        void messageOverride() {
            Result result = not(Cached.IS_NULL, "is required").validate(null);

            assertThat(result.firstExpectation().message()).isEqualTo("is required");
        }

        @ParameterizedTest
        @ValueSource(ints = {-5, 0, 3, 4, 100})
        void doubleNegationAgreesWithOriginalOnValidity(int input) {
            Validator v = Comparisons.isGt(3);

            assertThat(not(not(v)).validate(input).isValid()).isEqualTo(v.validate(input).isValid());
        }
    }

    @Test
    void validityAlwaysMatchesEmptyExpectations() {
        List<Validator> validators = List.of(
                all(Cached.IS_STRING, Cached.IS_EMAIL),
                any(Cached.IS_INT, Cached.IS_STRING),
                none(Cached.IS_NULL),
                not(Cached.IS_MAP),
                allCollecting(List.of(Cached.IS_INT, Comparisons.isGt(1))));
        List<Object> inputs = new ArrayList<>(List.of("a@b.io", 7, "x", List.of(), 0.5));
        inputs.add(null);

        for (Validator v : validators) {
            for (Object input : inputs) {
                Result r = v.validate(input);
                assertThat(r.isValid()).isEqualTo(r.expectations().isEmpty());
            }
        }
    }
}
