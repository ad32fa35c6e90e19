package io.eskema.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.eskema.core.error.ValidatorFailedException;
import io.eskema.core.model.Expectation;
import io.eskema.core.model.ExpectationCodes;
import io.eskema.core.model.Result;
import io.eskema.core.predicate.Cached;
import io.eskema.core.predicate.Comparisons;
import io.eskema.core.spi.Validator;
import io.eskema.core.transform.Transformers;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for the static validator factory. */
class EskemaTest {

    @Nested
    @DisplayName("withExpectation")
    class WithExpectation {

        @Test
        void overrideCodeWins() {
            Validator v = Eskema.withExpectation(Cached.IS_INT, "id must be numeric", "custom.id");

            Expectation e = v.validate("x").firstExpectation();

            assertThat(e.message()).isEqualTo("id must be numeric");
            assertThat(e.code()).isEqualTo("custom.id");
            assertThat(e.value()).isEqualTo("x");
        }

        @Test
        void childCodeAndDataFillTheGaps() {
            Validator v = Eskema.withExpectation(Cached.IS_INT, Expectation.of("id must be numeric", null));

            Expectation e = v.validate("x").firstExpectation();

            assertThat(e.code()).isEqualTo(ExpectationCodes.TYPE_MISMATCH);
            assertThat(e.data()).containsEntry("expected", "int");
        }

        @Test
        void manyChildFailuresCollapseIntoOne() {
            Validator v = Eskema.withExpectation(
                    Eskema.allCollecting(List.of(Cached.IS_INT, Cached.IS_BOOL)), Expectation.of("bad", null));

            assertThat(v.validate("x").expectations()).hasSize(1);
        }

        @Test
        void validResultKeepsTransformedValue() {
            Validator v = Transformers.toInt(Cached.IS_INT).withMessage("an int");

            assertThat(v.validate("7").value()).isEqualTo(7L);
        }

        @Test
        void inheritsPresenceFlags() {
            Validator v = Cached.IS_INT.nullable().withMessage("an int");

            assertThat(v.isNullable()).isTrue();
            assertThat(v.isValid(null)).isTrue();
        }
    }

    @Nested
    @DisplayName("throwing")
    class Throwing {

        @Test
        void throwInsteadRaisesWithResult() {
            Validator v = Eskema.throwInstead(Comparisons.isGt(0));

            assertThatThrownBy(() -> v.validate(-1))
                    .isInstanceOf(ValidatorFailedException.class)
                    .satisfies(e -> assertThat(((ValidatorFailedException) e).result().firstExpectation().message())
                            .isEqualTo("greater than 0"));
            assertThat(v.isValid(1)).isTrue();
        }

        @Test
        void throwInsteadInsideMapStopsValidation() {
            var schema = new LinkedHashMap<String, Validator>();
            schema.put("id", Eskema.throwInstead(Cached.IS_INT));
            Validator v = Eskema.eskema(schema);

            assertThatThrownBy(() -> v.validate(Map.of("id", "x"))).isInstanceOf(ValidatorFailedException.class);
        }

        @Test
        void validateOrThrowReturnsValue() {
            Validator v = Transformers.toInt(Comparisons.isGt(0));

            assertThat(v.validateOrThrow("5")).isEqualTo(5L);
            assertThatThrownBy(() -> v.validateOrThrow("-5")).isInstanceOf(ValidatorFailedException.class);
        }
    }

    @Test
    void customValidatorAndPredicate() {
        Validator even = Eskema.predicate(
                v -> v instanceof Integer i && i % 2 == 0, v -> Expectation.of("an even number", v, "custom.even"));
        Validator positive = Eskema.validator(
                v -> (Integer) v > 0 ? Result.valid(v) : Result.invalid(v, Expectation.of("positive", v)));

        Validator both = even.and(positive);

        assertThat(both.isValid(4)).isTrue();
        assertThat(both.validate(3).firstExpectation().code()).isEqualTo("custom.even");
        assertThat(both.validate(-2).firstExpectation().message()).isEqualTo("positive");
    }

    @Test
    void validAcceptsEverything() {
        assertThat(Eskema.valid().isValid(null)).isTrue();
        assertThat(Eskema.valid().isValid(List.of())).isTrue();
    }

    @Test
    void requiredRejectsNullEvenWhenChildIsNullable() {
        Validator v = Eskema.required(Cached.IS_STRING.nullable());

        assertThat(v.validate(null).firstExpectation().message()).isEqualTo("is required");
        assertThat(v.isValid("x")).isTrue();
    }

    @Test
    void nullableAndOptionalHelpers() {
        assertThat(Eskema.nullable(Cached.IS_INT).isNullable()).isTrue();
        assertThat(Eskema.optional(Cached.IS_INT).isOptional()).isTrue();
        assertThat(Cached.IS_INT.isNullable()).isFalse();
    }
}
