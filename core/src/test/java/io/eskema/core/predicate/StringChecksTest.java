package io.eskema.core.predicate;

import static org.assertj.core.api.Assertions.assertThat;

import io.eskema.core.model.Expectation;
import io.eskema.core.model.ExpectationCodes;
import io.eskema.core.spi.Validator;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class StringChecksTest {

    @ParameterizedTest
    @CsvSource({
        "'42', true",
        "'-7', true",
        "' 12 ', true",
        "'4.2', false",
        "'', false",
        "'12a', false"
    })
    void intStrings(String input, boolean expected) {
        assertThat(Cached.IS_INT_STRING.isValid(input)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"'3.14', true", "'-.5', true", "'1e3', true", "'7', true", "'abc', false", "'1.2.3', false"})
    void decimalStrings(String input, boolean expected) {
        assertThat(Cached.IS_DOUBLE_STRING.isValid(input)).isEqualTo(expected);
        assertThat(Cached.IS_NUM_STRING.isValid(input)).isEqualTo(expected);
    }

    @Test
    void boolStringsIgnoreCase() {
        assertThat(Cached.IS_BOOL_STRING.isValid("TRUE")).isTrue();
        assertThat(Cached.IS_BOOL_STRING.isValid("no")).isFalse();
    }

    @Test
    void nonStringsFailOnTypeFirst() {
        Expectation e = Cached.IS_INT_STRING.validate(42).firstExpectation();

        assertThat(e.message()).isEqualTo("String");
        assertThat(e.code()).isEqualTo(ExpectationCodes.TYPE_MISMATCH);
    }

    @Test
    void formatFailureCode() {
        Expectation e = Cached.IS_INT_STRING.validate("x").firstExpectation();

        assertThat(e.message()).isEqualTo("a valid formatted int String");
        assertThat(e.code()).isEqualTo(ExpectationCodes.VALUE_FORMAT_INVALID);
    }

    @Test
    void matchesFindsAnywhere() {
        Validator v = StringChecks.matches(Pattern.compile("\\d{3}"));

        assertThat(v.isValid("ab123cd")).isTrue();
        Expectation e = v.validate("ab12").firstExpectation();
        assertThat(e.message()).isEqualTo("String to match \"\\d{3}\"");
        assertThat(e.code()).isEqualTo(ExpectationCodes.VALUE_PATTERN_MISMATCH);
    }

    @Test
    void matchesWithCustomError() {
        Validator v = StringChecks.matches(Pattern.compile("^x"), "must start with x");

        assertThat(v.validate("y").firstExpectation().message()).isEqualTo("must start with x");
    }

    @Test
    void caseChecks() {
        assertThat(Cached.IS_LOWER_CASE.isValid("abc")).isTrue();
        assertThat(Cached.IS_LOWER_CASE.isValid("aBc")).isFalse();
        assertThat(Cached.IS_UPPER_CASE.isValid("ABC")).isTrue();
        assertThat(Cached.IS_UPPER_CASE.validate("abc").firstExpectation().code())
                .isEqualTo(ExpectationCodes.VALUE_CASE_MISMATCH);
    }

    @Test
    void email() {
        assertThat(Cached.IS_EMAIL.isValid("dev@example.org")).isTrue();
        assertThat(Cached.IS_EMAIL.isValid("dev@example")).isFalse();
        assertThat(Cached.IS_EMAIL.validate("nope").firstExpectation().message()).isEqualTo("a valid email address");
    }

    @Test
    void dateStrings() {
        assertThat(Cached.IS_DATE.isValid("2024-02-29")).isTrue();
        assertThat(Cached.IS_DATE.isValid("2024-02-29T10:15:30Z")).isTrue();
        assertThat(Cached.IS_DATE.isValid("2024-02-29 10:15:30")).isTrue();
        assertThat(Cached.IS_DATE.isValid("29/02/2024")).isFalse();
        assertThat(Cached.IS_DATE.validate("x").firstExpectation().message())
                .isEqualTo("a valid DateTime formatted String");
    }
}
