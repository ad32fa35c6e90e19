package io.eskema.core.predicate;

import io.eskema.core.engine.AllValidator;
import io.eskema.core.engine.FunctionValidator;
import io.eskema.core.model.Expectation;
import io.eskema.core.model.ExpectationCodes;
import io.eskema.core.model.JsonValues;
import io.eskema.core.spi.Validator;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/** String content checks. Each one fails with a type mismatch on non-strings. */
public final class StringChecks {

    private static final String FORMAT_INVALID = ExpectationCodes.VALUE_FORMAT_INVALID;
    private static final String CASE_MISMATCH = ExpectationCodes.VALUE_CASE_MISMATCH;

    static final Pattern INT = Pattern.compile("[+-]?\\d+");
    static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern LOWER = Pattern.compile("^[a-z]+$");
    private static final Pattern UPPER = Pattern.compile("^[A-Z]+$");
    private static final Pattern EMAIL = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private StringChecks() {}

    public static boolean isIntText(String s) {
        return INT.matcher(s.trim()).matches();
    }

    public static boolean isDecimalText(String s) {
        return DECIMAL.matcher(s.trim()).matches();
    }

    public static boolean isBoolText(String s) {
        String t = s.trim().toLowerCase(Locale.ROOT);
        return t.equals("true") || t.equals("false");
    }

    public static Validator stringLength(List<Validator> validators) {
        return AllValidator.conjunction(Cached.IS_STRING, Comparisons.length(validators));
    }

    public static Validator stringIsOfLength(int size) {
        return stringLength(List.of(Comparisons.isEq(size)));
    }

    public static Validator stringContains(String text) {
        return AllValidator.conjunction(
                Cached.IS_STRING,
                Comparisons.contains(text).withMessage("String to contain " + JsonValues.prettify(text)));
    }

    public static Validator stringEmpty() {
        return stringLength(List.of(Comparisons.isLte(0))).withMessage("String to be empty");
    }

    /** Passes when {@code pattern} is found anywhere in the string. */
    public static Validator matches(Pattern pattern) {
        return matches(pattern, null);
    }

    public static Validator matches(Pattern pattern, String error) {
        String message = error != null ? error : "String to match \"" + pattern.pattern() + "\"";
        return textCheck(
                "matches",
                s -> pattern.matcher(s).find(),
                message,
                ExpectationCodes.VALUE_PATTERN_MISMATCH);
    }

    public static Validator isLowerCase() {
        return textCheck("isLowerCase", s -> LOWER.matcher(s).matches(), "lowercase string", CASE_MISMATCH);
    }

    public static Validator isUpperCase() {
        return textCheck("isUpperCase", s -> UPPER.matcher(s).matches(), "uppercase string", CASE_MISMATCH);
    }

    public static Validator isEmail() {
        return textCheck("isEmail", s -> EMAIL.matcher(s).matches(), "a valid email address", FORMAT_INVALID);
    }

    public static Validator isIntString() {
        return textCheck("isIntString", StringChecks::isIntText, "a valid formatted int String", FORMAT_INVALID);
    }

    public static Validator isDoubleString() {
        return textCheck(
                "isDoubleString", StringChecks::isDecimalText, "a valid formatted double String", FORMAT_INVALID);
    }

    public static Validator isNumString() {
        return textCheck(
                "isNumString", StringChecks::isDecimalText, "a valid formatted number String", FORMAT_INVALID);
    }

    public static Validator isBoolString() {
        return textCheck("isBoolString", StringChecks::isBoolText, "a valid formatted bool String", FORMAT_INVALID);
    }

    /** ISO-8601 date or date-time text. */
    public static Validator isDate() {
        return textCheck(
                "isDate", s -> DateTimes.parse(s) != null, "a valid DateTime formatted String", FORMAT_INVALID);
    }

    private static Validator textCheck(String name, Predicate<String> test, String message, String code) {
        Validator check = FunctionValidator.predicate(
                name, v -> test.test((String) v), v -> Expectation.of(message, v, code));
        return AllValidator.conjunction(Cached.IS_STRING, check);
    }
}
