package io.eskema.core.transform;

import io.eskema.core.engine.AllValidator;
import io.eskema.core.engine.AnyValidator;
import io.eskema.core.engine.FunctionValidator;
import io.eskema.core.model.Expectation;
import io.eskema.core.model.ExpectationCodes;
import io.eskema.core.model.JsonValues;
import io.eskema.core.model.Result;
import io.eskema.core.predicate.Cached;
import io.eskema.core.predicate.CollectionChecks;
import io.eskema.core.predicate.Comparisons;
import io.eskema.core.predicate.DateTimes;
import io.eskema.core.predicate.Numbers;
import io.eskema.core.predicate.StringChecks;
import io.eskema.core.spi.Outcome;
import io.eskema.core.spi.Validator;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Validators that change the value before handing it to a child.
 *
 * <p>
 * Coercions first check that the input can be converted (the guard), then convert and validate the
 * converted value with the child. A passing result carries the child's value, so conversions
 * compose: {@code toInt(isGte(10))} on {@code "12"} yields {@code 12L}.
 */
public final class Transformers {

    static final long MAX_SAFE_INT = (1L << 53) - 1;
    static final long MIN_SAFE_INT = -MAX_SAFE_INT;

    private static final Set<String> LENIENT_TRUE = Set.of("true", "t", "yes", "y", "on", "1");
    private static final Set<String> LENIENT_FALSE = Set.of("false", "f", "no", "n", "off", "0");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Transformers() {}

    /** Applies {@code fn} and validates the result with {@code child}. */
    public static Validator transform(Function<Object, Object> fn, Validator child) {
        Objects.requireNonNull(fn, "fn must not be null");
        Objects.requireNonNull(child, "child must not be null");
        return new FunctionValidator("transform", value -> child.evaluate(fn.apply(value)));
    }

    /**
     * Applies {@code fn}; a {@code null} result fails with {@code errorMessage}, anything else is
     * validated by {@code child}.
     */
    public static Validator pivotValue(Function<Object, Object> fn, Validator child, String errorMessage) {
        return convert("pivotValue", fn, child, errorMessage, ExpectationCodes.TYPE_MISMATCH);
    }

    private static Validator convert(
            String name, Function<Object, Object> fn, Validator child, String errorMessage, String code) {
        Objects.requireNonNull(child, "child must not be null");
        return new FunctionValidator(name, value -> {
            Object converted = fn.apply(value);
            if (converted == null) {
                return Outcome.of(Result.invalid(value, Expectation.of(errorMessage, value, code)));
            }
            return child.evaluate(converted);
        });
    }

    private static Validator guarded(Validator guard, Validator conversion) {
        return new AllValidator(List.of(guard, conversion));
    }

    private static Validator anyOf(Validator... alternatives) {
        return new AnyValidator(List.of(alternatives));
    }

    // numbers

    /** Integers, any number (truncated) or integer text, to {@code Long} ({@code BigInteger} when wider). */
    public static Validator toInt(Validator child) {
        return guarded(
                anyOf(Cached.IS_INT, Cached.IS_NUMBER, Cached.IS_INT_STRING),
                convert("toInt", Transformers::intValue, child, "a value convertible to an int",
                        ExpectationCodes.TYPE_MISMATCH));
    }

    /** Like {@link #toInt} but rejects fractional numbers. */
    public static Validator toIntStrict(Validator child) {
        return guarded(
                anyOf(Cached.IS_INT, Cached.IS_INT_STRING),
                convert("toIntStrict", Transformers::intValue, child, "a value strictly convertible to an int",
                        ExpectationCodes.TYPE_MISMATCH));
    }

    /** Like {@link #toIntStrict}, also requiring the value to fit in 53 bits. */
    public static Validator toIntSafe(Validator child) {
        Objects.requireNonNull(child, "child must not be null");
        Validator safeRange = new FunctionValidator("safeRange", value -> {
            Number n = (Number) value;
            boolean safe = Numbers.compare(n, MIN_SAFE_INT) >= 0 && Numbers.compare(n, MAX_SAFE_INT) <= 0;
            if (!safe) {
                return Outcome.of(Result.invalid(
                        value,
                        Expectation.of(
                                "a value strictly convertible to an int within safe 53-bit range",
                                value,
                                ExpectationCodes.VALUE_RANGE_OUT_OF_BOUNDS)));
            }
            return child.evaluate(value);
        });
        return toIntStrict(safeRange);
    }

    /** Any number or decimal text to {@code Double}. */
    public static Validator toDouble(Validator child) {
        return guarded(
                anyOf(Cached.IS_DOUBLE, Cached.IS_NUMBER, Cached.IS_DOUBLE_STRING),
                convert("toDouble", Transformers::doubleValue, child, "a value convertible to a double",
                        ExpectationCodes.TYPE_MISMATCH));
    }

    /** Numbers pass through; numeric text becomes {@code Long} or {@code Double}. */
    public static Validator toNum(Validator child) {
        return guarded(
                anyOf(Cached.IS_NUMBER, Cached.IS_NUM_STRING),
                convert("toNum", Transformers::numValue, child, "a value convertible to a number",
                        ExpectationCodes.TYPE_MISMATCH));
    }

    public static Validator toBigInt(Validator child) {
        return guarded(
                anyOf(Cached.IS_INT, Cached.IS_INT_STRING),
                convert("toBigInt", Transformers::bigIntValue, child, "a value convertible to a BigInt",
                        ExpectationCodes.TYPE_MISMATCH));
    }

    // booleans

    /** Booleans, the numbers {@code 0} and {@code 1}, and {@code "true"}/{@code "false"} in any case. */
    public static Validator toBool(Validator child) {
        Validator boolText = new AllValidator(List.of(
                Cached.IS_STRING, transform(Transformers::lowerCase, Comparisons.isOneOf(List.of("true", "false")))));
        return guarded(
                anyOf(Cached.IS_BOOL, Comparisons.isOneOf(List.of(0, 1)), boolText),
                convert("toBool", Transformers::boolValue, child, "a value convertible to a bool",
                        ExpectationCodes.TYPE_MISMATCH));
    }

    /** Only booleans and the exact strings {@code "true"} and {@code "false"}. */
    public static Validator toBoolStrict(Validator child) {
        return guarded(
                anyOf(Cached.IS_BOOL, Comparisons.isOneOf(List.of("true", "false"))),
                convert("toBoolStrict", Transformers::boolValue, child, "a value strictly convertible to a bool",
                        ExpectationCodes.TYPE_MISMATCH));
    }

    /** Also accepts {@code yes/no}, {@code y/n}, {@code on/off}, {@code t/f} and {@code 1/0}, ignoring case. */
    public static Validator toBoolLenient(Validator child) {
        return convert(
                "toBoolLenient",
                Transformers::lenientBoolValue,
                child,
                "a value convertible to a bool",
                ExpectationCodes.TYPE_MISMATCH);
    }

    // text

    /** {@link String#valueOf(Object)} of the value. */
    public static Validator toStringValue(Validator child) {
        return transform(String::valueOf, child);
    }

    public static Validator trim(Validator child) {
        return onString(String::strip, child);
    }

    /** Trims and replaces every whitespace run with a single space. */
    public static Validator collapseWhitespace(Validator child) {
        return onString(s -> WHITESPACE.matcher(s.strip()).replaceAll(" "), child);
    }

    public static Validator toLowerCase(Validator child) {
        return onString(s -> s.toLowerCase(Locale.ROOT), child);
    }

    public static Validator toUpperCase(Validator child) {
        return onString(s -> s.toUpperCase(Locale.ROOT), child);
    }

    /** Splits on the literal {@code separator}, keeping empty parts. */
    public static Validator split(String separator, Validator child) {
        Pattern literal = Pattern.compile(Pattern.quote(separator));
        return onString(s -> List.of(literal.split(s, -1)), child);
    }

    private static Validator onString(Function<String, Object> fn, Validator child) {
        return new AllValidator(List.of(Cached.IS_STRING, transform(v -> fn.apply((String) v), child)));
    }

    // dates and json

    /** Date-time values and ISO-8601 text to {@code OffsetDateTime}; text without an offset is UTC. */
    public static Validator toDateTime(Validator child) {
        return convert(
                "toDateTime",
                DateTimes::coerce,
                child,
                "a value convertible to a DateTime",
                ExpectationCodes.VALUE_FORMAT_INVALID);
    }

    /** Maps and lists pass through; strings are parsed as JSON and must yield a map or list. */
    public static Validator toJsonDecoded(Validator child) {
        return convert(
                "toJsonDecoded",
                Transformers::jsonValue,
                child,
                "a JSON decodable value (Map/List)",
                ExpectationCodes.VALUE_FORMAT_INVALID);
    }

    // structure

    /** Replaces {@code null} with {@code defaultValue}. */
    public static Validator defaultTo(Object defaultValue, Validator child) {
        return transform(v -> v == null ? defaultValue : v, child);
    }

    /** Keeps only {@code keys} (those present) of a map. */
    public static Validator pickKeys(List<String> keys, Validator child) {
        List<String> picked = List.copyOf(keys);
        return pivotValue(
                v -> {
                    if (!(v instanceof Map<?, ?> map)) {
                        return null;
                    }
                    Map<String, Object> out = new LinkedHashMap<>();
                    for (String key : picked) {
                        if (map.containsKey(key)) {
                            out.put(key, map.get(key));
                        }
                    }
                    return out;
                },
                child,
                "a Map containing keys: " + JsonValues.prettify(picked));
    }

    /** Replaces a map with the value of one of its keys. */
    public static Validator pluckKey(String key, Validator child) {
        return pivotValue(
                v -> v instanceof Map<?, ?> map ? map.get(key) : null, child, "a Map containing key: " + key);
    }

    /** Flattens nested maps into one level, joining key paths with {@code delimiter}. */
    public static Validator flattenMapKeys(String delimiter, Validator child) {
        return pivotValue(
                v -> {
                    if (!(v instanceof Map<?, ?> map)) {
                        return null;
                    }
                    Map<String, Object> out = new LinkedHashMap<>();
                    flatten(null, map, delimiter, out);
                    return out;
                },
                child,
                "a Map");
    }

    /**
     * Validates the value under {@code key} of a map. The key must be present; failures are
     * prefixed with {@code .key}. A passing result carries the field's (possibly transformed)
     * value.
     */
    public static Validator getField(String key, Validator inner) {
        Objects.requireNonNull(inner, "inner must not be null");
        Validator field = new FunctionValidator("getField", value -> {
            Map<?, ?> map = (Map<?, ?>) value;
            return inner.evaluate(map.get(key))
                    .map(result -> result.isValid()
                            ? result
                            : Result.invalid(map, result.prependPath("." + key).expectations()));
        });
        return new AllValidator(List.of(CollectionChecks.containsKey(key), field));
    }

    private static void flatten(String prefix, Map<?, ?> map, String delimiter, Map<String, Object> out) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = prefix == null ? String.valueOf(entry.getKey()) : prefix + delimiter + entry.getKey();
            if (entry.getValue() instanceof Map<?, ?> nested && !nested.isEmpty()) {
                flatten(key, nested, delimiter, out);
            } else {
                out.put(key, entry.getValue());
            }
        }
    }

    // conversions

    static Object intValue(Object v) {
        if (v instanceof BigInteger bi) {
            return narrow(bi);
        }
        if (Numbers.isIntegral(v)) {
            return ((Number) v).longValue();
        }
        if (v instanceof BigDecimal bd) {
            return narrow(bd.toBigInteger());
        }
        if (v instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? narrow(BigDecimal.valueOf(d).toBigInteger()) : null;
        }
        if (v instanceof String s && StringChecks.isIntText(s)) {
            return narrow(new BigInteger(s.trim()));
        }
        return null;
    }

    private static Object narrow(BigInteger value) {
        return value.bitLength() < 64 ? (Object) value.longValue() : value;
    }

    static Object doubleValue(Object v) {
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        if (v instanceof String s && StringChecks.isDecimalText(s)) {
            return Double.parseDouble(s.trim());
        }
        return null;
    }

    static Object numValue(Object v) {
        if (v instanceof Number) {
            return v;
        }
        if (v instanceof String s) {
            return StringChecks.isIntText(s) ? intValue(s) : doubleValue(s);
        }
        return null;
    }

    static Object bigIntValue(Object v) {
        Object integral = intValue(v);
        if (integral instanceof BigInteger) {
            return integral;
        }
        return integral == null ? null : BigInteger.valueOf((Long) integral);
    }

    static Object boolValue(Object v) {
        if (v instanceof Boolean) {
            return v;
        }
        if (v instanceof Number n) {
            return Numbers.compare(n, 1) == 0;
        }
        if (v instanceof String s && StringChecks.isBoolText(s)) {
            return Boolean.parseBoolean(s.trim());
        }
        return null;
    }

    static Object lenientBoolValue(Object v) {
        if (v instanceof Boolean) {
            return v;
        }
        if (v instanceof Number n) {
            if (Numbers.compare(n, 1) == 0) {
                return true;
            }
            return Numbers.compare(n, 0) == 0 ? false : null;
        }
        if (v instanceof String s) {
            String t = s.trim().toLowerCase(Locale.ROOT);
            if (LENIENT_TRUE.contains(t)) {
                return true;
            }
            return LENIENT_FALSE.contains(t) ? false : null;
        }
        return null;
    }

    static Object jsonValue(Object v) {
        if (v instanceof Map<?, ?> || v instanceof List<?>) {
            return v;
        }
        if (v instanceof String s) {
            return JsonValues.tryParse(s)
                    .filter(decoded -> decoded instanceof Map<?, ?> || decoded instanceof List<?>)
                    .orElse(null);
        }
        return null;
    }

    private static Object lowerCase(Object v) {
        return ((String) v).toLowerCase(Locale.ROOT);
    }
}
