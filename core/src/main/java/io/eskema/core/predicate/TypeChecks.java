package io.eskema.core.predicate;

import io.eskema.core.engine.FunctionValidator;
import io.eskema.core.model.Expectation;
import io.eskema.core.model.ExpectationCodes;
import io.eskema.core.model.JsonValues;
import io.eskema.core.spi.Validator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/** Runtime type checks. A failure's message is the expected type name. */
public final class TypeChecks {

    private TypeChecks() {}

    /** The expectation every type check reports on failure. */
    public static Expectation mismatch(String expected, Object value) {
        return Expectation.of(
                expected,
                value,
                ExpectationCodes.TYPE_MISMATCH,
                Data.of("expected", expected, "found", JsonValues.typeName(value)));
    }

    /** Checks {@code type.isInstance(value)}, reporting the simple class name. */
    public static Validator isType(Class<?> type) {
        Objects.requireNonNull(type, "type must not be null");
        return check(type.getSimpleName(), type::isInstance);
    }

    static Validator check(String name, Predicate<Object> test) {
        return FunctionValidator.predicate("is" + name, test, v -> mismatch(name, v));
    }

    public static Validator isString() {
        return check("String", v -> v instanceof String);
    }

    /** Whole numbers of any integral boxed type. */
    public static Validator isInt() {
        return check("int", Numbers::isIntegral);
    }

    public static Validator isDouble() {
        return check("double", Numbers::isFloating);
    }

    public static Validator isNumber() {
        return check("number", v -> v instanceof Number);
    }

    public static Validator isBool() {
        return check("bool", v -> v instanceof Boolean);
    }

    public static Validator isList() {
        return check("List", v -> v instanceof List<?>);
    }

    public static Validator isMap() {
        return check("Map", v -> v instanceof Map<?, ?>);
    }

    public static Validator isNull() {
        return check("null", Objects::isNull);
    }

    public static Validator isDateTime() {
        return check("DateTime", DateTimes::isDateTime);
    }
}
