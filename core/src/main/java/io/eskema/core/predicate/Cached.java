package io.eskema.core.predicate;

import io.eskema.core.spi.Validator;

/** Shared instances of the parameterless checks. Validators are immutable, so sharing is safe. */
public final class Cached {

    public static final Validator IS_STRING = TypeChecks.isString();
    public static final Validator IS_INT = TypeChecks.isInt();
    public static final Validator IS_DOUBLE = TypeChecks.isDouble();
    public static final Validator IS_NUMBER = TypeChecks.isNumber();
    public static final Validator IS_BOOL = TypeChecks.isBool();
    public static final Validator IS_LIST = TypeChecks.isList();
    public static final Validator IS_MAP = TypeChecks.isMap();
    public static final Validator IS_NULL = TypeChecks.isNull();
    public static final Validator IS_DATE_TIME = TypeChecks.isDateTime();

    public static final Validator IS_INT_STRING = StringChecks.isIntString();
    public static final Validator IS_DOUBLE_STRING = StringChecks.isDoubleString();
    public static final Validator IS_NUM_STRING = StringChecks.isNumString();
    public static final Validator IS_BOOL_STRING = StringChecks.isBoolString();
    public static final Validator IS_DATE = StringChecks.isDate();
    public static final Validator IS_EMAIL = StringChecks.isEmail();
    public static final Validator IS_LOWER_CASE = StringChecks.isLowerCase();
    public static final Validator IS_UPPER_CASE = StringChecks.isUpperCase();
    public static final Validator STRING_EMPTY = StringChecks.stringEmpty();
    public static final Validator LIST_EMPTY = CollectionChecks.listEmpty();

    private Cached() {}
}
