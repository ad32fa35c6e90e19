package io.eskema.core.builder;

import io.eskema.core.predicate.Cached;
import io.eskema.core.predicate.TypeChecks;
import io.eskema.core.spi.Validator;
import java.util.function.Function;

/** Starts a chain with a type check. Each call starts a new, independent chain. */
public final class RootBuilder {

    static final RootBuilder INSTANCE = new RootBuilder();

    private RootBuilder() {}

    private static <C extends BaseBuilder<C>> C start(
            Function<ChainState, C> factory, Validator check, String message) {
        return factory.apply(new ChainState()).add(check, message);
    }

    public StringChain string() {
        return string(null);
    }

    public StringChain string(String message) {
        return start(StringChain::new, Cached.IS_STRING, message);
    }

    /** Whole numbers. */
    public NumberChain integer() {
        return integer(null);
    }

    public NumberChain integer(String message) {
        return start(NumberChain::new, Cached.IS_INT, message);
    }

    /** Floating-point numbers. */
    public NumberChain decimal() {
        return decimal(null);
    }

    public NumberChain decimal(String message) {
        return start(NumberChain::new, Cached.IS_DOUBLE, message);
    }

    public NumberChain number() {
        return number(null);
    }

    public NumberChain number(String message) {
        return start(NumberChain::new, Cached.IS_NUMBER, message);
    }

    public BoolChain bool() {
        return bool(null);
    }

    public BoolChain bool(String message) {
        return start(BoolChain::new, Cached.IS_BOOL, message);
    }

    public ListChain list() {
        return list(null);
    }

    public ListChain list(String message) {
        return start(ListChain::new, Cached.IS_LIST, message);
    }

    public MapChain map() {
        return map(null);
    }

    public MapChain map(String message) {
        return start(MapChain::new, Cached.IS_MAP, message);
    }

    public DateTimeChain dateTime() {
        return dateTime(null);
    }

    public DateTimeChain dateTime(String message) {
        return start(DateTimeChain::new, Cached.IS_DATE_TIME, message);
    }

    /** Values that are instances of {@code type}; every step is available afterwards. */
    public GenericChain type(Class<?> type) {
        return type(type, null);
    }

    public GenericChain type(Class<?> type, String message) {
        return start(GenericChain::new, TypeChecks.isType(type), message);
    }
}
