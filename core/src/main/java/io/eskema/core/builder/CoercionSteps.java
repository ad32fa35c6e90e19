package io.eskema.core.builder;

import io.eskema.core.spi.Validator;
import io.eskema.core.transform.Transformers;
import java.util.function.UnaryOperator;

/**
 * Coercions that switch the chain to another value domain.
 *
 * <p>
 * Constraints added before a coercion are dropped unless {@code preservePre} is set; the coercion's
 * own guard still rejects values it cannot convert. Repeating a coercion of the kind already active
 * keeps the constraints gathered so far, so {@code toInt().gte(5).toInt().lt(10)} checks both.
 */
public interface CoercionSteps<B> extends ChainSteps<B> {

    private ChainState coerce(CoercionKind kind, UnaryOperator<Validator> transformer, boolean preservePre) {
        ChainState chain = state();
        if (!chain.isCoerced(kind)) {
            chain.setTransform(kind, transformer, !preservePre);
        }
        return chain;
    }

    default NumberChain toInt() {
        return toInt(false);
    }

    default NumberChain toInt(boolean preservePre) {
        return new NumberChain(coerce(CoercionKind.INT, Transformers::toInt, preservePre));
    }

    default NumberChain toIntStrict() {
        return new NumberChain(coerce(CoercionKind.INT, Transformers::toIntStrict, false));
    }

    default NumberChain toIntSafe() {
        return new NumberChain(coerce(CoercionKind.INT, Transformers::toIntSafe, false));
    }

    default NumberChain toDouble() {
        return toDouble(false);
    }

    default NumberChain toDouble(boolean preservePre) {
        return new NumberChain(coerce(CoercionKind.DOUBLE, Transformers::toDouble, preservePre));
    }

    /** No-op when the chain is already coerced to an int or double. */
    default NumberChain toNum() {
        ChainState chain = state();
        if (chain.isCoerced(CoercionKind.INT) || chain.isCoerced(CoercionKind.DOUBLE)) {
            return new NumberChain(chain);
        }
        return new NumberChain(coerce(CoercionKind.DOUBLE, Transformers::toNum, false));
    }

    default NumberChain toBigInt() {
        return new NumberChain(coerce(CoercionKind.DOUBLE, Transformers::toBigInt, false));
    }

    default BoolChain toBool() {
        return toBool(false);
    }

    default BoolChain toBool(boolean preservePre) {
        return new BoolChain(coerce(CoercionKind.BOOL, Transformers::toBool, preservePre));
    }

    default BoolChain toBoolStrict() {
        return new BoolChain(coerce(CoercionKind.BOOL, Transformers::toBoolStrict, false));
    }

    default BoolChain toBoolLenient() {
        return new BoolChain(coerce(CoercionKind.BOOL, Transformers::toBoolLenient, false));
    }

    default StringChain toStringValue() {
        return toStringValue(false);
    }

    default StringChain toStringValue(boolean preservePre) {
        return new StringChain(coerce(CoercionKind.STRING, Transformers::toStringValue, preservePre));
    }

    default DateTimeChain toDateTime() {
        return toDateTime(false);
    }

    default DateTimeChain toDateTime(boolean preservePre) {
        return new DateTimeChain(coerce(CoercionKind.DATETIME, Transformers::toDateTime, preservePre));
    }

    default JsonChain toJson() {
        return toJson(false);
    }

    default JsonChain toJson(boolean preservePre) {
        return new JsonChain(coerce(CoercionKind.JSON, Transformers::toJsonDecoded, preservePre));
    }

    /** Applies a user-defined pivot. It always takes effect, composing with earlier coercions. */
    default GenericChain use(CustomPivot pivot) {
        state().setTransform(CoercionKind.CUSTOM, pivot.transformer(), pivot.dropPre());
        return new GenericChain(state());
    }
}
