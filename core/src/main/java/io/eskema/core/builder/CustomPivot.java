package io.eskema.core.builder;

import io.eskema.core.spi.Validator;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A user-defined coercion for {@code use(...)}.
 *
 * <p>
 * {@code transformer} receives the validator built from the constraints added after the pivot and
 * returns the validator that converts the value and applies them. Custom pivots compose with any
 * earlier coercion instead of replacing it.
 *
 * @param transformer wraps the post-pivot constraints
 * @param dropPre     whether constraints added before the pivot are discarded
 * @param name        descriptive label, may be {@code null}
 */
public record CustomPivot(UnaryOperator<Validator> transformer, boolean dropPre, String name) {

    public CustomPivot {
        Objects.requireNonNull(transformer, "transformer must not be null");
    }

    /** A pivot that drops earlier constraints. */
    public static CustomPivot of(UnaryOperator<Validator> transformer) {
        return new CustomPivot(transformer, true, null);
    }
}
