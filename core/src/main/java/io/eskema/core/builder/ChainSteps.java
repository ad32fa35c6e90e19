package io.eskema.core.builder;

import io.eskema.core.spi.Validator;
import java.util.function.UnaryOperator;

/**
 * Operations every builder step interface is written against.
 *
 * @param <B> the concrete builder type returned for chaining
 */
public interface ChainSteps<B> {

    /** Shared chain state; its operations are internal to this package. */
    ChainState state();

    B self();

    B add(Validator validator);

    /** Adds {@code validator}, replacing its failure message with {@code message} when non-null. */
    B add(Validator validator, String message);

    /** Replaces the constraints added so far with {@code fn} applied to their conjunction. */
    B wrap(UnaryOperator<Validator> fn);
}
