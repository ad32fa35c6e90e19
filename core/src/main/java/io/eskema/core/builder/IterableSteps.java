package io.eskema.core.builder;

import io.eskema.core.Eskema;
import io.eskema.core.spi.Validator;

public interface IterableSteps<B> extends ChainSteps<B> {

    /** Every element must pass {@code element}; failures carry the {@code [index]} path. */
    default B each(Validator element) {
        return add(Eskema.listEach(element));
    }
}
