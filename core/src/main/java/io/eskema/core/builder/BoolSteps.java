package io.eskema.core.builder;

import io.eskema.core.predicate.Comparisons;

public interface BoolSteps<B> extends ChainSteps<B> {

    default B isTrue() {
        return add(Comparisons.isEq(true), "true");
    }

    default B isFalse() {
        return add(Comparisons.isEq(false), "false");
    }
}
