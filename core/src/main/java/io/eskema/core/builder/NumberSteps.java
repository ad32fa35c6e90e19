package io.eskema.core.builder;

import io.eskema.core.predicate.Comparisons;

public interface NumberSteps<B> extends ChainSteps<B> {

    default B lt(Number max) {
        return add(Comparisons.isLt(max));
    }

    default B lte(Number max) {
        return add(Comparisons.isLte(max));
    }

    default B gt(Number min) {
        return add(Comparisons.isGt(min));
    }

    default B gte(Number min) {
        return add(Comparisons.isGte(min));
    }

    /** Inclusive on both ends. */
    default B between(Number min, Number max) {
        return add(Comparisons.isInRange(min, max));
    }
}
