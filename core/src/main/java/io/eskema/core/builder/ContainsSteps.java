package io.eskema.core.builder;

import io.eskema.core.predicate.Comparisons;

public interface ContainsSteps<B> extends ChainSteps<B> {

    /** Substring for strings, element membership for lists. */
    default B contains(Object item) {
        return add(Comparisons.contains(item));
    }
}
