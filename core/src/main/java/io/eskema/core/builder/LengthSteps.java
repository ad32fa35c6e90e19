package io.eskema.core.builder;

import io.eskema.core.predicate.Comparisons;
import io.eskema.core.spi.Validator;
import java.util.List;

/** Constraints on the length of strings, lists and maps. */
public interface LengthSteps<B> extends ChainSteps<B> {

    default B length(List<Validator> validators) {
        return add(Comparisons.length(validators));
    }

    default B lengthMin(int min) {
        return length(List.of(Comparisons.isGte(min)));
    }

    default B lengthMax(int max) {
        return length(List.of(Comparisons.isLte(max)));
    }

    default B lengthRange(int min, int max) {
        return length(List.of(Comparisons.isInRange(min, max)));
    }

    default B empty() {
        return length(List.of(Comparisons.isLte(0)));
    }
}
