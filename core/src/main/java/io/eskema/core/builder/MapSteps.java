package io.eskema.core.builder;

import io.eskema.core.Eskema;
import io.eskema.core.predicate.CollectionChecks;
import io.eskema.core.spi.Validator;
import io.eskema.core.transform.Transformers;
import java.util.List;
import java.util.Map;

public interface MapSteps<B> extends ChainSteps<B> {

    default B schema(Map<String, Validator> schema) {
        return add(Eskema.eskema(schema));
    }

    /** Schema that also rejects keys it does not declare. */
    default B strict(Map<String, Validator> schema) {
        return add(Eskema.eskemaStrict(schema));
    }

    default B containsKey(String key) {
        return add(CollectionChecks.containsKey(key));
    }

    /** Narrows the map to {@code keys} for the constraints added so far. */
    default B pick(List<String> keys) {
        return wrap(current -> Transformers.pickKeys(keys, current));
    }

    /** Validates the constraints added so far against the value of {@code key}. */
    default B pluck(String key) {
        return wrap(current -> Transformers.pluckKey(key, current));
    }

    /**
     * Switches the whole chain to the value of {@code key}: every later step, coercions included,
     * sees that value. The key must be present.
     */
    default GenericChain pluckValue(String key) {
        add(CollectionChecks.containsKey(key));
        state().pivot(child -> Transformers.pluckKey(key, child));
        return new GenericChain(state());
    }

    default B flattenKeys() {
        return flattenKeys(".");
    }

    default B flattenKeys(String delimiter) {
        return wrap(current -> Transformers.flattenMapKeys(delimiter, current));
    }
}
