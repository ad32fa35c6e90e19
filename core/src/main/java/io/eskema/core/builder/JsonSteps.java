package io.eskema.core.builder;

import io.eskema.core.predicate.JsonChecks;
import io.eskema.core.spi.Validator;
import java.util.List;

public interface JsonSteps<B> extends ChainSteps<B> {

    default B jsonContainer() {
        return add(JsonChecks.isJsonContainer());
    }

    default B jsonObject() {
        return add(JsonChecks.isJsonObject());
    }

    default B jsonArray() {
        return add(JsonChecks.isJsonArray());
    }

    default B jsonRequiresKeys(List<String> keys) {
        return add(JsonChecks.jsonHasKeys(keys));
    }

    /** {@code null} leaves that side of the range open. */
    default B jsonArrayLength(Integer min, Integer max) {
        return add(JsonChecks.jsonArrayLength(min, max));
    }

    default B jsonArrayEach(Validator element) {
        return add(JsonChecks.jsonArrayEvery(element));
    }
}
