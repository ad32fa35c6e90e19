package io.eskema.core.builder;

/** Steps for decoded JSON values. */
public final class JsonChain extends BaseBuilder<JsonChain>
        implements JsonSteps<JsonChain>,
                MapSteps<JsonChain>,
                IterableSteps<JsonChain>,
                CoercionSteps<JsonChain> {

    JsonChain(ChainState chain) {
        super(chain);
    }

    @Override
    public JsonChain self() {
        return this;
    }
}
