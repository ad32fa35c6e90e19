package io.eskema.core.builder;

/** Steps for maps. */
public final class MapChain extends BaseBuilder<MapChain>
        implements LengthSteps<MapChain>,
                MapSteps<MapChain>,
                CoercionSteps<MapChain> {

    MapChain(ChainState chain) {
        super(chain);
    }

    @Override
    public MapChain self() {
        return this;
    }
}
