package io.eskema.core.builder;

/** Steps for lists. */
public final class ListChain extends BaseBuilder<ListChain>
        implements LengthSteps<ListChain>,
                ContainsSteps<ListChain>,
                IterableSteps<ListChain> {

    ListChain(ChainState chain) {
        super(chain);
    }

    @Override
    public ListChain self() {
        return this;
    }
}
