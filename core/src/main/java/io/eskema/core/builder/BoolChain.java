package io.eskema.core.builder;

public final class BoolChain extends BaseBuilder<BoolChain> implements BoolSteps<BoolChain>, CoercionSteps<BoolChain> {

    BoolChain(ChainState chain) {
        super(chain);
    }

    @Override
    public BoolChain self() {
        return this;
    }
}
