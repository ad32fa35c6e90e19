package io.eskema.core.builder;

/** Steps for string values. */
public final class StringChain extends BaseBuilder<StringChain>
        implements LengthSteps<StringChain>,
                ContainsSteps<StringChain>,
                StringSteps<StringChain>,
                CoercionSteps<StringChain> {

    StringChain(ChainState chain) {
        super(chain);
    }

    @Override
    public StringChain self() {
        return this;
    }
}
