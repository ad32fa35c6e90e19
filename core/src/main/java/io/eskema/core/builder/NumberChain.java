package io.eskema.core.builder;

/** Steps for numeric values: any number, whole numbers ({@code integer()}, {@code toInt()}) or doubles. */
public final class NumberChain extends BaseBuilder<NumberChain>
        implements NumberSteps<NumberChain>,
                CoercionSteps<NumberChain> {

    NumberChain(ChainState chain) {
        super(chain);
    }

    @Override
    public NumberChain self() {
        return this;
    }
}
