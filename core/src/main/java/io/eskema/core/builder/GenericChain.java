package io.eskema.core.builder;

/**
 * Steps for values of a type known only at run time, such as a plucked field or the output of a
 * custom pivot. Every step is available; each one checks the value's type itself.
 */
public final class GenericChain extends BaseBuilder<GenericChain>
        implements NumberSteps<GenericChain>,
                LengthSteps<GenericChain>,
                ContainsSteps<GenericChain>,
                StringSteps<GenericChain>,
                MapSteps<GenericChain>,
                IterableSteps<GenericChain>,
                DateTimeSteps<GenericChain>,
                JsonSteps<GenericChain>,
                CoercionSteps<GenericChain> {

    GenericChain(ChainState chain) {
        super(chain);
    }

    @Override
    public GenericChain self() {
        return this;
    }
}
