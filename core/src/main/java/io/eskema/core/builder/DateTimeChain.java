package io.eskema.core.builder;

/** Steps for date-time values. */
public final class DateTimeChain extends BaseBuilder<DateTimeChain>
        implements DateTimeSteps<DateTimeChain>,
                CoercionSteps<DateTimeChain> {

    DateTimeChain(ChainState chain) {
        super(chain);
    }

    @Override
    public DateTimeChain self() {
        return this;
    }
}
