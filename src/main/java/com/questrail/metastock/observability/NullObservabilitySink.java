package com.questrail.metastock.observability;

/**
 * No-op implementation of MetastockObservabilitySink.
 */
public final class NullObservabilitySink implements MetastockObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onIndexLoaded(IndexLoadedEvent event) {}

    @Override
    public void onSymbolConverted(SymbolConvertedEvent event) {}

    @Override
    public void onError(MetastockErrorEvent event) {}
}
