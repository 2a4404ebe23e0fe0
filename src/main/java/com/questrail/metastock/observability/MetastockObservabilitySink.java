package com.questrail.metastock.observability;

/**
 * Receives reader events. Implementations can provide logging, metrics, or
 * test recording.
 */
public interface MetastockObservabilitySink {
    /**
     * Called once per index variant after the catalog looked for it.
     * @param event what was found and how many symbols it contributed
     */
    void onIndexLoaded(IndexLoadedEvent event);

    /**
     * Called after a symbol's data file was decoded successfully.
     * @param event the symbol and its record count
     */
    void onSymbolConverted(SymbolConvertedEvent event);

    /**
     * Called when an index file or a symbol fails and processing continues
     * without it.
     * @param event the error event
     */
    void onError(MetastockErrorEvent event);
}
