package com.questrail.metastock.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of MetastockObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jMetastockObservabilitySink implements MetastockObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jMetastockObservabilitySink.class);

    @Override
    public void onIndexLoaded(IndexLoadedEvent event) {
        if (!event.present()) {
            log.info("No {} file in {}", event.format().fileName(), event.path().getParent());
            return;
        }
        log.info("{}: {} records, {} symbols contributed",
            event.path().getFileName(),
            event.recordCount(),
            event.contributed());
    }

    @Override
    public void onSymbolConverted(SymbolConvertedEvent event) {
        log.debug("Processed {} (fileNo {}): {} records",
            event.symbolCode(),
            event.fileNumber(),
            event.recordCount());
    }

    @Override
    public void onError(MetastockErrorEvent event) {
        log.error("Error while converting {} [{}]: {}", event.subject(), event.kind(), event.message(), event.cause());
    }
}
