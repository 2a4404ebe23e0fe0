package com.questrail.metastock.observability;

import java.time.Instant;

/**
 * Record describing one successfully decoded symbol.
 */
public record SymbolConvertedEvent(
    Instant timestamp,
    String symbolCode,
    int fileNumber,
    int recordCount
) {
}
