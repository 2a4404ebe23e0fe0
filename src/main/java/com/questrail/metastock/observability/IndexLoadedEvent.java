package com.questrail.metastock.observability;

import com.questrail.metastock.index.IndexFormat;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Record describing the outcome of reading one index file.
 *
 * @param present       whether the file exists
 * @param recordCount   records declared by its header, placeholders included
 * @param contributed   symbols added to or updated in the catalog
 */
public record IndexLoadedEvent(
    Instant timestamp,
    IndexFormat format,
    Path path,
    boolean present,
    int recordCount,
    int contributed
) {
}
