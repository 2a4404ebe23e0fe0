package com.questrail.metastock.observability;

import com.questrail.metastock.error.ErrorKind;

import java.time.Instant;

/**
 * Record representing a failure that was isolated at a file or symbol boundary.
 *
 * @param subject symbol code or file name the failure belongs to
 */
public record MetastockErrorEvent(
    Instant timestamp,
    String subject,
    ErrorKind kind,
    String message,
    Throwable cause
) {
}
