package com.questrail.metastock.error;

import java.util.Objects;

/**
 * Base type for every failure raised by the MetaStock reader.
 *
 * <p>All subtypes are unchecked. Callers that need to isolate failures (per
 * index file, per symbol) catch this type at their boundary and inspect
 * {@link #kind()}.</p>
 */
public abstract class MetastockException extends RuntimeException
{
    private final ErrorKind kind;

    protected MetastockException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    protected MetastockException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
