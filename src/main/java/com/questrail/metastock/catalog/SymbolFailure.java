package com.questrail.metastock.catalog;

import com.questrail.metastock.error.ErrorKind;
import com.questrail.metastock.error.MetastockException;
import com.questrail.metastock.model.SymbolMetadata;

import java.util.Objects;

/**
 * A symbol whose data file could not be decoded.
 */
public record SymbolFailure(SymbolMetadata symbol, MetastockException cause) {
    public SymbolFailure {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(cause, "cause");
    }

    public ErrorKind kind() {
        return cause.kind();
    }
}
