package com.questrail.metastock.catalog;

import com.questrail.metastock.model.DecodedRecord;
import com.questrail.metastock.model.SymbolMetadata;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of decoding a selection of symbols.
 *
 * <p>A conversion never fails as a whole because of one symbol: {@code records}
 * holds the ticks of every symbol in {@code converted} (catalog order, file
 * order within a symbol), and each symbol that could not be read appears once
 * in {@code failures}.</p>
 */
public record ConversionResult(
    List<DecodedRecord> records,
    List<SymbolMetadata> converted,
    List<SymbolFailure> failures
) {
    public ConversionResult {
        records = List.copyOf(Objects.requireNonNull(records, "records"));
        converted = List.copyOf(Objects.requireNonNull(converted, "converted"));
        failures = List.copyOf(Objects.requireNonNull(failures, "failures"));
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
