package com.questrail.metastock.model;

import com.questrail.metastock.index.IndexFormat;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One tradable instrument as described by a MetaStock index record.
 *
 * <h2>Identity</h2>
 * <p>{@code fileNumber} correlates the record with its data file
 * ({@code F<n>.DAT} or {@code F<n>.MWD}) and its column definition file
 * ({@code F<n>.DOP}). A file number of {@code 0} marks an unused slot; such
 * records never reach a catalog.</p>
 *
 * <h2>Mutability</h2>
 * <p>Instances are immutable. The catalog replaces an entry with
 * {@link #withDisplayName(String)} when a secondary index supplies a better
 * display name; no other field ever changes after the index reader built it.</p>
 *
 * @param fileNumber         data file number, 0 for placeholders
 * @param symbolCode         normalized ticker
 * @param displayName        long name, possibly empty
 * @param declaredFieldCount number of 4-byte fields per data file record
 * @param recordLength       record length byte (standard index only, 0 otherwise)
 * @param timeFrame          period code, e.g. {@code 'D'} for end-of-day
 * @param firstDate          first stored tick, {@code null} if not recorded
 * @param lastDate           last stored tick, {@code null} if not recorded
 * @param dataFileExtension  {@code .DAT} or {@code .MWD}
 * @param source             index variant this record was read from
 */
public record SymbolMetadata(
    int fileNumber,
    String symbolCode,
    String displayName,
    int declaredFieldCount,
    int recordLength,
    char timeFrame,
    LocalDate firstDate,
    LocalDate lastDate,
    String dataFileExtension,
    IndexFormat source
) {
    public static final String COLUMN_DEFINITION_EXTENSION = ".DOP";

    public SymbolMetadata {
        Objects.requireNonNull(symbolCode, "symbolCode");
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(dataFileExtension, "dataFileExtension");
        Objects.requireNonNull(source, "source");
        if (fileNumber < 0) {
            throw new IllegalArgumentException("fileNumber must not be negative (was " + fileNumber + ")");
        }
    }

    /**
     * Placeholder slot as found in an index ({@code fileNumber == 0}).
     */
    public static SymbolMetadata placeholder(IndexFormat source) {
        return new SymbolMetadata(0, "", "", 0, 0, ' ', null, null,
                source.dataFileExtension(), source);
    }

    public boolean isPlaceholder() {
        return fileNumber == 0;
    }

    /**
     * Returns a copy carrying {@code name} as its display name.
     */
    public SymbolMetadata withDisplayName(String name) {
        return new SymbolMetadata(fileNumber, symbolCode, name, declaredFieldCount,
                recordLength, timeFrame, firstDate, lastDate, dataFileExtension, source);
    }

    /** File name without directory, e.g. {@code F7.DAT}. */
    public String dataFileName() {
        return "F" + fileNumber + dataFileExtension;
    }

    /** Column definition file name without directory, e.g. {@code F7.DOP}. */
    public String columnDefinitionFileName() {
        return "F" + fileNumber + COLUMN_DEFINITION_EXTENSION;
    }

    @Override
    public String toString() {
        return "symbol: " + symbolCode
                + ", name: " + displayName
                + ", filename: " + dataFileName()
                + ", start: " + firstDate
                + ", end: " + lastDate
                + ", frame: " + timeFrame;
    }
}
