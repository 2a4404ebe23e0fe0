package com.questrail.metastock.index;

import java.util.Objects;

/**
 * Byte layout of one index file variant.
 *
 * <p>All field offsets are relative to the start of a record. Record {@code i}
 * (zero-based) starts at {@code (i + 1) * stride}: the first stride-sized block
 * holds the file header. An offset of {@link #ABSENT} marks a field the variant
 * does not store.</p>
 *
 * @param fileName             file name inside a MetaStock directory
 * @param countOffset          absolute offset of the u16 record count
 * @param lastFileNumberOffset absolute offset of the u16 last file number, or {@link #ABSENT}
 * @param stride               bytes per record
 * @param fileNumberOffset     file number field
 * @param fileNumberWidth      1 (u8) or 2 (u16)
 * @param recordLengthOffset   u8 record length, or {@link #ABSENT}
 * @param fieldCountOffset     u8 declared field count, or {@link #ABSENT}
 * @param symbolOffset         symbol field
 * @param symbolWidth          symbol field width
 * @param normalizeSymbol      whether {@link SymbolNameNormalizer#normalize(String)} applies
 * @param nameOffset           display name field
 * @param nameWidth            display name field width
 * @param timeFrameOffset      1-byte period code
 * @param firstDateOffset      4-byte first date
 * @param lastDateOffset       4-byte last date
 * @param dateEncoding         encoding of both date fields
 * @param dataFileExtension    extension of the data files this index describes
 */
public record IndexLayout(
    String fileName,
    int countOffset,
    int lastFileNumberOffset,
    int stride,
    int fileNumberOffset,
    int fileNumberWidth,
    int recordLengthOffset,
    int fieldCountOffset,
    int symbolOffset,
    int symbolWidth,
    boolean normalizeSymbol,
    int nameOffset,
    int nameWidth,
    int timeFrameOffset,
    int firstDateOffset,
    int lastDateOffset,
    DateEncoding dateEncoding,
    String dataFileExtension
) {
    public static final int ABSENT = -1;

    public IndexLayout {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(dateEncoding, "dateEncoding");
        Objects.requireNonNull(dataFileExtension, "dataFileExtension");
        if (fileNumberWidth != 1 && fileNumberWidth != 2) {
            throw new IllegalArgumentException("fileNumberWidth must be 1 or 2 (was " + fileNumberWidth + ")");
        }
        if (stride <= 0) {
            throw new IllegalArgumentException("stride must be positive (was " + stride + ")");
        }
    }

    /** Absolute offset of record {@code index}. */
    public long recordOffset(int index) {
        return (long) (index + 1) * stride;
    }
}
