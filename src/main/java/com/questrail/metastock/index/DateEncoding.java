package com.questrail.metastock.index;

import com.questrail.metastock.codec.LegacyDates;
import com.questrail.metastock.codec.LegacyFloatCodec;

import java.time.LocalDate;

/**
 * How an index variant stores its first/last date fields.
 *
 * <p>Both encodings occupy 4 bytes. A stored value of zero means "no date" and
 * decodes to {@code null}.</p>
 */
public enum DateEncoding
{
    /** MBF float holding {@code YYYMMDD} (years since 1900). */
    LEGACY_FLOAT {
        @Override
        LocalDate decode(int littleEndianBits) {
            final int value = (int) LegacyFloatCodec.decode(littleEndianBits);
            return value == 0 ? null : LegacyDates.fromYearsSince1900(value);
        }
    },

    /** Plain little-endian integer holding {@code YYYYMMDD}. */
    PACKED_INTEGER {
        @Override
        LocalDate decode(int littleEndianBits) {
            return littleEndianBits == 0 ? null : LegacyDates.decodePackedDate(littleEndianBits);
        }
    };

    abstract LocalDate decode(int littleEndianBits);
}
