package com.questrail.metastock.codec;

import com.questrail.metastock.error.LegacyDecodeException;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Date and time interpretations of MetaStock numeric fields.
 *
 * <p>Two encodings exist and must never be mixed:</p>
 * <ul>
 *   <li><b>MBF dates</b> (standard and extended index, data files): the float
 *       value truncated to an integer {@code YYYMMDD}, where {@code YYY} is
 *       years since 1900 (so 2024-01-31 is stored as {@code 1240131}).</li>
 *   <li><b>Packed integer dates</b> (cross-reference index): a plain 32-bit
 *       {@code YYYYMMDD} with the full year.</li>
 * </ul>
 */
public final class LegacyDates
{
    private static final int BASE_YEAR = 1900;

    private LegacyDates() {}

    /**
     * Decodes an MBF-encoded {@code YYYMMDD} date.
     *
     * @throws LegacyDecodeException if the value is not a calendar date
     */
    public static LocalDate decodeDate(byte[] raw)
    {
        return fromYearsSince1900(truncate(LegacyFloatCodec.decode(raw)));
    }

    /**
     * Decodes an MBF-encoded {@code HHMMSS} time of day. Seconds are dropped.
     *
     * @throws LegacyDecodeException if the value is not a time of day
     */
    public static LocalTime decodeTime(byte[] raw)
    {
        final int value = truncate(LegacyFloatCodec.decode(raw));
        final int hour = value / 10000;
        final int minute = (value % 10000) / 100;
        try {
            return LocalTime.of(hour, minute);
        } catch (DateTimeException e) {
            throw new LegacyDecodeException("Invalid packed time " + value, e);
        }
    }

    /**
     * Interprets an already-decoded float as {@code YYYMMDD}.
     */
    public static LocalDate fromYearsSince1900(int value)
    {
        return toDate(BASE_YEAR + value / 10000, (value % 10000) / 100, value % 100, value);
    }

    /**
     * Decodes a cross-reference index date stored as a plain {@code YYYYMMDD}
     * integer.
     *
     * @throws LegacyDecodeException if the value is not a calendar date
     */
    public static LocalDate decodePackedDate(int value)
    {
        return toDate(value / 10000, (value % 10000) / 100, value % 100, value);
    }

    private static LocalDate toDate(int year, int month, int day, int raw)
    {
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            throw new LegacyDecodeException("Invalid packed date " + raw, e);
        }
    }

    private static int truncate(double value)
    {
        return (int) value;
    }
}
