package com.questrail.metastock.column;

import com.questrail.metastock.codec.LegacyDates;
import com.questrail.metastock.codec.LegacyFloatCodec;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * The decoders behind the known column tokens.
 */
public final class ColumnDecoders
{
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd", Locale.ROOT);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HHmm", Locale.ROOT);

    private ColumnDecoders() {}

    public static ColumnDecoder<LocalDate> date(String outputName) {
        return new DateColumn(outputName);
    }

    public static ColumnDecoder<LocalTime> time(String outputName) {
        return new TimeColumn(outputName);
    }

    public static ColumnDecoder<Double> price(String outputName, int precision) {
        return new PriceColumn(outputName, precision);
    }

    public static ColumnDecoder<Long> integer(String outputName) {
        return new IntegerColumn(outputName);
    }

    private abstract static class NamedColumn<T> implements ColumnDecoder<T> {
        private final String outputName;

        NamedColumn(String outputName) {
            this.outputName = Objects.requireNonNull(outputName, "outputName");
        }

        @Override
        public String outputName() {
            return outputName;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "[" + outputName + "]";
        }
    }

    static final class DateColumn extends NamedColumn<LocalDate> {
        DateColumn(String outputName) {
            super(outputName);
        }

        @Override
        public LocalDate read(byte[] raw) {
            return LegacyDates.decodeDate(raw);
        }

        @Override
        public String format(LocalDate value) {
            return value.format(DATE_FORMAT);
        }
    }

    static final class TimeColumn extends NamedColumn<LocalTime> {
        TimeColumn(String outputName) {
            super(outputName);
        }

        @Override
        public LocalTime read(byte[] raw) {
            return LegacyDates.decodeTime(raw);
        }

        @Override
        public String format(LocalTime value) {
            return value.format(TIME_FORMAT);
        }
    }

    static final class PriceColumn extends NamedColumn<Double> {
        private final String pattern;

        PriceColumn(String outputName, int precision) {
            super(outputName);
            if (precision < 0) {
                throw new IllegalArgumentException("precision must not be negative (was " + precision + ")");
            }
            this.pattern = "%." + precision + "f";
        }

        @Override
        public Double read(byte[] raw) {
            return LegacyFloatCodec.decode(raw);
        }

        @Override
        public String format(Double value) {
            return String.format(Locale.ROOT, pattern, value);
        }
    }

    static final class IntegerColumn extends NamedColumn<Long> {
        IntegerColumn(String outputName) {
            super(outputName);
        }

        @Override
        public Long read(byte[] raw) {
            return (long) LegacyFloatCodec.decode(raw);
        }

        @Override
        public String format(Long value) {
            return Long.toString(value);
        }
    }
}
