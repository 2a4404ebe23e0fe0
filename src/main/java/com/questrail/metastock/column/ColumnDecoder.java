package com.questrail.metastock.column;

/**
 * Reads one fixed-width data file field and renders it for output.
 *
 * @param <T> decoded value type
 */
public interface ColumnDecoder<T>
{
    /** Default field width; every known MetaStock column uses it. */
    int DEFAULT_WIDTH = 4;

    /** Name of the output column, e.g. {@code "Close"}. */
    String outputName();

    default int width() {
        return DEFAULT_WIDTH;
    }

    T read(byte[] raw);

    String format(T value);

    default String decode(byte[] raw) {
        return format(read(raw));
    }
}
