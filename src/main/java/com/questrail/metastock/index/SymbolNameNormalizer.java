package com.questrail.metastock.index;

import java.nio.charset.Charset;
import java.util.Objects;

/**
 * SymbolNameNormalizer
 * -----------------------------------------------------------------------------
 * Cleans fixed-width name fields read from index records.
 *
 * <p>Two steps exist:</p>
 * <ol>
 *   <li>{@link #padded(byte[], Charset)}: decode the field, cut at the first
 *       NUL and drop trailing blanks. Applied to every name field.</li>
 *   <li>{@link #normalize(String)}: symbol cleanup for the standard and
 *       extended index. A leading {@code '@'} introduces a 2-character vendor
 *       marker that is removed; everything from the first {@code '#'} on is
 *       removed. Cross-reference symbols skip this step.</li>
 * </ol>
 */
public final class SymbolNameNormalizer
{
    static final char MARKER = '@';
    static final int MARKER_LENGTH = 2;
    static final char DELIMITER = '#';

    private SymbolNameNormalizer() {}

    /**
     * Decodes a NUL- or blank-padded fixed-width field.
     */
    public static String padded(byte[] field, Charset charset)
    {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(charset, "charset");

        int end = 0;
        while (end < field.length && field[end] != 0) {
            end++;
        }
        return new String(field, 0, end, charset).stripTrailing();
    }

    /**
     * Applies the marker and delimiter rules.
     *
     * <p>A name without a delimiter is kept whole (after marker removal).</p>
     */
    public static String normalize(String raw)
    {
        Objects.requireNonNull(raw, "raw");

        String name = raw.strip();
        if (name.isEmpty()) {
            return name;
        }

        if (name.charAt(0) == MARKER) {
            name = name.length() <= MARKER_LENGTH ? "" : name.substring(MARKER_LENGTH);
        }

        final int delimiter = name.indexOf(DELIMITER);
        if (delimiter >= 0) {
            name = name.substring(0, delimiter);
        }
        return name.strip();
    }
}
