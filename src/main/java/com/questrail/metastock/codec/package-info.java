/**
 * MetaStock numeric codecs
 * =============================================================================
 *
 * <p>This package holds the bit-level conversions every other layer builds on:</p>
 * <ul>
 *   <li>{@link com.questrail.metastock.codec.LegacyFloatCodec}: MBF to IEEE-754</li>
 *   <li>{@link com.questrail.metastock.codec.LegacyDates}: packed date and time
 *       interpretations of decoded values</li>
 * </ul>
 *
 * <p>Nothing here performs I/O or knows about file layouts. Callers hand in the
 * raw field bytes already extracted from an index or data file.</p>
 */
package com.questrail.metastock.codec;
