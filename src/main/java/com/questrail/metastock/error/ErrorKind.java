package com.questrail.metastock.error;

/**
 * Classification of failures raised while reading a MetaStock directory.
 *
 * <p>The kind decides how far a failure propagates:</p>
 * <ul>
 *   <li>{@link #STRUCTURAL_FORMAT}: fatal for the affected file or symbol only</li>
 *   <li>{@link #DECODE}: aborts the current symbol's record stream</li>
 *   <li>{@link #CONFIGURATION}: fatal for the whole catalog build</li>
 * </ul>
 */
public enum ErrorKind
{
    STRUCTURAL_FORMAT,
    DECODE,
    CONFIGURATION
}
