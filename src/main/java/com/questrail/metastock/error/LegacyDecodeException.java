package com.questrail.metastock.error;

/**
 * Indicates that a fixed-width field was read but its value cannot be
 * interpreted (for example a packed date whose month is 13).
 */
public final class LegacyDecodeException extends MetastockException
{
    public LegacyDecodeException(String message) {
        super(ErrorKind.DECODE, message);
    }

    public LegacyDecodeException(String message, Throwable cause) {
        super(ErrorKind.DECODE, message, cause);
    }
}
