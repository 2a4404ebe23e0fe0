package com.questrail.metastock.error;

/**
 * Indicates that the directory as a whole cannot be read: a mandatory index is
 * missing or unreadable, or a symbol's declared field count contradicts the
 * default column layout it falls back to.
 */
public final class ConfigurationException extends MetastockException
{
    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, cause);
    }
}
