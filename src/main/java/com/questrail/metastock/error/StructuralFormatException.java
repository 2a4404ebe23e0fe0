package com.questrail.metastock.error;

/**
 * Indicates that a file does not have the shape its format requires.
 *
 * This typically reflects:
 * <ul>
 *   <li>A mandatory file that does not exist</li>
 *   <li>A read past end-of-file (declared counts larger than the file)</li>
 *   <li>A column definition file that disagrees with the declared field count</li>
 * </ul>
 */
public final class StructuralFormatException extends MetastockException
{
    public StructuralFormatException(String message) {
        super(ErrorKind.STRUCTURAL_FORMAT, message);
    }

    public StructuralFormatException(String message, Throwable cause) {
        super(ErrorKind.STRUCTURAL_FORMAT, message, cause);
    }
}
