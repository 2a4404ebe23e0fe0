package com.questrail.metastock.codec;

/**
 * LegacyFloatCodec
 * -----------------------------------------------------------------------------
 * Converts 4-byte Microsoft Binary Format (MBF) single-precision values, as
 * stored by MetaStock, into standard IEEE-754 values.
 *
 * <p>Layout of the stored bytes (file order, little-endian):</p>
 * <pre>
 *   byte 0..1 : low mantissa bytes      (identical in both formats)
 *   byte 2    : sign bit + 7 high mantissa bits
 *   byte 3    : exponent, bias 129
 * </pre>
 *
 * <p>IEEE-754 keeps the sign in the top bit and uses bias 127, so only the upper
 * 16-bit word has to be rebuilt. A zero upper word always decodes to exactly
 * {@code 0.0}, whatever the low mantissa bytes contain.</p>
 */
public final class LegacyFloatCodec
{
    /** Width of an encoded value in bytes. */
    public static final int WIDTH = 4;

    /* MBF bias (129) minus IEEE bias (127), pre-shifted into the exponent byte. */
    private static final int EXPONENT_REBIAS = 0x0200;

    private LegacyFloatCodec() {}

    /**
     * Decodes exactly four MBF bytes.
     *
     * @throws IllegalArgumentException if {@code raw} is not 4 bytes long
     */
    public static double decode(byte[] raw)
    {
        if (raw == null || raw.length != WIDTH) {
            throw new IllegalArgumentException("MBF value must be exactly 4 bytes");
        }
        return decode(raw, 0);
    }

    /**
     * Decodes four MBF bytes starting at {@code offset}.
     */
    public static double decode(byte[] raw, int offset)
    {
        if (offset < 0 || offset + WIDTH > raw.length) {
            throw new IllegalArgumentException("MBF value out of bounds at offset " + offset);
        }

        int man = (raw[offset + 2] & 0xFF) | ((raw[offset + 3] & 0xFF) << 8);
        if (man == 0) {
            return 0.0;
        }

        final int exp = (man & 0xFF00) - EXPONENT_REBIAS;
        man = (man & 0x7F) | ((man << 8) & 0x8000);
        man |= exp >> 1;

        final int bits = (raw[offset] & 0xFF)
                | ((raw[offset + 1] & 0xFF) << 8)
                | ((man & 0xFF) << 16)
                | (((man >> 8) & 0xFF) << 24);

        return Float.intBitsToFloat(bits);
    }

    /**
     * Decodes an MBF value held in a little-endian {@code int}, as returned by
     * a little-endian buffer read of the four stored bytes.
     */
    public static double decode(int littleEndianBits)
    {
        return decode(new byte[] {
                (byte) littleEndianBits,
                (byte) (littleEndianBits >>> 8),
                (byte) (littleEndianBits >>> 16),
                (byte) (littleEndianBits >>> 24)
        }, 0);
    }
}
