package com.questrail.metastock.index;

import static com.questrail.metastock.index.IndexLayout.ABSENT;

/**
 * The three MetaStock index variants.
 *
 * <p>All variants are read by the same {@link IndexFile} code; they differ
 * only in the {@link IndexLayout} constants below.</p>
 */
public enum IndexFormat
{
    /** {@code MASTER}: up to 255 symbols, 53-byte records. */
    STANDARD(new IndexLayout("MASTER",
            0, ABSENT, 53,
            0, 1,
            3, 4,
            36, 14, true,
            7, 16,
            33, 25, 29,
            DateEncoding.LEGACY_FLOAT,
            ".DAT")),

    /** {@code EMASTER}: companion of MASTER with longer names, 192-byte records. */
    EXTENDED(new IndexLayout("EMASTER",
            0, 2, 192,
            2, 1,
            ABSENT, 6,
            11, 14, true,
            32, 16,
            60, 64, 72,
            DateEncoding.LEGACY_FLOAT,
            ".DAT")),

    /** {@code XMASTER}: symbols numbered above 255, 150-byte records, {@code .MWD} data. */
    CROSS_REFERENCE(new IndexLayout("XMASTER",
            10, ABSENT, 150,
            65, 2,
            ABSENT, ABSENT,
            1, 14, false,
            16, 45,
            62, 108, 116,
            DateEncoding.PACKED_INTEGER,
            ".MWD"));

    private final IndexLayout layout;

    IndexFormat(IndexLayout layout) {
        this.layout = layout;
    }

    public IndexLayout layout() {
        return layout;
    }

    public String fileName() {
        return layout.fileName();
    }

    public String dataFileExtension() {
        return layout.dataFileExtension();
    }
}
