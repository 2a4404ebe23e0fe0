package com.questrail.metastock.config;

import com.questrail.metastock.column.ColumnRegistry;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings for reading one MetaStock directory.
 *
 * @param directory      directory holding the index, definition and data files
 * @param pricePrecision decimals rendered for OPEN/HIGH/LOW/CLOSE
 * @param nameCharset    charset of display name fields; symbols are always ASCII
 */
public record MetastockReaderConfig(
    Path directory,
    int pricePrecision,
    Charset nameCharset
) {
    public static final int MAX_PRECISION = 10;

    public MetastockReaderConfig {
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(nameCharset, "nameCharset");
        if (pricePrecision < 0 || pricePrecision > MAX_PRECISION) {
            throw new IllegalArgumentException(
                    "pricePrecision must be in range 0–" + MAX_PRECISION + " (was " + pricePrecision + ")");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path directory;
        private int pricePrecision = ColumnRegistry.DEFAULT_PRECISION;
        private Charset nameCharset = StandardCharsets.US_ASCII;

        public Builder withDirectory(Path directory) {
            this.directory = directory;
            return this;
        }

        public Builder withPricePrecision(int pricePrecision) {
            this.pricePrecision = pricePrecision;
            return this;
        }

        public Builder withNameCharset(Charset nameCharset) {
            this.nameCharset = nameCharset;
            return this;
        }

        public MetastockReaderConfig build() {
            return new MetastockReaderConfig(directory, pricePrecision, nameCharset);
        }
    }
}
