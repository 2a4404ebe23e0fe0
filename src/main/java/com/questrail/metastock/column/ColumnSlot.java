package com.questrail.metastock.column;

import java.util.Objects;

/**
 * What the data file reader does with one column of a layout.
 *
 * <ul>
 *   <li>{@link Known}: read {@link #width()} bytes and decode them</li>
 *   <li>{@link Unrecognized}: skip {@link #width()} bytes, emit nothing</li>
 * </ul>
 */
public sealed interface ColumnSlot permits ColumnSlot.Known, ColumnSlot.Unrecognized
{
    String token();

    int width();

    record Known(String token, ColumnDecoder<?> decoder) implements ColumnSlot {
        public Known {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(decoder, "decoder");
        }

        @Override
        public int width() {
            return decoder.width();
        }
    }

    record Unrecognized(String token, int width) implements ColumnSlot {
        public Unrecognized {
            Objects.requireNonNull(token, "token");
            if (width <= 0) {
                throw new IllegalArgumentException("width must be positive (was " + width + ")");
            }
        }
    }
}
