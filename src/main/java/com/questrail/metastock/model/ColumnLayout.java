package com.questrail.metastock.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered column tokens of one data file, in on-disk order.
 *
 * <p>Tokens the reader does not understand stay in the list. Their position
 * still accounts for a field on disk, so dropping them would shift every
 * later column.</p>
 */
public final class ColumnLayout
{
    /** Layout assumed when a symbol has no column definition file. */
    public static final ColumnLayout DEFAULT =
            new ColumnLayout(List.of("DATE", "OPEN", "HIGH", "LOW", "CLOSE", "VOL", "OI"));

    private final List<String> tokens;

    private ColumnLayout(List<String> tokens) {
        this.tokens = tokens;
    }

    public static ColumnLayout of(List<String> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("Column layout must contain at least one column");
        }
        return new ColumnLayout(List.copyOf(tokens));
    }

    public static ColumnLayout of(String... tokens) {
        return of(List.of(tokens));
    }

    public List<String> tokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnLayout that)) return false;
        return tokens.equals(that.tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return "ColumnLayout" + tokens;
    }
}
