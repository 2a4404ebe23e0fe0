package com.questrail.metastock.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One decoded tick.
 *
 * <p>A flat, insertion-ordered mapping from output column name to formatted
 * value. The first entry is always {@value #SYMBOL_KEY}; the remaining entries
 * follow the data file's column order, recognized columns only.</p>
 */
public final class DecodedRecord
{
    public static final String SYMBOL_KEY = "Symbol";

    private final Map<String, String> values;

    private DecodedRecord(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Builder builder(String symbolCode) {
        return new Builder(symbolCode);
    }

    public String symbol() {
        return values.get(SYMBOL_KEY);
    }

    /**
     * Returns the formatted value for {@code column}, or {@code null} if the
     * record has no such column.
     */
    public String get(String column) {
        return values.get(column);
    }

    public Set<String> columns() {
        return values.keySet();
    }

    public Map<String, String> values() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DecodedRecord that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "DecodedRecord" + values;
    }

    public static final class Builder {
        private final Map<String, String> values = new LinkedHashMap<>();

        private Builder(String symbolCode) {
            values.put(SYMBOL_KEY, Objects.requireNonNull(symbolCode, "symbolCode"));
        }

        public Builder put(String column, String value) {
            values.put(Objects.requireNonNull(column, "column"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public DecodedRecord build() {
            return new DecodedRecord(new LinkedHashMap<>(values));
        }
    }
}
