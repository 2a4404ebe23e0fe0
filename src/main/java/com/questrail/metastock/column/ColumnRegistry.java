package com.questrail.metastock.column;

import com.questrail.metastock.model.ColumnLayout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * ColumnRegistry
 * -----------------------------------------------------------------------------
 * Maps MetaStock column tokens to their decoders.
 *
 * <table>
 *   <caption>Known tokens</caption>
 *   <tr><th>token</th><th>output</th><th>value</th></tr>
 *   <tr><td>DATE</td><td>Date</td><td>{@code yyyyMMdd}</td></tr>
 *   <tr><td>TIME</td><td>Time</td><td>{@code HHmm}</td></tr>
 *   <tr><td>OPEN, HIGH, LOW, CLOSE</td><td>Open, High, Low, Close</td><td>fixed decimals</td></tr>
 *   <tr><td>VOL, OI</td><td>Volume, Oi</td><td>integer (truncated)</td></tr>
 * </table>
 *
 * <p>Any other token resolves to {@link ColumnSlot.Unrecognized} with the
 * default width, so the reader skips its bytes and stays aligned.</p>
 *
 * <p>The price precision is fixed per registry instance.</p>
 */
public final class ColumnRegistry
{
    public static final int DEFAULT_PRECISION = 2;

    private final int precision;
    private final Map<String, ColumnDecoder<?>> decoders;

    public ColumnRegistry()
    {
        this(DEFAULT_PRECISION);
    }

    public ColumnRegistry(int precision)
    {
        if (precision < 0) {
            throw new IllegalArgumentException("precision must not be negative (was " + precision + ")");
        }
        this.precision = precision;

        final Map<String, ColumnDecoder<?>> m = new LinkedHashMap<>();
        m.put("DATE", ColumnDecoders.date("Date"));
        m.put("TIME", ColumnDecoders.time("Time"));
        m.put("OPEN", ColumnDecoders.price("Open", precision));
        m.put("HIGH", ColumnDecoders.price("High", precision));
        m.put("LOW", ColumnDecoders.price("Low", precision));
        m.put("CLOSE", ColumnDecoders.price("Close", precision));
        m.put("VOL", ColumnDecoders.integer("Volume"));
        m.put("OI", ColumnDecoders.integer("Oi"));
        this.decoders = Collections.unmodifiableMap(m);
    }

    public int precision()
    {
        return precision;
    }

    public Set<String> knownTokens()
    {
        return decoders.keySet();
    }

    public boolean isKnown(String token)
    {
        return decoders.containsKey(token);
    }

    public ColumnSlot slotFor(String token)
    {
        final ColumnDecoder<?> decoder = decoders.get(token);
        if (decoder == null) {
            return new ColumnSlot.Unrecognized(token, ColumnDecoder.DEFAULT_WIDTH);
        }
        return new ColumnSlot.Known(token, decoder);
    }

    /** Resolves every token of {@code layout}, unrecognized ones included. */
    public List<ColumnSlot> slotsFor(ColumnLayout layout)
    {
        final List<ColumnSlot> slots = new ArrayList<>(layout.size());
        for (String token : layout.tokens()) {
            slots.add(slotFor(token));
        }
        return slots;
    }

    /** Bytes one data file record occupies under {@code layout}. */
    public int recordWidth(ColumnLayout layout)
    {
        int width = 0;
        for (ColumnSlot slot : slotsFor(layout)) {
            width += slot.width();
        }
        return width;
    }
}
