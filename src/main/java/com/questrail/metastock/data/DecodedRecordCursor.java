package com.questrail.metastock.data;

import com.questrail.metastock.column.ColumnSlot;
import com.questrail.metastock.internal.io.LegacyFileReader;
import com.questrail.metastock.model.DecodedRecord;
import com.questrail.metastock.model.SymbolMetadata;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Forward-only, lazy sequence of the ticks stored in one data file.
 *
 * <p>Each call to {@link #next()} reads exactly one record: {@link ColumnSlot.Known}
 * columns are decoded, {@link ColumnSlot.Unrecognized} columns are skipped, and
 * the file position always advances by {@link #recordWidth()} bytes. The cursor
 * owns the open file and must be closed; it cannot be rewound.</p>
 */
public final class DecodedRecordCursor implements Iterator<DecodedRecord>, AutoCloseable
{
    private final SymbolMetadata symbol;
    private final LegacyFileReader reader;
    private final List<ColumnSlot> slots;
    private final int recordWidth;
    private final int maxRecords;
    private final int lastRecord;
    private final int tickCount;

    private int consumed;

    DecodedRecordCursor(SymbolMetadata symbol,
                        LegacyFileReader reader,
                        List<ColumnSlot> slots,
                        int recordWidth,
                        int maxRecords,
                        int lastRecord)
    {
        this.symbol = symbol;
        this.reader = reader;
        this.slots = List.copyOf(slots);
        this.recordWidth = recordWidth;
        this.maxRecords = maxRecords;
        this.lastRecord = lastRecord;
        this.tickCount = Math.max(lastRecord - 1, 0);
    }

    public SymbolMetadata symbol()
    {
        return symbol;
    }

    /** Capacity declared by the data file header. */
    public int maxRecords()
    {
        return maxRecords;
    }

    /** Last used record number from the header; record 1 is the header itself. */
    public int lastRecord()
    {
        return lastRecord;
    }

    /** Number of ticks this cursor yields in total. */
    public int tickCount()
    {
        return tickCount;
    }

    /** Bytes per stored record under the resolved layout. */
    public int recordWidth()
    {
        return recordWidth;
    }

    /** Absolute file offset of the next unread record. */
    public long position()
    {
        return reader.position();
    }

    @Override
    public boolean hasNext()
    {
        return consumed < tickCount;
    }

    @Override
    public DecodedRecord next()
    {
        if (!hasNext()) {
            throw new NoSuchElementException("All " + tickCount + " records of " + symbol.symbolCode() + " consumed");
        }

        final DecodedRecord.Builder record = DecodedRecord.builder(symbol.symbolCode());
        for (ColumnSlot slot : slots) {
            if (slot instanceof ColumnSlot.Known known) {
                final String value = known.decoder().decode(reader.readBytes(known.width()));
                record.put(known.decoder().outputName(), value);
            } else {
                reader.skip(slot.width());
            }
        }
        consumed++;
        return record.build();
    }

    @Override
    public void close()
    {
        reader.close();
    }
}
