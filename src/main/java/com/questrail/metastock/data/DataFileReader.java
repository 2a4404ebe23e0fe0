package com.questrail.metastock.data;

import com.questrail.metastock.column.ColumnLayoutResolver;
import com.questrail.metastock.column.ColumnRegistry;
import com.questrail.metastock.column.ColumnSlot;
import com.questrail.metastock.error.StructuralFormatException;
import com.questrail.metastock.internal.io.LegacyFileReader;
import com.questrail.metastock.model.ColumnLayout;
import com.questrail.metastock.model.DecodedRecord;
import com.questrail.metastock.model.SymbolMetadata;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * DataFileReader
 * =============================================================================
 * Opens a symbol's price-history file and streams its ticks.
 *
 * <h2>File layout</h2>
 * <pre>
 *   u16  max record count
 *   u16  last used record number
 *   ...  padding, (declaredFieldCount - 1) * 4 bytes
 *   then (lastUsed - 1) records, each the concatenation of the layout's fields
 * </pre>
 *
 * <p>The header therefore occupies one record slot of a file whose fields are
 * all 4 bytes wide. The padding size comes from observed files rather than a
 * published layout.</p>
 *
 * <h2>Failure semantics</h2>
 * A missing data file, a header declaring more records than the file holds, or
 * a layout that disagrees with the symbol's field count raises
 * {@link StructuralFormatException}. Decoding errors in a value raise
 * {@code LegacyDecodeException} from the cursor. Neither is caught here; the
 * catalog isolates them per symbol.
 */
public final class DataFileReader
{
    private static final int HEADER_FIELD_WIDTH = 4;

    private final Path directory;
    private final ColumnRegistry registry;
    private final ColumnLayoutResolver resolver;

    public DataFileReader(Path directory, ColumnRegistry registry, ColumnLayoutResolver resolver)
    {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Opens the data file of {@code symbol} and positions it on the first tick.
     *
     * <p>The caller owns the returned cursor and must close it.</p>
     */
    public DecodedRecordCursor readRecords(SymbolMetadata symbol, ColumnLayout layout)
    {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(layout, "layout");

        if (symbol.declaredFieldCount() < 1) {
            throw new StructuralFormatException(String.format(
                    "Symbol %s declares %d fields", symbol.symbolCode(), symbol.declaredFieldCount()));
        }
        if (layout.size() != symbol.declaredFieldCount()) {
            throw new StructuralFormatException(String.format(
                    "Layout of %s has %d columns but the symbol declares %d fields",
                    symbol.symbolCode(), layout.size(), symbol.declaredFieldCount()));
        }

        final List<ColumnSlot> slots = registry.slotsFor(layout);
        final int recordWidth = registry.recordWidth(layout);

        final LegacyFileReader reader = LegacyFileReader.open(directory.resolve(symbol.dataFileName()));
        try {
            final int maxRecords = reader.readUnsignedShortLE();
            final int lastRecord = reader.readUnsignedShortLE();

            // TODO: check the padding size against files with TIME or extra columns once such samples are available
            reader.skip((symbol.declaredFieldCount() - 1) * HEADER_FIELD_WIDTH);

            final long ticks = Math.max(lastRecord - 1, 0);
            final long required = reader.position() + ticks * recordWidth;
            if (required > reader.size()) {
                throw new StructuralFormatException(String.format(
                        "%s declares %d records of %d bytes but holds only %d bytes",
                        reader.path(), ticks, recordWidth, reader.size()));
            }

            return new DecodedRecordCursor(symbol, reader, slots, recordWidth, maxRecords, lastRecord);
        }
        catch (RuntimeException e) {
            try {
                reader.close();
            }
            catch (RuntimeException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
    }

    /**
     * Resolves the column layout of {@code symbol} and decodes all of its ticks.
     */
    public List<DecodedRecord> readAll(SymbolMetadata symbol)
    {
        final ColumnLayout layout = resolver.resolve(symbol);
        try (DecodedRecordCursor cursor = readRecords(symbol, layout)) {
            final List<DecodedRecord> records = new ArrayList<>(cursor.tickCount());
            while (cursor.hasNext()) {
                records.add(cursor.next());
            }
            return records;
        }
    }
}
