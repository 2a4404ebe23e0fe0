package com.questrail.metastock.index;

import com.questrail.metastock.error.StructuralFormatException;
import com.questrail.metastock.internal.io.LegacyFileReader;
import com.questrail.metastock.model.SymbolMetadata;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * IndexFile
 * =============================================================================
 * Random-access reader for one MetaStock index file of any {@link IndexFormat}.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   openIfPresent()  → opened: header read, {@link #recordCount()} known
 *   readRecordAt(i)  → any order, any number of times
 *   close()          → terminal; further reads raise IllegalStateException
 * </pre>
 *
 * <h2>Record decoding</h2>
 * Every field is addressed by its absolute offset taken from the variant's
 * {@link IndexLayout}. The file number is read first; a value of {@code 0}
 * marks a placeholder slot and nothing after it is read.
 *
 * <h2>Failure semantics</h2>
 * A record that extends past end-of-file raises
 * {@link StructuralFormatException}. The exception is fatal for this file only;
 * whether that aborts a catalog build is the caller's decision.
 */
public final class IndexFile implements AutoCloseable
{
    private final IndexFormat format;
    private final LegacyFileReader reader;
    private final Charset nameCharset;
    private final int recordCount;
    private final OptionalInt lastFileNumber;

    private IndexFile(IndexFormat format, LegacyFileReader reader, Charset nameCharset)
    {
        this.format = format;
        this.reader = reader;
        this.nameCharset = nameCharset;

        final IndexLayout layout = format.layout();
        reader.seek(layout.countOffset());
        this.recordCount = reader.readUnsignedShortLE();

        if (layout.lastFileNumberOffset() != IndexLayout.ABSENT) {
            reader.seek(layout.lastFileNumberOffset());
            this.lastFileNumber = OptionalInt.of(reader.readUnsignedShortLE());
        } else {
            this.lastFileNumber = OptionalInt.empty();
        }
    }

    /**
     * Opens the variant's file inside {@code directory}.
     *
     * @return the opened index, or {@link Optional#empty()} if the file does not exist
     * @throws StructuralFormatException if the file exists but its header cannot be read
     */
    public static Optional<IndexFile> openIfPresent(Path directory, IndexFormat format, Charset nameCharset)
    {
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(nameCharset, "nameCharset");

        final Path path = directory.resolve(format.fileName());
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }

        final LegacyFileReader reader = LegacyFileReader.open(path);
        try {
            return Optional.of(new IndexFile(format, reader, nameCharset));
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

    public IndexFormat format()
    {
        return format;
    }

    public Path path()
    {
        return reader.path();
    }

    /** Number of records declared by the header, placeholders included. */
    public int recordCount()
    {
        return recordCount;
    }

    /** Highest file number in use, for variants whose header stores it. */
    public OptionalInt lastFileNumber()
    {
        return lastFileNumber;
    }

    /**
     * Decodes record {@code index}.
     *
     * @return the record, possibly a placeholder ({@link SymbolMetadata#isPlaceholder()})
     * @throws IndexOutOfBoundsException if {@code index} is not below {@link #recordCount()}
     * @throws StructuralFormatException if the record extends past end-of-file
     */
    public SymbolMetadata readRecordAt(int index)
    {
        Objects.checkIndex(index, recordCount);

        final IndexLayout layout = format.layout();
        final long base = layout.recordOffset(index);

        reader.seek(base + layout.fileNumberOffset());
        final int fileNumber = layout.fileNumberWidth() == 1
                ? reader.readUnsignedByte()
                : reader.readUnsignedShortLE();
        if (fileNumber == 0) {
            return SymbolMetadata.placeholder(format);
        }

        final int recordLength = readOptionalByte(base, layout.recordLengthOffset());
        final int fieldCount = readOptionalByte(base, layout.fieldCountOffset());

        reader.seek(base + layout.symbolOffset());
        final String rawSymbol = SymbolNameNormalizer.padded(
                reader.readBytes(layout.symbolWidth()), StandardCharsets.US_ASCII);
        final String symbol = layout.normalizeSymbol()
                ? SymbolNameNormalizer.normalize(rawSymbol)
                : rawSymbol;

        reader.seek(base + layout.nameOffset());
        final String name = SymbolNameNormalizer.padded(reader.readBytes(layout.nameWidth()), nameCharset);

        reader.seek(base + layout.timeFrameOffset());
        final char timeFrame = (char) reader.readUnsignedByte();

        final LocalDate firstDate = readDate(base, layout.firstDateOffset(), layout.dateEncoding());
        final LocalDate lastDate = readDate(base, layout.lastDateOffset(), layout.dateEncoding());

        return new SymbolMetadata(fileNumber, symbol, name, fieldCount, recordLength,
                timeFrame, firstDate, lastDate, layout.dataFileExtension(), format);
    }

    /**
     * Decodes every record and returns the non-placeholder ones in file order.
     */
    public List<SymbolMetadata> readAll()
    {
        final List<SymbolMetadata> out = new ArrayList<>(recordCount);
        for (int i = 0; i < recordCount; i++) {
            final SymbolMetadata symbol = readRecordAt(i);
            if (!symbol.isPlaceholder()) {
                out.add(symbol);
            }
        }
        return out;
    }

    @Override
    public void close()
    {
        reader.close();
    }

    private int readOptionalByte(long base, int offset)
    {
        if (offset == IndexLayout.ABSENT) {
            return 0;
        }
        reader.seek(base + offset);
        return reader.readUnsignedByte();
    }

    private LocalDate readDate(long base, int offset, DateEncoding encoding)
    {
        reader.seek(base + offset);
        return encoding.decode(reader.readIntLE());
    }
}
