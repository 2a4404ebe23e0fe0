package com.questrail.metastock.catalog;

import com.questrail.metastock.column.ColumnLayoutResolver;
import com.questrail.metastock.column.ColumnRegistry;
import com.questrail.metastock.config.MetastockReaderConfig;
import com.questrail.metastock.data.DataFileReader;
import com.questrail.metastock.error.ConfigurationException;
import com.questrail.metastock.error.MetastockException;
import com.questrail.metastock.index.IndexFile;
import com.questrail.metastock.index.IndexFormat;
import com.questrail.metastock.model.DecodedRecord;
import com.questrail.metastock.model.SymbolMetadata;
import com.questrail.metastock.observability.IndexLoadedEvent;
import com.questrail.metastock.observability.MetastockErrorEvent;
import com.questrail.metastock.observability.MetastockObservabilitySink;
import com.questrail.metastock.observability.NullObservabilitySink;
import com.questrail.metastock.observability.SymbolConvertedEvent;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Catalog
 * =============================================================================
 * The symbol table of one MetaStock directory, and the entry point for
 * decoding its data files.
 *
 * <h2>Building the table</h2>
 * <ol>
 *   <li><b>MASTER</b> decides which file numbers exist. Placeholder slots
 *       (file number 0) are dropped.</li>
 *   <li><b>EMASTER</b> must exist. A non-empty name replaces the display name of
 *       an entry MASTER already listed. If the directory has no readable
 *       MASTER, EMASTER supplies the entries itself.</li>
 *   <li><b>XMASTER</b> is optional and kept in its own table
 *       ({@link #crossReference()}); it is never merged into {@link #symbols()}.</li>
 * </ol>
 *
 * <h2>Failure isolation</h2>
 * <ul>
 *   <li>An unreadable MASTER or XMASTER is reported to the sink and contributes nothing.</li>
 *   <li>A missing or unreadable EMASTER aborts the build with {@link ConfigurationException}.</li>
 *   <li>During {@link #convert(Collection)} each symbol is isolated: its failure is
 *       reported and recorded in the {@link ConversionResult}, the others still run.</li>
 * </ul>
 *
 * <p>The table is read-only once {@link #load} returns.</p>
 */
public final class Catalog
{
    private final MetastockReaderConfig config;
    private final Map<Integer, SymbolMetadata> symbols;
    private final Map<Integer, SymbolMetadata> crossReference;
    private final DataFileReader dataFileReader;
    private final MetastockObservabilitySink sink;

    private Catalog(MetastockReaderConfig config,
                    Map<Integer, SymbolMetadata> symbols,
                    Map<Integer, SymbolMetadata> crossReference,
                    MetastockObservabilitySink sink)
    {
        this.config = config;
        this.symbols = Collections.unmodifiableMap(symbols);
        this.crossReference = Collections.unmodifiableMap(crossReference);
        this.sink = sink;

        final Path directory = config.directory();
        this.dataFileReader = new DataFileReader(directory,
                new ColumnRegistry(config.pricePrecision()),
                new ColumnLayoutResolver(directory));
    }

    public static Catalog load(MetastockReaderConfig config)
    {
        return load(config, NullObservabilitySink.INSTANCE);
    }

    /**
     * Reads the index files of {@code config.directory()}.
     *
     * @throws ConfigurationException if EMASTER is missing or unreadable
     */
    public static Catalog load(MetastockReaderConfig config, MetastockObservabilitySink sink)
    {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(sink, "sink");

        final Map<Integer, SymbolMetadata> table = new LinkedHashMap<>();

        // 1) MASTER: authoritative for presence
        final Optional<List<SymbolMetadata>> master = readOptional(config, IndexFormat.STANDARD, sink);
        master.ifPresent(entries -> {
            for (SymbolMetadata s : entries) {
                table.put(s.fileNumber(), s);
            }
        });

        // 2) EMASTER: mandatory, names only unless MASTER is unavailable
        final IndexContents extended = readMandatory(config, IndexFormat.EXTENDED);
        int contributed = 0;
        for (SymbolMetadata s : extended.symbols()) {
            if (master.isEmpty()) {
                table.put(s.fileNumber(), s);
                contributed++;
            }
            else if (!s.displayName().isEmpty() && table.containsKey(s.fileNumber())) {
                table.put(s.fileNumber(), table.get(s.fileNumber()).withDisplayName(s.displayName()));
                contributed++;
            }
        }
        sink.onIndexLoaded(new IndexLoadedEvent(Instant.now(), IndexFormat.EXTENDED,
                extended.path(), true, extended.recordCount(), contributed));

        // 3) XMASTER: separate table
        final Map<Integer, SymbolMetadata> xref = new LinkedHashMap<>();
        readOptional(config, IndexFormat.CROSS_REFERENCE, sink).ifPresent(entries -> {
            for (SymbolMetadata s : entries) {
                xref.put(s.fileNumber(), s);
            }
        });

        return new Catalog(config, table, xref, sink);
    }

    public MetastockReaderConfig config()
    {
        return config;
    }

    /** Catalog entries keyed by file number, in index order. */
    public Map<Integer, SymbolMetadata> symbols()
    {
        return symbols;
    }

    /** Entries of XMASTER keyed by file number; empty if the directory has none. */
    public Map<Integer, SymbolMetadata> crossReference()
    {
        return crossReference;
    }

    public Optional<SymbolMetadata> find(int fileNumber)
    {
        return Optional.ofNullable(symbols.get(fileNumber));
    }

    public Optional<SymbolMetadata> findBySymbol(String symbolCode)
    {
        return symbols.values().stream()
                .filter(s -> s.symbolCode().equals(symbolCode))
                .findFirst();
    }

    /**
     * Returns every entry when {@code all} is set, otherwise the entries whose
     * symbol code is in {@code codes} (exact match), in catalog order.
     */
    public List<SymbolMetadata> selectSymbols(boolean all, Collection<String> codes)
    {
        if (all) {
            return List.copyOf(symbols.values());
        }
        final Set<String> wanted = Set.copyOf(Objects.requireNonNull(codes, "codes"));
        final List<SymbolMetadata> out = new ArrayList<>();
        for (SymbolMetadata s : symbols.values()) {
            if (wanted.contains(s.symbolCode())) {
                out.add(s);
            }
        }
        return out;
    }

    /**
     * Listing of the table, one line per symbol.
     */
    public List<String> describe()
    {
        final List<String> lines = new ArrayList<>(symbols.size() + 1);
        lines.add("Number of available symbols: " + symbols.size());
        for (SymbolMetadata s : symbols.values()) {
            lines.add(String.format("symbol: %s, name: %s, file number: %d",
                    s.symbolCode(), s.displayName(), s.fileNumber()));
        }
        return lines;
    }

    public ConversionResult convert(boolean all, Collection<String> codes)
    {
        return convert(selectSymbols(all, codes));
    }

    /**
     * Decodes the data files of {@code selection} in order.
     */
    public ConversionResult convert(Collection<SymbolMetadata> selection)
    {
        Objects.requireNonNull(selection, "selection");

        final List<DecodedRecord> records = new ArrayList<>();
        final List<SymbolMetadata> converted = new ArrayList<>();
        final List<SymbolFailure> failures = new ArrayList<>();

        for (SymbolMetadata symbol : selection) {
            try {
                final List<DecodedRecord> ticks = dataFileReader.readAll(symbol);
                records.addAll(ticks);
                converted.add(symbol);
                sink.onSymbolConverted(new SymbolConvertedEvent(Instant.now(),
                        symbol.symbolCode(), symbol.fileNumber(), ticks.size()));
            }
            catch (MetastockException e) {
                failures.add(new SymbolFailure(symbol, e));
                sink.onError(new MetastockErrorEvent(Instant.now(),
                        symbol.symbolCode(), e.kind(), e.getMessage(), e));
            }
        }
        return new ConversionResult(records, converted, failures);
    }

    /**
     * Decodes one symbol without failure isolation.
     */
    public List<DecodedRecord> readRecords(SymbolMetadata symbol)
    {
        return dataFileReader.readAll(symbol);
    }

    private static Optional<List<SymbolMetadata>> readOptional(MetastockReaderConfig config,
                                                               IndexFormat format,
                                                               MetastockObservabilitySink sink)
    {
        final Path path = config.directory().resolve(format.fileName());
        try {
            final Optional<IndexContents> contents = read(config, format);
            if (contents.isEmpty()) {
                sink.onIndexLoaded(new IndexLoadedEvent(Instant.now(), format, path, false, 0, 0));
                return Optional.empty();
            }
            final IndexContents c = contents.get();
            sink.onIndexLoaded(new IndexLoadedEvent(Instant.now(), format, path, true,
                    c.recordCount(), c.symbols().size()));
            return Optional.of(c.symbols());
        }
        catch (MetastockException e) {
            sink.onError(new MetastockErrorEvent(Instant.now(), format.fileName(), e.kind(), e.getMessage(), e));
            return Optional.empty();
        }
    }

    private static IndexContents readMandatory(MetastockReaderConfig config, IndexFormat format)
    {
        final Optional<IndexContents> contents;
        try {
            contents = read(config, format);
        }
        catch (MetastockException e) {
            throw new ConfigurationException("Cannot read " + format.fileName() + " in " + config.directory(), e);
        }
        return contents.orElseThrow(() -> new ConfigurationException(
                "No " + format.fileName() + " file in directory " + config.directory()));
    }

    private static Optional<IndexContents> read(MetastockReaderConfig config, IndexFormat format)
    {
        final Optional<IndexFile> opened = IndexFile.openIfPresent(config.directory(), format, config.nameCharset());
        if (opened.isEmpty()) {
            return Optional.empty();
        }
        try (IndexFile index = opened.get()) {
            return Optional.of(new IndexContents(index.path(), index.recordCount(), index.readAll()));
        }
    }

    private record IndexContents(Path path, int recordCount, List<SymbolMetadata> symbols) {}
}
