package com.questrail.metastock.column;

import com.questrail.metastock.error.ConfigurationException;
import com.questrail.metastock.error.StructuralFormatException;
import com.questrail.metastock.model.ColumnLayout;
import com.questrail.metastock.model.SymbolMetadata;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ColumnLayoutResolver
 * -----------------------------------------------------------------------------
 * Determines the column order of a symbol's data file.
 *
 * <p>The column definition file {@code F<n>.DOP} lists one column per line in
 * on-disk order:</p>
 * <pre>
 *   "DATE",...
 *   "OPEN",...
 *   ...
 *   &lt;trailer line&gt;
 * </pre>
 *
 * <p>The file is split on whitespace, the final token (a non-data trailer) is
 * dropped, and the quoted name of every remaining token becomes a column.
 * When no definition file exists the 7-column {@link ColumnLayout#DEFAULT} is
 * used, which only fits symbols declaring exactly 7 fields.</p>
 */
public final class ColumnLayoutResolver
{
    private static final Pattern COLUMN_LINE = Pattern.compile("\"(.+)\",.+");
    private static final int TRAILER_TOKENS = 1;

    private final Path directory;

    public ColumnLayoutResolver(Path directory)
    {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    /**
     * @throws ConfigurationException    if no definition file exists and the
     *                                   symbol does not declare 7 fields
     * @throws StructuralFormatException if the definition file is malformed or
     *                                   disagrees with the declared field count
     */
    public ColumnLayout resolve(SymbolMetadata symbol)
    {
        Objects.requireNonNull(symbol, "symbol");

        final Path definition = directory.resolve(symbol.columnDefinitionFileName());
        if (!Files.isRegularFile(definition)) {
            if (symbol.declaredFieldCount() != ColumnLayout.DEFAULT.size()) {
                throw new ConfigurationException(String.format(
                        "No %s for symbol %s and declared field count %d does not match the default %d-column layout",
                        definition.getFileName(), symbol.symbolCode(),
                        symbol.declaredFieldCount(), ColumnLayout.DEFAULT.size()));
            }
            return ColumnLayout.DEFAULT;
        }

        final String content;
        try {
            content = Files.readString(definition, StandardCharsets.ISO_8859_1);
        }
        catch (IOException e) {
            throw new StructuralFormatException("Cannot read " + definition, e);
        }

        return parse(content, symbol, definition);
    }

    static ColumnLayout parse(String content, SymbolMetadata symbol, Path source)
    {
        final String stripped = content.strip();
        final List<String> tokens = stripped.isEmpty()
                ? List.of()
                : Arrays.asList(stripped.split("\\s+"));

        final int columnCount = tokens.size() - TRAILER_TOKENS;
        if (columnCount <= 0) {
            throw new StructuralFormatException(source + " defines no columns");
        }
        if (columnCount != symbol.declaredFieldCount()) {
            throw new StructuralFormatException(String.format(
                    "%s lists %d columns but symbol %s declares %d fields",
                    source, columnCount, symbol.symbolCode(), symbol.declaredFieldCount()));
        }

        final List<String> columns = new ArrayList<>(columnCount);
        for (String token : tokens.subList(0, columnCount)) {
            final Matcher m = COLUMN_LINE.matcher(token);
            if (!m.find()) {
                throw new StructuralFormatException("Malformed column definition in " + source + ": " + token);
            }
            columns.add(m.group(1));
        }
        return ColumnLayout.of(columns);
    }
}
