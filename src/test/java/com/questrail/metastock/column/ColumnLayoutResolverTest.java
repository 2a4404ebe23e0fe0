package com.questrail.metastock.column;

import com.questrail.metastock.MetastockFixtures;
import com.questrail.metastock.error.ConfigurationException;
import com.questrail.metastock.error.ErrorKind;
import com.questrail.metastock.error.StructuralFormatException;
import com.questrail.metastock.index.IndexFormat;
import com.questrail.metastock.model.ColumnLayout;
import com.questrail.metastock.model.SymbolMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ColumnLayoutResolverTest
{
    @TempDir
    Path dir;

    @Test
    void readsColumnsAndDropsTrailer()
    {
        MetastockFixtures.write(dir, "F4.DOP",
                MetastockFixtures.columnDefinition("DATE", "TIME", "OPEN", "HIGH", "LOW", "CLOSE", "VOL", "OI"));

        ColumnLayout layout = new ColumnLayoutResolver(dir).resolve(symbol(4, 8));

        assertEquals(List.of("DATE", "TIME", "OPEN", "HIGH", "LOW", "CLOSE", "VOL", "OI"), layout.tokens());
    }

    @Test
    void keepsUnrecognizedTokensInPlace()
    {
        MetastockFixtures.write(dir, "F5.DOP",
                MetastockFixtures.columnDefinition("DATE", "BID", "CLOSE", "ASK"));

        ColumnLayout layout = new ColumnLayoutResolver(dir).resolve(symbol(5, 4));

        assertEquals(List.of("DATE", "BID", "CLOSE", "ASK"), layout.tokens());
    }

    @Test
    void definitionMustMatchDeclaredFieldCount()
    {
        MetastockFixtures.write(dir, "F6.DOP", MetastockFixtures.columnDefinition("DATE", "CLOSE"));

        StructuralFormatException e = assertThrows(StructuralFormatException.class,
                () -> new ColumnLayoutResolver(dir).resolve(symbol(6, 7)));
        assertEquals(ErrorKind.STRUCTURAL_FORMAT, e.kind());
    }

    @Test
    void malformedLineIsStructuralError()
    {
        MetastockFixtures.write(dir, "F6.DOP", "\"DATE\",1,0\r\nCLOSE\r\n1\r\n");

        assertThrows(StructuralFormatException.class,
                () -> new ColumnLayoutResolver(dir).resolve(symbol(6, 2)));
    }

    @Test
    void emptyDefinitionIsStructuralError()
    {
        MetastockFixtures.write(dir, "F6.DOP", "1\r\n");

        assertThrows(StructuralFormatException.class,
                () -> new ColumnLayoutResolver(dir).resolve(symbol(6, 0)));
    }

    @Test
    void fallsBackToDefaultLayoutForSevenFields()
    {
        ColumnLayout layout = new ColumnLayoutResolver(dir).resolve(symbol(1, 7));

        assertSame(ColumnLayout.DEFAULT, layout);
        assertEquals(List.of("DATE", "OPEN", "HIGH", "LOW", "CLOSE", "VOL", "OI"), layout.tokens());
    }

    @Test
    void fallbackWithOtherFieldCountIsConfigurationError()
    {
        for (int fields : new int[] { 5, 6, 8 }) {
            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> new ColumnLayoutResolver(dir).resolve(symbol(1, fields)));
            assertEquals(ErrorKind.CONFIGURATION, e.kind());
        }
    }

    private static SymbolMetadata symbol(int fileNumber, int fields)
    {
        return new SymbolMetadata(fileNumber, "SYM" + fileNumber, "", fields, 0, 'D',
                null, null, ".DAT", IndexFormat.EXTENDED);
    }
}
