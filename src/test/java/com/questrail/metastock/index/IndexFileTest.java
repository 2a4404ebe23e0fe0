package com.questrail.metastock.index;

import com.questrail.metastock.MetastockFixtures;
import com.questrail.metastock.MetastockFixtures.Entry;
import com.questrail.metastock.error.StructuralFormatException;
import com.questrail.metastock.model.SymbolMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IndexFileTest
 * -----------------------------------------------------------------------------
 * Reads fixture files of all three index variants through the single
 * {@link IndexFile} reader.
 */
final class IndexFileTest
{
    private static final LocalDate FIRST = LocalDate.of(1995, 1, 3);
    private static final LocalDate LAST = LocalDate.of(2024, 6, 28);

    @TempDir
    Path dir;

    @Test
    void missingFileIsEmpty()
    {
        assertTrue(IndexFile.openIfPresent(dir, IndexFormat.STANDARD, StandardCharsets.US_ASCII).isEmpty());
        assertTrue(IndexFile.openIfPresent(dir, IndexFormat.EXTENDED, StandardCharsets.US_ASCII).isEmpty());
        assertTrue(IndexFile.openIfPresent(dir, IndexFormat.CROSS_REFERENCE, StandardCharsets.US_ASCII).isEmpty());
    }

    @Test
    void readsStandardIndexRecord()
    {
        MetastockFixtures.write(dir, "MASTER", MetastockFixtures.master(List.of(
                new Entry(1, "@:KGHM#1", "KGHM POLSKA MIED", 7, 'D', FIRST, LAST),
                Entry.placeholder(),
                new Entry(3, "WIG20", "WIG 20", 5, 'W', FIRST, null))));

        try (IndexFile index = open(IndexFormat.STANDARD)) {
            assertEquals(3, index.recordCount());
            assertTrue(index.lastFileNumber().isEmpty());

            SymbolMetadata kghm = index.readRecordAt(0);
            assertEquals(1, kghm.fileNumber());
            assertEquals("KGHM", kghm.symbolCode());
            assertEquals("KGHM POLSKA MIED", kghm.displayName());
            assertEquals(7, kghm.declaredFieldCount());
            assertEquals(28, kghm.recordLength());
            assertEquals('D', kghm.timeFrame());
            assertEquals(FIRST, kghm.firstDate());
            assertEquals(LAST, kghm.lastDate());
            assertEquals("F1.DAT", kghm.dataFileName());
            assertEquals(IndexFormat.STANDARD, kghm.source());

            assertTrue(index.readRecordAt(1).isPlaceholder());

            SymbolMetadata wig = index.readRecordAt(2);
            assertEquals("WIG20", wig.symbolCode());
            assertNull(wig.lastDate());
        }
    }

    @Test
    void readAllSkipsPlaceholders()
    {
        MetastockFixtures.write(dir, "MASTER", MetastockFixtures.master(List.of(
                Entry.placeholder(),
                new Entry(2, "ABC", "ABC CORP", 7, 'D', FIRST, LAST),
                Entry.placeholder())));

        try (IndexFile index = open(IndexFormat.STANDARD)) {
            List<SymbolMetadata> all = index.readAll();
            assertEquals(1, all.size());
            assertEquals(2, all.get(0).fileNumber());
        }
    }

    @Test
    void readsExtendedIndexRecord()
    {
        MetastockFixtures.write(dir, "EMASTER", MetastockFixtures.emaster(List.of(
                new Entry(7, "ABC", "ABC HOLDINGS INC", 7, 'D', FIRST, LAST),
                new Entry(9, "@:XYZ", "", 8, 'D', FIRST, LAST))));

        try (IndexFile index = open(IndexFormat.EXTENDED)) {
            assertEquals(2, index.recordCount());
            assertEquals(9, index.lastFileNumber().orElseThrow());

            SymbolMetadata abc = index.readRecordAt(0);
            assertEquals(7, abc.fileNumber());
            assertEquals("ABC", abc.symbolCode());
            assertEquals("ABC HOLDINGS INC", abc.displayName());
            assertEquals(7, abc.declaredFieldCount());
            assertEquals(0, abc.recordLength());
            assertEquals('D', abc.timeFrame());
            assertEquals(FIRST, abc.firstDate());
            assertEquals(LAST, abc.lastDate());

            SymbolMetadata xyz = index.readRecordAt(1);
            assertEquals("XYZ", xyz.symbolCode());
            assertEquals("", xyz.displayName());
            assertEquals(8, xyz.declaredFieldCount());
        }
    }

    @Test
    void extendedPlaceholderStopsAfterFileNumber()
    {
        byte[] full = MetastockFixtures.emaster(List.of(
                new Entry(7, "ABC", "ABC", 7, 'D', FIRST, LAST),
                Entry.placeholder()));
        // Cut the file right after the placeholder's file number byte.
        MetastockFixtures.write(dir, "EMASTER", Arrays.copyOf(full, 2 * 192 + 3));

        try (IndexFile index = open(IndexFormat.EXTENDED)) {
            assertTrue(index.readRecordAt(1).isPlaceholder());
            assertEquals(1, index.readAll().size());
        }
    }

    @Test
    void readsCrossReferenceRecordWithoutNormalizing()
    {
        MetastockFixtures.write(dir, "XMASTER", MetastockFixtures.xmaster(List.of(
                new Entry(300, "@:XR#1", "A VERY LONG CROSS REFERENCE NAME OF FORTY", 0, 'D',
                        LocalDate.of(2001, 2, 3), LocalDate.of(2023, 12, 29)))));

        try (IndexFile index = open(IndexFormat.CROSS_REFERENCE)) {
            assertEquals(1, index.recordCount());

            SymbolMetadata xr = index.readRecordAt(0);
            assertEquals(300, xr.fileNumber());
            assertEquals("@:XR#1", xr.symbolCode());
            assertEquals("A VERY LONG CROSS REFERENCE NAME OF FORTY", xr.displayName());
            assertEquals('D', xr.timeFrame());
            assertEquals(LocalDate.of(2001, 2, 3), xr.firstDate());
            assertEquals(LocalDate.of(2023, 12, 29), xr.lastDate());
            assertEquals("F300.MWD", xr.dataFileName());
        }
    }

    @Test
    void declaredCountBeyondFileIsStructuralError()
    {
        byte[] oneRecord = MetastockFixtures.master(List.of(new Entry(1, "ABC", "ABC", 7, 'D', FIRST, LAST)));
        oneRecord[0] = 2;
        MetastockFixtures.write(dir, "MASTER", oneRecord);

        try (IndexFile index = open(IndexFormat.STANDARD)) {
            assertEquals(2, index.recordCount());
            assertNotNull(index.readRecordAt(0));
            assertThrows(StructuralFormatException.class, () -> index.readRecordAt(1));
        }
    }

    @Test
    void truncatedHeaderIsStructuralError()
    {
        MetastockFixtures.write(dir, "XMASTER", new byte[] { 0, 0, 0, 0 });
        assertThrows(StructuralFormatException.class,
                () -> IndexFile.openIfPresent(dir, IndexFormat.CROSS_REFERENCE, StandardCharsets.US_ASCII));
    }

    @Test
    void rejectsIndexOutsideRecordCount()
    {
        MetastockFixtures.write(dir, "MASTER", MetastockFixtures.master(List.of(
                new Entry(1, "ABC", "ABC", 7, 'D', FIRST, LAST))));

        try (IndexFile index = open(IndexFormat.STANDARD)) {
            assertThrows(IndexOutOfBoundsException.class, () -> index.readRecordAt(1));
            assertThrows(IndexOutOfBoundsException.class, () -> index.readRecordAt(-1));
        }
    }

    @Test
    void closedIndexRejectsReads()
    {
        MetastockFixtures.write(dir, "MASTER", MetastockFixtures.master(List.of(
                new Entry(1, "ABC", "ABC", 7, 'D', FIRST, LAST))));

        IndexFile index = open(IndexFormat.STANDARD);
        index.close();
        assertThrows(IllegalStateException.class, () -> index.readRecordAt(0));
    }

    @Test
    void layoutsUseDocumentedStrides()
    {
        assertEquals(53, IndexFormat.STANDARD.layout().stride());
        assertEquals(192, IndexFormat.EXTENDED.layout().stride());
        assertEquals(150, IndexFormat.CROSS_REFERENCE.layout().stride());
        assertEquals(3 * 192L, IndexFormat.EXTENDED.layout().recordOffset(2));
    }

    private IndexFile open(IndexFormat format)
    {
        return IndexFile.openIfPresent(dir, format, StandardCharsets.US_ASCII).orElseThrow();
    }
}
