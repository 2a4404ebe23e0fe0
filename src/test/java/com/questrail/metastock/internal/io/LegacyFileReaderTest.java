package com.questrail.metastock.internal.io;

import com.questrail.metastock.MetastockFixtures;
import com.questrail.metastock.error.StructuralFormatException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class LegacyFileReaderTest
{
    @TempDir
    Path dir;

    @Test
    void readsLittleEndianPrimitives()
    {
        Path file = MetastockFixtures.write(dir, "F1.DAT", new byte[] {
                (byte) 0xFE, 0x34, 0x12, 0x78, 0x56, 0x34, 0x12, 'A', 'B', 'C'
        });

        try (LegacyFileReader reader = LegacyFileReader.open(file)) {
            assertEquals(10, reader.size());
            assertEquals(0xFE, reader.readUnsignedByte());
            assertEquals(0x1234, reader.readUnsignedShortLE());
            assertEquals(0x12345678, reader.readIntLE());
            assertArrayEquals(new byte[] { 'A', 'B', 'C' }, reader.readBytes(3));
            assertEquals(10, reader.position());
            assertFalse(reader.hasRemaining(1));
        }
    }

    @Test
    void seekAndSkipMoveThePosition()
    {
        Path file = MetastockFixtures.write(dir, "F1.DAT", new byte[] { 1, 2, 3, 4, 5, 6 });

        try (LegacyFileReader reader = LegacyFileReader.open(file)) {
            reader.seek(4);
            assertEquals(5, reader.readUnsignedByte());
            reader.seek(0);
            reader.skip(2);
            assertEquals(3, reader.readUnsignedByte());
        }
    }

    @Test
    void readPastEndIsStructuralError()
    {
        Path file = MetastockFixtures.write(dir, "F1.DAT", new byte[] { 1, 2, 3 });

        try (LegacyFileReader reader = LegacyFileReader.open(file)) {
            reader.skip(2);
            StructuralFormatException e = assertThrows(StructuralFormatException.class, reader::readUnsignedShortLE);
            assertTrue(e.getMessage().contains("F1.DAT"));
            assertEquals(2, reader.position());
        }
    }

    @Test
    void missingFileIsStructuralError()
    {
        assertThrows(StructuralFormatException.class, () -> LegacyFileReader.open(dir.resolve("F9.DAT")));
    }

    @Test
    void closedReaderRejectsReads()
    {
        Path file = MetastockFixtures.write(dir, "F1.DAT", new byte[] { 1, 2 });

        LegacyFileReader reader = LegacyFileReader.open(file);
        reader.close();
        reader.close();
        assertThrows(IllegalStateException.class, reader::readUnsignedByte);
    }
}
