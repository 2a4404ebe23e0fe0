package com.questrail.metastock.config;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class MetastockReaderConfigTest
{
    @Test
    void builderDefaults()
    {
        MetastockReaderConfig config = MetastockReaderConfig.builder()
                .withDirectory(Path.of("quotes"))
                .build();

        assertEquals(Path.of("quotes"), config.directory());
        assertEquals(2, config.pricePrecision());
        assertEquals(StandardCharsets.US_ASCII, config.nameCharset());
    }

    @Test
    void builderOverrides()
    {
        MetastockReaderConfig config = MetastockReaderConfig.builder()
                .withDirectory(Path.of("quotes"))
                .withPricePrecision(4)
                .withNameCharset(StandardCharsets.ISO_8859_1)
                .build();

        assertEquals(4, config.pricePrecision());
        assertEquals(StandardCharsets.ISO_8859_1, config.nameCharset());
    }

    @Test
    void directoryIsRequired()
    {
        assertThrows(NullPointerException.class, () -> MetastockReaderConfig.builder().build());
    }

    @Test
    void precisionIsBounded()
    {
        MetastockReaderConfig.Builder builder = MetastockReaderConfig.builder().withDirectory(Path.of("quotes"));
        assertThrows(IllegalArgumentException.class, () -> builder.withPricePrecision(-1).build());
        assertThrows(IllegalArgumentException.class, () -> builder.withPricePrecision(11).build());
        assertDoesNotThrow(() -> builder.withPricePrecision(0).build());
    }
}
