package com.newsrelay.service.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void missingRelayFileYieldsDefaults(@TempDir Path dir) {
        RelayConfig config = ConfigLoader.loadRelay(dir, Map.of());

        assertEquals(RelayConfig.defaults(), config);
        assertEquals(LocalTime.of(9, 0), config.dailySendTime());
        assertEquals(Duration.ofMinutes(5), config.fetchSettings().cacheTtl());
    }

    @Test
    void fileValuesOverrideDefaultsKeyByKey(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("relay.json"), """
                {
                  "dailySendHour": 7,
                  "dailySendMinute": 30,
                  "zone": "Africa/Cairo",
                  "fetchTimeout": "PT4S",
                  "activityWindow": "P14D",
                  "userAgent": "Custom/2.0",
                  "someFutureKey": true
                }
                """);

        RelayConfig config = ConfigLoader.loadRelay(dir, Map.of());

        assertEquals(LocalTime.of(7, 30), config.dailySendTime());
        assertEquals(ZoneId.of("Africa/Cairo"), config.zone());
        assertEquals(Duration.ofSeconds(4), config.fetchTimeout());
        assertEquals(Duration.ofDays(14), config.activityWindow());
        assertEquals("Custom/2.0", config.userAgent());
        assertEquals(5, config.concurrencyLimit());
        assertEquals(10, config.aggregateLimit());
    }

    @Test
    void environmentOverridesFile(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("relay.json"), "{\"dailySendHour\": 7, \"concurrencyLimit\": 2}");

        RelayConfig config = ConfigLoader.loadRelay(dir, Map.of(
                "DAILY_NEWS_HOUR", "18",
                "DAILY_NEWS_MINUTE", "45",
                "MAX_CONCURRENT_FETCHES", "8",
                "RSS_TIMEOUT", "3",
                "CACHE_DURATION", "600",
                "RSS_MAX_ITEMS_PER_SOURCE", "2",
                "MAX_NEWS_ITEMS", "20",
                "ENABLE_SCHEDULED_NEWS", "False"
        ));

        assertEquals(LocalTime.of(18, 45), config.dailySendTime());
        assertEquals(8, config.concurrencyLimit());
        assertEquals(Duration.ofSeconds(3), config.fetchTimeout());
        assertEquals(Duration.ofMinutes(10), config.cacheTtl());
        assertEquals(2, config.perSourceItemCap());
        assertEquals(20, config.aggregateLimit());
        assertFalse(config.scheduledNewsEnabled());
    }

    @Test
    void invalidValuesFailFastNamingTheKey(@TempDir Path dir) throws Exception {
        IllegalStateException hour = assertThrows(IllegalStateException.class,
                () -> ConfigLoader.loadRelay(dir, Map.of("DAILY_NEWS_HOUR", "24")));
        assertTrue(hour.getMessage().contains("dailySendHour"));

        IllegalStateException notANumber = assertThrows(IllegalStateException.class,
                () -> ConfigLoader.loadRelay(dir, Map.of("MAX_CONCURRENT_FETCHES", "many")));
        assertTrue(notANumber.getMessage().contains("MAX_CONCURRENT_FETCHES"));

        IllegalStateException limit = assertThrows(IllegalStateException.class,
                () -> ConfigLoader.loadRelay(dir, Map.of("MAX_CONCURRENT_FETCHES", "0")));
        assertTrue(limit.getMessage().contains("concurrencyLimit"));

        IllegalStateException flag = assertThrows(IllegalStateException.class,
                () -> ConfigLoader.loadRelay(dir, Map.of("ENABLE_SCHEDULED_NEWS", "sometimes")));
        assertTrue(flag.getMessage().contains("ENABLE_SCHEDULED_NEWS"));

        Files.writeString(dir.resolve("relay.json"), "{\"cacheTtl\": \"-PT1S\"}");
        IllegalStateException ttl = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadRelay(dir, Map.of()));
        assertTrue(ttl.getMessage().contains("cacheTtl"));
    }

    @Test
    void malformedOrMistypedFileFailsWithPathInMessage(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("relay.json"), "{not-json");
        IllegalStateException malformed = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadRelay(dir, Map.of()));
        assertTrue(malformed.getMessage().contains("relay.json"));

        Files.writeString(dir.resolve("relay.json"), "{\"zone\": \"Mars/Olympus_Mons\"}");
        IllegalStateException zone = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadRelay(dir, Map.of()));
        assertTrue(zone.getMessage().contains("relay.json"));

        Files.writeString(dir.resolve("relay.json"), "[1, 2]");
        assertThrows(IllegalStateException.class, () -> ConfigLoader.loadRelay(dir, Map.of()));
    }

    @Test
    void zeroCacheTtlIsAllowed(@TempDir Path dir) {
        RelayConfig config = ConfigLoader.loadRelay(dir, Map.of("CACHE_DURATION", "0"));

        assertEquals(Duration.ZERO, config.cacheTtl());
    }

    @Test
    void loadsSourceCatalogBesideRelayConfig(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("sources.json"), """
                {"Egypt": {"general": [{"name": "Cairo Daily", "url": "https://cairo.example/rss"}]}}
                """);

        assertEquals(1, ConfigLoader.loadSources(dir).size());
        assertTrue(ConfigLoader.loadSources(dir.resolve("missing")).isEmpty());
    }
}
