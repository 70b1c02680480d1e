package com.newsrelay.feeds.cache;

import com.newsrelay.core.model.NewsItem;
import com.newsrelay.feeds.support.Feeds;
import com.newsrelay.feeds.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryNewsCacheTest {
    private static final Instant START = Instant.parse("2026-03-02T12:00:00Z");
    private static final Duration TTL = Duration.ofMinutes(5);

    private final MutableClock clock = new MutableClock(START, ZoneOffset.UTC);
    private final InMemoryNewsCache cache = new InMemoryNewsCache(clock);

    @Test
    void returnsStoredItemWithinTtl() {
        NewsItem item = item("https://x.example/1");
        cache.put(item, TTL);

        clock.advance(Duration.ofMinutes(4));

        assertEquals(item, cache.get("https://x.example/1").orElseThrow());
        assertTrue(cache.get("https://x.example/missing").isEmpty());
    }

    @Test
    void entryIsGoneOnceTtlElapses() {
        cache.put(item("https://x.example/1"), TTL);

        clock.advance(TTL);

        assertTrue(cache.get("https://x.example/1").isEmpty());
    }

    @Test
    void putReplacesAndRefreshesExpiry() {
        cache.put(item("https://x.example/1"), TTL);
        clock.advance(Duration.ofMinutes(4));
        NewsItem refreshed = new NewsItem("https://x.example/1", "Updated", "", START, "src", "Egypt", "general", clock.instant());
        cache.put(refreshed, TTL);

        clock.advance(Duration.ofMinutes(4));

        assertEquals("Updated", cache.get("https://x.example/1").orElseThrow().title());
        assertEquals(1, cache.size());
    }

    @Test
    void zeroTtlIsNeverServed() {
        cache.put(item("https://x.example/1"), Duration.ZERO);

        assertTrue(cache.get("https://x.example/1").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> cache.put(item("https://x.example/2"), Duration.ofSeconds(-1)));
    }

    @Test
    void purgeRemovesOnlyExpiredEntries() {
        cache.put(item("https://x.example/old"), Duration.ofMinutes(1));
        cache.put(item("https://x.example/new"), Duration.ofMinutes(10));

        clock.advance(Duration.ofMinutes(2));

        assertEquals(1, cache.purgeExpired());
        assertEquals(1, cache.size());
        assertTrue(cache.get("https://x.example/new").isPresent());
        assertEquals(0, cache.purgeExpired());
    }

    @Test
    void concurrentWritersAndPurgesKeepEntriesConsistent() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int writer = t;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        cache.put(item("https://x.example/" + writer + "/" + i), TTL);
                        cache.get("https://x.example/" + writer + "/" + (i / 2));
                        if (i % 50 == 0) {
                            cache.purgeExpired();
                        }
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1600, cache.size());
        clock.advance(TTL);
        assertEquals(1600, cache.purgeExpired());
        assertEquals(0, cache.size());
    }

    private NewsItem item(String link) {
        return Feeds.item(link, "src", "general", START, clock.instant());
    }
}
