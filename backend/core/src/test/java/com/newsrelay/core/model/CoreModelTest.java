package com.newsrelay.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoreModelTest {
    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Test
    void sourceIdentityIsEndpointUrl() {
        SourceDescriptor a = new SourceDescriptor("A", "https://x/rss", "Egypt", "general");
        SourceDescriptor renamed = new SourceDescriptor("A renamed", "https://x/rss", "Egypt", "sports");
        SourceDescriptor other = new SourceDescriptor("A", "https://y/rss", "Egypt", "general");

        assertEquals(a, renamed);
        assertEquals(a.hashCode(), renamed.hashCode());
        assertNotEquals(a, other);
    }

    @Test
    void cacheEntryExpiresExactlyAtTtl() {
        CacheEntry entry = CacheEntry.of(item("https://x/a"), NOW, Duration.ofMinutes(5));

        assertEquals(NOW.plusSeconds(300), entry.expiresAt());
        assertFalse(entry.isExpired(NOW.plusSeconds(299)));
        assertTrue(entry.isExpired(NOW.plusSeconds(300)));
        assertTrue(CacheEntry.of(item("https://x/a"), NOW, Duration.ZERO).isExpired(NOW));
    }

    @Test
    void subscriberEligibilityNeedsNotificationsAndRecentActivity() {
        Duration window = Duration.ofDays(30);
        assertTrue(new Subscriber("1", true, NOW.minus(Duration.ofDays(29)), null).isEligible(NOW, window));
        assertTrue(new Subscriber("2", true, NOW.minus(window), null).isEligible(NOW, window));
        assertFalse(new Subscriber("3", true, NOW.minus(Duration.ofDays(31)), null).isEligible(NOW, window));
        assertFalse(new Subscriber("4", false, NOW, null).isEligible(NOW, window));
    }

    @Test
    void unknownPublishedAtIsDetectedAndItemRequiresIdentity() {
        NewsItem unknown = new NewsItem("https://x/u", "t", "", NewsItem.UNKNOWN_PUBLISHED_AT, "s", "c", "g", NOW);
        assertFalse(unknown.hasKnownPublishedAt());
        assertTrue(item("https://x/k").hasKnownPublishedAt());
        assertThrows(NullPointerException.class,
                () -> new NewsItem(null, "t", "", NOW, "s", "c", "g", NOW));
    }

    @Test
    void deliveryRecordFactoriesSetOutcome() {
        assertTrue(DeliveryRecord.success("7", NOW).succeeded());
        DeliveryRecord failed = DeliveryRecord.failure("7", NOW, "blocked");
        assertEquals(DeliveryOutcome.FAILURE, failed.outcome());
        assertEquals("blocked", failed.error());
    }

    private static NewsItem item(String link) {
        return new NewsItem(link, "title", "summary", NOW, "source", "Egypt", "general", NOW);
    }
}
