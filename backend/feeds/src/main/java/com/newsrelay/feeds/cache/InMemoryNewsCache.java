package com.newsrelay.feeds.cache;

import com.newsrelay.core.model.CacheEntry;
import com.newsrelay.core.model.NewsItem;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryNewsCache implements NewsCache {
    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryNewsCache(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public Optional<NewsItem> get(String canonicalLink) {
        CacheEntry entry = entries.get(canonicalLink);
        if (entry == null || entry.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.item());
    }

    @Override
    public void put(NewsItem item, Duration ttl) {
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative");
        }
        entries.put(item.canonicalLink(), CacheEntry.of(item, clock.instant(), ttl));
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, CacheEntry> entry : entries.entrySet()) {
            // conditional remove keeps an entry that a concurrent put just refreshed
            if (entry.getValue().isExpired(now) && entries.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return entries.size();
    }
}
