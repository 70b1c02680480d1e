package com.newsrelay.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record CacheEntry(NewsItem item, Instant cachedAt, Instant expiresAt) {
    public CacheEntry {
        Objects.requireNonNull(item, "item is required");
        Objects.requireNonNull(cachedAt, "cachedAt is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
    }

    public static CacheEntry of(NewsItem item, Instant cachedAt, Duration ttl) {
        return new CacheEntry(item, cachedAt, cachedAt.plus(ttl));
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
