package com.newsrelay.feeds.cache;

import com.newsrelay.core.model.NewsItem;

import java.time.Duration;
import java.util.Optional;

/**
 * Keyed store of normalized items with per-entry expiry. {@link #get} never returns an expired entry.
 * Implementations must tolerate concurrent calls; single-key upserts are atomic.
 */
public interface NewsCache {
    Optional<NewsItem> get(String canonicalLink);

    void put(NewsItem item, Duration ttl);

    int purgeExpired();

    int size();
}
