package com.newsrelay.feeds;

import java.time.Duration;
import java.util.Objects;

public record FetchSettings(
        int concurrencyLimit,
        Duration fetchTimeout,
        Duration cacheTtl,
        int perSourceItemCap
) {
    public FetchSettings {
        Objects.requireNonNull(fetchTimeout, "fetchTimeout is required");
        Objects.requireNonNull(cacheTtl, "cacheTtl is required");
        if (concurrencyLimit <= 0) {
            throw new IllegalArgumentException("concurrencyLimit must be positive");
        }
        if (fetchTimeout.isZero() || fetchTimeout.isNegative()) {
            throw new IllegalArgumentException("fetchTimeout must be positive");
        }
        if (cacheTtl.isNegative()) {
            throw new IllegalArgumentException("cacheTtl must not be negative");
        }
        if (perSourceItemCap <= 0) {
            throw new IllegalArgumentException("perSourceItemCap must be positive");
        }
    }
}
