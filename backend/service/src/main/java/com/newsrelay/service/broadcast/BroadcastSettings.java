package com.newsrelay.service.broadcast;

import java.time.Duration;
import java.util.Objects;

public record BroadcastSettings(
        int digestSize,
        Duration activityWindow,
        Duration deliveryTimeout,
        int deliveryConcurrency
) {
    public BroadcastSettings {
        Objects.requireNonNull(activityWindow, "activityWindow is required");
        Objects.requireNonNull(deliveryTimeout, "deliveryTimeout is required");
        if (digestSize <= 0) {
            throw new IllegalArgumentException("digestSize must be positive");
        }
        if (deliveryTimeout.isZero() || deliveryTimeout.isNegative()) {
            throw new IllegalArgumentException("deliveryTimeout must be positive");
        }
        if (deliveryConcurrency <= 0) {
            throw new IllegalArgumentException("deliveryConcurrency must be positive");
        }
    }
}
