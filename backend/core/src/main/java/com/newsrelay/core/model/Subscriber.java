package com.newsrelay.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record Subscriber(
        String id,
        boolean notificationsEnabled,
        Instant lastActivityAt,
        SubscriberPreferences preferences
) {
    public Subscriber {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(lastActivityAt, "lastActivityAt is required");
        preferences = preferences == null ? SubscriberPreferences.defaults() : preferences;
    }

    public boolean isEligible(Instant now, Duration activityWindow) {
        return notificationsEnabled && !lastActivityAt.isBefore(now.minus(activityWindow));
    }
}
