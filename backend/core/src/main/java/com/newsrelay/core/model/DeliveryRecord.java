package com.newsrelay.core.model;

import java.time.Instant;
import java.util.Objects;

public record DeliveryRecord(
        String subscriberId,
        Instant timestamp,
        DeliveryOutcome outcome,
        String error
) {
    public DeliveryRecord {
        Objects.requireNonNull(subscriberId, "subscriberId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(outcome, "outcome is required");
    }

    public static DeliveryRecord success(String subscriberId, Instant timestamp) {
        return new DeliveryRecord(subscriberId, timestamp, DeliveryOutcome.SUCCESS, null);
    }

    public static DeliveryRecord failure(String subscriberId, Instant timestamp, String error) {
        return new DeliveryRecord(subscriberId, timestamp, DeliveryOutcome.FAILURE, error);
    }

    public boolean succeeded() {
        return outcome == DeliveryOutcome.SUCCESS;
    }
}
