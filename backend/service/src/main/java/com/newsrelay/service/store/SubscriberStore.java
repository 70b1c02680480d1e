package com.newsrelay.service.store;

import com.newsrelay.core.model.Subscriber;

import java.time.Duration;
import java.util.List;

/**
 * Boundary to wherever subscribers live. The broadcast path only needs these two operations.
 */
public interface SubscriberStore {
    /**
     * Subscribers with notifications enabled whose last activity falls inside {@code activityWindow}.
     */
    List<Subscriber> listEligible(Duration activityWindow);

    void incrementDeliveryCount(String subscriberId);
}
