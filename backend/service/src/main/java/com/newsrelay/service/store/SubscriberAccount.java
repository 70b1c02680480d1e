package com.newsrelay.service.store;

import com.newsrelay.core.model.Subscriber;

import java.time.Instant;
import java.util.Objects;

public record SubscriberAccount(Subscriber subscriber, long deliveryCount, Instant lastDeliveryAt) {
    public SubscriberAccount {
        Objects.requireNonNull(subscriber, "subscriber is required");
    }

    static SubscriberAccount fresh(Subscriber subscriber) {
        return new SubscriberAccount(subscriber, 0, null);
    }

    SubscriberAccount withSubscriber(Subscriber updated) {
        return new SubscriberAccount(updated, deliveryCount, lastDeliveryAt);
    }

    SubscriberAccount delivered(Instant at) {
        return new SubscriberAccount(subscriber, deliveryCount + 1, at);
    }
}
