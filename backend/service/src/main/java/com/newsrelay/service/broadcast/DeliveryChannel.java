package com.newsrelay.service.broadcast;

import com.newsrelay.core.model.DeliveryOutcome;

/**
 * Transport that hands one rendered message to one subscriber.
 */
public interface DeliveryChannel {
    DeliveryOutcome send(String subscriberId, String message) throws DeliveryException;
}
