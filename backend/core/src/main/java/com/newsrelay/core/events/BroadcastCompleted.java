package com.newsrelay.core.events;

import java.time.Instant;

public record BroadcastCompleted(
        Instant timestamp,
        int successes,
        int failures,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "BroadcastCompleted";
    }
}
