package com.newsrelay.core.events;

import java.time.Instant;

public record FetchCycleCompleted(
        Instant timestamp,
        int sourceCount,
        int successes,
        int entryCount,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "FetchCycleCompleted";
    }
}
