package com.newsrelay.core.events;

import java.time.Instant;

public record FetchCycleStarted(Instant timestamp, int sourceCount, int concurrencyLimit) implements Event {
    @Override
    public String type() {
        return "FetchCycleStarted";
    }
}
