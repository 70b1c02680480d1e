package com.newsrelay.core.events;

import java.time.Instant;

public record BroadcastStarted(Instant timestamp, int recipients, int itemCount) implements Event {
    @Override
    public String type() {
        return "BroadcastStarted";
    }
}
