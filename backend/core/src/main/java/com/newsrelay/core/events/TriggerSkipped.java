package com.newsrelay.core.events;

import java.time.Instant;

public record TriggerSkipped(Instant timestamp, String triggerName, String reason) implements Event {
    @Override
    public String type() {
        return "TriggerSkipped";
    }
}
