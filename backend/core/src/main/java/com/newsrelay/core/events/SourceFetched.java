package com.newsrelay.core.events;

import java.time.Instant;

public record SourceFetched(Instant timestamp, String source, String url, int entryCount) implements Event {
    @Override
    public String type() {
        return "SourceFetched";
    }
}
