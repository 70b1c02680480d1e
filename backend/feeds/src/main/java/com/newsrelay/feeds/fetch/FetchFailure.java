package com.newsrelay.feeds.fetch;

import java.util.Objects;

public record FetchFailure(Kind kind, String message) {
    public FetchFailure {
        Objects.requireNonNull(kind, "kind is required");
        message = message == null ? kind.name() : message;
    }

    public enum Kind {
        NETWORK,
        TIMEOUT,
        HTTP_STATUS,
        MALFORMED_FEED
    }
}
