package com.newsrelay.feeds.fetch;

import java.io.IOException;

public class FeedHttpStatusException extends IOException {
    private final int statusCode;

    public FeedHttpStatusException(String url, int statusCode) {
        super("HTTP " + statusCode + " from " + url);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
