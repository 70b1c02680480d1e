package com.newsrelay.feeds.fetch;

public class MalformedFeedException extends Exception {
    public MalformedFeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
