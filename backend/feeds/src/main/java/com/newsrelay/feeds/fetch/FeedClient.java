package com.newsrelay.feeds.fetch;

import com.newsrelay.core.model.SourceDescriptor;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Transport for one feed document. Cancelling the returned future must release the underlying
 * connection; the caller owns timeout enforcement and cancels on expiry.
 */
public interface FeedClient {
    CompletableFuture<byte[]> fetch(SourceDescriptor source, Duration timeout);
}
