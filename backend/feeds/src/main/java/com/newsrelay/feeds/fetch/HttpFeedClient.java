package com.newsrelay.feeds.fetch;

import com.newsrelay.core.model.SourceDescriptor;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

public class HttpFeedClient implements FeedClient {
    private static final String ACCEPT = "application/rss+xml, application/atom+xml, application/xml;q=0.9, text/xml;q=0.9, */*;q=0.5";

    private final HttpClient httpClient;
    private final String userAgent;

    public HttpFeedClient(HttpClient httpClient, String userAgent) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent is required");
    }

    @Override
    public CompletableFuture<byte[]> fetch(SourceDescriptor source, Duration timeout) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(source.endpointUrl()))
                .GET()
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", ACCEPT)
                .build();

        // raw bytes so the XML parser applies the encoding declared in the prolog
        CompletableFuture<HttpResponse<byte[]>> exchange = httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        CompletableFuture<byte[]> body = exchange.thenApply(response -> {
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                throw new CompletionException(new FeedHttpStatusException(source.endpointUrl(), status));
            }
            return response.body();
        });
        // request timeout only covers the headers; cancelling the exchange aborts a body still streaming
        body.whenComplete((document, error) -> {
            if (body.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return body;
    }
}
