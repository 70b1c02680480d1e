package com.newsrelay.service.support;

import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.SourceDescriptor;
import com.newsrelay.feeds.FetchSettings;
import com.newsrelay.feeds.NewsService;
import com.newsrelay.feeds.cache.InMemoryNewsCache;
import com.newsrelay.feeds.fetch.FeedClient;
import com.newsrelay.feeds.fetch.FetchOrchestrator;
import com.newsrelay.feeds.normalize.Normalizer;
import com.newsrelay.feeds.normalize.TextCleaner;
import com.newsrelay.feeds.registry.SourceRegistry;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public final class TestNews {
    private TestNews() {
    }

    /**
     * A NewsService whose sources are served from {@code documents}, keyed by endpoint URL.
     */
    public static NewsService newsService(List<SourceDescriptor> sources, Map<String, String> documents, EventBus bus, Clock clock) {
        FeedClient client = (source, timeout) -> {
            String document = documents.get(source.endpointUrl());
            return document == null
                    ? CompletableFuture.failedFuture(new IllegalStateException("unreachable " + source.endpointUrl()))
                    : CompletableFuture.completedFuture(document.getBytes(StandardCharsets.UTF_8));
        };
        return new NewsService(
                new SourceRegistry(sources),
                new FetchOrchestrator(client, bus, clock),
                new Normalizer(new TextCleaner(), clock),
                new InMemoryNewsCache(clock),
                clock,
                new FetchSettings(2, Duration.ofSeconds(5), Duration.ofMinutes(5), 3)
        );
    }

    public static String rss(String... titlesAndLinks) {
        StringBuilder xml = new StringBuilder("<rss version=\"2.0\"><channel><title>t</title>");
        for (int i = 0; i + 1 < titlesAndLinks.length; i += 2) {
            xml.append("<item><title>").append(titlesAndLinks[i]).append("</title><link>")
                    .append(titlesAndLinks[i + 1]).append("</link><description>About ")
                    .append(titlesAndLinks[i]).append("</description><pubDate>Mon, 02 Mar 2026 0")
                    .append(9 - i / 2).append(":00:00 GMT</pubDate></item>");
        }
        return xml.append("</channel></rss>").toString();
    }

    public static NewsItem item(String link, String title, String category, String summary) {
        Instant at = Instant.parse("2026-03-02T09:00:00Z");
        return new NewsItem(link, title, summary, at, "Cairo Daily", "Egypt", category, at);
    }
}
