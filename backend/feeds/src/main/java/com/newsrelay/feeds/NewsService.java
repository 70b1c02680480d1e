package com.newsrelay.feeds;

import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.RawEntry;
import com.newsrelay.core.model.SourceDescriptor;
import com.newsrelay.feeds.aggregate.Aggregator;
import com.newsrelay.feeds.cache.NewsCache;
import com.newsrelay.feeds.fetch.FetchOrchestrator;
import com.newsrelay.feeds.fetch.FetchResult;
import com.newsrelay.feeds.normalize.Normalizer;
import com.newsrelay.feeds.registry.SourceRegistry;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Query surface over the fetch, normalize, cache and aggregate pipeline. A source fetched within the
 * cache TTL is served from the cache while all of its items are still cached; otherwise it is fetched again.
 */
public class NewsService {
    private static final Logger LOGGER = Logger.getLogger(NewsService.class.getName());

    private final SourceRegistry registry;
    private final FetchOrchestrator orchestrator;
    private final Normalizer normalizer;
    private final NewsCache cache;
    private final Clock clock;
    private final FetchSettings settings;
    private final Map<String, SourceSnapshot> snapshots = new ConcurrentHashMap<>();

    public NewsService(
            SourceRegistry registry,
            FetchOrchestrator orchestrator,
            Normalizer normalizer,
            NewsCache cache,
            Clock clock,
            FetchSettings settings
    ) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
    }

    public List<NewsItem> latest(int limit) {
        return Aggregator.aggregate(collect(registry.all()), Optional.empty(), limit, settings.perSourceItemCap());
    }

    public List<NewsItem> byCategory(String category, int limit) {
        List<SourceDescriptor> sources = registry.sourcesFor(Optional.empty(), Optional.of(category));
        return Aggregator.aggregate(collect(sources), Optional.of(category), limit, settings.perSourceItemCap());
    }

    public SourceRegistry registry() {
        return registry;
    }

    public List<NewsItem> collect(List<SourceDescriptor> sources) {
        List<NewsItem> items = new ArrayList<>();
        List<SourceDescriptor> misses = new ArrayList<>();
        Instant now = clock.instant();
        for (SourceDescriptor source : sources) {
            Optional<List<NewsItem>> cached = cachedItems(source, now);
            if (cached.isPresent()) {
                items.addAll(cached.get());
            } else {
                misses.add(source);
            }
        }
        LOGGER.fine(() -> "Cache served " + (sources.size() - misses.size()) + " sources, fetching " + misses.size());
        if (misses.isEmpty()) {
            return items;
        }

        List<FetchResult> results = orchestrator.fetchAll(
                misses,
                settings.perSourceItemCap(),
                settings.concurrencyLimit(),
                settings.fetchTimeout()
        );
        for (FetchResult result : results) {
            if (result.succeeded()) {
                items.addAll(store(result.source(), result.entries()));
            }
        }
        return items;
    }

    private Optional<List<NewsItem>> cachedItems(SourceDescriptor source, Instant now) {
        SourceSnapshot snapshot = snapshots.get(source.endpointUrl());
        if (snapshot == null || !now.isBefore(snapshot.fetchedAt().plus(settings.cacheTtl()))) {
            return Optional.empty();
        }
        List<NewsItem> items = new ArrayList<>(snapshot.links().size());
        for (String link : snapshot.links()) {
            Optional<NewsItem> item = cache.get(link);
            if (item.isEmpty()) {
                return Optional.empty();
            }
            items.add(item.get());
        }
        return Optional.of(items);
    }

    private List<NewsItem> store(SourceDescriptor source, List<RawEntry> entries) {
        List<NewsItem> items = new ArrayList<>(entries.size());
        for (RawEntry entry : entries) {
            NewsItem item = normalizer.normalize(entry, source);
            if (item.canonicalLink().isEmpty()) {
                LOGGER.fine(() -> "Dropping entry without link from " + source.name());
                continue;
            }
            cache.put(item, settings.cacheTtl());
            items.add(item);
        }
        snapshots.put(source.endpointUrl(), new SourceSnapshot(
                items.stream().map(NewsItem::canonicalLink).toList(),
                clock.instant()
        ));
        return items;
    }

    private record SourceSnapshot(List<String> links, Instant fetchedAt) {
    }
}
