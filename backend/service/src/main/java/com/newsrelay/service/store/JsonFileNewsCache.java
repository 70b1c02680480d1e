package com.newsrelay.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsrelay.core.model.CacheEntry;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.util.JsonUtils;
import com.newsrelay.feeds.cache.NewsCache;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

public class JsonFileNewsCache implements NewsCache {
    private static final Logger LOGGER = Logger.getLogger(JsonFileNewsCache.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();

    public JsonFileNewsCache(Path file, Clock clock) {
        this.file = Objects.requireNonNull(file, "file is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        loadIfPresent();
    }

    @Override
    public Optional<NewsItem> get(String canonicalLink) {
        CacheEntry entry = entries.get(canonicalLink);
        if (entry == null || entry.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.item());
    }

    @Override
    public void put(NewsItem item, Duration ttl) {
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative");
        }
        lock.lock();
        try {
            entries.put(item.canonicalLink(), CacheEntry.of(item, clock.instant(), ttl));
            persist();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int purgeExpired() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int before = entries.size();
            entries.values().removeIf(entry -> entry.isExpired(now));
            int removed = before - entries.size();
            if (removed > 0) {
                persist();
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        return entries.size();
    }

    private void loadIfPresent() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return;
            }
            try (InputStream in = Files.newInputStream(file)) {
                CacheFile loaded = MAPPER.readValue(in, CacheFile.class);
                Instant now = clock.instant();
                if (loaded.entries() != null) {
                    loaded.entries().stream()
                            .filter(entry -> !entry.isExpired(now))
                            .forEach(entry -> entries.put(entry.item().canonicalLink(), entry));
                }
                LOGGER.info("Restored " + entries.size() + " cached items from " + file);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading news cache from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        List<CacheEntry> snapshot = new ArrayList<>(entries.values());
        snapshot.sort(Comparator.comparing(CacheEntry::cachedAt).thenComparing(entry -> entry.item().canonicalLink()));
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(file)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, new CacheFile(snapshot));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing news cache to " + file, e);
        }
    }

    private record CacheFile(List<CacheEntry> entries) {
    }
}
