package com.newsrelay.service;

import com.newsrelay.core.bus.EventBus;
import com.newsrelay.feeds.NewsService;
import com.newsrelay.feeds.fetch.FetchOrchestrator;
import com.newsrelay.feeds.fetch.HttpFeedClient;
import com.newsrelay.feeds.normalize.Normalizer;
import com.newsrelay.feeds.normalize.TextCleaner;
import com.newsrelay.feeds.registry.SourceRegistry;
import com.newsrelay.service.api.ApiServer;
import com.newsrelay.service.api.StatusTracker;
import com.newsrelay.service.broadcast.BroadcastDispatcher;
import com.newsrelay.service.broadcast.BroadcastSettings;
import com.newsrelay.service.broadcast.DigestRenderer;
import com.newsrelay.service.broadcast.OutboxDeliveryChannel;
import com.newsrelay.service.config.ConfigLoader;
import com.newsrelay.service.config.RelayConfig;
import com.newsrelay.service.http.HttpClientFactory;
import com.newsrelay.service.runtime.DailyScheduler;
import com.newsrelay.service.store.JsonFileNewsCache;
import com.newsrelay.service.store.JsonFileSubscriberStore;
import com.newsrelay.service.store.JsonlEventStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Path configDir = Path.of("config");
        Path dataDir = Path.of("data");
        Path eventLogFile = Path.of("logs/events.jsonl");
        Clock clock = Clock.systemUTC();

        RelayConfig config = ConfigLoader.loadRelay(configDir);
        SourceRegistry registry = ConfigLoader.loadSources(configDir);
        if (registry.isEmpty()) {
            LOGGER.warning("No news sources configured; digests will report that no news is available");
        }

        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(eventLogFile);
        eventBus.subscribeAll(eventStore::append);
        StatusTracker statusTracker = new StatusTracker(eventBus, clock);

        JsonFileNewsCache cache = new JsonFileNewsCache(dataDir.resolve("news-cache.json"), clock);
        HttpFeedClient feedClient = new HttpFeedClient(HttpClientFactory.forFeeds(config.fetchTimeout()), config.userAgent());
        NewsService newsService = new NewsService(
                registry,
                new FetchOrchestrator(feedClient, eventBus, clock),
                new Normalizer(new TextCleaner(config.summaryMaxLength()), clock),
                cache,
                clock,
                config.fetchSettings()
        );

        JsonFileSubscriberStore subscribers = new JsonFileSubscriberStore(dataDir.resolve("subscribers.json"), clock);
        BroadcastDispatcher dispatcher = new BroadcastDispatcher(
                newsService,
                subscribers,
                new OutboxDeliveryChannel(dataDir.resolve("outbox.jsonl"), clock),
                new DigestRenderer(),
                eventBus,
                clock,
                new BroadcastSettings(config.digestSize(), config.activityWindow(), config.deliveryTimeout(), config.deliveryConcurrency())
        );

        DailyScheduler scheduler = new DailyScheduler(
                new DailyScheduler.DailyTrigger("daily-news", config.dailySendTime(), config.zone(), config.scheduledNewsEnabled()),
                dispatcher::broadcast,
                List.of(new DailyScheduler.MaintenanceTask("cache-purge", config.cachePurgeInterval(), () -> {
                    int removed = cache.purgeExpired();
                    LOGGER.fine(() -> "Purged " + removed + " expired cache entries");
                })),
                eventBus,
                clock
        );
        ApiServer apiServer = new ApiServer(
                config.apiPort(),
                newsService,
                eventStore,
                statusTracker,
                scheduler,
                clock,
                config.aggregateLimit()
        );

        scheduler.start();
        apiServer.start();
        LOGGER.info("News relay started with " + registry.size() + " sources and " + subscribers.size() + " subscribers");

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            apiServer.stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading logging.properties", e);
        }
    }
}
