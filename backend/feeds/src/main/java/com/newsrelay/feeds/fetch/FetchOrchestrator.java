package com.newsrelay.feeds.fetch;

import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.events.AlertRaised;
import com.newsrelay.core.events.FetchCycleCompleted;
import com.newsrelay.core.events.FetchCycleStarted;
import com.newsrelay.core.events.SourceFetched;
import com.newsrelay.core.model.RawEntry;
import com.newsrelay.core.model.SourceDescriptor;

import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

public class FetchOrchestrator {
    private static final Logger LOGGER = Logger.getLogger(FetchOrchestrator.class.getName());
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final FeedClient feedClient;
    private final EventBus eventBus;
    private final Clock clock;

    public FetchOrchestrator(FeedClient feedClient, EventBus eventBus, Clock clock) {
        this.feedClient = Objects.requireNonNull(feedClient, "feedClient is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public List<FetchResult> fetchAll(
            List<SourceDescriptor> sources,
            int perSourceCap,
            int concurrencyLimit,
            Duration timeout
    ) {
        if (perSourceCap <= 0) {
            throw new IllegalArgumentException("perSourceCap must be positive");
        }
        if (concurrencyLimit <= 0) {
            throw new IllegalArgumentException("concurrencyLimit must be positive");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }

        Instant startedAt = clock.instant();
        eventBus.publish(new FetchCycleStarted(startedAt, sources.size(), concurrencyLimit));
        if (sources.isEmpty()) {
            eventBus.publish(new FetchCycleCompleted(clock.instant(), 0, 0, 0, 0));
            return List.of();
        }

        // each worker blocks on its own fetch, so the pool size is the in-flight bound
        ExecutorService workers = Executors.newFixedThreadPool(
                Math.min(concurrencyLimit, sources.size()),
                workerThreads()
        );
        List<FetchResult> results = new ArrayList<>(sources.size());
        try {
            List<Future<FetchResult>> pending = new ArrayList<>(sources.size());
            for (SourceDescriptor source : sources) {
                pending.add(workers.submit(() -> fetchOne(source, perSourceCap, timeout)));
            }
            for (int i = 0; i < pending.size(); i++) {
                results.add(awaitResult(pending.get(i), sources.get(i)));
            }
        } finally {
            workers.shutdownNow();
        }

        int successes = (int) results.stream().filter(FetchResult::succeeded).count();
        int entryCount = results.stream().mapToInt(result -> result.entries().size()).sum();
        long durationMillis = Duration.between(startedAt, clock.instant()).toMillis();
        eventBus.publish(new FetchCycleCompleted(clock.instant(), sources.size(), successes, entryCount, durationMillis));
        LOGGER.info("Fetch cycle finished: " + successes + "/" + sources.size() + " sources, " + entryCount + " entries");
        return results;
    }

    private FetchResult fetchOne(SourceDescriptor source, int perSourceCap, Duration timeout) {
        CompletableFuture<byte[]> body = null;
        try {
            body = feedClient.fetch(source, timeout);
            byte[] document = body.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            List<RawEntry> entries = FeedParser.parse(document);
            List<RawEntry> capped = entries.size() > perSourceCap ? entries.subList(0, perSourceCap) : entries;
            eventBus.publish(new SourceFetched(clock.instant(), source.name(), source.endpointUrl(), capped.size()));
            return FetchResult.success(source, capped);
        } catch (TimeoutException e) {
            body.cancel(true);
            return failure(source, FetchFailure.Kind.TIMEOUT, "timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable root = rootCause(e);
            return failure(source, classify(root), rootMessage(root));
        } catch (MalformedFeedException e) {
            return failure(source, FetchFailure.Kind.MALFORMED_FEED, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (body != null) {
                body.cancel(true);
            }
            return failure(source, FetchFailure.Kind.NETWORK, "interrupted");
        } catch (RuntimeException e) {
            return failure(source, FetchFailure.Kind.NETWORK, rootMessage(rootCause(e)));
        }
    }

    private FetchResult awaitResult(Future<FetchResult> future, SourceDescriptor source) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(source, FetchFailure.Kind.NETWORK, "interrupted");
        } catch (ExecutionException e) {
            return failure(source, FetchFailure.Kind.NETWORK, rootMessage(rootCause(e)));
        }
    }

    private FetchResult failure(SourceDescriptor source, FetchFailure.Kind kind, String message) {
        LOGGER.warning("Fetch failed for " + source.name() + " (" + source.endpointUrl() + "): " + kind + " " + message);
        eventBus.publish(new AlertRaised(
                clock.instant(),
                "fetch",
                "Feed fetch failed for " + source.name() + ": " + message,
                Map.of("source", source.name(), "url", source.endpointUrl(), "kind", kind.name())
        ));
        return FetchResult.failed(source, kind, message);
    }

    private static FetchFailure.Kind classify(Throwable root) {
        if (root instanceof HttpTimeoutException || root instanceof TimeoutException) {
            return FetchFailure.Kind.TIMEOUT;
        }
        if (root instanceof FeedHttpStatusException) {
            return FetchFailure.Kind.HTTP_STATUS;
        }
        return FetchFailure.Kind.NETWORK;
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root;
    }

    private static String rootMessage(Throwable root) {
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }

    private static ThreadFactory workerThreads() {
        int pool = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "feed-fetch-" + pool + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
