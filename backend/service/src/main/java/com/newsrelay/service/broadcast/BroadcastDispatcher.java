package com.newsrelay.service.broadcast;

import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.events.BroadcastCompleted;
import com.newsrelay.core.events.BroadcastStarted;
import com.newsrelay.core.model.DeliveryOutcome;
import com.newsrelay.core.model.DeliveryRecord;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.Subscriber;
import com.newsrelay.feeds.NewsService;
import com.newsrelay.service.store.SubscriberStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

public class BroadcastDispatcher {
    private static final Logger LOGGER = Logger.getLogger(BroadcastDispatcher.class.getName());

    private final NewsService newsService;
    private final SubscriberStore subscriberStore;
    private final DeliveryChannel channel;
    private final DigestRenderer renderer;
    private final EventBus eventBus;
    private final Clock clock;
    private final BroadcastSettings settings;

    public BroadcastDispatcher(
            NewsService newsService,
            SubscriberStore subscriberStore,
            DeliveryChannel channel,
            DigestRenderer renderer,
            EventBus eventBus,
            Clock clock,
            BroadcastSettings settings
    ) {
        this.newsService = Objects.requireNonNull(newsService, "newsService is required");
        this.subscriberStore = Objects.requireNonNull(subscriberStore, "subscriberStore is required");
        this.channel = Objects.requireNonNull(channel, "channel is required");
        this.renderer = Objects.requireNonNull(renderer, "renderer is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
    }

    public List<DeliveryRecord> broadcast() {
        Instant startedAt = clock.instant();
        List<Subscriber> recipients = subscriberStore.listEligible(settings.activityWindow());
        List<NewsItem> digest = recipients.isEmpty() ? List.of() : newsService.latest(settings.digestSize());
        eventBus.publish(new BroadcastStarted(startedAt, recipients.size(), digest.size()));
        LOGGER.info("Broadcasting " + digest.size() + " items to " + recipients.size() + " subscribers");

        List<DeliveryRecord> records = recipients.isEmpty() ? List.of() : deliverAll(recipients, digest);

        int successes = (int) records.stream().filter(DeliveryRecord::succeeded).count();
        int failures = records.size() - successes;
        long durationMillis = Duration.between(startedAt, clock.instant()).toMillis();
        eventBus.publish(new BroadcastCompleted(clock.instant(), successes, failures, durationMillis));
        LOGGER.info("Broadcast finished: " + successes + " delivered, " + failures + " failed");
        return records;
    }

    private List<DeliveryRecord> deliverAll(List<Subscriber> recipients, List<NewsItem> digest) {
        ExecutorService workers = Executors.newFixedThreadPool(
                Math.min(settings.deliveryConcurrency(), recipients.size()),
                daemonThreads("broadcast-worker")
        );
        // sends run on their own threads so a hung transport can be abandoned after the timeout
        ExecutorService sends = Executors.newCachedThreadPool(daemonThreads("broadcast-send"));
        try {
            List<Future<DeliveryRecord>> pending = new ArrayList<>(recipients.size());
            for (Subscriber subscriber : recipients) {
                pending.add(workers.submit(() -> deliverOne(subscriber, digest, sends)));
            }
            List<DeliveryRecord> records = new ArrayList<>(recipients.size());
            for (int i = 0; i < pending.size(); i++) {
                records.add(awaitRecord(pending.get(i), recipients.get(i)));
            }
            return records;
        } finally {
            workers.shutdownNow();
            sends.shutdownNow();
        }
    }

    private DeliveryRecord deliverOne(Subscriber subscriber, List<NewsItem> digest, ExecutorService sends) {
        Future<DeliveryOutcome> attempt = null;
        try {
            String message = renderer.render(subscriber, digest);
            attempt = sends.submit(() -> channel.send(subscriber.id(), message));
            DeliveryOutcome outcome = attempt.get(settings.deliveryTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (outcome != DeliveryOutcome.SUCCESS) {
                return failed(subscriber, "channel reported " + outcome, null);
            }
        } catch (TimeoutException e) {
            attempt.cancel(true);
            return failed(subscriber, "timed out after " + settings.deliveryTimeout().toMillis() + "ms", null);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return failed(subscriber, describe(cause), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (attempt != null) {
                attempt.cancel(true);
            }
            return failed(subscriber, "interrupted", e);
        } catch (RuntimeException e) {
            return failed(subscriber, describe(e), e);
        }

        DeliveryRecord record = DeliveryRecord.success(subscriber.id(), clock.instant());
        try {
            subscriberStore.incrementDeliveryCount(subscriber.id());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Delivered to " + subscriber.id() + " but could not update its delivery count", e);
        }
        return record;
    }

    private DeliveryRecord awaitRecord(Future<DeliveryRecord> future, Subscriber subscriber) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(subscriber, "interrupted", e);
        } catch (ExecutionException e) {
            return failed(subscriber, describe(e.getCause()), e.getCause());
        }
    }

    private DeliveryRecord failed(Subscriber subscriber, String reason, Throwable cause) {
        LOGGER.log(Level.WARNING, "Delivery to " + subscriber.id() + " failed: " + reason, cause);
        return DeliveryRecord.failure(subscriber.id(), clock.instant(), reason);
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
