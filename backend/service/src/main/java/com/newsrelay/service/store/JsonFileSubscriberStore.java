package com.newsrelay.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsrelay.core.model.Subscriber;
import com.newsrelay.core.model.SubscriberPreferences;
import com.newsrelay.core.util.JsonUtils;

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
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

public class JsonFileSubscriberStore implements SubscriberStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, SubscriberAccount> accounts = new ConcurrentHashMap<>();

    public JsonFileSubscriberStore(Path file, Clock clock) {
        this.file = Objects.requireNonNull(file, "file is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        loadIfPresent();
    }

    @Override
    public List<Subscriber> listEligible(Duration activityWindow) {
        Instant now = clock.instant();
        return accounts.values().stream()
                .map(SubscriberAccount::subscriber)
                .filter(subscriber -> subscriber.isEligible(now, activityWindow))
                .sorted(Comparator.comparing(Subscriber::id))
                .toList();
    }

    @Override
    public void incrementDeliveryCount(String subscriberId) {
        update(subscriberId, account -> account.delivered(clock.instant()));
    }

    // an existing subscriber keeps its delivery counter
    public void upsert(Subscriber subscriber) {
        lock.lock();
        try {
            accounts.merge(subscriber.id(), SubscriberAccount.fresh(subscriber),
                    (current, fresh) -> current.withSubscriber(subscriber));
            persist();
        } finally {
            lock.unlock();
        }
    }

    public void recordActivity(String subscriberId) {
        update(subscriberId, account -> {
            Subscriber current = account.subscriber();
            return account.withSubscriber(new Subscriber(
                    current.id(), current.notificationsEnabled(), clock.instant(), current.preferences()));
        });
    }

    public void setNotificationsEnabled(String subscriberId, boolean enabled) {
        update(subscriberId, account -> {
            Subscriber current = account.subscriber();
            return account.withSubscriber(new Subscriber(
                    current.id(), enabled, current.lastActivityAt(), current.preferences()));
        });
    }

    public void updatePreferences(String subscriberId, SubscriberPreferences preferences) {
        update(subscriberId, account -> {
            Subscriber current = account.subscriber();
            return account.withSubscriber(new Subscriber(
                    current.id(), current.notificationsEnabled(), current.lastActivityAt(), preferences));
        });
    }

    public Optional<SubscriberAccount> find(String subscriberId) {
        return Optional.ofNullable(accounts.get(subscriberId));
    }

    public int size() {
        return accounts.size();
    }

    private void update(String subscriberId, UnaryOperator<SubscriberAccount> change) {
        lock.lock();
        try {
            SubscriberAccount updated = accounts.computeIfPresent(subscriberId, (id, account) -> change.apply(account));
            if (updated == null) {
                throw new IllegalArgumentException("Unknown subscriber " + subscriberId);
            }
            persist();
        } finally {
            lock.unlock();
        }
    }

    private void loadIfPresent() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return;
            }
            try (InputStream in = Files.newInputStream(file)) {
                SubscriberFile loaded = MAPPER.readValue(in, SubscriberFile.class);
                if (loaded.subscribers() != null) {
                    for (SubscriberAccount account : loaded.subscribers()) {
                        accounts.put(account.subscriber().id(), account);
                    }
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading subscribers from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        List<SubscriberAccount> snapshot = new ArrayList<>(accounts.values());
        snapshot.sort(Comparator.comparing(account -> account.subscriber().id()));
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(file)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, new SubscriberFile(snapshot));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing subscribers to " + file, e);
        }
    }

    private record SubscriberFile(List<SubscriberAccount> subscribers) {
    }
}
