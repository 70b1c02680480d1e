package com.newsrelay.service.api;

import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.events.AlertRaised;
import com.newsrelay.core.events.BroadcastCompleted;
import com.newsrelay.core.events.Event;
import com.newsrelay.core.events.FetchCycleCompleted;
import com.newsrelay.core.events.SourceFetched;
import com.newsrelay.core.events.TriggerSkipped;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

public final class StatusTracker {
    private final Clock clock;
    private final LongAdder eventsTotal = new LongAdder();
    private final LongAdder skippedTriggers = new LongAdder();
    private final ArrayDeque<Instant> recentEvents = new ArrayDeque<>();
    private final Object recentLock = new Object();
    private final AtomicReference<FetchCycleCompleted> lastFetchCycle = new AtomicReference<>();
    private final AtomicReference<BroadcastCompleted> lastBroadcast = new AtomicReference<>();
    private final ConcurrentHashMap<String, SourceHealth> sources = new ConcurrentHashMap<>();

    public StatusTracker(EventBus eventBus, Clock clock) {
        this.clock = clock;
        eventBus.subscribeAll(this::onAnyEvent);
        eventBus.subscribe(FetchCycleCompleted.class, lastFetchCycle::set);
        eventBus.subscribe(BroadcastCompleted.class, lastBroadcast::set);
        eventBus.subscribe(TriggerSkipped.class, event -> skippedTriggers.increment());
        eventBus.subscribe(SourceFetched.class, this::onSourceFetched);
        eventBus.subscribe(AlertRaised.class, this::onAlert);
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("eventsEmittedTotal", eventsTotal.longValue());
        status.put("recentEventsPerMinute", recentEventsPerMinute());
        status.put("skippedTriggers", skippedTriggers.longValue());
        FetchCycleCompleted fetch = lastFetchCycle.get();
        if (fetch != null) {
            status.put("lastFetchCycle", Map.of(
                    "at", fetch.timestamp().toString(),
                    "sources", fetch.sourceCount(),
                    "successes", fetch.successes(),
                    "entries", fetch.entryCount(),
                    "durationMillis", fetch.durationMillis()
            ));
        }
        BroadcastCompleted broadcast = lastBroadcast.get();
        if (broadcast != null) {
            status.put("lastBroadcast", Map.of(
                    "at", broadcast.timestamp().toString(),
                    "successes", broadcast.successes(),
                    "failures", broadcast.failures(),
                    "durationMillis", broadcast.durationMillis()
            ));
        }
        Map<String, Object> perSource = new TreeMap<>();
        sources.forEach((name, health) -> perSource.put(name, health.toMap()));
        status.put("sources", perSource);
        return status;
    }

    private void onAnyEvent(Event event) {
        eventsTotal.increment();
        Instant now = clock.instant();
        synchronized (recentLock) {
            recentEvents.addLast(now);
            dropOlderThanAMinute(now);
        }
    }

    private int recentEventsPerMinute() {
        synchronized (recentLock) {
            dropOlderThanAMinute(clock.instant());
            return recentEvents.size();
        }
    }

    private void dropOlderThanAMinute(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentEvents.isEmpty() && recentEvents.peekFirst().isBefore(threshold)) {
            recentEvents.removeFirst();
        }
    }

    private void onSourceFetched(SourceFetched event) {
        sources.compute(event.source(), (name, current) ->
                (current == null ? SourceHealth.EMPTY : current).succeeded(event.timestamp(), event.entryCount()));
    }

    private void onAlert(AlertRaised event) {
        if (!"fetch".equals(event.category()) || event.details() == null) {
            return;
        }
        if (!(event.details().get("source") instanceof String source) || source.isBlank()) {
            return;
        }
        sources.compute(source, (name, current) ->
                (current == null ? SourceHealth.EMPTY : current).failed(event.timestamp(), event.message()));
    }

    private record SourceHealth(Instant lastSuccessAt, Integer lastEntryCount, Instant lastFailureAt, String lastError) {
        private static final SourceHealth EMPTY = new SourceHealth(null, null, null, null);

        private SourceHealth succeeded(Instant at, int entryCount) {
            return new SourceHealth(at, entryCount, lastFailureAt, null);
        }

        private SourceHealth failed(Instant at, String error) {
            return new SourceHealth(lastSuccessAt, lastEntryCount, at, error);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("lastSuccessAt", lastSuccessAt == null ? null : lastSuccessAt.toString());
            map.put("lastEntryCount", lastEntryCount);
            map.put("lastFailureAt", lastFailureAt == null ? null : lastFailureAt.toString());
            map.put("lastError", lastError);
            return map;
        }
    }
}
