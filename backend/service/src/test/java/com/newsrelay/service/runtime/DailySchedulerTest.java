package com.newsrelay.service.runtime;

import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.events.AlertRaised;
import com.newsrelay.core.events.TriggerSkipped;
import com.newsrelay.service.support.EventCapture;
import com.newsrelay.service.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DailySchedulerTest {
    private static final Instant NOW = Instant.parse("2026-01-15T05:00:00Z");

    private final EventBus bus = new EventBus();
    private final EventCapture capture = new EventCapture(bus);
    private final MutableClock clock = new MutableClock(NOW, ZoneOffset.UTC);

    @Test
    void firingWhileRunningIsDroppedAndReported() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();
        DailyScheduler scheduler = scheduler(trigger(LocalTime.of(9, 0), true), () -> {
            runs.incrementAndGet();
            entered.countDown();
            await(release);
        });
        try {
            assertTrue(scheduler.fire());
            assertTrue(entered.await(2, TimeUnit.SECONDS));
            assertTrue(scheduler.isRunning());

            assertFalse(scheduler.fire());
            TriggerSkipped skipped = capture.byType(TriggerSkipped.class).get(0);
            assertEquals("daily-news", skipped.triggerName());
            assertEquals("previous run still in progress", skipped.reason());

            release.countDown();
            waitUntil(() -> scheduler.completedRuns() == 1);
            assertFalse(scheduler.isRunning());

            assertTrue(scheduler.fire());
            waitUntil(() -> scheduler.completedRuns() == 2);
            assertEquals(2, runs.get());
        } finally {
            release.countDown();
            scheduler.shutdown();
        }
    }

    @Test
    void failedRunRaisesAlertAndReturnsToIdle() throws Exception {
        DailyScheduler scheduler = scheduler(trigger(LocalTime.of(9, 0), true), () -> {
            throw new IllegalStateException("news unavailable");
        });
        try {
            assertTrue(scheduler.fire());
            waitUntil(() -> scheduler.completedRuns() == 1);

            assertFalse(scheduler.isRunning());
            AlertRaised alert = capture.byType(AlertRaised.class).get(0);
            assertEquals("scheduler", alert.category());
            assertTrue(alert.message().contains("news unavailable"));
            assertEquals("daily-news", alert.details().get("trigger"));
            assertTrue(scheduler.fire());
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void nextFireTimeIsLaterTodayOrTomorrow() {
        DailyScheduler scheduler = scheduler(trigger(LocalTime.of(9, 0), true), () -> { });

        assertEquals(ZonedDateTime.parse("2026-01-15T09:00:00Z"), scheduler.nextFireTime(NOW));
        assertEquals(ZonedDateTime.parse("2026-01-16T09:00:00Z"), scheduler.nextFireTime(Instant.parse("2026-01-15T09:00:00Z")));
        assertEquals(ZonedDateTime.parse("2026-01-16T09:00:00Z"), scheduler.nextFireTime(Instant.parse("2026-01-15T12:30:00Z")));
    }

    @Test
    void nextFireTimeFollowsTriggerZone() {
        ZoneId cairo = ZoneId.of("Africa/Cairo");
        DailyScheduler scheduler = scheduler(
                new DailyScheduler.DailyTrigger("daily-news", LocalTime.of(8, 0), cairo, true), () -> { });

        ZonedDateTime next = scheduler.nextFireTime(NOW);

        assertEquals(cairo, next.getZone());
        assertEquals(Instant.parse("2026-01-15T06:00:00Z"), next.toInstant());
    }

    @Test
    void armedTriggerFiresAtWallClockTime() throws Exception {
        clock.setInstant(Instant.parse("2026-01-15T08:59:59.850Z"));
        AtomicInteger runs = new AtomicInteger();
        DailyScheduler scheduler = scheduler(trigger(LocalTime.of(9, 0), true), runs::incrementAndGet);
        try {
            scheduler.start();
            waitUntil(() -> runs.get() >= 1);
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void disabledTriggerNeverFiresOnItsOwn() throws Exception {
        clock.setInstant(Instant.parse("2026-01-15T08:59:59.950Z"));
        AtomicInteger runs = new AtomicInteger();
        DailyScheduler scheduler = scheduler(trigger(LocalTime.of(9, 0), false), runs::incrementAndGet);
        try {
            scheduler.start();
            Thread.sleep(300);
            assertEquals(0, runs.get());
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void maintenanceTasksKeepRunningAfterAFailure() throws Exception {
        AtomicInteger purges = new AtomicInteger();
        DailyScheduler scheduler = new DailyScheduler(
                trigger(LocalTime.of(9, 0), false),
                () -> { },
                List.of(new DailyScheduler.MaintenanceTask("cache-purge", Duration.ofMillis(20), () -> {
                    if (purges.incrementAndGet() == 1) {
                        throw new IllegalStateException("disk full");
                    }
                })),
                bus,
                clock
        );
        try {
            scheduler.start();
            waitUntil(() -> purges.get() >= 3);
        } finally {
            scheduler.shutdown();
        }
    }

    private DailyScheduler scheduler(DailyScheduler.DailyTrigger trigger, Runnable job) {
        return new DailyScheduler(trigger, job, List.of(), bus, clock);
    }

    private static DailyScheduler.DailyTrigger trigger(LocalTime time, boolean enabled) {
        return new DailyScheduler.DailyTrigger("daily-news", time, ZoneOffset.UTC, enabled);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 3s");
            }
            Thread.sleep(10);
        }
    }
}
