package com.newsrelay.service.runtime;

import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.events.AlertRaised;
import com.newsrelay.core.events.TriggerSkipped;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

public class DailyScheduler {
    private static final Logger LOGGER = Logger.getLogger(DailyScheduler.class.getName());

    private final DailyTrigger trigger;
    private final Runnable job;
    private final List<MaintenanceTask> maintenanceTasks;
    private final EventBus eventBus;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger completedRuns = new AtomicInteger();
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor(daemonThreads("scheduler-timer"));
    private final ExecutorService jobExecutor = Executors.newCachedThreadPool(daemonThreads("scheduler-job"));

    public DailyScheduler(
            DailyTrigger trigger,
            Runnable job,
            List<MaintenanceTask> maintenanceTasks,
            EventBus eventBus,
            Clock clock
    ) {
        this.trigger = Objects.requireNonNull(trigger, "trigger is required");
        this.job = Objects.requireNonNull(job, "job is required");
        this.maintenanceTasks = List.copyOf(maintenanceTasks);
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public void start() {
        if (trigger.enabled()) {
            armNext();
        } else {
            LOGGER.info("Daily trigger '" + trigger.name() + "' is disabled");
        }
        for (MaintenanceTask task : maintenanceTasks) {
            long intervalMillis = task.interval().toMillis();
            timerExecutor.scheduleAtFixedRate(() -> runMaintenance(task), intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        }
    }

    public boolean fire() {
        if (!running.compareAndSet(false, true)) {
            LOGGER.info("Skipping '" + trigger.name() + "': previous run still in progress");
            eventBus.publish(new TriggerSkipped(clock.instant(), trigger.name(), "previous run still in progress"));
            return false;
        }
        try {
            jobExecutor.execute(this::runJob);
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
        return true;
    }

    public ZonedDateTime nextFireTime(Instant now) {
        ZonedDateTime current = now.atZone(trigger.zone());
        ZonedDateTime candidate = current.toLocalDate().atTime(trigger.time()).atZone(trigger.zone());
        if (!candidate.isAfter(current)) {
            candidate = current.toLocalDate().plusDays(1).atTime(trigger.time()).atZone(trigger.zone());
        }
        return candidate;
    }

    public boolean isRunning() {
        return running.get();
    }

    public int completedRuns() {
        return completedRuns.get();
    }

    public DailyTrigger trigger() {
        return trigger;
    }

    public void shutdown() {
        timerExecutor.shutdownNow();
        jobExecutor.shutdown();
        try {
            if (!jobExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                jobExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            jobExecutor.shutdownNow();
        }
    }

    private void armNext() {
        ZonedDateTime next = nextFireTime(clock.instant());
        long delayMillis = Math.max(0, Duration.between(clock.instant(), next.toInstant()).toMillis());
        LOGGER.info("Next '" + trigger.name() + "' run at " + next);
        timerExecutor.schedule(this::onTrigger, delayMillis, TimeUnit.MILLISECONDS);
    }

    private void onTrigger() {
        try {
            fire();
        } finally {
            if (!timerExecutor.isShutdown()) {
                armNext();
            }
        }
    }

    private void runJob() {
        try {
            job.run();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Run of '" + trigger.name() + "' failed", e);
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    "scheduler",
                    "Scheduled run failed: " + trigger.name() + " - " + e.getMessage(),
                    Map.of("trigger", trigger.name())
            ));
        } finally {
            running.set(false);
            completedRuns.incrementAndGet();
        }
    }

    private void runMaintenance(MaintenanceTask task) {
        try {
            task.action().run();
        } catch (RuntimeException e) {
            // an exception would cancel the fixed-rate schedule
            LOGGER.log(Level.WARNING, "Maintenance task '" + task.name() + "' failed", e);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public record DailyTrigger(String name, LocalTime time, ZoneId zone, boolean enabled) {
        public DailyTrigger {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(time, "time is required");
            Objects.requireNonNull(zone, "zone is required");
        }
    }

    public record MaintenanceTask(String name, Duration interval, Runnable action) {
        public MaintenanceTask {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(interval, "interval is required");
            Objects.requireNonNull(action, "action is required");
            if (interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException("interval must be positive");
            }
        }
    }
}
