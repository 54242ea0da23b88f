package com.labvault.api.service;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A live entry of the {@link JobRegistry}: one cron trigger bound to one name.
 */
public final class JobHandle {

    private final String name;
    private final CronExpression cronExpression;
    private final ZoneId zone;
    private final Instant registeredAt;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicBoolean executing = new AtomicBoolean(false);
    private final AtomicLong runCount = new AtomicLong();
    private volatile Instant lastRunAt;
    private volatile ScheduledFuture<?> future;

    JobHandle(String name, CronExpression cronExpression, ZoneId zone, Instant registeredAt) {
        this.name = name;
        this.cronExpression = cronExpression;
        this.zone = zone;
        this.registeredAt = registeredAt;
    }

    /**
     * Wrap a task so that a fire racing with {@link #stop()} is dropped and run state is tracked.
     */
    Runnable wrap(Runnable task) {
        return () -> {
            if (stopped.get()) {
                return;
            }
            executing.set(true);
            lastRunAt = Instant.now();
            try {
                task.run();
            } finally {
                runCount.incrementAndGet();
                executing.set(false);
            }
        };
    }

    void attach(ScheduledFuture<?> future) {
        this.future = future;
    }

    /**
     * Cancel the trigger. A fire already in progress is allowed to finish; no new fire starts.
     */
    void stop() {
        stopped.set(true);
        ScheduledFuture<?> current = future;
        if (current != null) {
            current.cancel(false);
        }
    }

    public String getName() {
        return name;
    }

    public String getCronExpression() {
        return cronExpression.toString();
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public long getRunCount() {
        return runCount.get();
    }

    /**
     * True while the trigger is armed.
     */
    public boolean isRunning() {
        ScheduledFuture<?> current = future;
        return !stopped.get() && current != null && !current.isCancelled();
    }

    /**
     * True while the job body is executing.
     */
    public boolean isExecuting() {
        return executing.get();
    }

    public Instant nextExecution(Instant from) {
        ZonedDateTime next = cronExpression.next(from.atZone(zone));
        return next != null ? next.toInstant() : null;
    }
}
