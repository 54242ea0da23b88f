package com.labvault.api.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * In-process table of named recurring jobs. At most one live trigger exists per name:
 * registering under an existing name stops the old trigger once the new one is armed.
 * Mutations are serialized on a registry lock; job bodies run outside of it on the scheduler pool,
 * so a long backup never blocks registering or stopping another job.
 * Spring's cron trigger schedules the next fire only after the current one returns, which gives
 * single-flight execution per name.
 */
@Slf4j
@Component
public class JobRegistry {

    private final TaskScheduler taskScheduler;
    private final ZoneId zone;
    private final Map<String, JobHandle> jobs = new LinkedHashMap<>();
    private final Object lock = new Object();

    public JobRegistry(@Qualifier("jobTaskScheduler") TaskScheduler taskScheduler,
                       @Value("${backup.schedule.zone:UTC}") String zone) {
        this.taskScheduler = taskScheduler;
        this.zone = ZoneId.of(zone);
    }

    /**
     * Register a job under a name, replacing any existing one.
     *
     * @throws IllegalArgumentException if the cron expression is invalid or never fires; the existing job is kept
     */
    public JobHandle register(String name, String cronExpression, Runnable task) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Job name must not be blank");
        }
        CronExpression expression = CronExpression.parse(cronExpression);
        if (expression.next(ZonedDateTime.now(zone)) == null) {
            throw new IllegalArgumentException("Cron expression never fires: " + cronExpression);
        }

        synchronized (lock) {
            JobHandle handle = new JobHandle(name, expression, zone, Instant.now());
            ScheduledFuture<?> future = taskScheduler.schedule(handle.wrap(task),
                    new CronTrigger(cronExpression, zone));
            if (future == null) {
                throw new IllegalArgumentException("Cron expression never fires: " + cronExpression);
            }
            handle.attach(future);

            JobHandle previous = jobs.put(name, handle);
            if (previous != null) {
                previous.stop();
                log.info("Replaced job '{}' (was {})", name, previous.getCronExpression());
            }

            log.info("Scheduled job '{}' with expression: {} ({})", name, cronExpression, zone);
            return handle;
        }
    }

    /**
     * Stop and remove a job.
     *
     * @return false if no job was registered under the name
     */
    public boolean stop(String name) {
        synchronized (lock) {
            JobHandle handle = jobs.remove(name);
            if (handle == null) {
                log.debug("No job registered under '{}'", name);
                return false;
            }
            handle.stop();
            log.info("Stopped job: {}", name);
            return true;
        }
    }

    public boolean isActive(String name) {
        synchronized (lock) {
            JobHandle handle = jobs.get(name);
            return handle != null && handle.isRunning();
        }
    }

    public Optional<JobHandle> find(String name) {
        synchronized (lock) {
            return Optional.ofNullable(jobs.get(name));
        }
    }

    /**
     * Snapshot of the registered jobs, in registration order.
     */
    public Map<String, JobHandle> listActive() {
        synchronized (lock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(jobs));
        }
    }

    public int size() {
        synchronized (lock) {
            return jobs.size();
        }
    }

    /**
     * Stop every job and leave the registry empty. Runs on context shutdown, before the scheduler
     * pool itself is destroyed.
     */
    @PreDestroy
    public void stopAll() {
        List<String> names;
        synchronized (lock) {
            names = new ArrayList<>(jobs.keySet());
            for (JobHandle handle : jobs.values()) {
                handle.stop();
            }
            jobs.clear();
        }
        if (!names.isEmpty()) {
            log.info("Stopped {} scheduled jobs: {}", names.size(), names);
        }
    }
}
