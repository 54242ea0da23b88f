package com.labvault.api.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.util.ErrorHandler;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for named recurring jobs and for snapshot work.
 * Jobs fire on the scheduler pool; the snapshot body runs on a separate pool so it can be
 * bounded by a timeout without tying up a scheduler thread indefinitely.
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    @Value("${jobs.scheduler.pool-size:4}")
    private int schedulerPoolSize;

    @Value("${backup.executor.pool-size:2}")
    private int snapshotPoolSize;

    @Bean(name = "jobTaskScheduler", destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler jobTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();

        // Several named jobs may be due at the same time; each gets its own thread
        scheduler.setPoolSize(schedulerPoolSize);
        scheduler.setThreadNamePrefix("job-scheduler-");

        // Cancelled triggers must not linger in the queue
        scheduler.setRemoveOnCancelPolicy(true);

        // Let a running backup finish its write before the pool goes away
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(60);

        scheduler.setErrorHandler(new JobErrorHandler());
        scheduler.initialize();

        log.info("Job scheduler initialized: poolSize={}", schedulerPoolSize);
        return scheduler;
    }

    @Bean(name = "snapshotTaskExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor snapshotTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(snapshotPoolSize);
        executor.setMaxPoolSize(snapshotPoolSize * 2);
        executor.setQueueCapacity(20);
        executor.setThreadNamePrefix("backup-snapshot-");
        executor.setKeepAliveSeconds(60);
        executor.setAllowCoreThreadTimeOut(true);

        // Run in the caller's thread rather than dropping a backup when saturated
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        log.info("Snapshot executor initialized: corePoolSize={}, maxPoolSize={}",
                executor.getCorePoolSize(), executor.getMaxPoolSize());

        return executor;
    }

    /**
     * Timer-triggered jobs have no caller to report to, so their failures end up here.
     */
    static class JobErrorHandler implements ErrorHandler {
        @Override
        public void handleError(Throwable t) {
            log.error("Scheduled job failed on thread {}: {}",
                    Thread.currentThread().getName(), t.getMessage(), t);
        }
    }
}
