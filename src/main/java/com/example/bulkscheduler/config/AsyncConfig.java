package com.example.bulkscheduler.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools for job timers, job executions and @Async work.
 * <p>
 * Timers and executions live on separate pools:
 * - jobTimerScheduler only owns the daily cron triggers and hands fires off
 * - jobExecutionExecutor runs the (slow) generation calls
 * - taskExecutor backs @Async alerting
 */
@Slf4j
@EnableAsync
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final BulkSchedulerProperties properties;

    /**
     * Scheduler holding one cron trigger per armed job.
     * Cancelled triggers are removed from the work queue immediately.
     */
    @Bean(name = "jobTimerScheduler")
    public ThreadPoolTaskScheduler jobTimerScheduler() {
        log.info("Creating job timer scheduler with {} threads", properties.getTimerPoolSize());

        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getTimerPoolSize());
        scheduler.setThreadNamePrefix("job-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(t -> log.error("Unhandled error in job timer: {}", t.getMessage(), t));
        scheduler.setWaitForTasksToCompleteOnShutdown(false);

        return scheduler;
    }

    /**
     * Executor running fired jobs, so a long generation call never delays other timers.
     * A full queue rejects the fire (abort policy); the registry drops it.
     */
    @Bean(name = "jobExecutionExecutor")
    public TaskExecutor jobExecutionExecutor() {
        log.info("Creating job execution executor with {} core threads", properties.getExecutionPoolSize());

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutionPoolSize());
        executor.setMaxPoolSize(properties.getExecutionPoolSize() * 2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("job-exec-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        return executor;
    }

    /**
     * Task executor for Spring's @Async annotation.
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("async-task-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        return executor;
    }
}
