package com.example.bulkscheduler.service.registry;

import lombok.Getter;

import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.ScheduledFuture;

/**
 * One registry entry: the recurring trigger armed for a job.
 * Once destroyed it can never fire again.
 */
@Getter
public class ArmedTimer {

    private final Long jobId;
    private final String cronExpression;
    private final ZoneId zone;
    private final Instant armedAt;

    private volatile ScheduledFuture<?> future;
    private volatile boolean stopped;
    private volatile boolean destroyed;

    ArmedTimer(Long jobId, String cronExpression, ZoneId zone, Instant armedAt) {
        this.jobId = jobId;
        this.cronExpression = cronExpression;
        this.zone = zone;
        this.armedAt = armedAt;
    }

    void attach(ScheduledFuture<?> future) {
        this.future = future;
    }

    /**
     * Stop future fires; an execution already handed off keeps running
     */
    void stop() {
        stopped = true;
        var current = future;
        if (current != null) {
            current.cancel(false);
        }
    }

    void destroy() {
        if (!stopped) {
            stop();
        }
        destroyed = true;
        future = null;
    }

    public boolean isRunning() {
        var current = future;
        return !stopped && !destroyed && current != null && !current.isCancelled() && !current.isDone();
    }
}
