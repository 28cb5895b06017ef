package com.example.bulkscheduler.service.registry;

import com.example.bulkscheduler.domain.entity.ScheduledJob;
import com.example.bulkscheduler.dto.SchedulerStatusResponse;
import com.example.bulkscheduler.dto.SchedulerStatusResponse.JobTimerStatus;
import com.example.bulkscheduler.service.schedule.ScheduleCalculator;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory registry of armed job timers.
 * <p>
 * Guarantees:
 * - At most one armed timer per job id
 * - Arming always tears down the previous timer first
 * - Teardown plus re-arm of one job id runs as a single critical section
 *   (per-job {@link ReentrantLock}), so interleaved edits cannot leak a timer
 * <p>
 * Fires are handed off to the execution executor; the timer threads never run jobs.
 */
@Slf4j
@Component
public class JobTimerRegistry {

    private final TaskScheduler taskScheduler;
    private final TaskExecutor executionExecutor;
    private final ScheduleCalculator scheduleCalculator;
    private final ExecutionLock executionLock;
    private final JobFireHandler fireHandler;
    private final Clock clock;

    private final ConcurrentHashMap<Long, ArmedTimer> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, JobLock> jobLocks = new ConcurrentHashMap<>();

    public JobTimerRegistry(@Qualifier("jobTimerScheduler") TaskScheduler taskScheduler,
                            @Qualifier("jobExecutionExecutor") TaskExecutor executionExecutor,
                            ScheduleCalculator scheduleCalculator,
                            ExecutionLock executionLock,
                            JobFireHandler fireHandler,
                            Clock clock) {
        this.taskScheduler = taskScheduler;
        this.executionExecutor = executionExecutor;
        this.scheduleCalculator = scheduleCalculator;
        this.executionLock = executionLock;
        this.fireHandler = fireHandler;
        this.clock = clock;
    }

    // === Arming ===

    /**
     * Arm the daily timer for a job, replacing any existing one.
     *
     * @return true if a timer was armed, false for an inactive job
     */
    public boolean arm(ScheduledJob job) {
        var jobId = job.getId();
        if (!job.shouldBeArmed()) {
            log.debug("Job {} is inactive, not arming", jobId);
            return false;
        }

        var cron = scheduleCalculator.cronExpression(job.getScheduleTime());
        var zone = scheduleCalculator.parseTimezone(job.getTimezone());

        return withJobLock(jobId, () -> {
            teardownAndDestroy(jobId);

            var residual = timers.remove(jobId);
            if (residual != null) {
                log.warn("Residual timer found for job {} after teardown, destroying it", jobId);
                residual.destroy();
            }

            var timer = new ArmedTimer(jobId, cron, zone, clock.instant());
            var future = taskScheduler.schedule(() -> fire(timer), new CronTrigger(cron, zone));
            if (future == null) {
                throw new IllegalStateException("Timer for job " + jobId + " could not be scheduled");
            }
            timer.attach(future);
            timers.put(jobId, timer);

            log.info("Armed job {} ('{}') daily at {} (cron: {})", jobId, job.getName(), job.describeSchedule(), cron);
            return true;
        });
    }

    // === Teardown ===

    /**
     * Stop and permanently destroy a job's timer and clear its execution lock.
     * Idempotent: an absent id is a no-op.
     *
     * @return true if a timer was removed
     */
    public boolean teardownAndDestroy(Long jobId) {
        return withJobLock(jobId, () -> {
            var timer = timers.remove(jobId);
            executionLock.clear(jobId);
            if (timer == null) {
                return false;
            }
            timer.stop();
            timer.destroy();
            log.info("Tore down timer for job {}", jobId);
            return true;
        });
    }

    /**
     * Tear down every armed timer.
     *
     * @return number of timers stopped
     */
    public int emergencyStopAll() {
        var stopped = 0;
        for (var jobId : new ArrayList<>(timers.keySet())) {
            if (teardownAndDestroy(jobId)) {
                stopped++;
            }
        }
        log.warn("Emergency stop: {} timers torn down, registry now holds {}", stopped, timers.size());
        return stopped;
    }

    /**
     * Full reset before re-arming from the store
     */
    public int wipeAll() {
        var wiped = emergencyStopAll();
        executionLock.clearAll();
        return wiped;
    }

    @PreDestroy
    public void shutdown() {
        var stopped = emergencyStopAll();
        log.info("Job timer registry shut down, {} timers stopped", stopped);
    }

    // === Per-job critical section ===

    /**
     * Run an action while holding the job's registry lock.
     * Re-entrant, so arm/teardown may be called from inside.
     * <p>
     * The lock entry lives only while some caller holds or waits for it, so ids
     * that were deleted or never existed leave nothing behind.
     */
    public <T> T withJobLock(Long jobId, Supplier<T> action) {
        var jobLock = jobLocks.compute(jobId, (id, existing) -> {
            var entry = existing != null ? existing : new JobLock();
            entry.users++;
            return entry;
        });

        jobLock.lock.lock();
        try {
            return action.get();
        } finally {
            jobLock.lock.unlock();
            jobLocks.computeIfPresent(jobId, (id, entry) -> --entry.users == 0 ? null : entry);
        }
    }

    int jobLockCount() {
        return jobLocks.size();
    }

    // === Diagnostics ===

    public SchedulerStatusResponse status() {
        var jobs = timers.values().stream()
                .sorted(Comparator.comparing(ArmedTimer::getJobId))
                .map(timer -> JobTimerStatus.builder()
                        .id(timer.getJobId())
                        .running(timer.isRunning())
                        .destroyed(timer.isDestroyed())
                        .executing(executionLock.isHeld(timer.getJobId()))
                        .cronExpression(timer.getCronExpression())
                        .timezone(timer.getZone().getId())
                        .armedAt(timer.getArmedAt())
                        .build())
                .toList();

        return SchedulerStatusResponse.builder()
                .totalActive(jobs.size())
                .jobs(new ArrayList<>(jobs))
                .build();
    }

    public boolean isArmed(Long jobId) {
        return timers.containsKey(jobId);
    }

    public Optional<ArmedTimer> findTimer(Long jobId) {
        return Optional.ofNullable(timers.get(jobId));
    }

    public int armedCount() {
        return timers.size();
    }

    // === Firing ===

    /**
     * Timer callback. A timer replaced or destroyed after it was queued does nothing.
     */
    void fire(ArmedTimer timer) {
        var jobId = timer.getJobId();
        if (timer.isDestroyed() || timers.get(jobId) != timer) {
            log.info("Ignoring fire from a stale timer for job {}", jobId);
            return;
        }

        log.info("Timer fired for job {}", jobId);
        try {
            executionExecutor.execute(() -> {
                try {
                    fireHandler.onFire(jobId);
                } catch (Exception e) {
                    log.error("Execution of job {} failed outside the executor's bookkeeping: {}", jobId, e.getMessage(), e);
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("Execution pool is full, dropping fire for job {}: {}", jobId, e.getMessage());
            fireHandler.onRejected(jobId);
        }
    }

    /**
     * Registry lock of one job id; users is only read and written inside map compute calls.
     */
    private static final class JobLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
