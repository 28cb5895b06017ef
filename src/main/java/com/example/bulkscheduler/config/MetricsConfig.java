package com.example.bulkscheduler.config;

import com.example.bulkscheduler.domain.enums.GenerationOrigin;
import com.example.bulkscheduler.domain.enums.RunOutcome;
import com.example.bulkscheduler.domain.repository.ScheduledJobRepository;
import com.example.bulkscheduler.service.registry.ExecutionLock;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for monitoring scheduled job health.
 * <p>
 * Exposes Prometheus metrics for:
 * - Active and failing job counts
 * - In-flight executions
 * - Execution outcomes and durations per origin
 * - Safeguard blocks, skipped fires and emergency stops
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final ScheduledJobRepository jobRepository;
    private final ExecutionLock executionLock;

    private final AtomicLong activeJobs = new AtomicLong(0);
    private final AtomicLong failingJobs = new AtomicLong(0);

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder("bulk_scheduler_active_jobs", activeJobs, AtomicLong::get)
                .description("Number of jobs marked active in the store")
                .register(meterRegistry);

        Gauge.builder("bulk_scheduler_failing_jobs", failingJobs, AtomicLong::get)
                .description("Number of jobs whose last run failed")
                .register(meterRegistry);

        Gauge.builder("bulk_scheduler_inflight_executions", executionLock, ExecutionLock::heldCount)
                .description("Number of job executions currently holding the execution lock")
                .register(meterRegistry);
    }

    /**
     * Periodically refresh gauges from the store
     */
    @Scheduled(fixedDelayString = "${bulk-scheduler.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            activeJobs.set(jobRepository.countByIsActiveTrue());
            failingJobs.set(jobRepository.countByConsecutiveFailuresGreaterThan(0));
        } catch (DataAccessException e) {
            log.warn("Could not refresh job gauges: {}", e.getMessage());
        }
    }

    public Timer.Sample startExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record an execution attempt with its duration
     */
    public void recordExecution(Timer.Sample sample, GenerationOrigin origin, RunOutcome outcome) {
        var originTag = origin.getCode();
        var outcomeTag = outcome.name().toLowerCase();
        sample.stop(Timer.builder("bulk_scheduler_execution_time")
                .tag("origin", originTag)
                .tag("outcome", outcomeTag)
                .description("Job execution time")
                .register(meterRegistry));
        meterRegistry.counter("bulk_scheduler_executions", "origin", originTag, "outcome", outcomeTag).increment();
    }

    public void recordSafeguardBlock(GenerationOrigin origin) {
        meterRegistry.counter("bulk_scheduler_safeguard_blocks", "origin", origin.getCode()).increment();
    }

    /**
     * Record a fire that did not run (lock held, job gone or inactive)
     */
    public void recordSkippedFire(String reason) {
        meterRegistry.counter("bulk_scheduler_skipped_fires", "reason", reason).increment();
    }

    public void recordEmergencyStop(int stoppedCount) {
        meterRegistry.counter("bulk_scheduler_emergency_stops").increment();
        meterRegistry.counter("bulk_scheduler_emergency_stopped_timers").increment(stoppedCount);
    }
}
