package com.example.bulkscheduler.service.executor;

import com.example.bulkscheduler.client.ClientModels.GenerationRequest;
import com.example.bulkscheduler.client.GenerationServiceClient;
import com.example.bulkscheduler.config.BulkSchedulerProperties;
import com.example.bulkscheduler.config.MetricsConfig;
import com.example.bulkscheduler.domain.entity.JobRunLog;
import com.example.bulkscheduler.domain.entity.ScheduledJob;
import com.example.bulkscheduler.domain.enums.AiModel;
import com.example.bulkscheduler.domain.enums.GenerationOrigin;
import com.example.bulkscheduler.domain.enums.RunOutcome;
import com.example.bulkscheduler.exception.ExternalServiceException;
import com.example.bulkscheduler.service.alert.SlackAlertService;
import com.example.bulkscheduler.service.registry.ExecutionLock;
import com.example.bulkscheduler.service.registry.JobFireHandler;
import com.example.bulkscheduler.service.safeguard.GenerationSafeguard;
import com.example.bulkscheduler.service.safeguard.SafeguardContext;
import com.example.bulkscheduler.service.safeguard.SafeguardDecision;
import com.example.bulkscheduler.service.schedule.ScheduleCalculator;
import com.example.bulkscheduler.service.store.ScheduledJobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;

/**
 * Runs execution attempts of scheduled jobs.
 * <p>
 * Handles:
 * - Execution lock acquisition and release
 * - Safeguard checks before any generation call
 * - Run bookkeeping (last run, next run, total runs)
 * - The generation call and outcome recording
 * - Run history, metrics and failure-streak alerts
 * <p>
 * Failures are recorded on the job and never rethrown: the job stays scheduled
 * for its next fire.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduledJobExecutor implements JobFireHandler {

    static final String DEFAULT_FAILURE_MESSAGE = "Content generation failed";
    static final String BLOCKED_PREFIX = "Blocked by safeguards: ";

    private final ScheduledJobStore jobStore;
    private final GenerationSafeguard safeguard;
    private final GenerationServiceClient generationClient;
    private final ExecutionLock executionLock;
    private final ScheduleCalculator scheduleCalculator;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final BulkSchedulerProperties properties;
    private final Clock clock;

    @Override
    public void onFire(Long jobId) {
        var result = runScheduled(jobId);
        if (result.getOutcome().isFailure()) {
            log.warn("Scheduled run of job {} finished: {} ({})", jobId, result.getOutcome(), result.summary());
        } else {
            log.info("Scheduled run of job {} finished: {} ({})", jobId, result.getOutcome(), result.summary());
        }
    }

    @Override
    public void onRejected(Long jobId) {
        metricsConfig.recordSkippedFire("rejected");
    }

    /**
     * Handle a timer fire: lock, re-read the job, safeguard check, execute.
     * A fire that finds the lock held is dropped, not queued.
     */
    public JobExecutionResult runScheduled(Long jobId) {
        var holder = executionLock.tryAcquire(jobId).orElse(null);
        if (holder == null) {
            log.info("Job {} is still running, skipping this fire", jobId);
            metricsConfig.recordSkippedFire("locked");
            return JobExecutionResult.alreadyRunning(jobId);
        }

        try {
            var job = jobStore.findById(jobId).orElse(null);
            if (job == null) {
                log.warn("Job {} no longer exists, ignoring fire", jobId);
                metricsConfig.recordSkippedFire("missing");
                return JobExecutionResult.skipped(jobId, "Job no longer exists");
            }
            if (!job.shouldBeArmed()) {
                log.info("Job {} is inactive, ignoring fire", jobId);
                metricsConfig.recordSkippedFire("inactive");
                return JobExecutionResult.skipped(jobId, "Job is inactive");
            }

            var decision = safeguard.evaluate(SafeguardContext.forJob(GenerationOrigin.SCHEDULED_JOB, job));
            if (!decision.isAllowed()) {
                return recordBlocked(job, GenerationOrigin.SCHEDULED_JOB, decision);
            }

            return execute(job, GenerationOrigin.SCHEDULED_JOB);
        } finally {
            executionLock.release(holder);
        }
    }

    /**
     * Handle a manual trigger: safeguard check, then lock and execute.
     * Returns an ALREADY_RUNNING result instead of waiting for a running execution.
     */
    public JobExecutionResult runManual(ScheduledJob job) {
        var jobId = job.getId();

        var decision = safeguard.evaluate(SafeguardContext.forJob(GenerationOrigin.MANUAL_TRIGGER, job));
        if (!decision.isAllowed()) {
            return recordBlocked(job, GenerationOrigin.MANUAL_TRIGGER, decision);
        }

        var holder = executionLock.tryAcquire(jobId).orElse(null);
        if (holder == null) {
            log.info("Manual trigger for job {} ignored, an execution is in progress", jobId);
            metricsConfig.recordSkippedFire("locked");
            return JobExecutionResult.alreadyRunning(jobId);
        }

        try {
            return execute(job, GenerationOrigin.MANUAL_TRIGGER);
        } finally {
            executionLock.release(holder);
        }
    }

    /**
     * One attempt for a job whose lock is held and whose safeguard check passed.
     */
    JobExecutionResult execute(ScheduledJob job, GenerationOrigin origin) {
        var jobId = job.getId();
        var timerSample = metricsConfig.startExecutionTimer();
        var startedAt = clock.instant();

        log.info("Executing job {} ('{}') via {}", jobId, job.getName(), origin.getCode());

        var nextRunAt = scheduleCalculator.nextRunAt(job.getScheduleTime(), job.getTimezone(), startedAt);
        jobStore.recordRunStart(jobId, startedAt, nextRunAt);
        job.setLastRunAt(startedAt);
        job.setNextRunAt(nextRunAt);
        job.setTotalRuns(job.getTotalRuns() + 1);

        JobExecutionResult result;
        try {
            result = attempt(job);
        } catch (Exception e) {
            log.error("Unexpected error executing job {}: {}", jobId, e.getMessage(), e);
            result = JobExecutionResult.failure(jobId, e);
        }

        var completedAt = clock.instant();
        result.setDurationMs(completedAt.toEpochMilli() - startedAt.toEpochMilli());

        if (result.isSuccess()) {
            handleSuccess(job, result, completedAt);
        } else {
            handleFailure(job, result, completedAt);
        }

        writeRunLog(job, origin, result, startedAt, completedAt);
        metricsConfig.recordExecution(timerSample, origin, result.getOutcome());
        return result;
    }

    private JobExecutionResult attempt(ScheduledJob job) {
        var jobId = job.getId();

        var missing = job.missingGenerationParameters();
        if (!missing.isEmpty()) {
            log.error("Job {} validation failed, missing: {}", jobId, missing);
            return JobExecutionResult.failure(jobId,
                    "Missing required generation parameters: " + String.join(", ", missing), "VALIDATION_ERROR");
        }

        try {
            var response = generationClient.generate(buildRequest(job));
            if (response.isSuccess()) {
                return JobExecutionResult.success(jobId, response.getGeneratedCount(), response.getMessage());
            }
            var error = StringUtils.hasText(response.getError()) ? response.getError() : DEFAULT_FAILURE_MESSAGE;
            return JobExecutionResult.failure(jobId, error, "GENERATION_FAILED");
        } catch (ExternalServiceException e) {
            if (e.isCircuitOpen()) {
                return JobExecutionResult.failure(jobId, e.getMessage(), "CIRCUIT_OPEN");
            }
            if (e.getHttpStatusCode() != null) {
                return JobExecutionResult.httpFailure(jobId, e.getHttpStatusCode(), e.getMessage());
            }
            return JobExecutionResult.failure(jobId, e);
        }
    }

    private void handleSuccess(ScheduledJob job, JobExecutionResult result, Instant completedAt) {
        log.info("Job {} completed successfully in {}ms", job.getId(), result.getDurationMs());

        jobStore.recordSuccess(job.getId(), completedAt);
        job.setConsecutiveFailures(0);
        job.setLastError(null);
    }

    private void handleFailure(ScheduledJob job, JobExecutionResult result, Instant completedAt) {
        log.warn("Job {} failed: {}", job.getId(), result.getErrorMessage());

        var message = StringUtils.hasText(result.getErrorMessage()) ? result.getErrorMessage() : DEFAULT_FAILURE_MESSAGE;
        jobStore.recordFailure(job.getId(), message, completedAt);

        var failures = job.getConsecutiveFailures() + 1;
        job.setConsecutiveFailures(failures);
        job.setLastError(message);

        var threshold = properties.getFailureAlertThreshold();
        if (threshold > 0 && failures == threshold) {
            slackAlertService.sendFailureStreakAlert(job, failures, message);
        }
    }

    private JobExecutionResult recordBlocked(ScheduledJob job, GenerationOrigin origin, SafeguardDecision decision) {
        var reason = BLOCKED_PREFIX + decision.getReason();
        var now = clock.instant();
        log.warn("Job {} blocked by safeguards ({}): {}", job.getId(), origin.getCode(), decision.getReason());

        jobStore.recordBlocked(job.getId(), reason, now);
        job.setLastError(reason);

        var result = JobExecutionResult.blocked(job.getId(), reason);
        result.setDurationMs(0L);
        writeRunLog(job, origin, result, now, now);
        metricsConfig.recordSafeguardBlock(origin);
        return result;
    }

    private void writeRunLog(ScheduledJob job, GenerationOrigin origin, JobExecutionResult result,
                             Instant startedAt, Instant completedAt) {
        var runLog = JobRunLog.builder()
                .jobId(job.getId())
                .origin(origin)
                .outcome(result.getOutcome())
                .startedAt(startedAt)
                .completedAt(completedAt)
                .durationMs(result.getDurationMs())
                .errorMessage(result.getOutcome() == RunOutcome.SUCCEEDED ? null : result.getErrorMessage())
                .errorType(result.getErrorType())
                .httpStatusCode(result.getHttpStatusCode())
                .generatedCount(result.getGeneratedCount())
                .build();
        try {
            jobStore.saveRunLog(runLog);
        } catch (DataAccessException e) {
            // Happens when the job was deleted while this run was in flight
            log.warn("Could not write run log for job {}: {}", job.getId(), e.getMessage());
        }
    }

    private GenerationRequest buildRequest(ScheduledJob job) {
        var aiModel = job.getAiModel() != null ? job.getAiModel() : AiModel.CLAUDE;
        return GenerationRequest.builder()
                .selectedNiches(job.getSelectedNiches())
                .tones(job.getTones())
                .templates(job.getTemplates())
                .platforms(job.getPlatforms())
                .useExistingProducts(Boolean.TRUE.equals(job.getUseExistingProducts()))
                .generateAffiliateLinks(Boolean.TRUE.equals(job.getGenerateAffiliateLinks()))
                .useSpartanFormat(Boolean.TRUE.equals(job.getUseSpartanFormat()))
                .useSmartStyle(Boolean.TRUE.equals(job.getUseSmartStyle()))
                .aiModel(aiModel.getCode())
                .affiliateId(job.getAffiliateId())
                .webhookUrl(job.getWebhookUrl())
                .sendToMakeWebhook(Boolean.TRUE.equals(job.getSendToMakeWebhook()))
                .userId(job.getUserId())
                .scheduledJobId(job.getId())
                .scheduledJobName(job.getName())
                .build();
    }
}
