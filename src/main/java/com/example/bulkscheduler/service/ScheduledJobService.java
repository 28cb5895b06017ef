package com.example.bulkscheduler.service;

import com.example.bulkscheduler.config.BulkSchedulerProperties;
import com.example.bulkscheduler.config.MetricsConfig;
import com.example.bulkscheduler.config.SafeguardProperties;
import com.example.bulkscheduler.domain.entity.ScheduledJob;
import com.example.bulkscheduler.domain.enums.AiModel;
import com.example.bulkscheduler.domain.enums.GenerationOrigin;
import com.example.bulkscheduler.dto.CreateScheduledJobRequest;
import com.example.bulkscheduler.dto.EmergencyStopResponse;
import com.example.bulkscheduler.dto.JobRunLogResponse;
import com.example.bulkscheduler.dto.SafeguardStatusResponse;
import com.example.bulkscheduler.dto.SafeguardStatusResponse.OriginDecision;
import com.example.bulkscheduler.dto.ScheduledJobResponse;
import com.example.bulkscheduler.dto.SchedulerStatusResponse;
import com.example.bulkscheduler.dto.TriggerResponse;
import com.example.bulkscheduler.dto.UpdateSafeguardsRequest;
import com.example.bulkscheduler.dto.UpdateScheduledJobRequest;
import com.example.bulkscheduler.exception.JobNotFoundException;
import com.example.bulkscheduler.mapper.ScheduledJobMapper;
import com.example.bulkscheduler.service.alert.SlackAlertService;
import com.example.bulkscheduler.service.executor.ScheduledJobExecutor;
import com.example.bulkscheduler.service.registry.ExecutionLock;
import com.example.bulkscheduler.service.registry.JobTimerRegistry;
import com.example.bulkscheduler.service.safeguard.GenerationSafeguard;
import com.example.bulkscheduler.service.safeguard.SafeguardContext;
import com.example.bulkscheduler.service.schedule.ScheduleCalculator;
import com.example.bulkscheduler.service.store.ScheduledJobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Orchestrates the job lifecycle across the store, the timer registry and the executor.
 * <p>
 * Provides:
 * - Job listing, lookup and run history
 * - Create (persist, then arm), update (teardown, persist, re-arm) and delete
 * - Manual triggers
 * - Emergency stop, registry status and safeguard status
 * - Startup initialization of timers from the store
 * <p>
 * Update and delete of one job id are serialized by the registry's per-job lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduledJobService {

    private final ScheduledJobStore jobStore;
    private final JobTimerRegistry timerRegistry;
    private final ExecutionLock executionLock;
    private final ScheduledJobExecutor jobExecutor;
    private final ScheduleCalculator scheduleCalculator;
    private final GenerationSafeguard safeguard;
    private final SafeguardProperties safeguardProperties;
    private final BulkSchedulerProperties properties;
    private final ScheduledJobMapper jobMapper;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    // === Job Retrieval ===

    public List<ScheduledJobResponse> listJobs(Long userId) {
        var jobs = userId != null ? jobStore.findByUser(userId) : jobStore.findAll();
        return jobs.stream().map(this::toResponse).toList();
    }

    public ScheduledJobResponse getJob(Long jobId) {
        return toResponse(findJob(jobId));
    }

    public List<JobRunLogResponse> getRecentRuns(Long jobId) {
        if (!jobStore.exists(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        return jobMapper.toRunResponses(jobStore.recentRuns(jobId));
    }

    // === Job Lifecycle ===

    /**
     * Persist a new job and arm its timer if it is active.
     * Nothing is armed unless the row was stored; a job whose timer cannot be armed is removed again.
     */
    public ScheduledJobResponse createJob(CreateScheduledJobRequest request) {
        var timezone = StringUtils.hasText(request.getTimezone()) ? request.getTimezone() : properties.getDefaultTimezone();
        scheduleCalculator.validate(request.getScheduleTime(), timezone);

        var tones = orDefault(request.getTones(), properties.getDefaultTones());
        var templates = orDefault(request.getTemplates(), properties.getDefaultTemplates());
        var platforms = orDefault(request.getPlatforms(), properties.getDefaultPlatforms());
        var niches = new ArrayList<>(request.getSelectedNiches());

        var job = ScheduledJob.builder()
                .userId(request.getUserId() != null ? request.getUserId() : properties.getDefaultUserId())
                .name(StringUtils.hasText(request.getName()) ? request.getName().trim() : defaultName(niches, tones))
                .scheduleTime(request.getScheduleTime())
                .timezone(timezone)
                .isActive(request.getIsActive() != null ? request.getIsActive() : Boolean.TRUE)
                .selectedNiches(niches)
                .tones(tones)
                .templates(templates)
                .platforms(platforms)
                .useExistingProducts(orDefault(request.getUseExistingProducts(), true))
                .generateAffiliateLinks(orDefault(request.getGenerateAffiliateLinks(), false))
                .useSpartanFormat(orDefault(request.getUseSpartanFormat(), false))
                .useSmartStyle(orDefault(request.getUseSmartStyle(), false))
                .aiModel(request.getAiModel() != null ? request.getAiModel() : AiModel.CLAUDE)
                .affiliateId(blankToNull(request.getAffiliateId() != null ? request.getAffiliateId() : properties.getDefaultAffiliateId()))
                .webhookUrl(blankToNull(request.getWebhookUrl()))
                .sendToMakeWebhook(orDefault(request.getSendToMakeWebhook(), true))
                .nextRunAt(scheduleCalculator.nextRunAt(request.getScheduleTime(), timezone, clock.instant()))
                .totalRuns(0)
                .consecutiveFailures(0)
                .build();

        var saved = jobStore.insert(job);
        log.info("Created job {} ('{}') at {}, next run {}", saved.getId(), saved.getName(), saved.describeSchedule(), saved.getNextRunAt());

        try {
            timerRegistry.arm(saved);
        } catch (RuntimeException e) {
            log.error("Could not arm new job {}, removing it: {}", saved.getId(), e.getMessage(), e);
            jobStore.delete(saved.getId());
            throw e;
        }

        return toResponse(saved);
    }

    /**
     * Tear down the job's timer, apply the non-null fields, recompute the next run and re-arm if active.
     * If the store write fails the previous definition is re-armed.
     */
    public ScheduledJobResponse updateJob(Long jobId, UpdateScheduledJobRequest request) {
        if (request.getScheduleTime() != null) {
            scheduleCalculator.parseScheduleTime(request.getScheduleTime());
        }
        if (request.getTimezone() != null) {
            scheduleCalculator.parseTimezone(request.getTimezone());
        }

        return timerRegistry.withJobLock(jobId, () -> {
            if (!jobStore.exists(jobId)) {
                throw new JobNotFoundException(jobId);
            }

            timerRegistry.teardownAndDestroy(jobId);

            ScheduledJob updated;
            try {
                updated = jobStore.update(jobId, job -> {
                    applyChanges(job, request);
                    job.setNextRunAt(scheduleCalculator.nextRunAt(job.getScheduleTime(), job.getTimezone(), clock.instant()));
                });
            } catch (RuntimeException e) {
                log.error("Failed to update job {}: {}", jobId, e.getMessage());
                restoreTimer(jobId);
                throw e;
            }

            var armed = timerRegistry.arm(updated);
            log.info("Updated job {} ('{}'), {} at {}", jobId, updated.getName(),
                    armed ? "armed" : "not armed", updated.describeSchedule());
            return toResponse(updated);
        });
    }

    /**
     * Tear down the job's timer and delete it. An execution already in flight completes normally.
     */
    public void deleteJob(Long jobId) {
        timerRegistry.withJobLock(jobId, () -> {
            if (!jobStore.exists(jobId)) {
                throw new JobNotFoundException(jobId);
            }

            timerRegistry.teardownAndDestroy(jobId);
            try {
                jobStore.delete(jobId);
            } catch (RuntimeException e) {
                log.error("Failed to delete job {}: {}", jobId, e.getMessage());
                restoreTimer(jobId);
                throw e;
            }
            return null;
        });
    }

    // === Manual Trigger ===

    /**
     * Run a job once, now. Never waits for a running execution of the same job.
     */
    public TriggerResponse triggerJob(Long jobId) {
        var job = findJob(jobId);
        log.info("Manual trigger requested for job {} ('{}')", jobId, job.getName());

        var result = jobExecutor.runManual(job);

        var current = jobStore.findById(jobId).map(this::toResponse).orElse(null);
        return TriggerResponse.builder()
                .jobId(jobId)
                .outcome(result.getOutcome())
                .message(result.summary())
                .generatedCount(result.getGeneratedCount())
                .durationMs(result.getDurationMs())
                .job(current)
                .build();
    }

    // === Registry Control ===

    public EmergencyStopResponse emergencyStop() {
        log.warn("Emergency stop requested");
        var stopped = timerRegistry.emergencyStopAll();

        metricsConfig.recordEmergencyStop(stopped);
        slackAlertService.sendEmergencyStopAlert(stopped);

        return EmergencyStopResponse.builder()
                .stoppedCount(stopped)
                .stoppedAt(clock.instant())
                .build();
    }

    public SchedulerStatusResponse getStatus() {
        return timerRegistry.status();
    }

    public SafeguardStatusResponse getSafeguardStatus() {
        var decisions = Arrays.stream(GenerationOrigin.values())
                .map(origin -> {
                    var decision = safeguard.evaluate(SafeguardContext.of(origin));
                    return OriginDecision.builder()
                            .origin(origin)
                            .allowed(decision.isAllowed())
                            .reason(decision.getReason())
                            .build();
                })
                .toList();

        return SafeguardStatusResponse.builder()
                .generationEnabled(safeguardProperties.isGenerationEnabled())
                .productionMode(safeguardProperties.isProductionMode())
                .allowScheduledGeneration(safeguardProperties.isAllowScheduledGeneration())
                .allowManualGeneration(safeguardProperties.isAllowManualGeneration())
                .decisions(new ArrayList<>(decisions))
                .build();
    }

    /**
     * Flip safeguard switches at runtime. Changes are not persisted and
     * revert to the configured values on restart.
     */
    public SafeguardStatusResponse updateSafeguards(UpdateSafeguardsRequest request) {
        if (request.getGenerationEnabled() != null) {
            log.warn("Safeguard change: generationEnabled {} -> {}",
                    safeguardProperties.isGenerationEnabled(), request.getGenerationEnabled());
            safeguardProperties.setGenerationEnabled(request.getGenerationEnabled());
        }
        if (request.getAllowScheduledGeneration() != null) {
            log.warn("Safeguard change: allowScheduledGeneration {} -> {}",
                    safeguardProperties.isAllowScheduledGeneration(), request.getAllowScheduledGeneration());
            safeguardProperties.setAllowScheduledGeneration(request.getAllowScheduledGeneration());
        }
        if (request.getAllowManualGeneration() != null) {
            log.warn("Safeguard change: allowManualGeneration {} -> {}",
                    safeguardProperties.isAllowManualGeneration(), request.getAllowManualGeneration());
            safeguardProperties.setAllowManualGeneration(request.getAllowManualGeneration());
        }
        return getSafeguardStatus();
    }

    // === Startup ===

    /**
     * Wipe the registry and arm every active job from the store.
     *
     * @return number of timers armed, 0 when blocked by safeguards
     */
    public int initializeScheduledJobs() {
        var decision = safeguard.evaluate(SafeguardContext.of(GenerationOrigin.STARTUP_INIT));
        if (!decision.isAllowed()) {
            log.warn("Scheduled job initialization blocked by safeguards: {}", decision.getReason());
            metricsConfig.recordSafeguardBlock(GenerationOrigin.STARTUP_INIT);
            slackAlertService.sendErrorAlert("Scheduled Jobs Not Started",
                    "Startup initialization was blocked by safeguards. No job timers are armed.",
                    decision.getReason());
            return 0;
        }

        var wiped = timerRegistry.wipeAll();
        if (wiped > 0) {
            log.info("Cleared {} existing timers before initialization", wiped);
        }

        var activeJobs = jobStore.findActive();
        var armed = 0;
        for (var job : activeJobs) {
            try {
                if (timerRegistry.arm(job)) {
                    armed++;
                }
            } catch (Exception e) {
                log.error("Failed to arm job {} ('{}') on startup: {}", job.getId(), job.getName(), e.getMessage(), e);
            }
        }

        log.info("Initialized {} of {} active scheduled jobs", armed, activeJobs.size());
        return armed;
    }

    // === Helper Methods ===

    private ScheduledJob findJob(Long jobId) {
        return jobStore.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private void restoreTimer(Long jobId) {
        try {
            jobStore.findById(jobId).ifPresent(timerRegistry::arm);
        } catch (Exception e) {
            log.error("Could not restore timer for job {}: {}", jobId, e.getMessage(), e);
        }
    }

    private void applyChanges(ScheduledJob job, UpdateScheduledJobRequest request) {
        if (StringUtils.hasText(request.getName())) {
            job.setName(request.getName().trim());
        }
        if (request.getScheduleTime() != null) {
            job.setScheduleTime(request.getScheduleTime());
        }
        if (request.getTimezone() != null) {
            job.setTimezone(request.getTimezone());
        }
        if (request.getSelectedNiches() != null) {
            job.setSelectedNiches(new ArrayList<>(request.getSelectedNiches()));
        }
        if (request.getTones() != null) {
            job.setTones(new ArrayList<>(request.getTones()));
        }
        if (request.getTemplates() != null) {
            job.setTemplates(new ArrayList<>(request.getTemplates()));
        }
        if (request.getPlatforms() != null) {
            job.setPlatforms(new ArrayList<>(request.getPlatforms()));
        }
        if (request.getUseExistingProducts() != null) {
            job.setUseExistingProducts(request.getUseExistingProducts());
        }
        if (request.getGenerateAffiliateLinks() != null) {
            job.setGenerateAffiliateLinks(request.getGenerateAffiliateLinks());
        }
        if (request.getUseSpartanFormat() != null) {
            job.setUseSpartanFormat(request.getUseSpartanFormat());
        }
        if (request.getUseSmartStyle() != null) {
            job.setUseSmartStyle(request.getUseSmartStyle());
        }
        if (request.getAiModel() != null) {
            job.setAiModel(request.getAiModel());
        }
        if (request.getAffiliateId() != null) {
            job.setAffiliateId(blankToNull(request.getAffiliateId()));
        }
        if (request.getWebhookUrl() != null) {
            job.setWebhookUrl(blankToNull(request.getWebhookUrl()));
        }
        if (request.getSendToMakeWebhook() != null) {
            job.setSendToMakeWebhook(request.getSendToMakeWebhook());
        }
        if (request.getIsActive() != null) {
            job.setIsActive(request.getIsActive());
        }
    }

    private ScheduledJobResponse toResponse(ScheduledJob job) {
        var response = jobMapper.toResponse(job);
        response.setArmed(timerRegistry.isArmed(job.getId()));
        response.setExecuting(executionLock.isHeld(job.getId()));
        return response;
    }

    private static String defaultName(List<String> niches, List<String> tones) {
        return String.format("Daily %s content (%s)", String.join(", ", niches), String.join(", ", tones));
    }

    private static List<String> orDefault(List<String> values, List<String> defaults) {
        return new ArrayList<>(values != null ? values : defaults);
    }

    private static Boolean orDefault(Boolean value, boolean defaultValue) {
        return value != null ? value : defaultValue;
    }

    private static String blankToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
