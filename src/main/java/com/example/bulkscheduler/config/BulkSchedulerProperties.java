package com.example.bulkscheduler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the job orchestrator.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "bulk-scheduler")
public class BulkSchedulerProperties {

    /**
     * Threads owning the daily job timers
     */
    @Min(1)
    private int timerPoolSize = 4;

    /**
     * Threads running job executions (generation calls)
     */
    @Min(1)
    private int executionPoolSize = 8;

    /**
     * Re-arm every active job once the application is ready
     */
    private boolean initializeOnStartup = true;

    /**
     * Timezone used when a job is created without one
     */
    @NotBlank
    private String defaultTimezone = "America/New_York";

    /**
     * Owner assigned when a job is created without one
     */
    @Min(1)
    private long defaultUserId = 1L;

    /**
     * Affiliate id assigned when a job is created without one (optional)
     */
    private String defaultAffiliateId;

    @NotEmpty
    private List<String> defaultTones = new ArrayList<>(List.of("Enthusiastic"));

    @NotEmpty
    private List<String> defaultTemplates = new ArrayList<>(List.of("Short-Form Video Script"));

    @NotEmpty
    private List<String> defaultPlatforms = new ArrayList<>(List.of("TikTok"));

    /**
     * Consecutive failures after which a Slack alert is sent (0 disables)
     */
    @Min(0)
    private int failureAlertThreshold = 3;

    /**
     * Refresh interval for job gauges
     */
    @Min(1000)
    private long metricsUpdateIntervalMs = 60000;
}
