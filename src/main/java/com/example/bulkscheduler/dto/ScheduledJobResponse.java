package com.example.bulkscheduler.dto;

import com.example.bulkscheduler.domain.enums.AiModel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for scheduled job data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledJobResponse {

    private Long id;
    private Long userId;
    private String name;
    private String scheduleTime;
    private String timezone;
    private Boolean isActive;
    private List<String> selectedNiches;
    private List<String> tones;
    private List<String> templates;
    private List<String> platforms;
    private Boolean useExistingProducts;
    private Boolean generateAffiliateLinks;
    private Boolean useSpartanFormat;
    private Boolean useSmartStyle;
    private AiModel aiModel;
    private String affiliateId;
    private String webhookUrl;
    private Boolean sendToMakeWebhook;
    private Instant lastRunAt;
    private Instant nextRunAt;
    private Integer totalRuns;
    private Integer consecutiveFailures;
    private String lastError;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Whether a timer is currently armed for this job
     */
    private boolean armed;

    /**
     * Whether an execution currently holds the job's lock
     */
    private boolean executing;
}
