package com.example.bulkscheduler.dto;

import com.example.bulkscheduler.domain.enums.AiModel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.validator.constraints.URL;

import java.util.List;

/**
 * Request DTO for creating a scheduled job.
 * Run statistics are never accepted from the caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateScheduledJobRequest {

    /**
     * Display name (default: derived from niches and tones)
     */
    @Size(max = 200, message = "Name must be at most 200 characters")
    private String name;

    /**
     * Owner (default: configured default user)
     */
    @Positive(message = "User ID must be positive")
    private Long userId;

    @NotBlank(message = "Schedule time is required")
    @Pattern(regexp = ScheduleFormats.SCHEDULE_TIME_REGEX, message = "Schedule time must be in HH:MM format")
    private String scheduleTime;

    /**
     * IANA timezone (default: configured default timezone)
     */
    @Size(max = 64, message = "Timezone must be at most 64 characters")
    private String timezone;

    @NotEmpty(message = "At least one niche is required")
    private List<@NotBlank String> selectedNiches;

    /**
     * Omitted lists fall back to configured defaults; supplied lists must not be empty
     */
    @Size(min = 1, message = "Tones must not be empty")
    private List<@NotBlank String> tones;

    @Size(min = 1, message = "Templates must not be empty")
    private List<@NotBlank String> templates;

    @Size(min = 1, message = "Platforms must not be empty")
    private List<@NotBlank String> platforms;

    private Boolean useExistingProducts;
    private Boolean generateAffiliateLinks;
    private Boolean useSpartanFormat;
    private Boolean useSmartStyle;

    private AiModel aiModel;

    @Size(max = 100, message = "Affiliate ID must be at most 100 characters")
    private String affiliateId;

    @URL(message = "Webhook URL must be a valid URL")
    @Size(max = 500, message = "Webhook URL must be at most 500 characters")
    private String webhookUrl;

    private Boolean sendToMakeWebhook;

    private Boolean isActive;
}
