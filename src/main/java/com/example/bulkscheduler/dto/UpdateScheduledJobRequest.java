package com.example.bulkscheduler.dto;

import com.example.bulkscheduler.domain.enums.AiModel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.validator.constraints.URL;

import java.util.List;

/**
 * Request DTO for updating a scheduled job.
 * Only non-null fields are applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateScheduledJobRequest {

    /**
     * Must contain a non-whitespace character when present
     */
    @Size(max = 200, message = "Name must be at most 200 characters")
    @Pattern(regexp = "(?s).*\\S.*", message = "Name must not be blank")
    private String name;

    @Pattern(regexp = ScheduleFormats.SCHEDULE_TIME_REGEX, message = "Schedule time must be in HH:MM format")
    private String scheduleTime;

    @Size(min = 1, max = 64, message = "Timezone must be between 1 and 64 characters")
    private String timezone;

    @Size(min = 1, message = "Niches must not be empty")
    private List<@NotBlank String> selectedNiches;

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
