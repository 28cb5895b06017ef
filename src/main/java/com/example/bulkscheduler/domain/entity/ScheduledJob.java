package com.example.bulkscheduler.domain.entity;

import com.example.bulkscheduler.domain.enums.AiModel;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A recurring bulk-generation job with a daily fire time.
 * <p>
 * Holds:
 * - The schedule (local time of day plus IANA timezone)
 * - Generation parameters passed through to the generation service
 * - Delivery settings for the webhook hand-off
 * - Run statistics, written only by the job executor
 * <p>
 * Only changed columns are written on update so that an API edit never
 * overwrites statistics recorded concurrently by a running execution.
 */
@Entity
@Table(name = "scheduled_bulk_jobs", indexes = {
        @Index(name = "idx_job_active", columnList = "is_active"),
        @Index(name = "idx_job_user_created", columnList = "user_id, created_at")
})
@DynamicUpdate
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduledJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    /**
     * Owner of the job
     */
    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    // === Schedule ===

    /**
     * Local time of day in HH:MM (24h)
     */
    @Column(name = "schedule_time", nullable = false, length = 5)
    private String scheduleTime;

    /**
     * IANA timezone the schedule time is interpreted in
     */
    @Column(name = "timezone", nullable = false, length = 64)
    private String timezone;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    // === Generation Parameters ===

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "selected_niches", columnDefinition = "jsonb", nullable = false)
    @Builder.Default
    private List<String> selectedNiches = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "tones", columnDefinition = "jsonb", nullable = false)
    @Builder.Default
    private List<String> tones = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "templates", columnDefinition = "jsonb", nullable = false)
    @Builder.Default
    private List<String> templates = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "platforms", columnDefinition = "jsonb", nullable = false)
    @Builder.Default
    private List<String> platforms = new ArrayList<>();

    @Column(name = "use_existing_products", nullable = false)
    @Builder.Default
    private Boolean useExistingProducts = true;

    @Column(name = "generate_affiliate_links", nullable = false)
    @Builder.Default
    private Boolean generateAffiliateLinks = false;

    @Column(name = "use_spartan_format", nullable = false)
    @Builder.Default
    private Boolean useSpartanFormat = false;

    @Column(name = "use_smart_style", nullable = false)
    @Builder.Default
    private Boolean useSmartStyle = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "ai_model", nullable = false, length = 20)
    @Builder.Default
    private AiModel aiModel = AiModel.CLAUDE;

    @Column(name = "affiliate_id", length = 100)
    private String affiliateId;

    // === Delivery ===

    @Column(name = "webhook_url", length = 500)
    private String webhookUrl;

    @Column(name = "send_to_make_webhook", nullable = false)
    @Builder.Default
    private Boolean sendToMakeWebhook = true;

    // === Run Statistics ===

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Column(name = "next_run_at", nullable = false)
    private Instant nextRunAt;

    @Column(name = "total_runs", nullable = false)
    @Builder.Default
    private Integer totalRuns = 0;

    /**
     * Failures since the last successful run
     */
    @Column(name = "consecutive_failures", nullable = false)
    @Builder.Default
    private Integer consecutiveFailures = 0;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // === Lifecycle Callbacks ===

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.isActive == null) {
            this.isActive = true;
        }
        if (this.totalRuns == null) {
            this.totalRuns = 0;
        }
        if (this.consecutiveFailures == null) {
            this.consecutiveFailures = 0;
        }
        if (this.aiModel == null) {
            this.aiModel = AiModel.CLAUDE;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // === Helper Methods ===

    /**
     * Whether this job should have an armed timer
     */
    public boolean shouldBeArmed() {
        return Boolean.TRUE.equals(isActive);
    }

    /**
     * Names of the generation parameter sets that are missing or empty
     */
    public List<String> missingGenerationParameters() {
        var missing = new ArrayList<String>();
        if (isEmpty(selectedNiches)) {
            missing.add("selectedNiches");
        }
        if (isEmpty(tones)) {
            missing.add("tones");
        }
        if (isEmpty(templates)) {
            missing.add("templates");
        }
        if (isEmpty(platforms)) {
            missing.add("platforms");
        }
        return missing;
    }

    /**
     * Human-readable schedule, e.g. "06:30 America/New_York"
     */
    public String describeSchedule() {
        return scheduleTime + " " + timezone;
    }

    private static boolean isEmpty(List<String> values) {
        return values == null || values.isEmpty();
    }
}
