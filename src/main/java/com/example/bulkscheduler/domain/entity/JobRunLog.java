package com.example.bulkscheduler.domain.entity;

import com.example.bulkscheduler.domain.enums.GenerationOrigin;
import com.example.bulkscheduler.domain.enums.RunOutcome;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * History entry for one execution attempt of a scheduled job.
 * Blocked attempts are logged too, with no collaborator call behind them.
 */
@Entity
@Table(name = "job_run_logs", indexes = {
        @Index(name = "idx_run_log_job_started", columnList = "job_id, started_at"),
        @Index(name = "idx_run_log_outcome", columnList = "outcome")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobRunLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private Long jobId;

    /**
     * What started the attempt
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "origin", nullable = false, length = 30)
    private GenerationOrigin origin;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 30)
    private RunOutcome outcome;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    /**
     * Error classification, e.g. VALIDATION_ERROR or HTTP_503
     */
    @Column(name = "error_type", length = 200)
    private String errorType;

    @Column(name = "http_status_code")
    private Integer httpStatusCode;

    /**
     * Number of content pieces the generation service reported
     */
    @Column(name = "generated_count")
    private Integer generatedCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
    }
}
