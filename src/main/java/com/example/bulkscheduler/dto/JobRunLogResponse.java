package com.example.bulkscheduler.dto;

import com.example.bulkscheduler.domain.enums.GenerationOrigin;
import com.example.bulkscheduler.domain.enums.RunOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for one execution attempt
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRunLogResponse {

    private UUID id;
    private Long jobId;
    private GenerationOrigin origin;
    private RunOutcome outcome;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private String errorMessage;
    private String errorType;
    private Integer httpStatusCode;
    private Integer generatedCount;
}
