package com.example.bulkscheduler.dto;

import com.example.bulkscheduler.domain.enums.RunOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a manual trigger
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerResponse {

    private Long jobId;
    private RunOutcome outcome;
    private String message;
    private Integer generatedCount;
    private Long durationMs;

    /**
     * Job state after the attempt
     */
    private ScheduledJobResponse job;
}
