package com.example.bulkscheduler.service.executor;

import com.example.bulkscheduler.domain.enums.RunOutcome;
import lombok.Builder;
import lombok.Data;

/**
 * Represents the result of one execution attempt.
 * <p>
 * Contains everything needed to update the job's statistics,
 * write the run log and answer a manual trigger.
 */
@Data
@Builder
public class JobExecutionResult {

    private Long jobId;

    private RunOutcome outcome;

    /**
     * Error or block reason, null on success
     */
    private String errorMessage;

    /**
     * Error classification for analysis
     */
    private String errorType;

    /**
     * HTTP status code if the generation service answered with an error
     */
    private Integer httpStatusCode;

    /**
     * Content pieces produced, as reported by the generation service
     */
    private Integer generatedCount;

    /**
     * Message returned by the generation service on success
     */
    private String responseMessage;

    private Long durationMs;

    public boolean isSuccess() {
        return outcome == RunOutcome.SUCCEEDED;
    }

    public static JobExecutionResult success(Long jobId, Integer generatedCount, String responseMessage) {
        return JobExecutionResult.builder()
                .jobId(jobId)
                .outcome(RunOutcome.SUCCEEDED)
                .generatedCount(generatedCount)
                .responseMessage(responseMessage)
                .build();
    }

    public static JobExecutionResult failure(Long jobId, String errorMessage, String errorType) {
        return JobExecutionResult.builder()
                .jobId(jobId)
                .outcome(RunOutcome.FAILED)
                .errorMessage(errorMessage)
                .errorType(errorType)
                .build();
    }

    public static JobExecutionResult failure(Long jobId, Exception e) {
        var message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return failure(jobId, message, e.getClass().getSimpleName());
    }

    public static JobExecutionResult httpFailure(Long jobId, int statusCode, String errorMessage) {
        return JobExecutionResult.builder()
                .jobId(jobId)
                .outcome(RunOutcome.FAILED)
                .errorMessage(errorMessage)
                .errorType("HTTP_" + statusCode)
                .httpStatusCode(statusCode)
                .build();
    }

    public static JobExecutionResult blocked(Long jobId, String reason) {
        return JobExecutionResult.builder()
                .jobId(jobId)
                .outcome(RunOutcome.BLOCKED)
                .errorMessage(reason)
                .errorType("SAFEGUARD_BLOCKED")
                .build();
    }

    public static JobExecutionResult alreadyRunning(Long jobId) {
        return JobExecutionResult.builder()
                .jobId(jobId)
                .outcome(RunOutcome.ALREADY_RUNNING)
                .errorMessage("Job is currently running")
                .build();
    }

    public static JobExecutionResult skipped(Long jobId, String reason) {
        return JobExecutionResult.builder()
                .jobId(jobId)
                .outcome(RunOutcome.SKIPPED)
                .errorMessage(reason)
                .build();
    }

    /**
     * Short human-readable summary for API callers and logs
     */
    public String summary() {
        return switch (outcome) {
            case SUCCEEDED -> generatedCount != null
                    ? String.format("Generated %d pieces of content", generatedCount)
                    : "Content generation completed";
            case ALREADY_RUNNING -> "Job is currently running";
            default -> errorMessage != null ? errorMessage : outcome.getDisplayName();
        };
    }
}
