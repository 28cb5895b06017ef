package com.example.bulkscheduler.controller;

import com.example.bulkscheduler.domain.enums.RunOutcome;
import com.example.bulkscheduler.dto.ApiResponse;
import com.example.bulkscheduler.dto.CreateScheduledJobRequest;
import com.example.bulkscheduler.dto.EmergencyStopResponse;
import com.example.bulkscheduler.dto.JobRunLogResponse;
import com.example.bulkscheduler.dto.SafeguardStatusResponse;
import com.example.bulkscheduler.dto.ScheduledJobResponse;
import com.example.bulkscheduler.dto.SchedulerStatusResponse;
import com.example.bulkscheduler.dto.TriggerResponse;
import com.example.bulkscheduler.dto.UpdateSafeguardsRequest;
import com.example.bulkscheduler.dto.UpdateScheduledJobRequest;
import com.example.bulkscheduler.service.ScheduledJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Admin REST API for scheduled bulk-generation jobs.
 * <p>
 * Provides endpoints for:
 * - Listing, creating, updating and deleting jobs
 * - Run history and manual triggers
 * - Emergency stop and scheduler diagnostics
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/admin/jobs")
@Tag(name = "Scheduled Jobs", description = "APIs for managing scheduled bulk-generation jobs")
public class ScheduledJobController {

    private final ScheduledJobService jobService;

    // === Job Retrieval ===

    @GetMapping
    @Operation(summary = "List jobs", description = "List scheduled jobs ordered by creation time")
    public ResponseEntity<ApiResponse<List<ScheduledJobResponse>>> listJobs(
            @Parameter(description = "Owner filter") @RequestParam(required = false) Long userId) {

        return ResponseEntity.ok(ApiResponse.success(jobService.listJobs(userId)));
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job by ID", description = "Retrieve one scheduled job with its timer state")
    public ResponseEntity<ApiResponse<ScheduledJobResponse>> getJob(
            @Parameter(description = "Job ID") @PathVariable Long jobId) {

        return ResponseEntity.ok(ApiResponse.success(jobService.getJob(jobId)));
    }

    @GetMapping("/{jobId}/runs")
    @Operation(summary = "Get run history", description = "Most recent execution attempts of a job, newest first")
    public ResponseEntity<ApiResponse<List<JobRunLogResponse>>> getRuns(
            @Parameter(description = "Job ID") @PathVariable Long jobId) {

        return ResponseEntity.ok(ApiResponse.success(jobService.getRecentRuns(jobId)));
    }

    // === Job Lifecycle ===

    @PostMapping
    @Operation(summary = "Create a job", description = "Store a new job and arm its daily timer if active")
    public ResponseEntity<ApiResponse<ScheduledJobResponse>> createJob(@Valid @RequestBody CreateScheduledJobRequest request) {
        log.info("API: Create job at {} for niches {}", request.getScheduleTime(), request.getSelectedNiches());

        var response = jobService.createJob(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Scheduled job created successfully"));
    }

    @PutMapping("/{jobId}")
    @Operation(summary = "Update a job", description = "Apply the supplied fields and re-arm the job's timer")
    public ResponseEntity<ApiResponse<ScheduledJobResponse>> updateJob(
            @Parameter(description = "Job ID") @PathVariable Long jobId,
            @Valid @RequestBody UpdateScheduledJobRequest request) {
        log.info("API: Update job {}", jobId);

        var response = jobService.updateJob(jobId, request);
        return ResponseEntity.ok(ApiResponse.success(response, "Scheduled job updated successfully"));
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "Delete a job", description = "Destroy the job's timer and delete it")
    public ResponseEntity<ApiResponse<Void>> deleteJob(
            @Parameter(description = "Job ID") @PathVariable Long jobId) {
        log.info("API: Delete job {}", jobId);

        jobService.deleteJob(jobId);
        return ResponseEntity.ok(ApiResponse.success(null, "Scheduled job deleted successfully"));
    }

    // === Manual Trigger ===

    @PostMapping("/{jobId}/trigger")
    @Operation(summary = "Trigger a job", description = "Run a job once now; returns a 'currently running' result if it is executing")
    public ResponseEntity<ApiResponse<TriggerResponse>> triggerJob(
            @Parameter(description = "Job ID") @PathVariable Long jobId) {
        log.info("API: Manual trigger for job {}", jobId);

        var response = jobService.triggerJob(jobId);
        if (response.getOutcome() == RunOutcome.SUCCEEDED) {
            return ResponseEntity.ok(ApiResponse.success(response, response.getMessage()));
        }
        if (response.getOutcome() == RunOutcome.BLOCKED) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ApiResponse.failure(response, response.getMessage()));
        }
        return ResponseEntity.ok(ApiResponse.failure(response, response.getMessage()));
    }

    // === Scheduler Control ===

    @PostMapping("/emergency-stop")
    @Operation(summary = "Emergency stop", description = "Destroy every armed timer; in-flight executions complete")
    public ResponseEntity<ApiResponse<EmergencyStopResponse>> emergencyStop() {
        log.warn("API: Emergency stop");

        var response = jobService.emergencyStop();
        return ResponseEntity.ok(ApiResponse.success(response,
                String.format("Stopped %d scheduled jobs", response.getStoppedCount())));
    }

    @GetMapping("/status")
    @Operation(summary = "Scheduler status", description = "Diagnostic snapshot of every armed timer")
    public ResponseEntity<ApiResponse<SchedulerStatusResponse>> getStatus() {
        return ResponseEntity.ok(ApiResponse.success(jobService.getStatus()));
    }

    @GetMapping("/safeguards")
    @Operation(summary = "Safeguard status", description = "Current safeguard configuration and the verdict for each origin")
    public ResponseEntity<ApiResponse<SafeguardStatusResponse>> getSafeguards() {
        return ResponseEntity.ok(ApiResponse.success(jobService.getSafeguardStatus()));
    }

    @PutMapping("/safeguards")
    @Operation(summary = "Update safeguards", description = "Flip generation switches at runtime; omitted fields are unchanged")
    public ResponseEntity<ApiResponse<SafeguardStatusResponse>> updateSafeguards(
            @Valid @RequestBody UpdateSafeguardsRequest request) {
        log.warn("API: Update safeguards {}", request);

        var response = jobService.updateSafeguards(request);
        return ResponseEntity.ok(ApiResponse.success(response, "Safeguards updated"));
    }
}
