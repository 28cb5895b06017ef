package com.example.bulkscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostic snapshot of the timer registry
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStatusResponse {

    /**
     * Number of armed timers
     */
    private int totalActive;

    @Builder.Default
    private List<JobTimerStatus> jobs = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class JobTimerStatus {
        private Long id;
        private boolean running;
        private boolean destroyed;
        private boolean executing;
        private String cronExpression;
        private String timezone;
        private Instant armedAt;
    }
}
