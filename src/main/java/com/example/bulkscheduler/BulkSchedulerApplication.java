package com.example.bulkscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Bulk Generation Scheduler Application
 * <p>
 * Orchestrates recurring bulk content-generation jobs: one daily timer per
 * active job, at most one in-flight execution per job, and a safeguard policy
 * consulted before every generation attempt.
 * <p>
 * Features:
 * - Timezone-aware daily schedules backed by a persisted job table
 * - Safe teardown and re-arm of timers on edit, delete and restart
 * - Run statistics and execution history per job
 * - Slack alerting for failure streaks and emergency stops
 */
@EnableScheduling
@SpringBootApplication
public class BulkSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BulkSchedulerApplication.class, args);
    }
}
