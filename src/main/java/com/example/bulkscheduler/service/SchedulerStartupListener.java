package com.example.bulkscheduler.service;

import com.example.bulkscheduler.config.BulkSchedulerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Arms the timers of all active jobs once the application is ready
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchedulerStartupListener {

    private final ScheduledJobService jobService;
    private final BulkSchedulerProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isInitializeOnStartup()) {
            log.info("Scheduled job initialization on startup is disabled");
            return;
        }

        try {
            var armed = jobService.initializeScheduledJobs();
            log.info("Scheduler started with {} armed jobs", armed);
        } catch (Exception e) {
            log.error("Scheduled job initialization failed: {}", e.getMessage(), e);
        }
    }
}
