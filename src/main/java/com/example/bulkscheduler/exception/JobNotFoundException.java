package com.example.bulkscheduler.exception;

import lombok.Getter;

/**
 * Exception for scheduled job not found
 */
@Getter
public class JobNotFoundException extends RuntimeException {

    private final Long jobId;

    public JobNotFoundException(Long jobId) {
        super("Scheduled job not found: " + jobId);
        this.jobId = jobId;
    }
}
