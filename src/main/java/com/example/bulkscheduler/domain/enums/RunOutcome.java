package com.example.bulkscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of one execution attempt of a scheduled job.
 */
@Getter
@RequiredArgsConstructor
public enum RunOutcome {

    /**
     * Generation service reported success
     */
    SUCCEEDED("Succeeded"),

    /**
     * Validation, transport or collaborator failure
     */
    FAILED("Failed"),

    /**
     * Safeguard gate refused the attempt, nothing was sent
     */
    BLOCKED("Blocked"),

    /**
     * Another execution of the same job held the lock
     */
    ALREADY_RUNNING("Already running"),

    /**
     * Job vanished or was deactivated before the fire was handled
     */
    SKIPPED("Skipped");

    private final String displayName;

    public boolean isFailure() {
        return this == FAILED || this == BLOCKED;
    }
}
