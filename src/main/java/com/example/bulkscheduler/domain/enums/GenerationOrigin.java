package com.example.bulkscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Where a generation attempt originates. The safeguard gate decides per origin.
 */
@Getter
@RequiredArgsConstructor
public enum GenerationOrigin {

    /**
     * A job's daily timer fired
     */
    SCHEDULED_JOB("scheduled_job"),

    /**
     * An operator asked for an immediate run through the API
     */
    MANUAL_TRIGGER("manual_trigger"),

    /**
     * Process boot, before any timer is re-armed
     */
    STARTUP_INIT("startup_init");

    private final String code;
}
