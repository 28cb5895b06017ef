package com.example.bulkscheduler.service.safeguard;

import com.example.bulkscheduler.domain.entity.ScheduledJob;
import com.example.bulkscheduler.domain.enums.GenerationOrigin;
import lombok.Builder;
import lombok.Getter;

/**
 * What the safeguard gate gets to see about an attempt
 */
@Getter
@Builder
public class SafeguardContext {

    private final GenerationOrigin origin;

    /**
     * Null for startup initialization
     */
    private final Long jobId;

    private final String jobName;

    public static SafeguardContext of(GenerationOrigin origin) {
        return SafeguardContext.builder().origin(origin).build();
    }

    public static SafeguardContext forJob(GenerationOrigin origin, ScheduledJob job) {
        return SafeguardContext.builder()
                .origin(origin)
                .jobId(job.getId())
                .jobName(job.getName())
                .build();
    }
}
