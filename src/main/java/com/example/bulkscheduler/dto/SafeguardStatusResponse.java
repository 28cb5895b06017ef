package com.example.bulkscheduler.dto;

import com.example.bulkscheduler.domain.enums.GenerationOrigin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Current safeguard configuration and the verdict it gives per origin
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SafeguardStatusResponse {

    private boolean generationEnabled;
    private boolean productionMode;
    private boolean allowScheduledGeneration;
    private boolean allowManualGeneration;

    @Builder.Default
    private List<OriginDecision> decisions = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OriginDecision {
        private GenerationOrigin origin;
        private boolean allowed;
        private String reason;
    }
}
