package com.example.bulkscheduler.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request/Response DTOs for external service clients
 */
public class ClientModels {
    private ClientModels() {
    }

    // === Generation Service Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GenerationRequest {
        @Builder.Default
        private String mode = "automated";
        private List<String> selectedNiches;
        private List<String> tones;
        private List<String> templates;
        private List<String> platforms;
        private boolean useExistingProducts;
        private boolean generateAffiliateLinks;
        private boolean useSpartanFormat;
        private boolean useSmartStyle;
        private String aiModel;
        private String affiliateId;
        private String webhookUrl;
        private boolean sendToMakeWebhook;
        private Long userId;
        private Long scheduledJobId;
        private String scheduledJobName;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GenerationResponse {
        private boolean success;
        private String error;
        private String message;
        private Integer generatedCount;
    }
}
