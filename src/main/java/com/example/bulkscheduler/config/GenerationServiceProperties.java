package com.example.bulkscheduler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Generation service (external collaborator) configuration properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "external-services.generation-service")
public class GenerationServiceProperties {

    @NotBlank
    private String baseUrl;

    @NotBlank
    private String generatePath = "/api/generate-unified";

    /**
     * Bulk generation is slow, so the default is generous
     */
    @Min(1)
    private int timeoutSeconds = 300;

    /**
     * Value of the x-generation-source header sent with every call
     */
    @NotBlank
    private String sourceTag = "scheduled_job";
}
