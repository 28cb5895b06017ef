package com.example.bulkscheduler.config;

import com.example.bulkscheduler.domain.enums.GenerationOrigin;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumSet;
import java.util.Set;

/**
 * Generation safeguard configuration.
 * <p>
 * Outside production mode every origin is allowed unless generation is
 * switched off globally or the origin is explicitly blocked. In production
 * mode scheduled generation needs an explicit opt-in.
 * <p>
 * The switches can be flipped at runtime through the admin API.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "generation-safeguards")
public class SafeguardProperties {

    /**
     * Global kill switch for every generation attempt
     */
    private volatile boolean generationEnabled = true;

    private boolean productionMode = false;

    /**
     * Production only: permit timer fires and startup re-arming
     */
    private volatile boolean allowScheduledGeneration = false;

    /**
     * Production only: permit manual triggers
     */
    private volatile boolean allowManualGeneration = true;

    /**
     * Origins refused regardless of mode
     */
    private Set<GenerationOrigin> blockedOrigins = EnumSet.noneOf(GenerationOrigin.class);
}
