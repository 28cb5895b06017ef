package com.example.bulkscheduler.service.safeguard;

import com.example.bulkscheduler.config.SafeguardProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default safeguard policy driven by {@link SafeguardProperties}.
 * <p>
 * Rules, first match wins:
 * - unknown origin: blocked
 * - generation switched off globally: blocked
 * - origin on the deny list: blocked
 * - production mode: scheduled and startup origins need allow-scheduled-generation,
 *   manual triggers need allow-manual-generation
 * - anything else: allowed
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurableGenerationSafeguard implements GenerationSafeguard {

    private final SafeguardProperties properties;

    @Override
    public SafeguardDecision evaluate(SafeguardContext context) {
        var decision = decide(context);
        if (log.isDebugEnabled()) {
            log.debug("Safeguard verdict for {} (job {}): allowed={} reason={}",
                    context.getOrigin(), context.getJobId(), decision.isAllowed(), decision.getReason());
        }
        return decision;
    }

    private SafeguardDecision decide(SafeguardContext context) {
        var origin = context.getOrigin();
        if (origin == null) {
            return SafeguardDecision.block("Generation origin is unknown - blocking for security");
        }
        if (!properties.isGenerationEnabled()) {
            return SafeguardDecision.block("Generation is disabled (generation-safeguards.generation-enabled=false)");
        }
        if (properties.getBlockedOrigins() != null && properties.getBlockedOrigins().contains(origin)) {
            return SafeguardDecision.block(String.format("Origin '%s' is on the blocked origins list", origin.getCode()));
        }
        if (!properties.isProductionMode()) {
            return SafeguardDecision.allow();
        }

        return switch (origin) {
            case SCHEDULED_JOB, STARTUP_INIT -> properties.isAllowScheduledGeneration()
                    ? SafeguardDecision.allow()
                    : SafeguardDecision.block("Scheduled generation is disabled in production (set generation-safeguards.allow-scheduled-generation=true)");
            case MANUAL_TRIGGER -> properties.isAllowManualGeneration()
                    ? SafeguardDecision.allow()
                    : SafeguardDecision.block("Manual generation is disabled in production (set generation-safeguards.allow-manual-generation=true)");
        };
    }
}
