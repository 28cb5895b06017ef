package com.example.bulkscheduler.service.safeguard;

/**
 * Policy deciding whether a generation attempt may proceed.
 * <p>
 * Consulted once at startup before any timer is re-armed, once per timer fire
 * and once per manual trigger. Implementations must be free of side effects.
 */
public interface GenerationSafeguard {

    SafeguardDecision evaluate(SafeguardContext context);
}
