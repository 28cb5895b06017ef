package com.example.bulkscheduler.service.safeguard;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Verdict of the safeguard gate. A blocked decision always carries a reason.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SafeguardDecision {

    private static final SafeguardDecision ALLOWED = new SafeguardDecision(true, null);

    private final boolean allowed;
    private final String reason;

    public static SafeguardDecision allow() {
        return ALLOWED;
    }

    public static SafeguardDecision block(String reason) {
        return new SafeguardDecision(false, reason);
    }
}
