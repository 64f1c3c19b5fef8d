package com.agentid.api.ratelimit;

import java.time.Duration;

/**
 * Allowance for one action: at most {@code maxCount} actions per identifier per window.
 */
public record RateLimitPolicy(String actionType, int maxCount, Duration window) {

    public static final RateLimitPolicy REGISTRATION = new RateLimitPolicy("registration", 10, Duration.ofHours(24));
    public static final RateLimitPolicy WORK_REPORT = new RateLimitPolicy("work_report", 5, Duration.ofHours(24));

    public RateLimitPolicy {
        if (actionType == null || actionType.isBlank()) {
            throw new IllegalArgumentException("Action type cannot be null or blank");
        }
        if (maxCount <= 0) {
            throw new IllegalArgumentException("Max count must be positive");
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Window must be positive");
        }
    }
}
