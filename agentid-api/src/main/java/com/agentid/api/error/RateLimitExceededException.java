package com.agentid.api.error;

import java.time.Duration;

/**
 * An identifier used up its allowance for an action in the current window.
 */
public class RateLimitExceededException extends LedgerException {

    private final String actionType;
    private final Duration retryAfter;

    public RateLimitExceededException(String actionType, String message, Duration retryAfter) {
        super("RATE_001", message);
        this.actionType = actionType;
        this.retryAfter = retryAfter;
    }

    public String getActionType() {
        return actionType;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
