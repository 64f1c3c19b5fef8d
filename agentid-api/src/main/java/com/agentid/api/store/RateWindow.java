package com.agentid.api.store;

import java.time.Instant;

/**
 * Snapshot of a rate limit window.
 *
 * @param created true when this call inserted the row, i.e. the action is the first of a fresh window
 */
public record RateWindow(
        long id,
        String identifier,
        String actionType,
        int count,
        Instant windowStart,
        boolean created
) {}
