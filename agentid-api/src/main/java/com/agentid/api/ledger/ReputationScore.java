package com.agentid.api.ledger;

import java.math.BigDecimal;

/**
 * Aggregate of an agent's events.
 *
 * @param total sum of score deltas in hundredths of a point
 * @param count number of events
 */
public record ReputationScore(long total, long count) {

    public static final int BASE_HUNDREDTHS = 300;
    public static final int MAX_HUNDREDTHS = 500;

    /**
     * Reputation in points, clamped to [0, 5] with two decimals.
     */
    public BigDecimal reputation() {
        return ofHundredths(BASE_HUNDREDTHS + total);
    }

    /**
     * Clamps a score given in hundredths to [0, 5] points.
     */
    public static BigDecimal ofHundredths(long hundredths) {
        long clamped = Math.max(0, Math.min(MAX_HUNDREDTHS, hundredths));
        return BigDecimal.valueOf(clamped, 2);
    }
}
