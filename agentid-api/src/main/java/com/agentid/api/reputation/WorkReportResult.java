package com.agentid.api.reputation;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of an accepted work report. Reputations are clamped to [0, 5].
 *
 * @param delta applied change in points, two decimals
 */
public record WorkReportResult(
        UUID agentId,
        String did,
        String period,
        BigDecimal delta,
        BigDecimal oldReputation,
        BigDecimal newReputation,
        Instant recordedAt
) {}
