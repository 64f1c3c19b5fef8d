package com.agentid.api.reputation;

import java.math.BigDecimal;

/**
 * A signed self-report of work done in a period.
 *
 * Counts are kept exactly as submitted because the signature covers them in
 * that form; they are floored and clamped only after the signature checks out.
 * A null count is treated as zero.
 *
 * @param period    free-form label, defaults to today's UTC date
 * @param signature hex Ed25519 signature over the canonical report JSON
 */
public record WorkReport(
        String period,
        BigDecimal tasksCompleted,
        BigDecimal corrections,
        BigDecimal positiveFeedback,
        BigDecimal errors,
        String signature
) {
    public WorkReport {
        tasksCompleted = orZero(tasksCompleted);
        corrections = orZero(corrections);
        positiveFeedback = orZero(positiveFeedback);
        errors = orZero(errors);
    }

    public static WorkReport of(String period, long tasksCompleted, long corrections, long positiveFeedback,
                                long errors, String signature) {
        return new WorkReport(period, BigDecimal.valueOf(tasksCompleted), BigDecimal.valueOf(corrections),
                BigDecimal.valueOf(positiveFeedback), BigDecimal.valueOf(errors), signature);
    }

    public WorkReport withSignature(String newSignature) {
        return new WorkReport(period, tasksCompleted, corrections, positiveFeedback, errors, newSignature);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
