package com.agentid.api.store;

import java.time.Instant;
import java.util.UUID;

public record ClaimRecord(
        UUID id,
        UUID agentId,
        String verifierId,
        String claimType,
        String claimValue,
        String signature,
        Instant verifiedAt,
        Instant expiresAt
) {
    public boolean isActive(Instant now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }
}
