package com.agentid.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * Agent Claim - An attested statement about an agent.
 *
 * A claim may be backed by a signature and may expire. Expired claims stay in
 * the table and are filtered out by readers.
 */
@Entity
@Table(name = "verifications", indexes = {
    @Index(name = "idx_verifications_agent", columnList = "agent_id")
})
public class AgentClaim {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "agent_id", nullable = false, updatable = false)
    private UUID agentId;

    @Column(name = "verifier_id", updatable = false)
    private String verifierId;

    @NotNull
    @Column(name = "claim_type", nullable = false, updatable = false)
    private String claimType;

    @Column(name = "claim_value", length = 1000, updatable = false)
    private String claimValue;

    @Column(name = "signature", length = 256, updatable = false)
    private String signature;

    @NotNull
    @Column(name = "verified_at", nullable = false, updatable = false)
    private Instant verifiedAt;

    @Column(name = "expires_at", updatable = false)
    private Instant expiresAt;

    protected AgentClaim() {}

    public static AgentClaim create(UUID id, UUID agentId, String verifierId, String claimType, String claimValue,
                                    String signature, Instant verifiedAt, Instant expiresAt) {
        if (id == null || agentId == null) {
            throw new IllegalArgumentException("Claim and agent IDs cannot be null");
        }
        if (claimType == null || claimType.isBlank()) {
            throw new IllegalArgumentException("Claim type cannot be null or blank");
        }
        if (expiresAt != null && expiresAt.isBefore(verifiedAt)) {
            throw new IllegalArgumentException("Claim cannot expire before it was verified");
        }
        AgentClaim claim = new AgentClaim();
        claim.id = id;
        claim.agentId = agentId;
        claim.verifierId = verifierId;
        claim.claimType = claimType;
        claim.claimValue = claimValue;
        claim.signature = signature;
        claim.verifiedAt = verifiedAt;
        claim.expiresAt = expiresAt;
        return claim;
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getAgentId() { return agentId; }
    public String getVerifierId() { return verifierId; }
    public String getClaimType() { return claimType; }
    public String getClaimValue() { return claimValue; }
    public String getSignature() { return signature; }
    public Instant getVerifiedAt() { return verifiedAt; }
    public Instant getExpiresAt() { return expiresAt; }
}
