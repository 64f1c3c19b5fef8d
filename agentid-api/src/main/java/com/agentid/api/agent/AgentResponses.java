package com.agentid.api.agent;

import com.agentid.api.store.IdentityRecord;
import com.agentid.api.store.StoredEvent;
import com.agentid.core.domain.AgentIdentity.AgentStatus;
import com.agentid.core.domain.AgentIdentity.AgentType;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Response bodies of the agent endpoints.
 */
public final class AgentResponses {

    private AgentResponses() {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AgentView(
            UUID id,
            String name,
            String did,
            String publicKey,
            String ownerId,
            String parentDid,
            AgentType agentType,
            AgentStatus status,
            Map<String, Object> metadata,
            Instant createdAt,
            Instant updatedAt,
            BigDecimal reputation
    ) {
        static AgentView of(IdentityRecord identity, BigDecimal reputation) {
            return new AgentView(identity.id(), identity.name(), identity.did(), identity.publicKey(),
                    identity.ownerId(), identity.parentDid(), identity.agentType(), identity.status(),
                    identity.metadata(), identity.createdAt(), identity.updatedAt(), reputation);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RegistrationResponse(
            AgentView agent,
            String privateKey,
            String warning,
            String message
    ) {}

    public record ProfileResponse(AgentView agent, Map<String, Object> didDocument) {}

    public record SignatureCheckResponse(boolean verified, UUID agentId, String did, Instant verifiedAt) {}

    public record ReputationResponse(
            UUID agentId,
            String did,
            long score,
            long eventCount,
            BigDecimal reputation,
            long verificationCount,
            long ageDays,
            AgentStatus status,
            List<EventView> recentEvents
    ) {}

    public record EventView(
            long id,
            String eventType,
            int scoreDelta,
            String description,
            Map<String, Object> metadata,
            Instant createdAt
    ) {
        static EventView of(StoredEvent event) {
            return new EventView(event.id(), event.eventType().name(), event.scoreDelta(), event.description(),
                    event.metadata(), event.createdAt());
        }
    }

    public record WorkReportResponse(
            UUID agentId,
            String did,
            String period,
            BigDecimal delta,
            BigDecimal oldReputation,
            BigDecimal newReputation,
            Instant recordedAt
    ) {}

    public record WorkersResponse(UUID parentId, String parentDid, List<AgentView> workers, int total) {}

    public record PageResponse(List<AgentView> agents, long total, int limit, int offset) {}

    public record StatsResponse(
            long totalAgents,
            long mainAgents,
            long workerAgents,
            long totalVerifications,
            long registrations24h
    ) {}

    public record RepairResponse(UUID agentId, String did, boolean eventAppended) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record LookupResponse(
            boolean verified,
            String did,
            String name,
            BigDecimal reputation,
            Long tasksCompleted,
            Instant registeredAt,
            Integer flags,
            String message
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ClaimResponse(
            boolean verified,
            UUID verificationId,
            UUID agentId,
            String did,
            String claimType,
            String claimValue,
            Boolean signatureVerified,
            Instant verifiedAt,
            Instant expiresAt
    ) {}

    public record ClaimView(
            UUID id,
            String verifierId,
            String claimType,
            String claimValue,
            Instant verifiedAt,
            Instant expiresAt
    ) {}

    public record ClaimsResponse(UUID agentId, String did, List<ClaimView> claims, int total) {}
}
