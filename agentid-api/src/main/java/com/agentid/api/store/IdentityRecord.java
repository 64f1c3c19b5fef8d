package com.agentid.api.store;

import com.agentid.core.domain.AgentIdentity.AgentStatus;
import com.agentid.core.domain.AgentIdentity.AgentType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Stored agent identity as seen by the ledger services.
 */
public record IdentityRecord(
        UUID id,
        String name,
        String ownerId,
        String publicKey,
        String did,
        String parentDid,
        AgentType agentType,
        AgentStatus status,
        Map<String, Object> metadata,
        Instant createdAt,
        Instant updatedAt
) {
    public IdentityRecord {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean isWorker() {
        return agentType == AgentType.WORKER;
    }

    public IdentityRecord withStatus(AgentStatus newStatus, Instant at) {
        return new IdentityRecord(id, name, ownerId, publicKey, did, parentDid, agentType,
                newStatus, metadata, createdAt, at);
    }
}
