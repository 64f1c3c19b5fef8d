package com.agentid.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * AgentIdentity - A registered agent and its Ed25519 public key.
 *
 * Main agents carry a DID derived from their key. Workers are scoped under a
 * main agent: their DID is the parent DID plus a short suffix, and they can
 * never act as a parent themselves.
 *
 * Only the status may change once the row is written.
 */
@Entity
@Table(name = "agents",
    uniqueConstraints = @UniqueConstraint(name = "uk_agents_did", columnNames = "did"),
    indexes = {
    @Index(name = "idx_agents_owner", columnList = "owner_id"),
    @Index(name = "idx_agents_parent", columnList = "parent_did"),
    @Index(name = "idx_agents_created", columnList = "created_at")
})
public class AgentIdentity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "owner_id", updatable = false)
    private String ownerId;

    @NotNull
    @Column(name = "public_key", nullable = false, length = 64, updatable = false)
    private String publicKey;

    @NotNull
    @Column(name = "did", nullable = false, updatable = false)
    private String did;

    @Column(name = "parent_did", updatable = false)
    private String parentDid;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "agent_type", nullable = false, updatable = false)
    private AgentType agentType;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private AgentStatus status;

    @Column(name = "metadata", length = 4000, updatable = false)
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public enum AgentType {
        MAIN,
        WORKER
    }

    public enum AgentStatus {
        ACTIVE,
        FLAGGED
    }

    protected AgentIdentity() {}

    /**
     * Creates a main agent identity.
     */
    public static AgentIdentity createMain(UUID id, String name, String ownerId, String publicKey,
                                           String did, String metadata, Instant createdAt) {
        return create(id, name, ownerId, publicKey, did, null, AgentType.MAIN, metadata, createdAt);
    }

    /**
     * Creates a worker identity under an existing main agent.
     */
    public static AgentIdentity createWorker(UUID id, String name, String ownerId, String publicKey,
                                             String did, String parentDid, String metadata, Instant createdAt) {
        if (parentDid == null || parentDid.isBlank()) {
            throw new IllegalArgumentException("Worker identities require a parent DID");
        }
        return create(id, name, ownerId, publicKey, did, parentDid, AgentType.WORKER, metadata, createdAt);
    }

    private static AgentIdentity create(UUID id, String name, String ownerId, String publicKey, String did,
                                        String parentDid, AgentType agentType, String metadata, Instant createdAt) {
        if (id == null) {
            throw new IllegalArgumentException("Identity ID cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Name cannot be null or blank");
        }
        if (publicKey == null || publicKey.isBlank()) {
            throw new IllegalArgumentException("Public key cannot be null or blank");
        }
        if (did == null || !did.startsWith("did:")) {
            throw new IllegalArgumentException("DID must start with did:");
        }
        AgentIdentity identity = new AgentIdentity();
        identity.id = id;
        identity.name = name;
        identity.ownerId = ownerId;
        identity.publicKey = publicKey;
        identity.did = did;
        identity.parentDid = parentDid;
        identity.agentType = agentType;
        identity.status = AgentStatus.ACTIVE;
        identity.metadata = metadata;
        identity.createdAt = createdAt;
        identity.updatedAt = createdAt;
        return identity;
    }

    public void changeStatus(AgentStatus newStatus, Instant at) {
        if (newStatus == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        this.status = newStatus;
        this.updatedAt = at;
    }

    // Getters
    public UUID getId() { return id; }
    public String getName() { return name; }
    public String getOwnerId() { return ownerId; }
    public String getPublicKey() { return publicKey; }
    public String getDid() { return did; }
    public String getParentDid() { return parentDid; }
    public AgentType getAgentType() { return agentType; }
    public AgentStatus getStatus() { return status; }
    public String getMetadata() { return metadata; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
