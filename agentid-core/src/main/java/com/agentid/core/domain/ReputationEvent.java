package com.agentid.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * Reputation Event - One immutable adjustment to an agent's score.
 *
 * The ledger is append-only: there are no mutators and the repository exposes
 * no update path. The score delta is stored in hundredths of a reputation
 * point, so +10 is +0.10 reputation.
 */
@Entity
@Table(name = "reputation_events", indexes = {
    @Index(name = "idx_reputation_agent", columnList = "agent_id"),
    @Index(name = "idx_reputation_agent_type_time", columnList = "agent_id, event_type, created_at")
})
public class ReputationEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @NotNull
    @Column(name = "agent_id", nullable = false, updatable = false)
    private UUID agentId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false)
    private EventType eventType;

    @Column(name = "score_delta", nullable = false, updatable = false)
    private int scoreDelta;

    @Column(name = "description", updatable = false)
    private String description;

    @Column(name = "metadata", length = 4000, updatable = false)
    private String metadata;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public enum EventType {
        REGISTRATION,
        VERIFICATION_SUCCESS,
        WORK_REPORT,
        CLAIM_VERIFIED
    }

    protected ReputationEvent() {}

    public static ReputationEvent create(UUID agentId, EventType eventType, int scoreDelta,
                                         String description, String metadata, Instant createdAt) {
        if (agentId == null) {
            throw new IllegalArgumentException("Agent ID cannot be null");
        }
        if (eventType == null) {
            throw new IllegalArgumentException("Event type cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Creation time cannot be null");
        }
        ReputationEvent event = new ReputationEvent();
        event.agentId = agentId;
        event.eventType = eventType;
        event.scoreDelta = scoreDelta;
        event.description = description;
        event.metadata = metadata;
        event.createdAt = createdAt;
        return event;
    }

    // Getters
    public Long getId() { return id; }
    public UUID getAgentId() { return agentId; }
    public EventType getEventType() { return eventType; }
    public int getScoreDelta() { return scoreDelta; }
    public String getDescription() { return description; }
    public String getMetadata() { return metadata; }
    public Instant getCreatedAt() { return createdAt; }
}
