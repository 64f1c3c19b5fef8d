package com.agentid.api.store;

import com.agentid.api.error.DuplicateIdentityException;
import com.agentid.api.error.PersistenceFailureException;
import com.agentid.core.domain.AgentIdentity.AgentStatus;
import com.agentid.core.domain.AgentIdentity.AgentType;
import com.agentid.core.domain.ReputationEvent.EventType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence operations the ledger depends on.
 *
 * Every call is atomic on its own. Not-found is reported as an empty result;
 * an unreachable or timed-out store is reported as {@link PersistenceFailureException}.
 */
public interface LedgerStore {

    // ==================== Identities ====================

    /**
     * @throws DuplicateIdentityException if the id or DID is already taken
     */
    IdentityRecord insertIdentity(IdentityRecord identity);

    Optional<IdentityRecord> findIdentityByDid(String did);

    Optional<IdentityRecord> findIdentityById(UUID id);

    /**
     * Workers whose parent DID is the given one, newest first.
     */
    List<IdentityRecord> listWorkers(String parentDid);

    /**
     * Identities newest first.
     */
    List<IdentityRecord> pageIdentities(int limit, int offset);

    long countIdentities();

    long countIdentitiesByType(AgentType agentType);

    long countIdentitiesCreatedSince(Instant since);

    Optional<IdentityRecord> updateIdentityStatus(UUID id, AgentStatus status, Instant at);

    // ==================== Reputation events ====================

    StoredEvent insertEvent(NewEvent event);

    EventTotals sumEventDeltas(UUID agentId);

    /**
     * Sum of deltas of one event type created at or after {@code since}.
     */
    long sumEventDeltasSince(UUID agentId, EventType eventType, Instant since);

    /**
     * Most recent events first.
     */
    List<StoredEvent> listEvents(UUID agentId, int limit);

    boolean hasEventOfType(UUID agentId, EventType eventType);

    // ==================== Claims ====================

    ClaimRecord insertClaim(ClaimRecord claim);

    /**
     * Every claim for the agent, expired ones included, newest first.
     */
    List<ClaimRecord> listClaims(UUID agentId);

    long countClaims(UUID agentId);

    long countAllClaims();

    // ==================== Rate limit windows ====================

    /**
     * Inserts a window with count 1, or returns the existing window for the pair when the
     * unique key is already taken.
     */
    RateWindow findOrCreateRateWindow(String identifier, String actionType, Instant now);

    /**
     * Compare-and-swap increment.
     *
     * @return false if the stored count no longer equals {@code expectedCount}
     */
    boolean incrementRateWindow(long windowId, int expectedCount);

    /**
     * Deletes the window of one pair if it started at or before the cutoff.
     */
    int deleteExpiredRateWindow(String identifier, String actionType, Instant cutoff);

    /**
     * Deletes every window that started at or before the cutoff.
     */
    int deleteExpiredRateWindows(Instant cutoff);
}
