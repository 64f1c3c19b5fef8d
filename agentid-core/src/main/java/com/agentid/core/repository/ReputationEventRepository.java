package com.agentid.core.repository;

import com.agentid.core.domain.ReputationEvent;
import com.agentid.core.domain.ReputationEvent.EventType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for reputation events.
 * Append-only: no update or delete operations are exposed.
 */
@Repository
public interface ReputationEventRepository extends JpaRepository<ReputationEvent, Long> {

    /**
     * Sum and count of every event for an agent, read in one statement.
     */
    @Query("SELECT SUM(e.scoreDelta) AS total, COUNT(e) AS eventCount FROM ReputationEvent e WHERE e.agentId = :agentId")
    DeltaTotals sumDeltasByAgentId(@Param("agentId") UUID agentId);

    /**
     * Sum of one event type since an instant (daily cap bookkeeping).
     */
    @Query("SELECT SUM(e.scoreDelta) FROM ReputationEvent e " +
           "WHERE e.agentId = :agentId AND e.eventType = :eventType AND e.createdAt >= :since")
    Long sumDeltasSince(@Param("agentId") UUID agentId,
                        @Param("eventType") EventType eventType,
                        @Param("since") Instant since);

    /**
     * Newest first; the identity column is monotonic so it breaks timestamp ties.
     */
    List<ReputationEvent> findByAgentIdOrderByIdDesc(UUID agentId, Pageable pageable);

    boolean existsByAgentIdAndEventType(UUID agentId, EventType eventType);

    /**
     * Projection for {@link #sumDeltasByAgentId(UUID)}. The total is null when the agent has no events.
     */
    interface DeltaTotals {
        Long getTotal();
        Long getEventCount();
    }
}
