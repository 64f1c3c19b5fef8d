package com.agentid.api.ledger;

import com.agentid.api.error.PersistenceFailureException;
import com.agentid.api.store.EventTotals;
import com.agentid.api.store.LedgerStore;
import com.agentid.api.store.NewEvent;
import com.agentid.api.store.StoredEvent;
import com.agentid.core.domain.ReputationEvent.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only reputation ledger.
 *
 * There is no update or delete path; a score is always recomputed from the
 * events, never cached.
 */
@Service
public class EventLedger {

    private static final Logger log = LoggerFactory.getLogger(EventLedger.class);

    /** Width of the description column. */
    public static final int MAX_DESCRIPTION_LENGTH = 255;

    private final LedgerStore store;

    public EventLedger(LedgerStore store) {
        this.store = store;
    }

    /**
     * Appends one event. Descriptions longer than the column are cut to fit.
     *
     * @throws PersistenceFailureException if the store rejects or times out
     */
    public StoredEvent append(NewEvent event) {
        if (event.agentId() == null || event.eventType() == null || event.createdAt() == null) {
            throw new IllegalArgumentException("Event requires agent, type and timestamp");
        }
        StoredEvent stored = store.insertEvent(boundDescription(event));
        log.debug("Appended {} event {} for agent {} with delta {}",
                stored.eventType(), stored.id(), stored.agentId(), stored.scoreDelta());
        return stored;
    }

    private static NewEvent boundDescription(NewEvent event) {
        String description = event.description();
        if (description == null || description.length() <= MAX_DESCRIPTION_LENGTH) {
            return event;
        }
        return new NewEvent(event.agentId(), event.eventType(), event.scoreDelta(),
                description.substring(0, MAX_DESCRIPTION_LENGTH), event.metadata(), event.createdAt());
    }

    public ReputationScore scoreFor(UUID agentId) {
        EventTotals totals = store.sumEventDeltas(agentId);
        return new ReputationScore(totals.total(), totals.count());
    }

    /**
     * Most recent events first.
     */
    public List<StoredEvent> recentEvents(UUID agentId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return store.listEvents(agentId, limit);
    }

    /**
     * Net delta (hundredths) of one event type recorded at or after {@code since}.
     */
    public long dailyDelta(UUID agentId, EventType eventType, Instant since) {
        return store.sumEventDeltasSince(agentId, eventType, since);
    }

    public boolean hasEventOfType(UUID agentId, EventType eventType) {
        return store.hasEventOfType(agentId, eventType);
    }
}
