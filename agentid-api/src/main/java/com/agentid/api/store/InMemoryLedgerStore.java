package com.agentid.api.store;

import com.agentid.api.error.DuplicateIdentityException;
import com.agentid.core.domain.AgentIdentity.AgentStatus;
import com.agentid.core.domain.AgentIdentity.AgentType;
import com.agentid.core.domain.ReputationEvent.EventType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of LedgerStore for tests and local development.
 * Production uses {@link JpaLedgerStore}.
 *
 * Each method is atomic by synchronizing on the store, which is enough to
 * reproduce the unique-key and compare-and-swap behavior of the database.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final Map<UUID, IdentityRecord> identities = new ConcurrentHashMap<>();
    private final Map<String, UUID> didIndex = new ConcurrentHashMap<>();
    private final List<StoredEvent> events = new ArrayList<>();
    private final List<ClaimRecord> claims = new ArrayList<>();
    private final Map<String, RateWindow> windows = new ConcurrentHashMap<>();
    private final AtomicLong eventSequence = new AtomicLong();
    private final AtomicLong windowSequence = new AtomicLong();

    @Override
    public synchronized IdentityRecord insertIdentity(IdentityRecord identity) {
        if (identities.containsKey(identity.id()) || didIndex.containsKey(identity.did())) {
            throw new DuplicateIdentityException(identity.did(), null);
        }
        identities.put(identity.id(), identity);
        didIndex.put(identity.did(), identity.id());
        return identity;
    }

    @Override
    public Optional<IdentityRecord> findIdentityByDid(String did) {
        UUID id = didIndex.get(did);
        return id == null ? Optional.empty() : Optional.ofNullable(identities.get(id));
    }

    @Override
    public Optional<IdentityRecord> findIdentityById(UUID id) {
        return Optional.ofNullable(identities.get(id));
    }

    @Override
    public List<IdentityRecord> listWorkers(String parentDid) {
        return identities.values().stream()
                .filter(identity -> parentDid.equals(identity.parentDid()))
                .sorted(Comparator.comparing(IdentityRecord::createdAt).reversed())
                .toList();
    }

    @Override
    public List<IdentityRecord> pageIdentities(int limit, int offset) {
        return identities.values().stream()
                .sorted(Comparator.comparing(IdentityRecord::createdAt).reversed())
                .skip(offset)
                .limit(limit)
                .toList();
    }

    @Override
    public long countIdentities() {
        return identities.size();
    }

    @Override
    public long countIdentitiesByType(AgentType agentType) {
        return identities.values().stream().filter(identity -> identity.agentType() == agentType).count();
    }

    @Override
    public long countIdentitiesCreatedSince(Instant since) {
        return identities.values().stream().filter(identity -> identity.createdAt().isAfter(since)).count();
    }

    @Override
    public synchronized Optional<IdentityRecord> updateIdentityStatus(UUID id, AgentStatus status, Instant at) {
        IdentityRecord current = identities.get(id);
        if (current == null) {
            return Optional.empty();
        }
        IdentityRecord updated = current.withStatus(status, at);
        identities.put(id, updated);
        return Optional.of(updated);
    }

    @Override
    public synchronized StoredEvent insertEvent(NewEvent event) {
        StoredEvent stored = new StoredEvent(
                eventSequence.incrementAndGet(),
                event.agentId(),
                event.eventType(),
                event.scoreDelta(),
                event.description(),
                event.metadata(),
                event.createdAt());
        events.add(stored);
        return stored;
    }

    @Override
    public synchronized EventTotals sumEventDeltas(UUID agentId) {
        long total = 0;
        long count = 0;
        for (StoredEvent event : events) {
            if (event.agentId().equals(agentId)) {
                total += event.scoreDelta();
                count++;
            }
        }
        return new EventTotals(total, count);
    }

    @Override
    public synchronized long sumEventDeltasSince(UUID agentId, EventType eventType, Instant since) {
        return events.stream()
                .filter(event -> event.agentId().equals(agentId))
                .filter(event -> event.eventType() == eventType)
                .filter(event -> !event.createdAt().isBefore(since))
                .mapToLong(StoredEvent::scoreDelta)
                .sum();
    }

    @Override
    public synchronized List<StoredEvent> listEvents(UUID agentId, int limit) {
        return events.stream()
                .filter(event -> event.agentId().equals(agentId))
                .sorted(Comparator.comparingLong(StoredEvent::id).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized boolean hasEventOfType(UUID agentId, EventType eventType) {
        return events.stream().anyMatch(event -> event.agentId().equals(agentId) && event.eventType() == eventType);
    }

    @Override
    public synchronized ClaimRecord insertClaim(ClaimRecord claim) {
        claims.add(claim);
        return claim;
    }

    @Override
    public synchronized List<ClaimRecord> listClaims(UUID agentId) {
        return claims.stream()
                .filter(claim -> claim.agentId().equals(agentId))
                .sorted(Comparator.comparing(ClaimRecord::verifiedAt).reversed())
                .toList();
    }

    @Override
    public synchronized long countClaims(UUID agentId) {
        return claims.stream().filter(claim -> claim.agentId().equals(agentId)).count();
    }

    @Override
    public synchronized long countAllClaims() {
        return claims.size();
    }

    @Override
    public synchronized RateWindow findOrCreateRateWindow(String identifier, String actionType, Instant now) {
        String key = windowKey(identifier, actionType);
        RateWindow existing = windows.get(key);
        if (existing != null) {
            return new RateWindow(existing.id(), identifier, actionType, existing.count(), existing.windowStart(), false);
        }
        RateWindow created = new RateWindow(windowSequence.incrementAndGet(), identifier, actionType, 1, now, true);
        windows.put(key, created);
        return created;
    }

    @Override
    public synchronized boolean incrementRateWindow(long windowId, int expectedCount) {
        for (Map.Entry<String, RateWindow> entry : windows.entrySet()) {
            RateWindow window = entry.getValue();
            if (window.id() == windowId) {
                if (window.count() != expectedCount) {
                    return false;
                }
                entry.setValue(new RateWindow(window.id(), window.identifier(), window.actionType(),
                        window.count() + 1, window.windowStart(), false));
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized int deleteExpiredRateWindow(String identifier, String actionType, Instant cutoff) {
        String key = windowKey(identifier, actionType);
        RateWindow window = windows.get(key);
        if (window != null && !window.windowStart().isAfter(cutoff)) {
            windows.remove(key);
            return 1;
        }
        return 0;
    }

    @Override
    public synchronized int deleteExpiredRateWindows(Instant cutoff) {
        int before = windows.size();
        windows.values().removeIf(window -> !window.windowStart().isAfter(cutoff));
        return before - windows.size();
    }

    /**
     * Current count of a window (for testing).
     */
    public synchronized Optional<Integer> windowCount(String identifier, String actionType) {
        RateWindow window = windows.get(windowKey(identifier, actionType));
        return window == null ? Optional.empty() : Optional.of(window.count());
    }

    private static String windowKey(String identifier, String actionType) {
        return identifier + "|" + actionType;
    }
}
