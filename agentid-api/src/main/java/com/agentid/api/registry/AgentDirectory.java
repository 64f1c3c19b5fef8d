package com.agentid.api.registry;

import com.agentid.api.crypto.CryptoIdentity;
import com.agentid.api.error.RateLimitExceededException;
import com.agentid.api.error.ValidationException;
import com.agentid.api.ledger.EventLedger;
import com.agentid.api.ledger.ReputationScore;
import com.agentid.api.ratelimit.VerifyLookupLimiter;
import com.agentid.api.store.IdentityRecord;
import com.agentid.api.store.LedgerStore;
import com.agentid.api.store.StoredEvent;
import com.agentid.core.domain.AgentIdentity.AgentStatus;
import com.agentid.core.domain.AgentIdentity.AgentType;
import com.agentid.core.domain.ReputationEvent.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read models over the registry and the ledger: profiles, reputation
 * breakdowns, the public DID lookup, listings and platform counts.
 */
@Service
public class AgentDirectory {

    private static final Logger log = LoggerFactory.getLogger(AgentDirectory.class);

    private static final int RECENT_EVENTS = 10;
    private static final int LOOKUP_EVENT_SCAN = 1000;
    private static final int MAX_PAGE_SIZE = 100;
    static final int MAX_OFFSET = 10_000;

    private final IdentityRegistry registry;
    private final EventLedger eventLedger;
    private final VerifyLookupLimiter lookupLimiter;
    private final LedgerStore store;
    private final CryptoIdentity crypto;
    private final Clock clock;

    public AgentDirectory(IdentityRegistry registry, EventLedger eventLedger, VerifyLookupLimiter lookupLimiter,
                          LedgerStore store, CryptoIdentity crypto, Clock clock) {
        this.registry = registry;
        this.eventLedger = eventLedger;
        this.lookupLimiter = lookupLimiter;
        this.store = store;
        this.crypto = crypto;
        this.clock = clock;
    }

    public AgentProfile profile(String idOrDid) {
        IdentityRecord identity = registry.require(idOrDid);
        BigDecimal reputation = eventLedger.scoreFor(identity.id()).reputation();
        Map<String, Object> didDocument = crypto.didDocument(identity.did(), identity.publicKey(), identity.ownerId());
        return new AgentProfile(identity, reputation, didDocument);
    }

    public ReputationReport reputation(String idOrDid) {
        IdentityRecord identity = registry.require(idOrDid);
        ReputationScore score = eventLedger.scoreFor(identity.id());
        long ageDays = Math.max(0, Duration.between(identity.createdAt(), clock.instant()).toDays());
        return new ReputationReport(
                identity.id(),
                identity.did(),
                score.total(),
                score.count(),
                score.reputation(),
                store.countClaims(identity.id()),
                ageDays,
                identity.status(),
                eventLedger.recentEvents(identity.id(), RECENT_EVENTS));
    }

    /**
     * Public, unauthenticated DID check used by third parties before trusting an agent.
     *
     * @throws RateLimitExceededException when the client exceeds its lookups per minute
     * @throws ValidationException        when the DID is blank or not a did:agent DID
     */
    public PublicLookup publicLookup(String did, String clientIp) {
        if (!lookupLimiter.tryAcquire(clientIp)) {
            log.warn("Verify lookup limit hit for {}", clientIp);
            throw new RateLimitExceededException("verify_lookup",
                    "Maximum 1000 verification requests per minute per IP", Duration.ofMinutes(1));
        }
        if (did == null || did.isBlank()) {
            throw new ValidationException("DID parameter is required");
        }
        if (!did.startsWith(CryptoIdentity.DID_PREFIX)) {
            throw new ValidationException("DID must start with \"" + CryptoIdentity.DID_PREFIX + "\"");
        }
        Optional<IdentityRecord> found = store.findIdentityByDid(did);
        if (found.isEmpty()) {
            return PublicLookup.unknown(did);
        }
        IdentityRecord identity = found.get();
        long tasksCompleted = eventLedger.recentEvents(identity.id(), LOOKUP_EVENT_SCAN).stream()
                .filter(event -> event.eventType() == EventType.WORK_REPORT)
                .mapToLong(AgentDirectory::tasksCompleted)
                .sum();
        return new PublicLookup(
                true,
                identity.did(),
                identity.name(),
                eventLedger.scoreFor(identity.id()).reputation(),
                tasksCompleted,
                identity.createdAt(),
                identity.status() == AgentStatus.FLAGGED ? 1 : 0);
    }

    /**
     * Agents newest first. The limit is clamped to [1, 100] and a negative offset read as 0.
     *
     * @throws ValidationException if the offset is past {@link #MAX_OFFSET}
     */
    public AgentPage page(int limit, int offset) {
        if (offset > MAX_OFFSET) {
            throw new ValidationException("offset must be at most " + MAX_OFFSET);
        }
        int effectiveLimit = Math.max(1, Math.min(MAX_PAGE_SIZE, limit));
        int effectiveOffset = Math.max(0, offset);
        List<AgentSummary> agents = store.pageIdentities(effectiveLimit, effectiveOffset).stream()
                .map(identity -> new AgentSummary(identity, eventLedger.scoreFor(identity.id()).reputation()))
                .toList();
        return new AgentPage(agents, store.countIdentities(), effectiveLimit, effectiveOffset);
    }

    public DirectoryStats stats() {
        long total = store.countIdentities();
        long workers = store.countIdentitiesByType(AgentType.WORKER);
        return new DirectoryStats(
                total,
                total - workers,
                workers,
                store.countAllClaims(),
                store.countIdentitiesCreatedSince(clock.instant().minus(Duration.ofHours(24))));
    }

    private static long tasksCompleted(StoredEvent event) {
        Object value = event.metadata().get("tasks_completed");
        return value instanceof Number number ? number.longValue() : 0L;
    }

    public record AgentProfile(IdentityRecord identity, BigDecimal reputation, Map<String, Object> didDocument) {}

    public record ReputationReport(
            UUID agentId,
            String did,
            long score,
            long eventCount,
            BigDecimal reputation,
            long verificationCount,
            long ageDays,
            AgentStatus status,
            List<StoredEvent> recentEvents
    ) {}

    public record PublicLookup(
            boolean verified,
            String did,
            String name,
            BigDecimal reputation,
            Long tasksCompleted,
            Instant registeredAt,
            Integer flags
    ) {
        static PublicLookup unknown(String did) {
            return new PublicLookup(false, did, null, null, null, null, null);
        }
    }

    public record AgentSummary(IdentityRecord identity, BigDecimal reputation) {}

    public record AgentPage(List<AgentSummary> agents, long total, int limit, int offset) {}

    public record DirectoryStats(
            long totalAgents,
            long mainAgents,
            long workerAgents,
            long totalVerifications,
            long registrations24h
    ) {}
}
