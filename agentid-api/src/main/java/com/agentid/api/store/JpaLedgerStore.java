package com.agentid.api.store;

import com.agentid.api.error.DuplicateIdentityException;
import com.agentid.api.error.PersistenceFailureException;
import com.agentid.api.error.ValidationException;
import com.agentid.core.domain.AgentClaim;
import com.agentid.core.domain.AgentIdentity;
import com.agentid.core.domain.AgentIdentity.AgentStatus;
import com.agentid.core.domain.AgentIdentity.AgentType;
import com.agentid.core.domain.RateLimitWindow;
import com.agentid.core.domain.ReputationEvent;
import com.agentid.core.domain.ReputationEvent.EventType;
import com.agentid.core.repository.AgentClaimRepository;
import com.agentid.core.repository.AgentIdentityRepository;
import com.agentid.core.repository.RateLimitWindowRepository;
import com.agentid.core.repository.ReputationEventRepository;
import com.agentid.core.repository.ReputationEventRepository.DeltaTotals;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * LedgerStore backed by the Spring Data repositories of agentid-core.
 *
 * Every operation runs in its own transaction with a timeout, so a slow or
 * unreachable database surfaces as {@link PersistenceFailureException} instead
 * of blocking the caller.
 */
@Component
public class JpaLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(JpaLedgerStore.class);
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    /** SQLSTATE for unique_violation, shared by PostgreSQL and H2. */
    private static final String UNIQUE_VIOLATION = "23505";

    private final AgentIdentityRepository identityRepository;
    private final ReputationEventRepository eventRepository;
    private final AgentClaimRepository claimRepository;
    private final RateLimitWindowRepository windowRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;

    public JpaLedgerStore(
            AgentIdentityRepository identityRepository,
            ReputationEventRepository eventRepository,
            AgentClaimRepository claimRepository,
            RateLimitWindowRepository windowRepository,
            ObjectMapper objectMapper,
            PlatformTransactionManager transactionManager,
            @Value("${agentid.store.timeout-seconds:5}") int timeoutSeconds) {
        this.identityRepository = identityRepository;
        this.eventRepository = eventRepository;
        this.claimRepository = claimRepository;
        this.windowRepository = windowRepository;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.transactionTemplate.setTimeout(timeoutSeconds);
    }

    // ==================== Identities ====================

    @Override
    public IdentityRecord insertIdentity(IdentityRecord identity) {
        AgentIdentity entity = identity.isWorker()
                ? AgentIdentity.createWorker(identity.id(), identity.name(), identity.ownerId(), identity.publicKey(),
                        identity.did(), identity.parentDid(), writeMetadata(identity.metadata()), identity.createdAt())
                : AgentIdentity.createMain(identity.id(), identity.name(), identity.ownerId(), identity.publicKey(),
                        identity.did(), writeMetadata(identity.metadata()), identity.createdAt());
        try {
            return inConflictingTransaction("insertIdentity", () -> {
                if (identityRepository.existsById(identity.id())) {
                    throw new DuplicateKeyException("Duplicate agent id " + identity.id());
                }
                return toRecord(identityRepository.saveAndFlush(entity));
            });
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateIdentityException(identity.did(), e);
        }
    }

    @Override
    public Optional<IdentityRecord> findIdentityByDid(String did) {
        return inTransaction("findIdentityByDid", () -> identityRepository.findByDid(did).map(this::toRecord));
    }

    @Override
    public Optional<IdentityRecord> findIdentityById(UUID id) {
        return inTransaction("findIdentityById", () -> identityRepository.findById(id).map(this::toRecord));
    }

    @Override
    public List<IdentityRecord> listWorkers(String parentDid) {
        return inTransaction("listWorkers", () -> identityRepository.findByParentDidOrderByCreatedAtDesc(parentDid)
                .stream().map(this::toRecord).toList());
    }

    @Override
    public List<IdentityRecord> pageIdentities(int limit, int offset) {
        return inTransaction("pageIdentities", () -> identityRepository
                .findNewestFirst(limit, offset)
                .stream().map(this::toRecord).toList());
    }

    @Override
    public long countIdentities() {
        return inTransaction("countIdentities", identityRepository::count);
    }

    @Override
    public long countIdentitiesByType(AgentType agentType) {
        return inTransaction("countIdentitiesByType", () -> identityRepository.countByAgentType(agentType));
    }

    @Override
    public long countIdentitiesCreatedSince(Instant since) {
        return inTransaction("countIdentitiesCreatedSince", () -> identityRepository.countByCreatedAtAfter(since));
    }

    @Override
    public Optional<IdentityRecord> updateIdentityStatus(UUID id, AgentStatus status, Instant at) {
        return inTransaction("updateIdentityStatus", () -> identityRepository.findById(id).map(entity -> {
            entity.changeStatus(status, at);
            return toRecord(identityRepository.save(entity));
        }));
    }

    // ==================== Reputation events ====================

    @Override
    public StoredEvent insertEvent(NewEvent event) {
        ReputationEvent entity = ReputationEvent.create(event.agentId(), event.eventType(), event.scoreDelta(),
                event.description(), writeMetadata(event.metadata()), event.createdAt());
        return inTransaction("insertEvent", () -> toRecord(eventRepository.saveAndFlush(entity)));
    }

    @Override
    public EventTotals sumEventDeltas(UUID agentId) {
        return inTransaction("sumEventDeltas", () -> {
            DeltaTotals totals = eventRepository.sumDeltasByAgentId(agentId);
            if (totals == null || totals.getEventCount() == null || totals.getEventCount() == 0) {
                return EventTotals.EMPTY;
            }
            return new EventTotals(totals.getTotal() == null ? 0 : totals.getTotal(), totals.getEventCount());
        });
    }

    @Override
    public long sumEventDeltasSince(UUID agentId, EventType eventType, Instant since) {
        return inTransaction("sumEventDeltasSince", () -> {
            Long sum = eventRepository.sumDeltasSince(agentId, eventType, since);
            return sum == null ? 0L : sum;
        });
    }

    @Override
    public List<StoredEvent> listEvents(UUID agentId, int limit) {
        return inTransaction("listEvents", () -> eventRepository
                .findByAgentIdOrderByIdDesc(agentId, PageRequest.of(0, limit))
                .stream().map(this::toRecord).toList());
    }

    @Override
    public boolean hasEventOfType(UUID agentId, EventType eventType) {
        return inTransaction("hasEventOfType", () -> eventRepository.existsByAgentIdAndEventType(agentId, eventType));
    }

    // ==================== Claims ====================

    @Override
    public ClaimRecord insertClaim(ClaimRecord claim) {
        AgentClaim entity = AgentClaim.create(claim.id(), claim.agentId(), claim.verifierId(), claim.claimType(),
                claim.claimValue(), claim.signature(), claim.verifiedAt(), claim.expiresAt());
        return inTransaction("insertClaim", () -> toRecord(claimRepository.saveAndFlush(entity)));
    }

    @Override
    public List<ClaimRecord> listClaims(UUID agentId) {
        return inTransaction("listClaims", () -> claimRepository.findByAgentIdOrderByVerifiedAtDesc(agentId)
                .stream().map(this::toRecord).toList());
    }

    @Override
    public long countClaims(UUID agentId) {
        return inTransaction("countClaims", () -> claimRepository.countByAgentId(agentId));
    }

    @Override
    public long countAllClaims() {
        return inTransaction("countAllClaims", claimRepository::count);
    }

    // ==================== Rate limit windows ====================

    @Override
    public RateWindow findOrCreateRateWindow(String identifier, String actionType, Instant now) {
        try {
            // The failed insert poisons its transaction, so the lookup below runs in a fresh one.
            return inConflictingTransaction("insertRateWindow", () ->
                    toRecord(windowRepository.saveAndFlush(RateLimitWindow.open(identifier, actionType, now)), true));
        } catch (DataIntegrityViolationException e) {
            log.debug("Rate window for {}/{} already exists", identifier, actionType);
        }
        return inTransaction("findRateWindow", () -> windowRepository
                .findByIdentifierAndActionType(identifier, actionType)
                .map(window -> toRecord(window, false))
                // Deleted between the two statements: report a fresh window without a row.
                .orElseGet(() -> new RateWindow(-1, identifier, actionType, 0, now, false)));
    }

    @Override
    public boolean incrementRateWindow(long windowId, int expectedCount) {
        return inTransaction("incrementRateWindow",
                () -> windowRepository.compareAndIncrement(windowId, expectedCount) == 1);
    }

    @Override
    public int deleteExpiredRateWindow(String identifier, String actionType, Instant cutoff) {
        return inTransaction("deleteExpiredRateWindow",
                () -> windowRepository.deleteExpired(identifier, actionType, cutoff));
    }

    @Override
    public int deleteExpiredRateWindows(Instant cutoff) {
        return inTransaction("deleteExpiredRateWindows", () -> windowRepository.deleteAllExpired(cutoff));
    }

    // ==================== Helpers ====================

    private <T> T inTransaction(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataIntegrityViolationException e) {
            throw rejectedByConstraint(operation, e);
        } catch (DataAccessException | TransactionException e) {
            log.error("Store operation {} failed", operation, e);
            throw new PersistenceFailureException(operation, e);
        }
    }

    /**
     * Like {@link #inTransaction} but lets unique-key violations through for the caller to interpret.
     */
    private <T> T inConflictingTransaction(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataIntegrityViolationException e) {
            if (isUniqueViolation(e)) {
                throw e;
            }
            throw rejectedByConstraint(operation, e);
        } catch (DataAccessException | TransactionException e) {
            log.error("Store operation {} failed", operation, e);
            throw new PersistenceFailureException(operation, e);
        }
    }

    // Oversized values, broken references and the like fail the same way on every retry.
    private static ValidationException rejectedByConstraint(String operation, DataIntegrityViolationException e) {
        log.warn("Store operation {} rejected by a constraint: {}", operation, e.getMostSpecificCause().getMessage());
        return new ValidationException("Rejected by a storage constraint", e);
    }

    static boolean isUniqueViolation(Throwable e) {
        if (e instanceof DuplicateKeyException) {
            return true;
        }
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    private IdentityRecord toRecord(AgentIdentity entity) {
        return new IdentityRecord(
                entity.getId(),
                entity.getName(),
                entity.getOwnerId(),
                entity.getPublicKey(),
                entity.getDid(),
                entity.getParentDid(),
                entity.getAgentType(),
                entity.getStatus(),
                readMetadata(entity.getMetadata()),
                entity.getCreatedAt(),
                entity.getUpdatedAt());
    }

    private StoredEvent toRecord(ReputationEvent entity) {
        return new StoredEvent(
                entity.getId(),
                entity.getAgentId(),
                entity.getEventType(),
                entity.getScoreDelta(),
                entity.getDescription(),
                readMetadata(entity.getMetadata()),
                entity.getCreatedAt());
    }

    private ClaimRecord toRecord(AgentClaim entity) {
        return new ClaimRecord(
                entity.getId(),
                entity.getAgentId(),
                entity.getVerifierId(),
                entity.getClaimType(),
                entity.getClaimValue(),
                entity.getSignature(),
                entity.getVerifiedAt(),
                entity.getExpiresAt());
    }

    private RateWindow toRecord(RateLimitWindow entity, boolean created) {
        return new RateWindow(
                entity.getId(),
                entity.getIdentifier(),
                entity.getActionType(),
                entity.getCount(),
                entity.getWindowStart(),
                created);
    }

    private String writeMetadata(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata == null ? Map.of() : metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not serializable", e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable metadata column, returning empty map", e);
            return Map.of();
        }
    }
}
