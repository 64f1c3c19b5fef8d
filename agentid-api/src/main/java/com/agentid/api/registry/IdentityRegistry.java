package com.agentid.api.registry;

import com.agentid.api.crypto.CryptoIdentity;
import com.agentid.api.crypto.CryptoIdentity.AgentKeyPair;
import com.agentid.api.error.IdentityNotFoundException;
import com.agentid.api.error.ParentNotFoundException;
import com.agentid.api.error.PersistenceFailureException;
import com.agentid.api.error.ValidationException;
import com.agentid.api.ledger.EventLedger;
import com.agentid.api.ratelimit.RateLimitPolicy;
import com.agentid.api.ratelimit.RateLimiter;
import com.agentid.api.store.IdentityRecord;
import com.agentid.api.store.LedgerStore;
import com.agentid.api.store.NewEvent;
import com.agentid.core.domain.AgentIdentity.AgentStatus;
import com.agentid.core.domain.AgentIdentity.AgentType;
import com.agentid.core.domain.ReputationEvent.EventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Identity Registry - Creates agent identities and resolves them by id or DID.
 *
 * Main agents get a DID derived from their public key; workers get one scoped
 * under their parent. Hierarchies are one level deep. Every new identity is
 * credited with a registration event.
 */
@Service
public class IdentityRegistry {

    private static final Logger log = LoggerFactory.getLogger(IdentityRegistry.class);

    static final int REGISTRATION_DELTA = 10;

    // Column widths of the agents table
    static final int MAX_OWNER_ID_LENGTH = 255;
    static final int MAX_METADATA_LENGTH = 4000;

    private final CryptoIdentity crypto;
    private final RateLimiter rateLimiter;
    private final EventLedger eventLedger;
    private final LedgerStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public IdentityRegistry(CryptoIdentity crypto, RateLimiter rateLimiter, EventLedger eventLedger,
                            LedgerStore store, ObjectMapper objectMapper, Clock clock) {
        this.crypto = crypto;
        this.rateLimiter = rateLimiter;
        this.eventLedger = eventLedger;
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Registers a main agent or, when a parent DID is given, a worker.
     */
    public RegistrationResult register(RegistrationRequest request) {
        String name = NameSanitizer.sanitize(request.name());
        if (name.isEmpty()) {
            throw ValidationException.invalidName("Name is required and must contain visible characters");
        }
        String suppliedKey = request.publicKey();
        if (suppliedKey != null && !crypto.isWellFormedPublicKey(suppliedKey)) {
            throw new ValidationException("Public key must be 64 hex characters (32-byte Ed25519 key)");
        }
        if (request.ownerId() != null && request.ownerId().length() > MAX_OWNER_ID_LENGTH) {
            throw new ValidationException("owner_id must be at most " + MAX_OWNER_ID_LENGTH + " characters");
        }
        requireStorableMetadata(request.metadata());

        rateLimiter.check(clientKey(request.clientIp()), RateLimitPolicy.REGISTRATION);

        IdentityRecord parent = null;
        if (request.parentDid() != null && !request.parentDid().isBlank()) {
            parent = resolveParent(request.parentDid());
        }

        String privateKey = null;
        String publicKey = suppliedKey;
        if (publicKey == null) {
            AgentKeyPair keyPair = crypto.generateKeyPair();
            publicKey = keyPair.publicKeyHex();
            privateKey = keyPair.privateKeyHex();
        }

        String did = parent == null ? crypto.deriveDid(publicKey) : crypto.deriveWorkerDid(parent.did(), publicKey);
        Instant now = clock.instant();
        IdentityRecord identity = store.insertIdentity(new IdentityRecord(
                UUID.randomUUID(),
                name,
                request.ownerId(),
                publicKey,
                did,
                parent == null ? null : parent.did(),
                parent == null ? AgentType.MAIN : AgentType.WORKER,
                AgentStatus.ACTIVE,
                request.metadata(),
                now,
                now));
        log.info("Registered {} agent {} ({})", identity.agentType(), identity.did(), identity.id());

        try {
            appendRegistrationEvent(identity, now);
        } catch (PersistenceFailureException e) {
            log.warn("Identity {} created without registration event; repair required", identity.did(), e);
            return new RegistrationResult(identity, privateKey, RegistrationResult.Warning.PARTIAL_REGISTRATION);
        }
        return new RegistrationResult(identity, privateKey, null);
    }

    private void requireStorableMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new ValidationException("metadata must be a JSON object", e);
        }
        if (json.length() > MAX_METADATA_LENGTH) {
            throw new ValidationException("metadata must serialize to at most " + MAX_METADATA_LENGTH + " characters");
        }
    }

    /**
     * Appends the registration event if the identity has none.
     *
     * @return true if an event was appended
     */
    public boolean ensureRegistrationEvent(String idOrDid) {
        IdentityRecord identity = require(idOrDid);
        if (eventLedger.hasEventOfType(identity.id(), EventType.REGISTRATION)) {
            return false;
        }
        appendRegistrationEvent(identity, clock.instant());
        log.info("Repaired missing registration event for {}", identity.did());
        return true;
    }

    /**
     * Looks an identity up by DID (anything starting with {@code did:}) or by UUID.
     */
    public Optional<IdentityRecord> resolve(String idOrDid) {
        if (idOrDid == null || idOrDid.isBlank()) {
            return Optional.empty();
        }
        if (idOrDid.startsWith("did:")) {
            return store.findIdentityByDid(idOrDid);
        }
        try {
            return store.findIdentityById(UUID.fromString(idOrDid));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public IdentityRecord require(String idOrDid) {
        return resolve(idOrDid).orElseThrow(() -> new IdentityNotFoundException(idOrDid));
    }

    /**
     * Workers registered under a main agent, newest first.
     */
    public List<IdentityRecord> workers(String idOrDid) {
        IdentityRecord identity = require(idOrDid);
        if (identity.isWorker()) {
            return List.of();
        }
        return store.listWorkers(identity.did());
    }

    public IdentityRecord updateStatus(String idOrDid, AgentStatus status) {
        if (status == null) {
            throw new ValidationException("Status is required");
        }
        IdentityRecord identity = require(idOrDid);
        IdentityRecord updated = store.updateIdentityStatus(identity.id(), status, clock.instant())
                .orElseThrow(() -> new IdentityNotFoundException(idOrDid));
        log.info("Agent {} status changed to {}", updated.did(), status);
        return updated;
    }

    private IdentityRecord resolveParent(String parentDid) {
        IdentityRecord parent = store.findIdentityByDid(parentDid)
                .orElseThrow(() -> new ParentNotFoundException(parentDid, "Parent agent not found: " + parentDid));
        if (parent.isWorker()) {
            throw new ParentNotFoundException(parentDid, "Workers cannot register workers: " + parentDid);
        }
        return parent;
    }

    private void appendRegistrationEvent(IdentityRecord identity, Instant at) {
        eventLedger.append(new NewEvent(
                identity.id(),
                EventType.REGISTRATION,
                REGISTRATION_DELTA,
                "Agent registered",
                Map.of("agent_type", identity.agentType().name()),
                at));
    }

    private static String clientKey(String clientIp) {
        return clientIp == null || clientIp.isBlank() ? "unknown" : clientIp;
    }
}
