package com.agentid.api.claim;

import com.agentid.api.crypto.CryptoIdentity;
import com.agentid.api.error.UnauthorizedReportException;
import com.agentid.api.error.ValidationException;
import com.agentid.api.ledger.EventLedger;
import com.agentid.api.registry.IdentityRegistry;
import com.agentid.api.store.ClaimRecord;
import com.agentid.api.store.IdentityRecord;
import com.agentid.api.store.LedgerStore;
import com.agentid.api.store.NewEvent;
import com.agentid.core.domain.ReputationEvent.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Records third-party claims about agents (identity, capability, ...).
 * Each recorded claim credits the agent with a claim event.
 */
@Service
public class ClaimVerificationService {

    private static final Logger log = LoggerFactory.getLogger(ClaimVerificationService.class);

    static final int CLAIM_DELTA = 5;

    // Column widths of the verifications table
    static final int MAX_CLAIM_TYPE_LENGTH = 255;
    static final int MAX_CLAIM_VALUE_LENGTH = 1000;
    static final int MAX_VERIFIER_ID_LENGTH = 255;
    static final int MAX_SIGNATURE_LENGTH = 256;

    private final CryptoIdentity crypto;
    private final EventLedger eventLedger;
    private final IdentityRegistry registry;
    private final LedgerStore store;
    private final Clock clock;

    public ClaimVerificationService(CryptoIdentity crypto, EventLedger eventLedger, IdentityRegistry registry,
                                    LedgerStore store, Clock clock) {
        this.crypto = crypto;
        this.eventLedger = eventLedger;
        this.registry = registry;
        this.store = store;
        this.clock = clock;
    }

    public ClaimResult verifyClaim(ClaimRequest request) {
        if (request.agentId() == null || request.agentId().isBlank()
                || request.claimType() == null || request.claimType().isBlank()) {
            throw new ValidationException("agent_id and claim_type are required");
        }
        if (request.expiresInDays() != null && request.expiresInDays() <= 0) {
            throw new ValidationException("expires_in_days must be positive");
        }
        requireMaxLength("claim_type", request.claimType(), MAX_CLAIM_TYPE_LENGTH);
        requireMaxLength("claim_value", request.claimValue(), MAX_CLAIM_VALUE_LENGTH);
        requireMaxLength("verifier_id", request.verifierId(), MAX_VERIFIER_ID_LENGTH);
        requireMaxLength("signature", request.signature(), MAX_SIGNATURE_LENGTH);
        IdentityRecord agent = registry.require(request.agentId());

        Boolean signatureVerified = null;
        if (request.carriesSignature()) {
            if (!crypto.verify(request.message(), request.signature(), agent.publicKey())) {
                log.warn("Claim {} for {} rejected: signature verification failed", request.claimType(), agent.did());
                throw new UnauthorizedReportException("Signature verification failed");
            }
            signatureVerified = true;
        }

        Instant now = clock.instant();
        Instant expiresAt = request.expiresInDays() == null ? null : now.plus(Duration.ofDays(request.expiresInDays()));
        ClaimRecord claim = store.insertClaim(new ClaimRecord(
                UUID.randomUUID(),
                agent.id(),
                request.verifierId(),
                request.claimType(),
                request.claimValue(),
                request.signature(),
                now,
                expiresAt));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("claim_type", request.claimType());
        metadata.put("claim_value", request.claimValue());
        metadata.put("verifier_id", request.verifierId());
        eventLedger.append(new NewEvent(agent.id(), EventType.CLAIM_VERIFIED, CLAIM_DELTA,
                "Claim verified: " + request.claimType(), metadata, now));

        log.info("Recorded {} claim {} for {}", claim.claimType(), claim.id(), agent.did());
        return new ClaimResult(claim, agent.did(), signatureVerified);
    }

    private static void requireMaxLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new ValidationException(field + " must be at most " + max + " characters");
        }
    }

    /**
     * Claims that have not expired, newest first.
     */
    public List<ClaimRecord> activeClaims(String idOrDid) {
        IdentityRecord agent = registry.require(idOrDid);
        Instant now = clock.instant();
        return store.listClaims(agent.id()).stream()
                .filter(claim -> claim.isActive(now))
                .toList();
    }
}
