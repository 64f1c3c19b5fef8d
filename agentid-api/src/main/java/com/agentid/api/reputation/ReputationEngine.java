package com.agentid.api.reputation;

import com.agentid.api.crypto.CryptoIdentity;
import com.agentid.api.error.UnauthorizedReportException;
import com.agentid.api.error.ValidationException;
import com.agentid.api.ledger.EventLedger;
import com.agentid.api.ledger.ReputationScore;
import com.agentid.api.ratelimit.RateLimitPolicy;
import com.agentid.api.ratelimit.RateLimiter;
import com.agentid.api.registry.IdentityRegistry;
import com.agentid.api.store.IdentityRecord;
import com.agentid.api.store.NewEvent;
import com.agentid.core.domain.ReputationEvent.EventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reputation Engine - Turns signed work reports and proofs of key possession
 * into ledger events.
 *
 * All arithmetic is done in hundredths of a point so stored and compared
 * deltas are exact. A work report moves the score by at most 0.50, and the
 * work reports of one UTC day together by at most 0.50 in either direction.
 */
@Service
public class ReputationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReputationEngine.class);

    static final int VERIFICATION_DELTA = 1;
    static final int MAX_REPORT_DELTA = 50;
    static final int MAX_DAILY_DELTA = 50;

    private static final int MAX_TASKS = 1000;
    private static final int MAX_OTHER = 100;

    private static final int TASK_WEIGHT = 1;
    private static final int CORRECTION_WEIGHT = -5;
    private static final int POSITIVE_WEIGHT = 2;
    private static final int ERROR_WEIGHT = -3;

    private final CryptoIdentity crypto;
    private final RateLimiter rateLimiter;
    private final EventLedger eventLedger;
    private final IdentityRegistry registry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ReputationEngine(CryptoIdentity crypto, RateLimiter rateLimiter, EventLedger eventLedger,
                            IdentityRegistry registry, ObjectMapper objectMapper, Clock clock) {
        this.crypto = crypto;
        this.rateLimiter = rateLimiter;
        this.eventLedger = eventLedger;
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // ==================== Work reports ====================

    public WorkReportResult submitWorkReport(String idOrDid, WorkReport report) {
        IdentityRecord agent = registry.require(idOrDid);
        Instant now = clock.instant();
        String period = effectivePeriod(report.period(), now);

        if (report.signature() == null || report.signature().isBlank()) {
            log.warn("Unsigned work report rejected for {}", agent.did());
            throw new UnauthorizedReportException("Work reports must be signed by the agent");
        }
        if (!crypto.verify(canonicalReport(agent.did(), period, report), report.signature(), agent.publicKey())) {
            log.warn("Work report with invalid signature rejected for {}", agent.did());
            throw new UnauthorizedReportException("Signature does not match agent public key");
        }

        int tasks = floorClamp(report.tasksCompleted(), MAX_TASKS);
        int corrections = floorClamp(report.corrections(), MAX_OTHER);
        int positive = floorClamp(report.positiveFeedback(), MAX_OTHER);
        int errors = floorClamp(report.errors(), MAX_OTHER);

        rateLimiter.check(agent.id().toString(), RateLimitPolicy.WORK_REPORT);

        int requested = clamp(requestedDelta(tasks, corrections, positive, errors), -MAX_REPORT_DELTA, MAX_REPORT_DELTA);
        long appliedToday = eventLedger.dailyDelta(agent.id(), EventType.WORK_REPORT, startOfUtcDay(now));
        long upper = Math.max(0, MAX_DAILY_DELTA - appliedToday);
        long lower = Math.min(0, -MAX_DAILY_DELTA - appliedToday);
        int delta = (int) Math.max(lower, Math.min(upper, requested));

        ReputationScore before = eventLedger.scoreFor(agent.id());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("period", period);
        metadata.put("tasks_completed", tasks);
        metadata.put("corrections", corrections);
        metadata.put("positive_feedback", positive);
        metadata.put("errors", errors);
        metadata.put("signature_verified", true);
        metadata.put("requested_delta", requested);
        metadata.put("daily_cap_applied", delta != requested);

        eventLedger.append(new NewEvent(agent.id(), EventType.WORK_REPORT, delta,
                "Work report: " + tasks + " tasks, " + corrections + " corrections", metadata, now));

        BigDecimal oldReputation = ReputationScore.ofHundredths(ReputationScore.BASE_HUNDREDTHS + before.total());
        BigDecimal newReputation = ReputationScore.ofHundredths(ReputationScore.BASE_HUNDREDTHS + before.total() + delta);
        log.info("Work report accepted for {}: delta {} ({} requested), reputation {} -> {}",
                agent.did(), delta, requested, oldReputation, newReputation);

        return new WorkReportResult(agent.id(), agent.did(), period, BigDecimal.valueOf(delta, 2),
                oldReputation, newReputation, now);
    }

    /**
     * The exact text a work report signature must cover: compact JSON with the keys
     * did, period, tasks_completed, corrections, positive_feedback, errors in that order.
     * Integral counts are written without a fraction.
     */
    public String canonicalReport(String did, String period, WorkReport report) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("did", did);
        node.put("period", period);
        putNumber(node, "tasks_completed", report.tasksCompleted());
        putNumber(node, "corrections", report.corrections());
        putNumber(node, "positive_feedback", report.positiveFeedback());
        putNumber(node, "errors", report.errors());
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize work report", e);
        }
    }

    /**
     * Period label used when the report does not carry one: today's UTC date.
     */
    public String effectivePeriod(String period, Instant now) {
        if (period != null && !period.isBlank()) {
            return period;
        }
        return LocalDate.ofInstant(now, ZoneOffset.UTC).toString();
    }

    // ==================== Proof of possession ====================

    /**
     * Checks a signature against the agent's key. A valid signature earns a
     * small verification credit; an invalid one changes nothing.
     */
    public SignatureCheckResult verifySignature(String idOrDid, String message, String signature) {
        if (message == null || message.isBlank() || signature == null || signature.isBlank()) {
            throw new ValidationException("Message and signature are required");
        }
        IdentityRecord agent = registry.require(idOrDid);
        Instant now = clock.instant();
        if (!crypto.verify(message, signature, agent.publicKey())) {
            log.warn("Signature verification failed for {}", agent.did());
            return new SignatureCheckResult(false, agent.id(), agent.did(), now);
        }
        eventLedger.append(new NewEvent(agent.id(), EventType.VERIFICATION_SUCCESS, VERIFICATION_DELTA,
                "Signature verified", Map.of(), now));
        return new SignatureCheckResult(true, agent.id(), agent.did(), now);
    }

    static int requestedDelta(int tasks, int corrections, int positive, int errors) {
        return tasks * TASK_WEIGHT + corrections * CORRECTION_WEIGHT + positive * POSITIVE_WEIGHT + errors * ERROR_WEIGHT;
    }

    private static int floorClamp(BigDecimal value, int max) {
        BigDecimal floored = value.setScale(0, RoundingMode.FLOOR);
        if (floored.signum() <= 0) {
            return 0;
        }
        return floored.compareTo(BigDecimal.valueOf(max)) >= 0 ? max : floored.intValueExact();
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private static Instant startOfUtcDay(Instant now) {
        return LocalDate.ofInstant(now, ZoneOffset.UTC).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    private static void putNumber(ObjectNode node, String field, BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            node.put(field, stripped.toBigIntegerExact());
        } else {
            node.put(field, stripped);
        }
    }
}
