package com.agentid.api.reputation;

import com.agentid.api.LedgerFixture;
import com.agentid.api.error.IdentityNotFoundException;
import com.agentid.api.error.PersistenceFailureException;
import com.agentid.api.error.RateLimitExceededException;
import com.agentid.api.error.UnauthorizedReportException;
import com.agentid.api.error.ValidationException;
import com.agentid.api.registry.RegistrationResult;
import com.agentid.api.store.InMemoryLedgerStore;
import com.agentid.api.store.NewEvent;
import com.agentid.api.store.StoredEvent;
import com.agentid.core.domain.ReputationEvent.EventType;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for work reports and proof-of-possession credits.
 */
class ReputationEnginePropertyTest {

    // ==================== Canonical report ====================

    @Test
    void canonicalReportHasFixedKeyOrderAndIntegralNumbers() {
        LedgerFixture fixture = new LedgerFixture();

        String json = fixture.reputationEngine.canonicalReport("did:agent:abc", "2026-03-10",
                WorkReport.of(null, 10, 0, 2, 0, null));

        assertThat(json).isEqualTo("{\"did\":\"did:agent:abc\",\"period\":\"2026-03-10\",\"tasks_completed\":10,"
                + "\"corrections\":0,\"positive_feedback\":2,\"errors\":0}");
    }

    @Test
    void canonicalReportKeepsRawFractions() {
        LedgerFixture fixture = new LedgerFixture();
        WorkReport report = new WorkReport("p", new BigDecimal("2.50"), new BigDecimal("10.0"), null, null, null);

        String json = fixture.reputationEngine.canonicalReport("did:agent:abc", "p", report);

        assertThat(json).contains("\"tasks_completed\":2.5", "\"corrections\":10,", "\"errors\":0}");
    }

    @Test
    void periodDefaultsToTodayInUtc() {
        LedgerFixture fixture = new LedgerFixture();

        assertThat(fixture.reputationEngine.effectivePeriod(null, Instant.parse("2026-03-10T23:59:59Z")))
                .isEqualTo("2026-03-10");
        assertThat(fixture.reputationEngine.effectivePeriod(" ", Instant.parse("2026-03-11T00:00:00Z")))
                .isEqualTo("2026-03-11");
        assertThat(fixture.reputationEngine.effectivePeriod("week-10", Instant.now())).isEqualTo("week-10");
    }

    // ==================== Work reports ====================

    @Test
    @Label("Signed report moves the score by the weighted counts")
    void acceptedReportAppliesDelta() {
        LedgerFixture fixture = new LedgerFixture();
        RegistrationResult agent = fixture.registerMain("Worker Bee");

        WorkReportResult result = submitSigned(fixture, agent, WorkReport.of("2026-03-10", 10, 0, 2, 0, null));

        assertThat(result.delta()).isEqualByComparingTo("0.14");
        assertThat(result.oldReputation()).isEqualByComparingTo("3.10");
        assertThat(result.newReputation()).isEqualByComparingTo("3.24");
        assertThat(result.period()).isEqualTo("2026-03-10");
        assertThat(result.did()).isEqualTo(agent.identity().did());
        StoredEvent event = fixture.eventLedger.recentEvents(agent.identity().id(), 1).get(0);
        assertThat(event.eventType()).isEqualTo(EventType.WORK_REPORT);
        assertThat(event.scoreDelta()).isEqualTo(14);
        assertThat(event.metadata())
                .containsEntry("tasks_completed", 10)
                .containsEntry("signature_verified", true)
                .containsEntry("daily_cap_applied", false);
    }

    @Test
    @Label("Counts are clamped before weighting")
    void hugeCountsAreClamped() {
        LedgerFixture fixture = new LedgerFixture();
        RegistrationResult agent = fixture.registerMain("Sloppy");

        WorkReportResult result = submitSigned(fixture, agent, WorkReport.of(null, 0, 10_000, 0, 0, null));

        assertThat(result.delta()).isEqualByComparingTo("-0.50");
        StoredEvent event = fixture.eventLedger.recentEvents(agent.identity().id(), 1).get(0);
        assertThat(event.metadata()).containsEntry("corrections", 100).containsEntry("requested_delta", -50);
    }

    @Test
    void fractionalAndNegativeCountsAreFlooredAtZero() {
        LedgerFixture fixture = new LedgerFixture();
        RegistrationResult agent = fixture.registerMain("Fractional");
        WorkReport report = new WorkReport(null, new BigDecimal("2.7"), new BigDecimal("-5"), null, null, null);

        WorkReportResult result = submitSigned(fixture, agent, report);

        assertThat(result.delta()).isEqualByComparingTo("0.02");
    }

    @Test
    @Label("Two same-day reports together add at most +0.50")
    void dailyAllowanceCapsSecondReport() {
        LedgerFixture fixture = new LedgerFixture();
        RegistrationResult agent = fixture.registerMain("Eager");

        WorkReportResult first = submitSigned(fixture, agent, WorkReport.of("a", 40, 0, 0, 0, null));
        fixture.clock.advance(Duration.ofHours(1));
        WorkReportResult second = submitSigned(fixture, agent, WorkReport.of("b", 40, 0, 0, 0, null));

        assertThat(first.delta()).isEqualByComparingTo("0.40");
        assertThat(second.delta()).isEqualByComparingTo("0.10");
        assertThat(second.newReputation()).isEqualByComparingTo("3.60");
        StoredEvent event = fixture.eventLedger.recentEvents(agent.identity().id(), 1).get(0);
        assertThat(event.metadata()).containsEntry("requested_delta", 40).containsEntry("daily_cap_applied", true);
    }

    @Test
    void dailyAllowanceResetsAtUtcMidnight() {
        LedgerFixture fixture = new LedgerFixture();
        fixture.clock.set(Instant.parse("2026-03-10T23:00:00Z"));
        RegistrationResult agent = fixture.registerMain("Night Owl");
        submitSigned(fixture, agent, WorkReport.of("a", 50, 0, 0, 0, null));

        fixture.clock.set(Instant.parse("2026-03-11T00:30:00Z"));
        WorkReportResult next = submitSigned(fixture, agent, WorkReport.of("b", 50, 0, 0, 0, null));

        assertThat(next.delta()).isEqualByComparingTo("0.50");
    }

    @Test
    @Label("The sixth report within 24h is refused and records nothing")
    void sixthReportIsRateLimited() {
        LedgerFixture fixture = new LedgerFixture();
        RegistrationResult agent = fixture.registerMain("Chatty");
        for (int i = 0; i < 5; i++) {
            submitSigned(fixture, agent, WorkReport.of("p" + i, 0, 0, 0, 0, null));
        }
        WorkReport sixth = sign(fixture, agent, WorkReport.of("p5", 1, 0, 0, 0, null));

        assertThatThrownBy(() -> fixture.reputationEngine.submitWorkReport(agent.identity().did(), sixth))
                .isInstanceOf(RateLimitExceededException.class);
        assertThat(fixture.eventLedger.scoreFor(agent.identity().id()).count()).isEqualTo(6);
    }

    @Test
    void unsignedReportIsUnauthorizedAndConsumesNothing() {
        LedgerFixture fixture = new LedgerFixture();
        RegistrationResult agent = fixture.registerMain("Anonymous");
        String agentId = agent.identity().id().toString();

        assertThatThrownBy(() -> fixture.reputationEngine.submitWorkReport(agentId,
                WorkReport.of(null, 10, 0, 0, 0, null)))
                .isInstanceOf(UnauthorizedReportException.class);
        assertThat(fixture.store.windowCount(agentId, "work_report")).isEmpty();
        assertThat(fixture.eventLedger.scoreFor(agent.identity().id()).count()).isEqualTo(1);
    }

    @Test
    void tamperedReportIsUnauthorized() {
        LedgerFixture fixture = new LedgerFixture();
        RegistrationResult agent = fixture.registerMain("Tamperer");
        WorkReport signed = sign(fixture, agent, WorkReport.of("p", 1, 0, 0, 0, null));
        WorkReport tampered = WorkReport.of("p", 1000, 0, 0, 0, signed.signature());

        assertThatThrownBy(() -> fixture.reputationEngine.submitWorkReport(agent.identity().did(), tampered))
                .isInstanceOf(UnauthorizedReportException.class);
        assertThat(fixture.eventLedger.scoreFor(agent.identity().id()).total()).isEqualTo(10);
    }

    @Test
    void reportSignedByAnotherKeyIsUnauthorized() {
        LedgerFixture fixture = new LedgerFixture();
        RegistrationResult agent = fixture.registerMain("Victim");
        RegistrationResult attacker = fixture.registerMain("Attacker");
        WorkReport report = WorkReport.of("p", 100, 0, 0, 0, null);
        String canonical = fixture.reputationEngine.canonicalReport(agent.identity().did(), "p", report);
        String forged = fixture.crypto.sign(canonical, attacker.privateKey());

        assertThatThrownBy(() -> fixture.reputationEngine.submitWorkReport(agent.identity().did(),
                report.withSignature(forged)))
                .isInstanceOf(UnauthorizedReportException.class);
    }

    @Test
    void unknownAgentIsNotFound() {
        LedgerFixture fixture = new LedgerFixture();

        assertThatThrownBy(() -> fixture.reputationEngine.submitWorkReport(UUID.randomUUID().toString(),
                WorkReport.of(null, 1, 0, 0, 0, "00")))
                .isInstanceOf(IdentityNotFoundException.class);
    }

    @Property(tries = 40)
    @Label("A single report never moves the score by more than 0.50")
    void singleReportDeltaIsBounded(@ForAll @IntRange(min = -10, max = 5000) int tasks,
                                    @ForAll @IntRange(min = -10, max = 500) int corrections,
                                    @ForAll @IntRange(min = -10, max = 500) int positive,
                                    @ForAll @IntRange(min = -10, max = 500) int errors) {
        LedgerFixture fixture = new LedgerFixture();
        RegistrationResult agent = fixture.registerMain("Bounded");

        WorkReportResult result = submitSigned(fixture, agent, WorkReport.of(null, tasks, corrections, positive, errors, null));

        assertThat(result.delta().abs()).isLessThanOrEqualTo(new BigDecimal("0.50"));
        assertThat(result.newReputation()).isBetween(BigDecimal.ZERO, BigDecimal.valueOf(5));
        assertThat(result.newReputation().subtract(result.oldReputation())).isEqualByComparingTo(result.delta());
    }

    @Property(tries = 20)
    @Label("Same-day reports net to within [-0.50, +0.50]")
    void sameDayNetIsBounded(@ForAll @IntRange(min = 0, max = 200) int tasksA,
                             @ForAll @IntRange(min = 0, max = 30) int correctionsA,
                             @ForAll @IntRange(min = 0, max = 200) int tasksB,
                             @ForAll @IntRange(min = 0, max = 30) int correctionsB,
                             @ForAll @IntRange(min = 0, max = 200) int tasksC) {
        LedgerFixture fixture = new LedgerFixture();
        RegistrationResult agent = fixture.registerMain("Daily");
        submitSigned(fixture, agent, WorkReport.of("a", tasksA, correctionsA, 0, 0, null));
        submitSigned(fixture, agent, WorkReport.of("b", tasksB, correctionsB, 0, 0, null));
        submitSigned(fixture, agent, WorkReport.of("c", tasksC, 0, 0, 0, null));

        long today = fixture.eventLedger.dailyDelta(agent.identity().id(), EventType.WORK_REPORT,
                LedgerFixture.START.minus(Duration.ofHours(9)));
        assertThat(today).isBetween(-50L, 50L);
    }

    // ==================== Proof of possession ====================

    @Test
    @Label("A valid signature earns +0.01; an invalid one changes nothing")
    void verifySignatureCreditsOnlyValidSignatures() {
        LedgerFixture fixture = new LedgerFixture();
        RegistrationResult agent = fixture.registerMain("Prover");
        String signature = fixture.crypto.sign("ping", agent.privateKey());

        SignatureCheckResult ok = fixture.reputationEngine.verifySignature(agent.identity().did(), "ping", signature);
        SignatureCheckResult bad = fixture.reputationEngine.verifySignature(agent.identity().did(), "pong", signature);

        assertThat(ok.verified()).isTrue();
        assertThat(bad.verified()).isFalse();
        assertThat(fixture.eventLedger.scoreFor(agent.identity().id()).reputation()).isEqualByComparingTo("3.11");
    }

    @Test
    void verifySignatureRequiresMessageAndSignature() {
        LedgerFixture fixture = new LedgerFixture();
        RegistrationResult agent = fixture.registerMain("Prover");

        assertThatThrownBy(() -> fixture.reputationEngine.verifySignature(agent.identity().did(), "", "ab"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> fixture.reputationEngine.verifySignature(agent.identity().did(), "ping", null))
                .isInstanceOf(ValidationException.class);
    }

    // ==================== Store failures ====================

    @Test
    void failedWorkReportAppendSurfacesWithoutEvent() {
        AtomicBoolean failEvents = new AtomicBoolean(false);
        LedgerFixture fixture = new LedgerFixture(failingEventStore(failEvents));
        RegistrationResult agent = fixture.registerMain("Unlucky");
        WorkReport report = sign(fixture, agent, WorkReport.of(null, 10, 0, 0, 0, null));
        failEvents.set(true);

        assertThatThrownBy(() -> fixture.reputationEngine.submitWorkReport(agent.identity().did(), report))
                .isInstanceOf(PersistenceFailureException.class);
        assertThat(fixture.eventLedger.hasEventOfType(agent.identity().id(), EventType.WORK_REPORT)).isFalse();
        assertThat(fixture.eventLedger.scoreFor(agent.identity().id()).total()).isEqualTo(10);
    }

    @Test
    void failedDailyTotalSurfacesWithoutEvent() {
        InMemoryLedgerStore store = new InMemoryLedgerStore() {
            @Override
            public synchronized long sumEventDeltasSince(UUID agentId, EventType eventType, Instant since) {
                throw new PersistenceFailureException("sumEventDeltasSince", new IllegalStateException("timeout"));
            }
        };
        LedgerFixture fixture = new LedgerFixture(store);
        RegistrationResult agent = fixture.registerMain("Unlucky");

        assertThatThrownBy(() -> submitSigned(fixture, agent, WorkReport.of(null, 10, 0, 0, 0, null)))
                .isInstanceOf(PersistenceFailureException.class);
        assertThat(fixture.eventLedger.hasEventOfType(agent.identity().id(), EventType.WORK_REPORT)).isFalse();
    }

    @Test
    void failedVerificationCreditSurfaces() {
        AtomicBoolean failEvents = new AtomicBoolean(false);
        LedgerFixture fixture = new LedgerFixture(failingEventStore(failEvents));
        RegistrationResult agent = fixture.registerMain("Unlucky");
        String signature = fixture.crypto.sign("ping", agent.privateKey());
        failEvents.set(true);

        assertThatThrownBy(() -> fixture.reputationEngine.verifySignature(agent.identity().did(), "ping", signature))
                .isInstanceOf(PersistenceFailureException.class);
        assertThat(fixture.eventLedger.hasEventOfType(agent.identity().id(), EventType.VERIFICATION_SUCCESS))
                .isFalse();
    }

    private static InMemoryLedgerStore failingEventStore(AtomicBoolean failEvents) {
        return new InMemoryLedgerStore() {
            @Override
            public synchronized StoredEvent insertEvent(NewEvent event) {
                if (failEvents.get()) {
                    throw new PersistenceFailureException("insertEvent", new IllegalStateException("store down"));
                }
                return super.insertEvent(event);
            }
        };
    }

    private static WorkReportResult submitSigned(LedgerFixture fixture, RegistrationResult agent, WorkReport report) {
        return fixture.reputationEngine.submitWorkReport(agent.identity().did(), sign(fixture, agent, report));
    }

    private static WorkReport sign(LedgerFixture fixture, RegistrationResult agent, WorkReport report) {
        String period = fixture.reputationEngine.effectivePeriod(report.period(), fixture.clock.instant());
        String canonical = fixture.reputationEngine.canonicalReport(agent.identity().did(), period, report);
        return report.withSignature(fixture.crypto.sign(canonical, agent.privateKey()));
    }
}
