package com.agentid.api.agent;

import com.agentid.api.agent.AgentResponses.AgentView;
import com.agentid.api.agent.AgentResponses.EventView;
import com.agentid.api.agent.AgentResponses.PageResponse;
import com.agentid.api.agent.AgentResponses.ProfileResponse;
import com.agentid.api.agent.AgentResponses.RegistrationResponse;
import com.agentid.api.agent.AgentResponses.RepairResponse;
import com.agentid.api.agent.AgentResponses.ReputationResponse;
import com.agentid.api.agent.AgentResponses.SignatureCheckResponse;
import com.agentid.api.agent.AgentResponses.StatsResponse;
import com.agentid.api.agent.AgentResponses.WorkReportResponse;
import com.agentid.api.agent.AgentResponses.WorkersResponse;
import com.agentid.api.ledger.EventLedger;
import com.agentid.api.ledger.ReputationScore;
import com.agentid.api.registry.AgentDirectory;
import com.agentid.api.registry.IdentityRegistry;
import com.agentid.api.registry.RegistrationRequest;
import com.agentid.api.registry.RegistrationResult;
import com.agentid.api.reputation.ReputationEngine;
import com.agentid.api.reputation.SignatureCheckResult;
import com.agentid.api.reputation.WorkReport;
import com.agentid.api.reputation.WorkReportResult;
import com.agentid.api.store.IdentityRecord;
import com.agentid.core.domain.AgentIdentity.AgentStatus;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Agent registry and reputation REST API endpoints.
 *
 * {@code {id}} accepts either the agent UUID or its DID.
 */
@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private final IdentityRegistry registry;
    private final ReputationEngine reputationEngine;
    private final AgentDirectory directory;
    private final EventLedger eventLedger;

    public AgentController(IdentityRegistry registry, ReputationEngine reputationEngine,
                           AgentDirectory directory, EventLedger eventLedger) {
        this.registry = registry;
        this.reputationEngine = reputationEngine;
        this.directory = directory;
        this.eventLedger = eventLedger;
    }

    /**
     * Registers a main agent, or a worker when parentDid is set. When no public key
     * is supplied a keypair is generated and the private key returned once.
     */
    @PostMapping("/register")
    public ResponseEntity<RegistrationResponse> register(@Valid @RequestBody RegisterRequest request,
                                                         HttpServletRequest httpRequest) {
        RegistrationResult result = registry.register(new RegistrationRequest(
                request.name(),
                request.publicKey(),
                request.parentDid(),
                request.ownerId(),
                request.metadata(),
                ClientAddress.of(httpRequest)));

        IdentityRecord identity = result.identity();
        BigDecimal reputation = eventLedger.scoreFor(identity.id()).reputation();
        String warning = result.warning() == null ? null : result.warning().name();
        String message = result.privateKey() == null ? null
                : "Store the private key securely. It is not kept by the registry and cannot be recovered.";
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new RegistrationResponse(AgentView.of(identity, reputation), result.privateKey(),
                        warning, message));
    }

    @GetMapping
    public ResponseEntity<PageResponse> list(@RequestParam(defaultValue = "100") int limit,
                                             @RequestParam(defaultValue = "0") int offset) {
        AgentDirectory.AgentPage page = directory.page(limit, offset);
        List<AgentView> agents = page.agents().stream()
                .map(summary -> AgentView.of(summary.identity(), summary.reputation()))
                .toList();
        return ResponseEntity.ok(new PageResponse(agents, page.total(), page.limit(), page.offset()));
    }

    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> stats() {
        AgentDirectory.DirectoryStats stats = directory.stats();
        return ResponseEntity.ok(new StatsResponse(stats.totalAgents(), stats.mainAgents(), stats.workerAgents(),
                stats.totalVerifications(), stats.registrations24h()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProfileResponse> profile(@PathVariable String id) {
        AgentDirectory.AgentProfile profile = directory.profile(id);
        return ResponseEntity.ok(new ProfileResponse(
                AgentView.of(profile.identity(), profile.reputation()), profile.didDocument()));
    }

    /**
     * Proof of key possession: the agent signs a message of the caller's choosing.
     */
    @PostMapping("/{id}/verify")
    public ResponseEntity<SignatureCheckResponse> verify(@PathVariable String id,
                                                         @Valid @RequestBody SignatureRequest request) {
        SignatureCheckResult result = reputationEngine.verifySignature(id, request.message(), request.signature());
        return ResponseEntity.ok(new SignatureCheckResponse(result.verified(), result.agentId(), result.did(),
                result.verifiedAt()));
    }

    @GetMapping("/{id}/reputation")
    public ResponseEntity<ReputationResponse> reputation(@PathVariable String id) {
        AgentDirectory.ReputationReport report = directory.reputation(id);
        return ResponseEntity.ok(new ReputationResponse(
                report.agentId(),
                report.did(),
                report.score(),
                report.eventCount(),
                report.reputation(),
                report.verificationCount(),
                report.ageDays(),
                report.status(),
                report.recentEvents().stream().map(EventView::of).toList()));
    }

    /**
     * Signed work report. The signature covers the canonical report JSON.
     */
    @PostMapping("/{id}/work-report")
    public ResponseEntity<WorkReportResponse> workReport(@PathVariable String id,
                                                         @RequestBody WorkReportRequest request) {
        WorkReportResult result = reputationEngine.submitWorkReport(id, new WorkReport(
                request.period(),
                request.tasksCompleted(),
                request.corrections(),
                request.positiveFeedback(),
                request.errors(),
                request.signature()));
        return ResponseEntity.ok(new WorkReportResponse(result.agentId(), result.did(), result.period(),
                result.delta(), result.oldReputation(), result.newReputation(), result.recordedAt()));
    }

    @GetMapping("/{id}/workers")
    public ResponseEntity<WorkersResponse> workers(@PathVariable String id) {
        IdentityRecord parent = registry.require(id);
        List<AgentView> workers = registry.workers(id).stream()
                .map(worker -> AgentView.of(worker, eventLedger.scoreFor(worker.id()).reputation()))
                .toList();
        return ResponseEntity.ok(new WorkersResponse(parent.id(), parent.did(), workers, workers.size()));
    }

    @PostMapping("/{id}/status")
    public ResponseEntity<AgentView> updateStatus(@PathVariable String id,
                                                  @Valid @RequestBody StatusRequest request) {
        IdentityRecord updated = registry.updateStatus(id, request.status());
        ReputationScore score = eventLedger.scoreFor(updated.id());
        return ResponseEntity.ok(AgentView.of(updated, score.reputation()));
    }

    /**
     * Repairs a partial registration by appending the missing registration event.
     */
    @PostMapping("/{id}/registration-event")
    public ResponseEntity<RepairResponse> repairRegistration(@PathVariable String id) {
        boolean appended = registry.ensureRegistrationEvent(id);
        IdentityRecord identity = registry.require(id);
        return ResponseEntity.ok(new RepairResponse(identity.id(), identity.did(), appended));
    }

    public record RegisterRequest(
            String name,
            String publicKey,
            String parentDid,
            String ownerId,
            Map<String, Object> metadata
    ) {}

    public record SignatureRequest(
            @NotBlank String message,
            @NotBlank String signature
    ) {}

    public record WorkReportRequest(
            String period,
            BigDecimal tasksCompleted,
            BigDecimal corrections,
            BigDecimal positiveFeedback,
            BigDecimal errors,
            String signature
    ) {}

    public record StatusRequest(
            @NotNull AgentStatus status
    ) {}
}
