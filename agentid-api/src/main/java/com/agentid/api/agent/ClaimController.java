package com.agentid.api.agent;

import com.agentid.api.agent.AgentResponses.ClaimResponse;
import com.agentid.api.agent.AgentResponses.ClaimView;
import com.agentid.api.agent.AgentResponses.ClaimsResponse;
import com.agentid.api.claim.ClaimRequest;
import com.agentid.api.claim.ClaimResult;
import com.agentid.api.claim.ClaimVerificationService;
import com.agentid.api.registry.IdentityRegistry;
import com.agentid.api.store.ClaimRecord;
import com.agentid.api.store.IdentityRecord;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Claim attestation endpoints.
 */
@RestController
@RequestMapping("/api/v1/claims")
public class ClaimController {

    private final ClaimVerificationService claimService;
    private final IdentityRegistry registry;

    public ClaimController(ClaimVerificationService claimService, IdentityRegistry registry) {
        this.claimService = claimService;
        this.registry = registry;
    }

    @PostMapping
    public ResponseEntity<ClaimResponse> verifyClaim(@Valid @RequestBody VerifyClaimRequest request) {
        ClaimResult result = claimService.verifyClaim(new ClaimRequest(
                request.agentId(),
                request.claimType(),
                request.claimValue(),
                request.message(),
                request.signature(),
                request.verifierId(),
                request.expiresInDays()));
        ClaimRecord claim = result.claim();
        return ResponseEntity.status(HttpStatus.CREATED).body(new ClaimResponse(
                true,
                claim.id(),
                claim.agentId(),
                result.did(),
                claim.claimType(),
                claim.claimValue(),
                result.signatureVerified(),
                claim.verifiedAt(),
                claim.expiresAt()));
    }

    @GetMapping("/{agentId}")
    public ResponseEntity<ClaimsResponse> activeClaims(@PathVariable String agentId) {
        IdentityRecord agent = registry.require(agentId);
        List<ClaimView> claims = claimService.activeClaims(agentId).stream()
                .map(claim -> new ClaimView(claim.id(), claim.verifierId(), claim.claimType(), claim.claimValue(),
                        claim.verifiedAt(), claim.expiresAt()))
                .toList();
        return ResponseEntity.ok(new ClaimsResponse(agent.id(), agent.did(), claims, claims.size()));
    }

    public record VerifyClaimRequest(
            @NotBlank String agentId,
            @NotBlank String claimType,
            String claimValue,
            String message,
            String signature,
            String verifierId,
            Integer expiresInDays
    ) {}
}
