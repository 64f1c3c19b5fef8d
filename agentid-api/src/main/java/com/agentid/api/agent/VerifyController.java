package com.agentid.api.agent;

import com.agentid.api.agent.AgentResponses.LookupResponse;
import com.agentid.api.registry.AgentDirectory;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public DID lookup. No authentication; rate limited per client address.
 */
@RestController
@RequestMapping("/api/v1/verify")
public class VerifyController {

    private final AgentDirectory directory;

    public VerifyController(AgentDirectory directory) {
        this.directory = directory;
    }

    @GetMapping("/{did}")
    public ResponseEntity<LookupResponse> lookup(@PathVariable String did, HttpServletRequest request) {
        AgentDirectory.PublicLookup lookup = directory.publicLookup(did, ClientAddress.of(request));
        String message = lookup.verified() ? null : "Agent not registered";
        return ResponseEntity.ok(new LookupResponse(lookup.verified(), lookup.did(), lookup.name(),
                lookup.reputation(), lookup.tasksCompleted(), lookup.registeredAt(), lookup.flags(), message));
    }
}
