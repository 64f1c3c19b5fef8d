package com.agentid.core.repository;

import com.agentid.core.domain.AgentClaim;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for agent claims. Expired claims are kept; readers filter them.
 */
@Repository
public interface AgentClaimRepository extends JpaRepository<AgentClaim, UUID> {

    List<AgentClaim> findByAgentIdOrderByVerifiedAtDesc(UUID agentId);

    long countByAgentId(UUID agentId);
}
