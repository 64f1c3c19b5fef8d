package com.agentid.core.repository;

import com.agentid.core.domain.AgentIdentity;
import com.agentid.core.domain.AgentIdentity.AgentType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for agent identities.
 */
@Repository
public interface AgentIdentityRepository extends JpaRepository<AgentIdentity, UUID> {

    Optional<AgentIdentity> findByDid(String did);

    /**
     * Find the workers registered under a main agent.
     */
    List<AgentIdentity> findByParentDidOrderByCreatedAtDesc(String parentDid);

    /**
     * One slice of the identities, newest first, skipping {@code offset} rows in the database.
     */
    @Query(value = "SELECT * FROM agents ORDER BY created_at DESC, id LIMIT :limit OFFSET :offset",
           nativeQuery = true)
    List<AgentIdentity> findNewestFirst(@Param("limit") int limit, @Param("offset") int offset);

    long countByAgentType(AgentType agentType);

    long countByCreatedAtAfter(Instant since);
}
