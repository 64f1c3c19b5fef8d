package com.agentid.core.repository;

import com.agentid.core.domain.RateLimitWindow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for rate limit windows.
 * Counts are only changed through {@link #compareAndIncrement(Long, int)}.
 */
@Repository
public interface RateLimitWindowRepository extends JpaRepository<RateLimitWindow, Long> {

    Optional<RateLimitWindow> findByIdentifierAndActionType(String identifier, String actionType);

    /**
     * Optimistic increment: only applies while the stored count still equals the observed one.
     *
     * @return 1 when the increment was applied, 0 when a concurrent writer got there first
     */
    @Modifying
    @Query("UPDATE RateLimitWindow w SET w.actionCount = w.actionCount + 1 " +
           "WHERE w.id = :id AND w.actionCount = :expectedCount")
    int compareAndIncrement(@Param("id") Long id, @Param("expectedCount") int expectedCount);

    @Modifying
    @Query("DELETE FROM RateLimitWindow w " +
           "WHERE w.identifier = :identifier AND w.actionType = :actionType AND w.windowStart <= :cutoff")
    int deleteExpired(@Param("identifier") String identifier,
                      @Param("actionType") String actionType,
                      @Param("cutoff") Instant cutoff);

    @Modifying
    @Query("DELETE FROM RateLimitWindow w WHERE w.windowStart <= :cutoff")
    int deleteAllExpired(@Param("cutoff") Instant cutoff);
}
