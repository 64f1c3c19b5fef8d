package com.agentid.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * Rate Limit Window - Counter for one (identifier, action) pair.
 *
 * At most one row exists per pair; the unique constraint is what makes the
 * first insert of a window win. The count is only ever changed through the
 * compare-and-swap update in the repository.
 */
@Entity
@Table(name = "rate_limits",
    uniqueConstraints = @UniqueConstraint(name = "uk_rate_limits_identifier_action",
            columnNames = {"identifier", "action_type"}),
    indexes = @Index(name = "idx_rate_limits_window_start", columnList = "window_start"))
public class RateLimitWindow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @NotNull
    @Column(name = "identifier", nullable = false, updatable = false)
    private String identifier;

    @NotNull
    @Column(name = "action_type", nullable = false, updatable = false)
    private String actionType;

    @Column(name = "action_count", nullable = false)
    private int actionCount;

    @NotNull
    @Column(name = "window_start", nullable = false, updatable = false)
    private Instant windowStart;

    protected RateLimitWindow() {}

    /**
     * Opens a fresh window holding the first action.
     */
    public static RateLimitWindow open(String identifier, String actionType, Instant windowStart) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Identifier cannot be null or blank");
        }
        if (actionType == null || actionType.isBlank()) {
            throw new IllegalArgumentException("Action type cannot be null or blank");
        }
        RateLimitWindow window = new RateLimitWindow();
        window.identifier = identifier;
        window.actionType = actionType;
        window.actionCount = 1;
        window.windowStart = windowStart;
        return window;
    }

    // Getters
    public Long getId() { return id; }
    public String getIdentifier() { return identifier; }
    public String getActionType() { return actionType; }
    public int getCount() { return actionCount; }
    public Instant getWindowStart() { return windowStart; }
}
