package com.agentid.api.ratelimit;

import com.agentid.api.error.RateLimitExceededException;
import com.agentid.api.store.LedgerStore;
import com.agentid.api.store.RateWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Durable fixed-window rate limiter on top of the ledger store.
 *
 * One window row per (identifier, action). The row is created by the first
 * action and counts up with an optimistic compare-and-swap; an expired row is
 * deleted before it is read, which starts a fresh window.
 */
@Service
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private static final List<RateLimitPolicy> POLICIES = List.of(RateLimitPolicy.REGISTRATION, RateLimitPolicy.WORK_REPORT);

    private final LedgerStore store;
    private final Clock clock;

    public RateLimiter(LedgerStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Records one action if the identifier still has allowance.
     *
     * @return true if the action is allowed and counted
     */
    public boolean tryConsume(String identifier, String actionType, int maxCount, Duration window) {
        return consume(identifier, new RateLimitPolicy(actionType, maxCount, window)).allowed();
    }

    /**
     * Like {@link #tryConsume} but throws when the allowance is used up.
     *
     * @throws RateLimitExceededException when the window is full
     */
    public void check(String identifier, RateLimitPolicy policy) {
        Decision decision = consume(identifier, policy);
        if (!decision.allowed()) {
            log.warn("Rate limit hit: {} for {} ({} per {})",
                    policy.actionType(), identifier, policy.maxCount(), policy.window());
            throw new RateLimitExceededException(policy.actionType(),
                    "Rate limit exceeded for " + policy.actionType() + ": max " + policy.maxCount()
                            + " per " + policy.window().toHours() + "h",
                    decision.retryAfter());
        }
    }

    private Decision consume(String identifier, RateLimitPolicy policy) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Identifier cannot be null or blank");
        }
        Instant now = clock.instant();
        store.deleteExpiredRateWindow(identifier, policy.actionType(), now.minus(policy.window()));

        RateWindow window = store.findOrCreateRateWindow(identifier, policy.actionType(), now);
        if (window.created()) {
            return Decision.ALLOW;
        }
        if (window.count() >= policy.maxCount()) {
            Duration remaining = Duration.between(now, window.windowStart().plus(policy.window()));
            return new Decision(false, remaining.isNegative() ? Duration.ZERO : remaining);
        }
        if (!store.incrementRateWindow(window.id(), window.count())) {
            // Lost the compare-and-swap to a concurrent writer; this request still passes.
            log.debug("Concurrent update on {} window for {}, allowing request", policy.actionType(), identifier);
        }
        return Decision.ALLOW;
    }

    @Scheduled(fixedRateString = "${agentid.rate-limit.sweep-interval-ms:3600000}")
    public void scheduledSweep() {
        sweepExpiredWindows();
    }

    /**
     * Removes windows older than the longest policy window.
     */
    public int sweepExpiredWindows() {
        Duration longest = POLICIES.stream().map(RateLimitPolicy::window).max(Duration::compareTo).orElseThrow();
        int removed = store.deleteExpiredRateWindows(clock.instant().minus(longest));
        if (removed > 0) {
            log.info("Swept {} expired rate limit windows", removed);
        }
        return removed;
    }

    private record Decision(boolean allowed, Duration retryAfter) {
        static final Decision ALLOW = new Decision(true, Duration.ZERO);
    }
}
