package com.agentid.api.ratelimit;

import com.agentid.api.MutableClock;
import com.agentid.api.error.RateLimitExceededException;
import com.agentid.api.store.InMemoryLedgerStore;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the durable fixed-window rate limiter.
 */
class RateLimiterPropertyTest {

    private static final Instant T0 = Instant.parse("2026-03-10T09:00:00Z");

    @Property(tries = 50)
    @Label("Exactly max actions are allowed within one window")
    void allowsExactlyMaxPerWindow(@ForAll @IntRange(min = 1, max = 20) int max,
                                   @ForAll @IntRange(min = 0, max = 30) int extra) {
        InMemoryLedgerStore store = new InMemoryLedgerStore();
        RateLimiter limiter = new RateLimiter(store, new MutableClock(T0));

        int allowed = 0;
        for (int i = 0; i < max + extra; i++) {
            if (limiter.tryConsume("agent-1", "work_report", max, Duration.ofHours(24))) {
                allowed++;
            }
        }

        assertThat(allowed).isEqualTo(max);
        assertThat(store.windowCount("agent-1", "work_report")).contains(max);
    }

    @Property(tries = 30)
    @Label("Identifiers and actions are limited independently")
    void windowsAreIndependent(@ForAll @IntRange(min = 1, max = 5) int max) {
        RateLimiter limiter = new RateLimiter(new InMemoryLedgerStore(), new MutableClock(T0));
        for (int i = 0; i < max; i++) {
            assertThat(limiter.tryConsume("a", "registration", max, Duration.ofHours(1))).isTrue();
        }

        assertThat(limiter.tryConsume("a", "registration", max, Duration.ofHours(1))).isFalse();
        assertThat(limiter.tryConsume("b", "registration", max, Duration.ofHours(1))).isTrue();
        assertThat(limiter.tryConsume("a", "work_report", max, Duration.ofHours(1))).isTrue();
    }

    @Test
    void expiredWindowStartsFresh() {
        MutableClock clock = new MutableClock(T0);
        InMemoryLedgerStore store = new InMemoryLedgerStore();
        RateLimiter limiter = new RateLimiter(store, clock);
        for (int i = 0; i < 5; i++) {
            limiter.tryConsume("agent-1", "work_report", 5, Duration.ofHours(24));
        }
        assertThat(limiter.tryConsume("agent-1", "work_report", 5, Duration.ofHours(24))).isFalse();

        clock.advance(Duration.ofHours(23).plusMinutes(59));
        assertThat(limiter.tryConsume("agent-1", "work_report", 5, Duration.ofHours(24))).isFalse();

        clock.advance(Duration.ofMinutes(1));
        assertThat(limiter.tryConsume("agent-1", "work_report", 5, Duration.ofHours(24))).isTrue();
        assertThat(store.windowCount("agent-1", "work_report")).contains(1);
    }

    @Test
    void lostCompareAndSwapStillAllows() {
        InMemoryLedgerStore store = new InMemoryLedgerStore() {
            @Override
            public synchronized boolean incrementRateWindow(long windowId, int expectedCount) {
                return false;
            }
        };
        RateLimiter limiter = new RateLimiter(store, new MutableClock(T0));

        assertThat(limiter.tryConsume("ip", "registration", 2, Duration.ofHours(1))).isTrue();
        assertThat(limiter.tryConsume("ip", "registration", 2, Duration.ofHours(1))).isTrue();
        assertThat(store.windowCount("ip", "registration")).contains(1);
    }

    @Test
    void checkThrowsWithRetryAfter() {
        MutableClock clock = new MutableClock(T0);
        RateLimiter limiter = new RateLimiter(new InMemoryLedgerStore(), clock);
        for (int i = 0; i < RateLimitPolicy.WORK_REPORT.maxCount(); i++) {
            limiter.check("agent-1", RateLimitPolicy.WORK_REPORT);
        }
        clock.advance(Duration.ofHours(4));

        assertThatThrownBy(() -> limiter.check("agent-1", RateLimitPolicy.WORK_REPORT))
                .isInstanceOfSatisfying(RateLimitExceededException.class, e -> {
                    assertThat(e.getCode()).isEqualTo("RATE_001");
                    assertThat(e.getActionType()).isEqualTo("work_report");
                    assertThat(e.getRetryAfter()).isEqualTo(Duration.ofHours(20));
                });
    }

    @Test
    void sweepRemovesWindowsOlderThanLongestPolicy() {
        MutableClock clock = new MutableClock(T0);
        InMemoryLedgerStore store = new InMemoryLedgerStore();
        RateLimiter limiter = new RateLimiter(store, clock);
        limiter.tryConsume("old", "registration", 10, Duration.ofHours(24));
        clock.advance(Duration.ofHours(12));
        limiter.tryConsume("new", "registration", 10, Duration.ofHours(24));
        clock.advance(Duration.ofHours(12));

        assertThat(limiter.sweepExpiredWindows()).isEqualTo(1);
        assertThat(store.windowCount("old", "registration")).isEmpty();
        assertThat(store.windowCount("new", "registration")).contains(1);
    }

    @Test
    void policiesMatchPublishedLimits() {
        assertThat(RateLimitPolicy.REGISTRATION.maxCount()).isEqualTo(10);
        assertThat(RateLimitPolicy.WORK_REPORT.maxCount()).isEqualTo(5);
        assertThat(RateLimitPolicy.WORK_REPORT.window()).isEqualTo(Duration.ofHours(24));
        assertThatThrownBy(() -> new RateLimitPolicy("x", 0, Duration.ofHours(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
