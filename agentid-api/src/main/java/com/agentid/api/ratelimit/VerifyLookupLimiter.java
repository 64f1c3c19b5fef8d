package com.agentid.api.ratelimit;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-process limiter for public DID lookups, keyed by client IP.
 *
 * Not durable and not shared between instances. The table is bounded: when it
 * fills up, expired entries go first, then the oldest ones.
 */
@Component
public class VerifyLookupLimiter {

    private static final Logger log = LoggerFactory.getLogger(VerifyLookupLimiter.class);

    private static final int LOOKUPS_PER_WINDOW = 1000;
    private static final Duration WINDOW = Duration.ofMinutes(1);
    private static final int EVICTION_HEADROOM = 10_000;

    private final Clock clock;
    private final int maxEntries;
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public VerifyLookupLimiter(Clock clock, @Value("${agentid.verify-limiter.max-entries:50000}") int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Max entries must be positive");
        }
        this.clock = clock;
        this.maxEntries = maxEntries;
    }

    /**
     * Consumes one lookup for the client.
     *
     * @return false once the client used up its lookups for the current minute
     */
    public synchronized boolean tryAcquire(String clientIp) {
        String key = clientIp == null || clientIp.isBlank() ? "unknown" : clientIp;
        Instant now = clock.instant();
        Entry entry = entries.get(key);
        if (entry == null || !now.isBefore(entry.resetAt())) {
            if (entry == null && entries.size() >= maxEntries) {
                evict(now);
            }
            entries.remove(key);
            entry = new Entry(newBucket(), now.plus(WINDOW));
            entries.put(key, entry);
        }
        return entry.bucket().tryConsume(1);
    }

    @Scheduled(fixedRateString = "${agentid.verify-limiter.sweep-interval-ms:300000}")
    public void scheduledSweep() {
        int removed = sweepExpired();
        if (removed > 0) {
            log.debug("Dropped {} expired lookup limiter entries", removed);
        }
    }

    public synchronized int sweepExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> !now.isBefore(entry.resetAt()));
        return before - entries.size();
    }

    public synchronized int size() {
        return entries.size();
    }

    private void evict(Instant now) {
        entries.values().removeIf(entry -> !now.isBefore(entry.resetAt()));
        int target = maxEntries - Math.min(EVICTION_HEADROOM, Math.max(1, maxEntries / 5));
        if (entries.size() > target) {
            int dropped = 0;
            Iterator<String> oldest = entries.keySet().iterator();
            while (entries.size() > target && oldest.hasNext()) {
                oldest.next();
                oldest.remove();
                dropped++;
            }
            log.warn("Lookup limiter full, evicted {} oldest entries", dropped);
        }
    }

    private static Bucket newBucket() {
        Bandwidth limit = Bandwidth.classic(LOOKUPS_PER_WINDOW, Refill.intervally(LOOKUPS_PER_WINDOW, WINDOW));
        return Bucket.builder().addLimit(limit).build();
    }

    private record Entry(Bucket bucket, Instant resetAt) {}
}
