package com.agentid.api.store;

import com.agentid.core.domain.ReputationEvent.EventType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Appended reputation event. Score delta is in hundredths of a reputation point.
 */
public record StoredEvent(
        long id,
        UUID agentId,
        EventType eventType,
        int scoreDelta,
        String description,
        Map<String, Object> metadata,
        Instant createdAt
) {
    public StoredEvent {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
