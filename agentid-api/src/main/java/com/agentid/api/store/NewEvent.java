package com.agentid.api.store;

import com.agentid.core.domain.ReputationEvent.EventType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Event about to be appended; the store assigns the id.
 */
public record NewEvent(
        UUID agentId,
        EventType eventType,
        int scoreDelta,
        String description,
        Map<String, Object> metadata,
        Instant createdAt
) {
    public NewEvent {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
