package com.wanradar.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Latest payload written for one entity and when it was written. Every write replaces the whole entry.
 */
public record CacheEntry(String entityId, Instant timestamp, List<JsonNode> payload) {

    public CacheEntry {
        payload = payload == null ? List.of() : List.copyOf(payload);
    }

    public Duration ageAt(Instant now) {
        return Duration.between(timestamp, now);
    }
}
