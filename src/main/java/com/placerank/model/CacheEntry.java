package com.placerank.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A cached payload with the time it was stored and how long it stays valid.
 */
public record CacheEntry(CacheKey key, List<Place> payload, Instant storedAt, Duration ttl) {

    public CacheEntry {
        payload = payload == null ? List.of() : List.copyOf(payload);
    }

    public Duration age(Instant now) {
        return Duration.between(storedAt, now);
    }

    /**
     * An entry is valid while its age is strictly below the ttl.
     */
    public boolean isValidAt(Instant now) {
        return age(now).compareTo(ttl) < 0;
    }

    public boolean isEmpty() {
        return payload.isEmpty();
    }
}
