package com.placerank.repository;

import com.placerank.model.CacheEntry;
import com.placerank.model.CacheKey;
import com.placerank.model.Place;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * On-disk form of a {@link CacheEntry}.
 */
record CacheRecord(String key, long storedAtMillis, long ttlMillis, List<Place> payload) {

    static CacheRecord from(CacheEntry entry) {
        return new CacheRecord(
                entry.key().value(),
                entry.storedAt().toEpochMilli(),
                entry.ttl().toMillis(),
                entry.payload());
    }

    CacheEntry toEntry() {
        return new CacheEntry(
                new CacheKey(key),
                payload,
                Instant.ofEpochMilli(storedAtMillis),
                Duration.ofMillis(ttlMillis));
    }
}
