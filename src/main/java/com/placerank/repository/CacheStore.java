package com.placerank.repository;

import com.placerank.model.CacheEntry;
import com.placerank.model.CacheKey;
import com.placerank.model.Place;
import com.placerank.model.dto.CacheStatistics;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable key to place-list store with expiry.
 *
 * The store is best-effort: read and write faults never reach the caller, a failed read is a miss.
 */
public interface CacheStore {

    /**
     * Get a valid entry.
     *
     * @param key cache key
     * @return the entry, or empty when missing, stale (age at or above its ttl) or unreadable
     */
    Optional<CacheEntry> get(CacheKey key);

    /**
     * Store a payload with the store's default ttl.
     */
    void put(CacheKey key, List<Place> payload);

    /**
     * Store a payload with an explicit ttl.
     */
    void put(CacheKey key, List<Place> payload, Duration ttl);

    /**
     * Physically remove expired and unreadable entries.
     *
     * @return number of entries removed
     */
    int purgeExpired();

    /**
     * Remove every entry.
     *
     * @return number of entries removed
     */
    int clear();

    CacheStatistics stats();

    Duration defaultTtl();
}
