package com.placerank.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cache statistics for operational tooling.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    /**
     * Lookups answered with a valid entry.
     */
    private long hitCount;

    /**
     * Lookups that found nothing, a stale entry or a corrupted record.
     */
    private long missCount;

    /**
     * Records currently on disk, stale ones included until purged.
     */
    private long entryCount;

    /**
     * Hit rate (0.0-1.0).
     */
    private double hitRate;

    private long totalSizeBytes;

    private long ttlSeconds;

    private String cacheDirectory;
}
