package com.placerank.service.fetch;

import com.placerank.config.PlacerankProperties;

import java.time.Duration;

/**
 * Immutable settings of the batch fetch orchestrator.
 *
 * @param maxResults    per-category ceiling on raw results requested upstream
 * @param batchSize     detail lookups per group
 * @param pacing        delay between detail groups
 * @param fetchDetails  whether search results are enriched with detail lookups
 * @param timeout       per-call upstream timeout, null for none
 * @param cacheEnabled  whether the cache store is consulted and written
 */
public record FetchSettings(
        int maxResults,
        int batchSize,
        Duration pacing,
        boolean fetchDetails,
        Duration timeout,
        boolean cacheEnabled) {

    public static final int DEFAULT_MAX_RESULTS = 8;
    public static final int DEFAULT_BATCH_SIZE = 3;
    public static final Duration DEFAULT_PACING = Duration.ofMillis(100);

    public FetchSettings {
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be at least 1: " + maxResults);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1: " + batchSize);
        }
        if (pacing == null || pacing.isNegative()) {
            throw new IllegalArgumentException("pacing must be zero or positive: " + pacing);
        }
    }

    public static FetchSettings defaults() {
        return new FetchSettings(DEFAULT_MAX_RESULTS, DEFAULT_BATCH_SIZE, DEFAULT_PACING, true, null, true);
    }

    public static FetchSettings from(PlacerankProperties properties) {
        PlacerankProperties.FetchConfig fetch = properties.getFetch();
        return new FetchSettings(
                fetch.getMaxResults(),
                fetch.getBatchSize(),
                fetch.getPacing(),
                fetch.isFetchDetails(),
                fetch.getTimeout(),
                properties.getCache().isEnabled());
    }
}
