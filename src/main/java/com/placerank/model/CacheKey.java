package com.placerank.model;

/**
 * Opaque cache key produced by {@code RequestKeyBuilder}.
 */
public record CacheKey(String value) {

    public CacheKey {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Cache key must not be blank");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
