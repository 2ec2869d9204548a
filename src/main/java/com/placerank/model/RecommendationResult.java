package com.placerank.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Per-category recommendations for one destination.
 */
@Value
@Builder
public class RecommendationResult {

    String destination;

    Instant generatedAt;

    /**
     * Keyed by category, in request order.
     */
    Map<String, CategoryRecommendation> categories;

    public int totalPlaces() {
        return categories.values().stream()
                .mapToInt(category -> category.getPlaces().size())
                .sum();
    }
}
