package com.placerank.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Ranked places for one category plus counts for observability.
 */
@Value
@Builder
public class CategoryRecommendation {

    String category;

    /**
     * Places left after limiting, before scoring.
     */
    int totalFound;

    /**
     * Places left after scoring and the rating floor.
     */
    int aiFiltered;

    @Builder.Default
    List<ScoredPlace> places = List.of();

    /**
     * Why the category degraded to an empty result, null on success.
     */
    String failureReason;

    public static CategoryRecommendation failed(String category, String reason) {
        return CategoryRecommendation.builder()
                .category(category)
                .failureReason(reason)
                .build();
    }

    public boolean isFailed() {
        return failureReason != null;
    }
}
