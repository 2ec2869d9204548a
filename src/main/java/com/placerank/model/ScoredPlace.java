package com.placerank.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A place with its compatibility score for one user.
 */
@Value
@Builder
public class ScoredPlace {

    Place place;

    /**
     * Weighted score in [0, 1].
     */
    double aiScore;

    List<String> matchReasons;

    ScoreBreakdown breakdown;

    /**
     * Normalized sub-scores behind {@link #aiScore}, each in [0, 1].
     */
    public record ScoreBreakdown(double rating, double priceFit, double popularity, double categoryMatch) {
    }
}
