package com.placerank.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Preferences of one user, read-only during a scoring pass.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class UserPreferenceProfile {

    /**
     * Weight given to each preferred type of a travel style.
     */
    public static final double PREFERRED_TYPE_WEIGHT = 1.0;

    @Builder.Default
    double minimumRating = 3.0;

    @Builder.Default
    int maximumPriceTier = 3;

    TravelStyle travelStyle;

    /**
     * Category (upstream place type) to weight, weights are non-negative.
     */
    @Builder.Default
    Map<String, Double> preferredCategoryWeights = Map.of();

    BudgetRange budget;

    /**
     * Weight the user gives to a category, if any.
     */
    public OptionalDouble weightFor(String category) {
        if (category == null || preferredCategoryWeights == null) {
            return OptionalDouble.empty();
        }
        Double weight = preferredCategoryWeights.get(category);
        return weight == null ? OptionalDouble.empty() : OptionalDouble.of(weight);
    }

    /**
     * Build a profile from a travel style and budget.
     * The budget decides the price ceiling; without one the style's own ceiling applies.
     */
    public static UserPreferenceProfile forTravelStyle(TravelStyle style, BudgetRange budget) {
        if (style == null) {
            throw new IllegalArgumentException("Travel style is required");
        }

        Map<String, Double> weights = new LinkedHashMap<>();
        for (String type : style.getPreferredTypes()) {
            weights.put(type, PREFERRED_TYPE_WEIGHT);
        }

        int maxTier = budget != null ? budget.getMaximumPriceTier() : style.getMaximumPriceTier();

        return UserPreferenceProfile.builder()
                .minimumRating(style.getMinimumRating())
                .maximumPriceTier(maxTier)
                .travelStyle(style)
                .preferredCategoryWeights(Map.copyOf(weights))
                .budget(budget)
                .build();
    }
}
