package com.placerank.model;

import java.util.List;

/**
 * Travel style of a user and the place types it leans towards.
 */
public enum TravelStyle {

    CULTURAL(4.0, 4, List.of("museum", "art_gallery", "tourist_attraction")),

    ADVENTURE(3.5, 3, List.of("park", "tourist_attraction", "natural_feature")),

    RELAXED(4.0, 4, List.of("spa", "park", "restaurant")),

    FAMILY(3.5, 3, List.of("park", "tourist_attraction", "restaurant")),

    BUSINESS(4.0, 4, List.of("restaurant", "lodging", "shopping_mall"));

    private final double minimumRating;
    private final int maximumPriceTier;
    private final List<String> preferredTypes;

    TravelStyle(double minimumRating, int maximumPriceTier, List<String> preferredTypes) {
        this.minimumRating = minimumRating;
        this.maximumPriceTier = maximumPriceTier;
        this.preferredTypes = preferredTypes;
    }

    public double getMinimumRating() {
        return minimumRating;
    }

    public int getMaximumPriceTier() {
        return maximumPriceTier;
    }

    public List<String> getPreferredTypes() {
        return preferredTypes;
    }
}
