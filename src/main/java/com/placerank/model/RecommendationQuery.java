package com.placerank.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A multi-category recommendation request for one destination.
 */
@Value
@Builder
public class RecommendationQuery {

    /**
     * Destination key from the configured catalog, e.g. "bogota".
     */
    String destination;

    /**
     * Explicit location, overrides the destination's coordinates.
     */
    Coordinates location;

    /**
     * Categories to fetch; the configured defaults when empty.
     */
    @Builder.Default
    List<String> categories = List.of();

    /**
     * Free-text query override, replaces each category's default query.
     */
    String query;

    Integer radius;
}
