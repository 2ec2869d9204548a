package com.placerank.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Parameters of one upstream text search.
 * Built with named fields so the order optional parameters are supplied in never matters.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SearchParams {

    String query;

    Coordinates location;

    /**
     * Search radius in meters, null for no location bias.
     */
    Integer radius;

    /**
     * Upstream place type, e.g. "restaurant" or "lodging".
     */
    String typeFilter;

    String language;
}
