package com.placerank.provider;

import com.placerank.model.Place;
import com.placerank.model.SearchParams;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * External places search API.
 * Implementations handle authentication, transport and response mapping; the core only sees
 * places and the two failure conditions below.
 *
 * Failures should surface as {@code QuotaExceededException} or
 * {@code UpstreamUnavailableException}; anything else is classified by
 * {@link UpstreamErrorClassifier}.
 */
public interface PlacesSearchClient {

    /**
     * Get client name (e.g., "google-places").
     *
     * @return client name
     */
    String getName();

    /**
     * Search places by text.
     *
     * @param params     search parameters
     * @param maxResults upper bound on results requested
     * @return places in upstream relevance order, empty list when nothing matched
     */
    Mono<List<Place>> textSearch(SearchParams params, int maxResults);

    /**
     * Get the detailed record of one place.
     *
     * @param placeId upstream place id
     * @return detailed place, or empty when the upstream no longer knows the id
     */
    Mono<Place> placeDetails(String placeId);

    /**
     * Check if the client is configured and ready to use.
     *
     * @return true if ready
     */
    default boolean isEnabled() {
        return true;
    }
}
