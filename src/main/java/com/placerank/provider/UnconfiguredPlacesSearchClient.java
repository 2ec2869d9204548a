package com.placerank.provider;

import com.placerank.exception.UpstreamUnavailableException;
import com.placerank.model.Place;
import com.placerank.model.SearchParams;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Placeholder used when the application context provides no {@link PlacesSearchClient}.
 * Every call fails as unavailable, so cached results are still served.
 */
@Slf4j
public class UnconfiguredPlacesSearchClient implements PlacesSearchClient {

    public UnconfiguredPlacesSearchClient() {
        log.warn("No places search client configured - only cached results will be served");
    }

    @Override
    public String getName() {
        return "unconfigured";
    }

    @Override
    public Mono<List<Place>> textSearch(SearchParams params, int maxResults) {
        return Mono.error(new UpstreamUnavailableException("No places search client configured"));
    }

    @Override
    public Mono<Place> placeDetails(String placeId) {
        return Mono.error(new UpstreamUnavailableException("No places search client configured"));
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
