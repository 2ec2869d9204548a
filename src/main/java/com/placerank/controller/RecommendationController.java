package com.placerank.controller;

import com.placerank.config.PlacerankProperties;
import com.placerank.model.Coordinates;
import com.placerank.model.RecommendationQuery;
import com.placerank.model.RecommendationResult;
import com.placerank.model.ScoredPlace;
import com.placerank.model.SearchParams;
import com.placerank.model.UserPreferenceProfile;
import com.placerank.model.dto.ProfileRequest;
import com.placerank.model.dto.RankedPlacesRequest;
import com.placerank.model.dto.RecommendationRequest;
import com.placerank.service.RecommendationAssembler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Recommendation endpoints: ranked places for one category, or several categories at once.
 */
@Slf4j
@RestController
@RequestMapping("/v1/recommendations")
public class RecommendationController {

    private final RecommendationAssembler assembler;
    private final PlacerankProperties properties;

    public RecommendationController(RecommendationAssembler assembler, PlacerankProperties properties) {
        this.assembler = assembler;
        this.properties = properties;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<RecommendationResult> recommend(@RequestBody RecommendationRequest request) {
        log.info("Received recommendation request for destination: {}, categories: {}",
                request.getDestination(), request.getCategories());

        return Mono.fromCallable(() -> RecommendationQuery.builder()
                        .destination(request.getDestination())
                        .location(locationOf(request.getLatitude(), request.getLongitude()))
                        .categories(request.getCategories() == null ? List.of() : request.getCategories())
                        .query(request.getQuery())
                        .radius(request.getRadius())
                        .build())
                .flatMap(query -> assembler.recommend(query, profileOf(request.getProfile())));
    }

    @PostMapping(value = "/{category}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<ScoredPlace>> rankCategory(
            @PathVariable String category,
            @RequestBody RankedPlacesRequest request) {

        log.info("Received ranking request for category: {}", category);

        Coordinates location = locationOf(request.getLatitude(), request.getLongitude());
        if (location == null) {
            return Mono.error(new IllegalArgumentException("Latitude and longitude must be specified"));
        }

        PlacerankProperties.CategoryConfig catalog = properties.getCategories().get(category);
        String type = request.getType() != null || catalog == null ? request.getType() : catalog.getType();
        String query = request.getQuery() != null || catalog == null ? request.getQuery() : catalog.getQuery();

        SearchParams params = SearchParams.builder()
                .query(query)
                .location(location)
                .radius(request.getRadius() != null ? request.getRadius() : properties.getFetch().getDefaultRadius())
                .typeFilter(type)
                .language(request.getLanguage() != null ? request.getLanguage() : properties.getFetch().getLanguage())
                .build();

        int maxCount = request.getMaxCount() != null ? request.getMaxCount() : properties.getFetch().getMaxResults();

        return assembler.getRankedPlaces(category, params, profileOf(request.getProfile()), maxCount);
    }

    private UserPreferenceProfile profileOf(ProfileRequest profile) {
        return profile == null ? UserPreferenceProfile.builder().build() : profile.toProfile();
    }

    private Coordinates locationOf(Double latitude, Double longitude) {
        if (latitude == null && longitude == null) {
            return null;
        }
        if (latitude == null || longitude == null) {
            throw new IllegalArgumentException("Latitude and longitude must be given together");
        }
        return Coordinates.of(latitude, longitude);
    }
}
