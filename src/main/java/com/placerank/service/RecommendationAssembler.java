package com.placerank.service;

import com.placerank.config.PlacerankProperties;
import com.placerank.exception.UpstreamException;
import com.placerank.model.CategoryRecommendation;
import com.placerank.model.Coordinates;
import com.placerank.model.FetchJob;
import com.placerank.model.Place;
import com.placerank.model.RecommendationQuery;
import com.placerank.model.RecommendationResult;
import com.placerank.model.ScoredPlace;
import com.placerank.model.SearchParams;
import com.placerank.model.UserPreferenceProfile;
import com.placerank.model.dto.CacheStatistics;
import com.placerank.repository.CacheStore;
import com.placerank.service.fetch.BatchFetchOrchestrator;
import com.placerank.service.scoring.PreferenceScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Main service that orchestrates fetching, limiting and scoring per category.
 *
 * Categories of one recommendation run concurrently; a failing category degrades to an empty
 * result with its failure reason and never affects the others.
 */
@Slf4j
@Service
public class RecommendationAssembler {

    private final BatchFetchOrchestrator orchestrator;
    private final ResultLimiter resultLimiter;
    private final PreferenceScorer scorer;
    private final CacheStore cacheStore;
    private final PlacerankProperties properties;

    public RecommendationAssembler(
            BatchFetchOrchestrator orchestrator,
            ResultLimiter resultLimiter,
            PreferenceScorer scorer,
            CacheStore cacheStore,
            PlacerankProperties properties) {
        this.orchestrator = orchestrator;
        this.resultLimiter = resultLimiter;
        this.scorer = scorer;
        this.cacheStore = cacheStore;
        this.properties = properties;
    }

    /**
     * Fetch, limit and rank the places of one category.
     *
     * @param category category name
     * @param params   search parameters
     * @param profile  user preferences
     * @param maxCount maximum number of places considered
     * @return ranked places, best first
     */
    public Mono<List<ScoredPlace>> getRankedPlaces(
            String category, SearchParams params, UserPreferenceProfile profile, int maxCount) {
        return Mono.defer(() -> fetchLimited(FetchJob.create(category, params), maxCount))
                .map(places -> scorer.rank(places, profile));
    }

    /**
     * Recommend places for several categories of one destination.
     */
    public Mono<RecommendationResult> recommend(RecommendationQuery query, UserPreferenceProfile profile) {
        return Mono.defer(() -> {
            List<String> categories = query.getCategories() == null || query.getCategories().isEmpty()
                    ? properties.getRecommendation().getDefaultCategories()
                    : query.getCategories();

            // Resolve every category up front so bad input fails the request, not a category
            Map<String, SearchParams> paramsByCategory = new LinkedHashMap<>();
            for (String category : categories) {
                paramsByCategory.put(category, searchParamsFor(category, query));
            }

            log.info("Recommending {} categories for destination '{}'",
                    paramsByCategory.size(), query.getDestination());

            return Flux.fromIterable(paramsByCategory.entrySet())
                    .flatMapSequential(entry -> recommendCategory(entry.getKey(), entry.getValue(), profile))
                    .collect(LinkedHashMap<String, CategoryRecommendation>::new,
                            (byCategory, recommendation) -> byCategory.put(recommendation.getCategory(), recommendation))
                    .map(byCategory -> RecommendationResult.builder()
                            .destination(query.getDestination())
                            .generatedAt(Instant.now())
                            .categories(byCategory)
                            .build());
        });
    }

    /**
     * Search parameters of one category for a destination, from the configured catalogs.
     */
    SearchParams searchParamsFor(String category, RecommendationQuery query) {
        PlacerankProperties.CategoryConfig categoryConfig = properties.getCategories().get(category);
        if (categoryConfig == null) {
            throw new IllegalArgumentException("Unknown category: " + category);
        }

        PlacerankProperties.DestinationConfig destination = destinationFor(query.getDestination());
        Coordinates location = query.getLocation();
        if (location == null && destination != null) {
            location = Coordinates.of(destination.getLatitude(), destination.getLongitude());
        }
        if (location == null) {
            throw new IllegalArgumentException(
                    "A known destination or an explicit location is required: " + query.getDestination());
        }

        String text = query.getQuery() != null && !query.getQuery().isBlank()
                ? query.getQuery()
                : categoryConfig.getQuery();
        if (destination != null && destination.getName() != null) {
            text = text == null ? destination.getName() : text + " " + destination.getName();
        }

        PlacerankProperties.FetchConfig fetch = properties.getFetch();
        return SearchParams.builder()
                .query(text)
                .location(location)
                .radius(query.getRadius() != null ? query.getRadius() : fetch.getDefaultRadius())
                .typeFilter(categoryConfig.getType())
                .language(fetch.getLanguage())
                .build();
    }

    /**
     * Remove expired cache records.
     */
    public Mono<Integer> purgeExpiredCache() {
        return Mono.fromCallable(cacheStore::purgeExpired)
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Clear the cache.
     */
    public Mono<Integer> clearCache() {
        return Mono.fromCallable(cacheStore::clear)
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Get cache statistics.
     */
    public Mono<CacheStatistics> cacheStats() {
        return Mono.fromCallable(cacheStore::stats)
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<CategoryRecommendation> recommendCategory(
            String category, SearchParams params, UserPreferenceProfile profile) {
        int ceiling = orchestrator.getSettings().maxResults();
        int topN = properties.getRecommendation().getTopPerCategory();
        FetchJob job = FetchJob.create(category, params);

        return fetchLimited(job, ceiling)
                .map(places -> {
                    List<ScoredPlace> ranked = scorer.rank(places, profile);
                    log.info("Category '{}' ({}): {} found, {} after scoring",
                            category, job.getState(), places.size(), ranked.size());
                    return CategoryRecommendation.builder()
                            .category(category)
                            .totalFound(places.size())
                            .aiFiltered(ranked.size())
                            .places(List.copyOf(ranked.subList(0, Math.min(topN, ranked.size()))))
                            .build();
                })
                .onErrorResume(error -> {
                    String reason = failureReason(job, error);
                    log.warn("Category '{}' degraded to empty result ({}): {}", category, reason, error.getMessage());
                    return Mono.just(CategoryRecommendation.failed(category, reason));
                });
    }

    /**
     * Always fetches up to the per-category ceiling so cached payloads do not depend on
     * the caller's count, then limits.
     */
    private Mono<List<Place>> fetchLimited(FetchJob job, int maxCount) {
        return orchestrator.execute(job, orchestrator.getSettings().maxResults())
                .map(places -> resultLimiter.limit(places, maxCount));
    }

    /**
     * The reason recorded on the failed job, else derived from the error.
     */
    private static String failureReason(FetchJob job, Throwable error) {
        if (job.getFailureReason() != null) {
            return job.getFailureReason();
        }
        return error instanceof UpstreamException upstream ? upstream.reason() : "internal_error";
    }

    private PlacerankProperties.DestinationConfig destinationFor(String destination) {
        if (destination == null || destination.isBlank()) {
            return null;
        }
        return properties.getDestinations().get(destination.trim().toLowerCase(Locale.ROOT));
    }
}
