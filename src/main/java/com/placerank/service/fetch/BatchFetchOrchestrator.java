package com.placerank.service.fetch;

import com.placerank.exception.UpstreamException;
import com.placerank.model.CacheEntry;
import com.placerank.model.CacheKey;
import com.placerank.model.FetchJob;
import com.placerank.model.Place;
import com.placerank.model.SearchParams;
import com.placerank.provider.PlacesSearchClient;
import com.placerank.provider.UpstreamErrorClassifier;
import com.placerank.repository.CacheStore;
import com.placerank.service.canonicalization.RequestKeyBuilder;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.reactor.bulkhead.operator.BulkheadOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Fetches the raw places of one category: cache first, then a paced, batched upstream fetch.
 *
 * Flow:
 * 1. Cache lookup under the canonical search key (hit: CACHED, then DONE)
 * 2. Text search, at most {@code min(limit, maxResults)} results
 * 3. Detail lookups in groups of {@code batchSize}, concurrent within a group,
 *    one pacing delay between consecutive groups
 * 4. Store the complete list, then DONE
 *
 * Any upstream failure fails the job and nothing is written for the search key.
 * Transient failures are retried per {@link RetryPolicy}; quota failures never are.
 * Every upstream call holds a slot of the shared {@link Bulkhead} while in flight.
 */
@Slf4j
@Service
public class BatchFetchOrchestrator {

    private static final String INTERNAL_ERROR = "internal_error";

    private final CacheStore cacheStore;
    private final RequestKeyBuilder keyBuilder;
    private final PlacesSearchClient client;
    private final UpstreamErrorClassifier errorClassifier;
    private final Bulkhead upstreamBulkhead;
    private final FetchSettings settings;
    private final RetryPolicy retryPolicy;
    private final Pacer pacer;
    private final Clock clock;

    public BatchFetchOrchestrator(
            CacheStore cacheStore,
            RequestKeyBuilder keyBuilder,
            PlacesSearchClient client,
            UpstreamErrorClassifier errorClassifier,
            Bulkhead upstreamBulkhead,
            FetchSettings settings,
            RetryPolicy retryPolicy,
            Pacer pacer,
            Clock clock) {
        this.cacheStore = cacheStore;
        this.keyBuilder = keyBuilder;
        this.client = client;
        this.errorClassifier = errorClassifier;
        this.upstreamBulkhead = upstreamBulkhead;
        this.settings = settings;
        this.retryPolicy = retryPolicy;
        this.pacer = pacer;
        this.clock = clock;
    }

    /**
     * Fetch the raw places of a category.
     *
     * @param category category name, used for logging and job tracking
     * @param params   search parameters
     * @param limit    maximum number of places returned
     * @return places in upstream order, at most {@code limit}
     */
    public Mono<List<Place>> fetchCategory(String category, SearchParams params, int limit) {
        return Mono.defer(() -> execute(FetchJob.create(category, params), limit));
    }

    /**
     * Drive an existing job to DONE or FAILED.
     */
    public Mono<List<Place>> execute(FetchJob job, int limit) {
        if (limit < 1) {
            return Mono.error(new IllegalArgumentException("Limit must be at least 1: " + limit));
        }

        int cap = Math.min(limit, settings.maxResults());
        CacheKey key = keyBuilder.build(job.getParams());

        return lookup(key)
                .map(entry -> {
                    job.markCached();
                    job.markDone();
                    log.info("Cache HIT for category '{}' ({} places, age {}s)",
                            job.getCategory(), entry.payload().size(), entry.age(clock.instant()).toSeconds());
                    return truncate(entry.payload(), cap);
                })
                .switchIfEmpty(Mono.defer(() -> fetchAndStore(job, key, cap)));
    }

    public FetchSettings getSettings() {
        return settings;
    }

    private Mono<List<Place>> fetchAndStore(FetchJob job, CacheKey key, int cap) {
        job.markFetching();
        log.info("Cache MISS for category '{}' - searching upstream (max {} results)", job.getCategory(), cap);

        return callUpstream(() -> client.textSearch(job.getParams(), cap), "text search '" + job.getCategory() + "'")
                .defaultIfEmpty(List.of())
                .map(raw -> truncate(raw, cap))
                .flatMap(raw -> raw.isEmpty() ? Mono.just(raw) : enrich(raw))
                .flatMap(places -> store(key, places).thenReturn(places))
                .doOnSuccess(places -> {
                    job.markDone();
                    log.info("Fetched {} places for category '{}'", places.size(), job.getCategory());
                })
                .doOnError(error -> {
                    job.markFailed(reasonFor(error));
                    log.error("Fetch for category '{}' failed: {}", job.getCategory(), error.getMessage());
                });
    }

    /**
     * Replace each search result with its detailed record, group by group.
     */
    private Mono<List<Place>> enrich(List<Place> raw) {
        if (!settings.fetchDetails()) {
            return Mono.just(raw);
        }

        List<List<Place>> groups = partition(raw, settings.batchSize());
        log.debug("Fetching details for {} places in {} groups", raw.size(), groups.size());

        return Flux.fromIterable(groups)
                .index()
                .concatMap(indexed -> {
                    Mono<List<Place>> group = fetchGroup(indexed.getT2());
                    return indexed.getT1() == 0 ? group : pacer.pause(settings.pacing()).then(group);
                })
                .concatMapIterable(group -> group)
                .collectList();
    }

    private Mono<List<Place>> fetchGroup(List<Place> group) {
        return Flux.fromIterable(group)
                .flatMapSequential(this::fetchDetails, group.size())
                .collectList();
    }

    private Mono<Place> fetchDetails(Place summary) {
        String placeId = summary.getId();
        if (placeId == null || placeId.isBlank()) {
            return Mono.just(summary);
        }

        CacheKey detailsKey = keyBuilder.detailsKey(placeId);
        return lookup(detailsKey)
                .flatMap(entry -> Mono.justOrEmpty(entry.payload().stream().findFirst()))
                .switchIfEmpty(Mono.defer(() -> callUpstream(() -> client.placeDetails(placeId), "details " + placeId)
                        .flatMap(detailed -> store(detailsKey, List.of(detailed)).thenReturn(detailed))
                        .defaultIfEmpty(summary)));
    }

    /**
     * One upstream call: bulkheaded, timed, classified and retried.
     * The timeout starts once a slot is held; a full bulkhead surfaces as a retryable failure.
     */
    private <T> Mono<T> callUpstream(Supplier<Mono<T>> call, String operation) {
        Mono<T> attempt = Mono.defer(call);
        if (settings.timeout() != null) {
            attempt = attempt.timeout(settings.timeout());
        }

        return throughBulkhead(attempt, upstreamBulkhead)
                .onErrorMap(errorClassifier::classify)
                .retryWhen(retryPolicy.toRetry(this::isRetryable, pacer))
                .doOnError(error -> log.warn("Upstream {} failed: {}", operation, error.getMessage()));
    }

    /**
     * Subscribe to {@code call} only while holding a slot of {@code bulkhead}. The slot is
     * released on completion, error or cancellation. Waiting for a slot blocks, so the
     * subscription runs on {@code boundedElastic}.
     */
    static <T> Mono<T> throughBulkhead(Mono<T> call, Bulkhead bulkhead) {
        return call.transformDeferred(BulkheadOperator.of(bulkhead))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private boolean isRetryable(Throwable error) {
        return error instanceof UpstreamException upstream && upstream.isRetryable();
    }

    private Mono<CacheEntry> lookup(CacheKey key) {
        if (!settings.cacheEnabled()) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> cacheStore.get(key))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(Mono::justOrEmpty);
    }

    private Mono<Void> store(CacheKey key, List<Place> places) {
        if (!settings.cacheEnabled()) {
            return Mono.empty();
        }
        return Mono.fromRunnable(() -> cacheStore.put(key, places))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    private String reasonFor(Throwable error) {
        if (error instanceof UpstreamException upstream) {
            return upstream.reason();
        }
        return INTERNAL_ERROR;
    }

    private static List<Place> truncate(List<Place> places, int cap) {
        return places.size() > cap ? List.copyOf(places.subList(0, cap)) : places;
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> groups = new ArrayList<>();
        for (int start = 0; start < items.size(); start += size) {
            groups.add(List.copyOf(items.subList(start, Math.min(start + size, items.size()))));
        }
        return groups;
    }
}
