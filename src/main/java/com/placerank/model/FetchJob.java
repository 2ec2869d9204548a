package com.placerank.model;

import lombok.Getter;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * One category fetch. Created by the recommendation assembler, driven by the orchestrator.
 */
@Getter
public class FetchJob {

    private static final Map<FetchState, Set<FetchState>> TRANSITIONS = Map.of(
            FetchState.PENDING, EnumSet.of(FetchState.CACHED, FetchState.FETCHING, FetchState.FAILED),
            FetchState.CACHED, EnumSet.of(FetchState.DONE, FetchState.FAILED),
            FetchState.FETCHING, EnumSet.of(FetchState.DONE, FetchState.FAILED),
            FetchState.DONE, EnumSet.noneOf(FetchState.class),
            FetchState.FAILED, EnumSet.noneOf(FetchState.class)
    );

    private final String category;
    private final SearchParams params;
    private final Instant createdAt;

    private volatile FetchState state = FetchState.PENDING;
    private volatile String failureReason;

    private FetchJob(String category, SearchParams params) {
        this.category = category;
        this.params = params;
        this.createdAt = Instant.now();
    }

    public static FetchJob create(String category, SearchParams params) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Category is required");
        }
        if (params == null) {
            throw new IllegalArgumentException("Search params are required");
        }
        return new FetchJob(category, params);
    }

    public void markCached() {
        transition(FetchState.CACHED);
    }

    public void markFetching() {
        transition(FetchState.FETCHING);
    }

    public void markDone() {
        transition(FetchState.DONE);
    }

    public void markFailed(String reason) {
        transition(FetchState.FAILED);
        this.failureReason = reason;
    }

    private synchronized void transition(FetchState next) {
        if (!TRANSITIONS.get(state).contains(next)) {
            throw new IllegalStateException(
                    "Fetch job for '" + category + "' cannot move from " + state + " to " + next);
        }
        state = next;
    }
}
