package com.placerank.model;

/**
 * Lifecycle of a {@link FetchJob}.
 */
public enum FetchState {

    /**
     * Created, not started.
     */
    PENDING,

    /**
     * Served from cache.
     */
    CACHED,

    /**
     * Waiting on upstream calls.
     */
    FETCHING,

    DONE,

    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
