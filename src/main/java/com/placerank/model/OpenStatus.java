package com.placerank.model;

/**
 * Opening status reported by the upstream for a place.
 */
public enum OpenStatus {
    OPEN,
    CLOSED,
    UNKNOWN
}
