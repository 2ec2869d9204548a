package com.placerank.exception;

/**
 * A cache record could not be read or decoded.
 * Raised inside the cache store only; callers always see a miss instead.
 */
public class CacheCorruptionException extends RuntimeException {

    public CacheCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
