package com.placerank.exception;

/**
 * Failure of a call to the external places search API.
 */
public abstract class UpstreamException extends RuntimeException {

    protected UpstreamException(String message) {
        super(message);
    }

    protected UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Machine-readable failure reason, attached to degraded categories.
     */
    public abstract String reason();

    /**
     * Whether retrying within the same orchestration pass can help.
     */
    public abstract boolean isRetryable();
}
