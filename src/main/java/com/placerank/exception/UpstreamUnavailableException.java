package com.placerank.exception;

/**
 * Transient network or service failure of the upstream.
 */
public class UpstreamUnavailableException extends UpstreamException {

    public static final String REASON = "upstream_unavailable";

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return REASON;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
