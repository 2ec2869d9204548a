package com.placerank.exception;

/**
 * The upstream quota is exhausted. Never retried within one orchestration pass;
 * callers back off across a longer horizon.
 */
public class QuotaExceededException extends UpstreamException {

    public static final String REASON = "quota_exceeded";

    public QuotaExceededException(String message) {
        super(message);
    }

    public QuotaExceededException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return REASON;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
