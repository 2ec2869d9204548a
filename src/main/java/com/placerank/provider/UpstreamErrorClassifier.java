package com.placerank.provider;

import com.placerank.exception.QuotaExceededException;
import com.placerank.exception.UpstreamException;
import com.placerank.exception.UpstreamUnavailableException;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;

import java.io.IOException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Maps raw upstream failures onto quota exhaustion or transient unavailability.
 *
 * Errors the client already classified pass through unchanged. Quota is recognized by whole
 * status tokens only, so ids or ports that merely contain "429" stay transient. Anything
 * unrecognized is treated as transient.
 */
@Component
public class UpstreamErrorClassifier {

    private static final Pattern QUOTA_SIGNAL = Pattern.compile(
            "\\b(?:OVER_QUERY_LIMIT|RESOURCE_EXHAUSTED|429|too many requests|rate[ _-]limit(?:ed|s)?"
                    + "|quota (?:exceeded|exhausted)|exceeded [\\w ]*quota)\\b",
            Pattern.CASE_INSENSITIVE);

    public UpstreamException classify(Throwable throwable) {
        Throwable error = Exceptions.unwrap(throwable);

        if (error instanceof UpstreamException upstream) {
            return upstream;
        }

        for (Throwable current = error; current != null; current = current.getCause()) {
            if (isQuotaSignal(current)) {
                return new QuotaExceededException("Upstream quota exhausted: " + current.getMessage(), error);
            }
            if (current.getCause() == current) {
                break;
            }
        }

        if (error instanceof BulkheadFullException) {
            return new UpstreamUnavailableException("No free upstream slot: " + error.getMessage(), error);
        }

        if (error instanceof TimeoutException || error instanceof IOException) {
            return new UpstreamUnavailableException("Upstream unreachable: " + error.getMessage(), error);
        }

        return new UpstreamUnavailableException("Upstream call failed: " + error.getMessage(), error);
    }

    public boolean isRetryable(Throwable throwable) {
        return classify(throwable).isRetryable();
    }

    private boolean isQuotaSignal(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null) {
            return false;
        }

        return QUOTA_SIGNAL.matcher(message).find();
    }
}
