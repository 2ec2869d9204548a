package com.placerank.service.fetch;

import com.placerank.config.PlacerankProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Bounded retry policy for transient upstream failures.
 *
 * @param maxRetries  retries after the first attempt
 * @param backoff     delay before the first retry
 * @param exponential double the delay on every further retry
 * @param maxBackoff  cap for exponential delays
 */
public record RetryPolicy(int maxRetries, Duration backoff, boolean exponential, Duration maxBackoff) {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public static final int DEFAULT_MAX_RETRIES = 2;

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must be zero or positive: " + backoff);
        }
        if (maxBackoff == null || maxBackoff.compareTo(backoff) < 0) {
            maxBackoff = backoff;
        }
    }

    /**
     * Same delay before every retry.
     */
    public static RetryPolicy fixed(int maxRetries, Duration backoff) {
        return new RetryPolicy(maxRetries, backoff, false, backoff);
    }

    public static RetryPolicy none() {
        return fixed(0, Duration.ZERO);
    }

    /**
     * Retries pace with the same delay used between detail groups.
     */
    public static RetryPolicy from(PlacerankProperties.FetchConfig fetch) {
        return new RetryPolicy(
                fetch.getMaxRetries(),
                fetch.getPacing(),
                fetch.isExponentialBackoff(),
                fetch.getMaxBackoff());
    }

    /**
     * Delay before the retry with the given zero-based index.
     */
    public Duration backoffFor(int retryIndex) {
        if (!exponential || backoff.isZero()) {
            return backoff;
        }
        Duration delay = backoff.multipliedBy(1L << Math.min(retryIndex, 20));
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    /**
     * Delays before each retry, in order.
     */
    public List<Duration> schedule() {
        List<Duration> delays = new ArrayList<>(maxRetries);
        for (int i = 0; i < maxRetries; i++) {
            delays.add(backoffFor(i));
        }
        return delays;
    }

    /**
     * Reactor retry spec for this policy.
     * Failures rejected by {@code retryable}, and the last failure once retries run out,
     * propagate unchanged.
     *
     * @param retryable which failures may be retried
     * @param pacer     how delays are applied
     */
    public Retry toRetry(Predicate<Throwable> retryable, Pacer pacer) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            long retryIndex = signal.totalRetries();

            if (!retryable.test(failure) || retryIndex >= maxRetries) {
                return Mono.error(failure);
            }

            Duration delay = backoffFor((int) retryIndex);
            log.warn("Retrying upstream call after {} (attempt {}/{}): {}",
                    delay, retryIndex + 1, maxRetries, failure.getMessage());
            return pacer.pause(delay).thenReturn(retryIndex);
        }));
    }
}
