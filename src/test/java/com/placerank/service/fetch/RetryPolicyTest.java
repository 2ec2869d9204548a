package com.placerank.service.fetch;

import com.placerank.exception.QuotaExceededException;
import com.placerank.exception.UpstreamException;
import com.placerank.exception.UpstreamUnavailableException;
import com.placerank.support.RecordingPacer;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RetryPolicy.
 */
class RetryPolicyTest {

    private static boolean retryable(Throwable error) {
        return error instanceof UpstreamException upstream && upstream.isRetryable();
    }

    @Test
    void testFixedSchedule() {
        RetryPolicy policy = RetryPolicy.fixed(2, Duration.ofMillis(100));

        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(100)), policy.schedule());
    }

    @Test
    void testExponentialScheduleIsCapped() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100), true, Duration.ofMillis(500));

        assertEquals(List.of(
                Duration.ofMillis(100),
                Duration.ofMillis(200),
                Duration.ofMillis(400),
                Duration.ofMillis(500),
                Duration.ofMillis(500)), policy.schedule());
    }

    @Test
    void testNoRetries() {
        assertTrue(RetryPolicy.none().schedule().isEmpty());
    }

    @Test
    void testRejectsNegativeRetries() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.fixed(-1, Duration.ZERO));
    }

    @Test
    void testTransientFailureRetriedThenPropagated() {
        RecordingPacer pacer = new RecordingPacer();
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> call = Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(new UpstreamUnavailableException("connection reset"));
        });

        StepVerifier.create(call.retryWhen(RetryPolicy.fixed(2, Duration.ofMillis(100))
                        .toRetry(RetryPolicyTest::retryable, pacer)))
                .expectError(UpstreamUnavailableException.class)
                .verify(Duration.ofSeconds(5));

        assertEquals(3, attempts.get());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(100)), pacer.pauses());
    }

    @Test
    void testRecoversAfterTransientFailure() {
        RecordingPacer pacer = new RecordingPacer();
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> call = Mono.defer(() -> attempts.incrementAndGet() == 1
                ? Mono.error(new UpstreamUnavailableException("timeout"))
                : Mono.just("ok"));

        StepVerifier.create(call.retryWhen(RetryPolicy.fixed(2, Duration.ofMillis(50))
                        .toRetry(RetryPolicyTest::retryable, pacer)))
                .expectNext("ok")
                .verifyComplete();

        assertEquals(2, attempts.get());
        assertEquals(1, pacer.pauses().size());
    }

    @Test
    void testQuotaFailureNeverRetried() {
        RecordingPacer pacer = new RecordingPacer();
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> call = Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(new QuotaExceededException("OVER_QUERY_LIMIT"));
        });

        StepVerifier.create(call.retryWhen(RetryPolicy.fixed(2, Duration.ofMillis(100))
                        .toRetry(RetryPolicyTest::retryable, pacer)))
                .expectError(QuotaExceededException.class)
                .verify(Duration.ofSeconds(5));

        assertEquals(1, attempts.get());
        assertTrue(pacer.pauses().isEmpty());
    }
}
