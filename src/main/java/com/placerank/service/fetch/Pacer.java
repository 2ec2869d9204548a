package com.placerank.service.fetch;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Delay inserted between upstream calls.
 */
@FunctionalInterface
public interface Pacer {

    Mono<Void> pause(Duration delay);

    /**
     * Non-blocking delay on the parallel scheduler.
     */
    static Pacer reactorDelay() {
        return delay -> delay.isZero() ? Mono.empty() : Mono.delay(delay).then();
    }
}
