package com.pennywise.common.retry;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Non-blocking wait used between retries and between batch chunks. Injected so tests
 * can record delays instead of spending real time.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper REACTOR = duration -> duration.isZero() || duration.isNegative()
        ? Mono.empty()
        : Mono.delay(duration).then();

    Mono<Void> sleep(Duration duration);
}
