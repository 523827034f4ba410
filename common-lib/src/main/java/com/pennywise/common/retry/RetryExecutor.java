package com.pennywise.common.retry;

import com.pennywise.common.exception.MarketDataException;
import com.pennywise.common.exception.RateLimitException;
import com.pennywise.common.exception.ValidationException;
import com.pennywise.common.model.FailureRecord;
import com.pennywise.common.model.ProviderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Wraps a flaky asynchronous call with bounded retries and exponential backoff and
 * always answers with a {@link ProviderResult} instead of an error signal.
 *
 * <p><strong>Flow per call:</strong>
 * <ol>
 *   <li>Subscribe to the operation (attempt 1).</li>
 *   <li>On error: log the attempt; stop immediately if the error is not retryable
 *       ({@link ValidationException} and friends), otherwise wait
 *       {@code baseDelay * 2^(k-1)} through the {@link Sleeper} and try again. A
 *       {@link RateLimitException} carrying a suggested wait stretches that delay.</li>
 *   <li>After {@code maxAttempts} retries the failure is logged at ERROR, appended to
 *       the {@link LogSink} and returned with HTTP-status 500.</li>
 * </ol>
 *
 * <p>The backoff is a {@code Mono} suspension. The final {@link LogSink} append runs on
 * {@link Schedulers#boundedElastic()} because sinks may do file I/O. Cancelling the returned
 * {@code Mono} is not required to stop anything: callers may simply drop it.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    static final int EXHAUSTED_STATUS = 500;
    static final int VALIDATION_STATUS = 422;

    private final LogSink logSink;
    private final Sleeper sleeper;
    private final Clock   clock;

    public RetryExecutor(LogSink logSink) {
        this(logSink, Sleeper.REACTOR, Clock.systemUTC());
    }

    public RetryExecutor(LogSink logSink, Sleeper sleeper, Clock clock) {
        this.logSink = logSink;
        this.sleeper = sleeper;
        this.clock   = clock;
    }

    public <T> Mono<ProviderResult<T>> execute(Supplier<Mono<T>> operation, String name,
                                               int maxAttempts, Duration baseDelay) {
        return execute(operation, name, name, RetryPolicy.of(maxAttempts, baseDelay));
    }

    public <T> Mono<ProviderResult<T>> execute(Supplier<Mono<T>> operation, String name, RetryPolicy policy) {
        return execute(operation, name, name, policy);
    }

    /**
     * @param operation produces a fresh {@code Mono} per attempt
     * @param name      operation name used in logs and failure records
     * @param source    attributed as {@link ProviderResult#source()}
     * @param policy    attempts and base delay
     */
    public <T> Mono<ProviderResult<T>> execute(Supplier<Mono<T>> operation, String name,
                                               String source, RetryPolicy policy) {
        return Mono.defer(() -> attempt(operation, name, source, policy, 1, clock.instant()));
    }

    public LogSink getLogSink() {
        return logSink;
    }

    // ── attempt loop ──────────────────────────────────────────────────────────

    private <T> Mono<ProviderResult<T>> attempt(Supplier<Mono<T>> operation, String name, String source,
                                                RetryPolicy policy, int attempt, Instant startedAt) {
        return Mono.defer(operation)
            .switchIfEmpty(Mono.error(() -> new ValidationException(source, "operation completed without a value")))
            .map(data -> {
                long elapsed = elapsedMs(startedAt);
                log.debug("RETRY_SUCCESS operation={} attempt={} responseTimeMs={}", name, attempt, elapsed);
                return ProviderResult.success(data, source, elapsed, attempt - 1);
            })
            .onErrorResume(e -> {
                log.warn("RETRY_ATTEMPT_FAILED operation={} attempt={}/{} error={}",
                         name, attempt, policy.totalAttempts(), e.getMessage());

                if (!isRetryable(e)) {
                    return Mono.just(ProviderResult.<T>failure(
                        e.getMessage(), source, VALIDATION_STATUS, elapsedMs(startedAt), attempt - 1));
                }
                if (attempt > policy.maxAttempts()) {
                    // the sink may write a file; keep it off the event loop
                    return Mono.fromCallable(() -> this.<T>exhausted(name, source, policy, e, startedAt))
                        .subscribeOn(Schedulers.boundedElastic());
                }

                Duration delay = nextDelay(policy, attempt, e);
                log.info("Retrying. operation={} retry={} delayMs={}", name, attempt, delay.toMillis());
                return sleeper.sleep(delay)
                    .then(Mono.defer(() -> attempt(operation, name, source, policy, attempt + 1, startedAt)));
            });
    }

    private <T> ProviderResult<T> exhausted(String name, String source, RetryPolicy policy,
                                            Throwable lastError, Instant startedAt) {
        int attempts = policy.totalAttempts();
        String message = name + " failed after " + attempts + " attempts: " + lastError.getMessage();
        log.error("RETRY_EXHAUSTED operation={} attempts={} error={}", name, attempts, lastError.getMessage());

        logSink.append(new FailureRecord(name, String.valueOf(lastError.getMessage()), attempts,
                                         clock.instant().toString()));

        return ProviderResult.failure(message, source, EXHAUSTED_STATUS, elapsedMs(startedAt), policy.maxAttempts());
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private static boolean isRetryable(Throwable e) {
        if (e instanceof MarketDataException mde) {
            return mde.isRetryable();
        }
        return true;
    }

    private static Duration nextDelay(RetryPolicy policy, int retry, Throwable e) {
        Duration backoff = policy.delayBefore(retry);
        if (e instanceof RateLimitException rle && rle.getRetryAfter().isPresent()) {
            Duration suggested = rle.getRetryAfter().get();
            return suggested.compareTo(backoff) > 0 ? suggested : backoff;
        }
        return backoff;
    }

    private long elapsedMs(Instant startedAt) {
        return Duration.between(startedAt, clock.instant()).toMillis();
    }
}
