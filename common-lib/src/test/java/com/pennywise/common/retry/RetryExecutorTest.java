package com.pennywise.common.retry;

import com.pennywise.common.exception.NetworkException;
import com.pennywise.common.exception.RateLimitException;
import com.pennywise.common.exception.ValidationException;
import com.pennywise.common.model.FailureRecord;
import com.pennywise.common.model.ProviderResult;
import com.pennywise.common.support.MutableClock;
import com.pennywise.common.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class RetryExecutorTest {

    private MutableClock clock;
    private RecordingSleeper sleeper;
    private CappedLogSink sink;
    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        clock    = MutableClock.startingAt("2024-03-01T12:00:00Z");
        sleeper  = new RecordingSleeper(clock);
        sink     = new CappedLogSink();
        executor = new RetryExecutor(sink, sleeper, clock);
    }

    /** Fails with {@code error} for the first {@code failures} calls, then emits {@code value}. */
    private static Supplier<Mono<String>> failingTimes(int failures, RuntimeException error,
                                                      String value, AtomicInteger calls) {
        return () -> Mono.defer(() -> calls.incrementAndGet() <= failures
            ? Mono.error(error)
            : Mono.just(value));
    }

    // ── success paths ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("eventual success")
    class SuccessTests {

        @Test
        @DisplayName("first attempt → retryCount 0, no sleeps")
        void firstAttempt() {
            StepVerifier.create(executor.execute(() -> Mono.just("ok"), "fetch", 3, Duration.ofSeconds(1)))
                .assertNext(r -> {
                    assertTrue(r.success());
                    assertEquals("ok", r.data());
                    assertEquals(0, r.retryCount());
                    assertEquals(200, r.httpStatus());
                    assertEquals("fetch", r.source());
                })
                .verifyComplete();
            assertTrue(sleeper.getDelays().isEmpty());
        }

        @Test
        @DisplayName("third attempt succeeds → retryCount 2, delays 1s then 2s")
        void thirdAttempt() {
            AtomicInteger calls = new AtomicInteger();
            ProviderResult<String> result = executor.execute(
                failingTimes(2, new NetworkException("oplab", "timeout"), "ok", calls),
                "fetch", "oplab", RetryPolicy.of(3, Duration.ofSeconds(1))).block();

            assertTrue(result.success());
            assertEquals(2, result.retryCount());
            assertEquals("oplab", result.source());
            assertEquals(3, calls.get());
            assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.getDelays());
            assertEquals(3000, result.responseTimeMs());
            assertTrue(sink.readAll().isEmpty());
        }

        @Test
        @DisplayName("plain runtime errors are retried")
        void unknownErrorsAreRetried() {
            AtomicInteger calls = new AtomicInteger();
            ProviderResult<String> result = executor.execute(
                failingTimes(1, new IllegalStateException("socket closed"), "ok", calls),
                "fetch", RetryPolicy.of(1, Duration.ofMillis(10))).block();

            assertTrue(result.success());
            assertEquals(1, result.retryCount());
        }
    }

    // ── exhaustion ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("exhaustion")
    class ExhaustionTests {

        @Test
        @DisplayName("maxAttempts=2 → 3 calls, status 500, one failure record")
        void exhausts() {
            AtomicInteger calls = new AtomicInteger();
            ProviderResult<String> result = executor.execute(
                failingTimes(Integer.MAX_VALUE, new NetworkException("oplab", "down"), "never", calls),
                "fetch", 2, Duration.ofMillis(100)).block();

            assertFalse(result.success());
            assertNull(result.data());
            assertEquals(3, calls.get());
            assertEquals(2, result.retryCount());
            assertEquals(500, result.httpStatus());
            assertEquals("fetch failed after 3 attempts: [oplab] down", result.error());

            List<FailureRecord> records = sink.readAll();
            assertEquals(1, records.size());
            assertEquals("fetch", records.get(0).operation());
            assertEquals(3, records.get(0).attempts());
            assertEquals("[oplab] down", records.get(0).error());
            assertEquals("2024-03-01T12:00:00.300Z", records.get(0).timestamp());
        }

        @Test
        @DisplayName("failure record is appended off the calling thread")
        void sinkAppendRunsOnBoundedElastic() {
            AtomicReference<String> appendThread = new AtomicReference<>();
            LogSink threadRecordingSink = new CappedLogSink() {
                @Override
                public synchronized void append(FailureRecord record) {
                    appendThread.set(Thread.currentThread().getName());
                    super.append(record);
                }
            };
            RetryExecutor recording = new RetryExecutor(threadRecordingSink, sleeper, clock);

            ProviderResult<String> result = recording.execute(
                () -> Mono.<String>error(new NetworkException("oplab", "down")),
                "fetch", 0, Duration.ofMillis(10)).block();

            assertFalse(result.success());
            assertEquals(1, threadRecordingSink.readAll().size());
            assertTrue(appendThread.get().startsWith("boundedElastic"), appendThread.get());
        }

        @Test
        @DisplayName("backoff doubles per retry")
        void exponentialDelays() {
            executor.execute(() -> Mono.<String>error(new NetworkException("x", "e")),
                "fetch", 3, Duration.ofMillis(100)).block();

            assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400)),
                sleeper.getDelays());
        }

        @Test
        @DisplayName("maxAttempts=0 → a single call and no sleeps")
        void noRetries() {
            AtomicInteger calls = new AtomicInteger();
            ProviderResult<String> result = executor.execute(
                failingTimes(1, new NetworkException("x", "e"), "ok", calls),
                "fetch", 0, Duration.ofSeconds(1)).block();

            assertFalse(result.success());
            assertEquals(1, calls.get());
            assertEquals(0, result.retryCount());
            assertTrue(sleeper.getDelays().isEmpty());
        }

        @Test
        @DisplayName("rate-limit hint stretches the backoff")
        void rateLimitHint() {
            executor.execute(() -> Mono.<String>error(
                    new RateLimitException("alpha_vantage", "too many calls", Duration.ofSeconds(5))),
                "fetch", 1, Duration.ofSeconds(1)).block();

            assertEquals(List.of(Duration.ofSeconds(5)), sleeper.getDelays());
        }

        @Test
        @DisplayName("rate-limit hint shorter than the backoff is ignored")
        void shortRateLimitHint() {
            executor.execute(() -> Mono.<String>error(
                    new RateLimitException("alpha_vantage", "too many calls", Duration.ofMillis(10))),
                "fetch", 1, Duration.ofSeconds(1)).block();

            assertEquals(List.of(Duration.ofSeconds(1)), sleeper.getDelays());
        }
    }

    // ── non-retryable ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("non-retryable errors")
    class NonRetryableTests {

        @Test
        @DisplayName("validation error stops after one call, nothing logged to the sink")
        void validationShortCircuits() {
            AtomicInteger calls = new AtomicInteger();
            ProviderResult<String> result = executor.execute(
                failingTimes(Integer.MAX_VALUE, new ValidationException("oplab", "missing price"), "never", calls),
                "fetch", 3, Duration.ofSeconds(1)).block();

            assertFalse(result.success());
            assertEquals(1, calls.get());
            assertEquals(422, result.httpStatus());
            assertEquals(0, result.retryCount());
            assertEquals("[oplab] missing price", result.error());
            assertTrue(sink.readAll().isEmpty());
        }

        @Test
        @DisplayName("empty operation is treated as a validation failure")
        void emptyOperation() {
            ProviderResult<String> result = executor.execute(Mono::<String>empty, "fetch", 3, Duration.ofSeconds(1)).block();

            assertFalse(result.success());
            assertEquals(422, result.httpStatus());
        }
    }

    @Test
    @DisplayName("returned Mono is lazy")
    void lazy() {
        AtomicInteger calls = new AtomicInteger();
        executor.execute(failingTimes(0, new NetworkException("x", "e"), "ok", calls), "fetch", RetryPolicy.DEFAULT);
        assertEquals(0, calls.get());
    }
}
