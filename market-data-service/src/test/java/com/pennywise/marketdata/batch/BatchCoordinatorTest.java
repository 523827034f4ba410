package com.pennywise.marketdata.batch;

import com.pennywise.common.cache.CacheConfig;
import com.pennywise.common.cache.CacheKeys;
import com.pennywise.common.cache.CacheStore;
import com.pennywise.common.model.ProviderResult;
import com.pennywise.common.model.Quote;
import com.pennywise.marketdata.router.ProviderRouter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static com.pennywise.marketdata.support.Quotes.quote;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchCoordinatorTest {

    @Mock
    private ProviderRouter router;

    private final List<Duration> delays = new CopyOnWriteArrayList<>();
    private CacheStore<Quote> cache;
    private BatchCoordinator coordinator;

    @BeforeEach
    void setUp() {
        cache = new CacheStore<>("quote", CacheConfig.defaults().withCleanupInterval(Duration.ZERO));
        coordinator = new BatchCoordinator(cache, router, d -> Mono.fromRunnable(() -> delays.add(d)),
                                           2, Duration.ofMillis(100), Duration.ofMinutes(5));
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    /** Every symbol resolves except {@code BAD}. */
    private void stubRouter() {
        when(router.getQuote(anyString())).thenAnswer(invocation -> {
            String symbol = invocation.getArgument(0);
            return Mono.just("BAD".equals(symbol)
                ? ProviderResult.<Quote>failure("BAD failed after 4 attempts", "alpha_vantage", 500, 5, 3)
                : ProviderResult.success(quote(symbol, "alpha_vantage"), "alpha_vantage", 5, 0));
        });
    }

    @Test
    @DisplayName("input order kept, duplicates fetched once, chunks separated by the delay")
    void orderAndDedup() {
        stubRouter();

        Map<String, Quote> result = coordinator.getMany(List.of("aapl", "MSFT", "AAPL", "PETR4")).block();

        assertEquals(List.of("AAPL", "MSFT", "PETR4"), new ArrayList<>(result.keySet()));
        verify(router, times(1)).getQuote("AAPL");
        // 3 misses in chunks of 2 → one pause
        assertEquals(List.of(Duration.ofMillis(100)), delays);
    }

    @Test
    @DisplayName("symbols in one chunk are fetched concurrently; result follows input order")
    void chunkFetchedConcurrently() {
        List<String> events = new CopyOnWriteArrayList<>();
        Sinks.One<ProviderResult<Quote>> slow = Sinks.one();
        when(router.getQuote("PETR4")).thenReturn(slow.asMono()
            .doOnSubscribe(s -> events.add("subscribe:PETR4"))
            .doOnSuccess(r -> events.add("complete:PETR4")));
        when(router.getQuote("AAPL")).thenReturn(Mono.just(ProviderResult.success(quote("AAPL", "alpha_vantage"), "alpha_vantage", 5, 0))
            .doOnSubscribe(s -> events.add("subscribe:AAPL"))
            .doOnSuccess(r -> events.add("complete:AAPL")));

        AtomicReference<Map<String, Quote>> result = new AtomicReference<>();
        coordinator.getMany(List.of("PETR4", "AAPL")).subscribe(result::set);

        // PETR4 is still pending while AAPL has already been fetched
        assertEquals(List.of("subscribe:PETR4", "subscribe:AAPL", "complete:AAPL"), events);
        assertNull(result.get());

        slow.tryEmitValue(ProviderResult.success(quote("PETR4", "oplab"), "oplab", 40, 0));

        assertEquals("complete:PETR4", events.get(events.size() - 1));
        assertEquals(List.of("PETR4", "AAPL"), new ArrayList<>(result.get().keySet()));
        assertEquals("oplab", result.get().get("PETR4").source());
        assertTrue(delays.isEmpty());
    }

    @Test
    @DisplayName("failed symbols are omitted without aborting the batch")
    void failuresOmitted() {
        stubRouter();

        Map<String, Quote> result = coordinator.getMany(List.of("AAPL", "BAD", "MSFT")).block();

        assertEquals(List.of("AAPL", "MSFT"), new ArrayList<>(result.keySet()));
        assertFalse(cache.has(CacheKeys.quote("BAD")));
    }

    @Test
    @DisplayName("cached symbols skip the router; fetched ones are written back")
    void usesAndFillsCache() {
        stubRouter();
        cache.set(CacheKeys.quote("AAPL"), quote("AAPL", "oplab"));

        Map<String, Quote> result = coordinator.getMany(List.of("AAPL", "MSFT")).block();

        assertEquals("oplab", result.get("AAPL").source());
        assertEquals("alpha_vantage", result.get("MSFT").source());
        verify(router, never()).getQuote("AAPL");
        assertTrue(cache.has(CacheKeys.quote("MSFT")));
        assertTrue(delays.isEmpty());
    }

    @Test
    @DisplayName("all cached → router untouched")
    void allCached() {
        cache.set(CacheKeys.quote("AAPL"), quote("AAPL", "oplab"));

        Map<String, Quote> result = coordinator.getMany(List.of("AAPL")).block();

        assertEquals(1, result.size());
        verifyNoInteractions(router);
    }

    @Test
    @DisplayName("empty and blank input → empty map")
    void emptyInput() {
        assertTrue(coordinator.getMany(List.of()).block().isEmpty());
        assertTrue(coordinator.getMany(Arrays.asList(" ", null)).block().isEmpty());
        verifyNoInteractions(router);
    }

    @Test
    @DisplayName("partition keeps order and the remainder")
    void partition() {
        assertEquals(List.of(List.of(1, 2), List.of(3, 4), List.of(5)),
            BatchCoordinator.partition(List.of(1, 2, 3, 4, 5), 2));
    }

    @Test
    @DisplayName("batch size must be positive")
    void invalidBatchSize() {
        assertThrows(IllegalArgumentException.class, () -> new BatchCoordinator(
            cache, router, d -> Mono.empty(), 0, Duration.ZERO, Duration.ofMinutes(5)));
    }
}
