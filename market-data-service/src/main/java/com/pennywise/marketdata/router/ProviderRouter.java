package com.pennywise.marketdata.router;

import com.pennywise.common.classifier.SymbolClassifier;
import com.pennywise.common.model.MarketRegion;
import com.pennywise.common.model.ProviderResult;
import com.pennywise.common.model.Quote;
import com.pennywise.common.retry.RetryExecutor;
import com.pennywise.common.retry.RetryPolicy;
import com.pennywise.marketdata.provider.MarketDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Region-aware provider selection with ordered fallback.
 *
 * <p><strong>Routing plan:</strong>
 * <ul>
 *   <li>BR tickers: primary with the bare ticker, then the secondary with the
 *       {@value #B3_SUFFIX} suffix.</li>
 *   <li>US and unclassifiable tickers: secondary only.</li>
 * </ul>
 *
 * <p>Every provider call runs through the {@link RetryExecutor}; routes are tried in
 * order until one succeeds. The returned result names the provider that produced the
 * data. When every route fails, the last failure is returned. Nothing here throws.
 */
public class ProviderRouter {

    private static final Logger log = LoggerFactory.getLogger(ProviderRouter.class);

    static final String B3_SUFFIX = ".SA";

    private final MarketDataProvider primary;
    private final MarketDataProvider secondary;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy policy;

    public ProviderRouter(MarketDataProvider primary, MarketDataProvider secondary,
                          RetryExecutor retryExecutor, RetryPolicy policy) {
        this.primary       = primary;
        this.secondary     = secondary;
        this.retryExecutor = retryExecutor;
        this.policy        = policy;
    }

    /** Ordered routing plan for {@code symbol} (already trimmed and upper-cased). */
    public List<ProviderRoute> routesFor(String symbol) {
        if (SymbolClassifier.classify(symbol).region() == MarketRegion.BR) {
            return List.of(
                new ProviderRoute(primary, symbol),
                new ProviderRoute(secondary, symbol + B3_SUFFIX)
            );
        }
        return List.of(new ProviderRoute(secondary, symbol));
    }

    public Mono<ProviderResult<Quote>> getQuote(String symbol) {
        String normalized = normalize(symbol);
        return this.<Quote>tryRoutes(routesFor(normalized), 0, "getQuote",
                                     route -> route.provider().fetchQuote(route.providerSymbol()),
                                     result -> result.success())
            .map(result -> result.success() ? reportedAs(result, normalized) : result);
    }

    /**
     * Asks each route whether it knows the ticker. The first positive answer wins;
     * otherwise the last route's answer (or failure) is returned.
     */
    public Mono<ProviderResult<Boolean>> symbolExists(String symbol) {
        String normalized = normalize(symbol);
        return this.<Boolean>tryRoutes(routesFor(normalized), 0, "symbolExists",
                                       route -> route.provider().symbolExists(route.providerSymbol()),
                                       result -> result.success() && Boolean.TRUE.equals(result.data()));
    }

    public MarketDataProvider getPrimary() {
        return primary;
    }

    public MarketDataProvider getSecondary() {
        return secondary;
    }

    // ── private ───────────────────────────────────────────────────────────────

    private <T> Mono<ProviderResult<T>> tryRoutes(List<ProviderRoute> routes, int index, String operation,
                                                  Function<ProviderRoute, Mono<T>> call,
                                                  Predicate<ProviderResult<T>> accepted) {
        ProviderRoute route = routes.get(index);
        String name = route.source() + "." + operation + "(" + route.providerSymbol() + ")";

        return retryExecutor.execute(() -> call.apply(route), name, route.source(), policy)
            .flatMap(result -> {
                if (accepted.test(result)) {
                    return Mono.just(result);
                }
                if (index == routes.size() - 1) {
                    log.warn("ROUTE_EXHAUSTED operation={} routes={} lastSource={} error={}",
                             operation, routes.size(), route.source(), result.error());
                    return Mono.just(result);
                }
                ProviderRoute next = routes.get(index + 1);
                log.warn("PROVIDER_FALLBACK operation={} from={} to={} symbol={} error={}",
                         operation, route.source(), next.source(), next.providerSymbol(), result.error());
                return tryRoutes(routes, index + 1, operation, call, accepted);
            });
    }

    private static ProviderResult<Quote> reportedAs(ProviderResult<Quote> result, String symbol) {
        return ProviderResult.success(result.data().withSymbol(symbol), result.source(),
                                      result.responseTimeMs(), result.retryCount());
    }

    private static String normalize(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
    }
}
