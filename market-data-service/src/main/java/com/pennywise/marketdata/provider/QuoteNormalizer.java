package com.pennywise.marketdata.provider;

import com.pennywise.common.exception.ValidationException;
import com.pennywise.common.model.Quote;
import com.pennywise.marketdata.model.AlphaVantageGlobalQuoteResponse.GlobalQuote;
import com.pennywise.marketdata.model.OplabStockResponse;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Locale;

/**
 * Converts provider payloads into the canonical {@link Quote}.
 *
 * <p>Rules shared by every provider:
 * <ul>
 *   <li>A missing or unparseable price is a {@link ValidationException}.</li>
 *   <li>Open, high, low and previous close default to the price.</li>
 *   <li>Volume and change default to zero; change percent is derived from change and
 *       previous close when the provider does not send it.</li>
 *   <li>The quote carries the symbol the caller asked for, upper-cased.</li>
 * </ul>
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class QuoteNormalizer {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int PERCENT_SCALE = 4;

    private QuoteNormalizer() {}

    public static Quote fromOplab(String symbol, OplabStockResponse body, Instant now) {
        OplabStockResponse.Market market = body != null ? body.market() : null;
        if (market == null || market.close() == null) {
            throw new ValidationException(OplabProvider.ID, "missing price for " + symbol);
        }

        BigDecimal price    = market.close();
        BigDecimal previous = orDefault(market.previousClose(), price);
        BigDecimal change   = price.subtract(previous);
        BigDecimal percent  = market.variation() != null ? market.variation() : percentOf(change, previous);

        return new Quote(
            canonical(symbol),
            price,
            change,
            percent,
            market.volume() != null ? market.volume().longValue() : 0L,
            orDefault(market.open(), price),
            orDefault(market.high(), price),
            orDefault(market.low(), price),
            previous,
            now.toString(),
            OplabProvider.ID
        );
    }

    public static Quote fromAlphaVantage(String symbol, GlobalQuote quote, Instant now) {
        if (quote == null || quote.price() == null || quote.price().isBlank()) {
            throw new ValidationException(AlphaVantageProvider.ID, "missing price for " + symbol);
        }
        BigDecimal price = decimal(quote.price());
        if (price == null) {
            throw new ValidationException(AlphaVantageProvider.ID,
                "unparseable price '" + quote.price() + "' for " + symbol);
        }

        BigDecimal previous = orDefault(decimal(quote.previousClose()), price);
        BigDecimal change   = orDefault(decimal(quote.change()), BigDecimal.ZERO);
        BigDecimal percent  = decimal(stripPercent(quote.changePercent()));

        return new Quote(
            canonical(symbol),
            price,
            change,
            percent != null ? percent : percentOf(change, previous),
            volume(quote.volume()),
            orDefault(decimal(quote.open()), price),
            orDefault(decimal(quote.high()), price),
            orDefault(decimal(quote.low()), price),
            previous,
            now.toString(),
            AlphaVantageProvider.ID
        );
    }

    // ── helpers ────────────────────────────────────────────────────────────

    static String canonical(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
    }

    static BigDecimal percentOf(BigDecimal change, BigDecimal base) {
        if (base.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return change.multiply(HUNDRED).divide(base, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal orDefault(BigDecimal value, BigDecimal fallback) {
        return value != null ? value : fallback;
    }

    private static BigDecimal decimal(String raw) {
        if (isBlank(raw)) {
            return null;
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static long volume(String raw) {
        BigDecimal parsed = decimal(raw);
        return parsed != null ? parsed.longValue() : 0L;
    }

    private static String stripPercent(String raw) {
        return raw != null && raw.endsWith("%") ? raw.substring(0, raw.length() - 1) : raw;
    }

    private static boolean isBlank(String raw) {
        return raw == null || raw.isBlank();
    }
}
