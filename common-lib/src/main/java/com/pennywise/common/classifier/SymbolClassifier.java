package com.pennywise.common.classifier;

import com.pennywise.common.model.Classification;
import com.pennywise.common.model.Exchange;
import com.pennywise.common.model.MarketRegion;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pure stateless classifier that maps a ticker string to a {@link Classification}.
 *
 * <p>Region rules (evaluated in priority order, on the trimmed upper-case symbol):
 * <ol>
 *   <li>{@code ^[A-Z]{4}[0-9]{1,2}$} → {@link MarketRegion#BR} (B3, BRL)</li>
 *   <li>{@code ^[A-Z]{1,5}$}         → {@link MarketRegion#US} (NASDAQ/NYSE, USD)</li>
 *   <li>otherwise                    → {@link MarketRegion#UNKNOWN}</li>
 * </ol>
 *
 * <p>Confidence starts at {@value #BASE_CONFIDENCE}, gains {@value #PATTERN_BOOST} for a
 * region pattern match, is boosted by the known-issuer lists, penalised for common
 * short English words and, when a surrounding text is supplied, boosted by market
 * vocabulary and explicit ticker markup. The result is clamped to [0, 1] and rounded
 * to two decimals.
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class SymbolClassifier {

    static final double BASE_CONFIDENCE = 0.1;
    static final double PATTERN_BOOST = 0.2;
    static final double KNOWN_BR_BOOST = 0.6;
    static final double KNOWN_US_BOOST = 0.5;
    static final double COMMON_WORD_PENALTY = 0.4;
    static final double CONTEXT_WORD_BOOST = 0.1;
    static final double MARKUP_BOOST = 0.3;

    private static final Pattern BR_PATTERN = Pattern.compile("^[A-Z]{4}[0-9]{1,2}$");
    private static final Pattern US_PATTERN = Pattern.compile("^[A-Z]{1,5}$");

    private static final Set<String> KNOWN_BR_ISSUERS = Set.of(
        "PETR3", "PETR4", "VALE3", "ITUB3", "ITUB4", "BBDC3", "BBDC4", "ABEV3",
        "B3SA3", "RENT3", "LREN3", "MGLU3", "VIVT3", "JBSS3", "WEGE3", "SUZB3",
        "RAIL3", "CCRO3", "GGBR4", "USIM5", "GOAU4", "CMIG4", "BBSE3", "SANB11",
        "ITSA4", "BEEF3", "MRFG3", "RADL3", "POMO4", "FLRY3", "QUAL3", "HAPV3",
        "KLBN11", "TIMS3", "GOLL4", "AZUL4", "CIEL3", "PSSA3", "MULT3", "ALPA4",
        "YDUQ3", "COGN3", "VBBR3", "IRBR3", "EMBR3", "EQTL3", "SBSP3", "TAEE11",
        "EGIE3", "CPFE3", "CVCB3", "PETZ3", "NTCO3", "LWSA3", "RRRP3", "CSAN3",
        "CSNA3", "CYRE3", "ELET3", "ELET6", "PCAR3", "SMTO3", "TOTS3", "UGPA3"
    );

    private static final Set<String> KNOWN_US_ISSUERS = Set.of(
        "AAPL", "MSFT", "GOOGL", "GOOG", "AMZN", "TSLA", "META", "NVDA", "NFLX",
        "ADBE", "CRM", "ORCL", "INTC", "AMD", "UBER", "PYPL", "SHOP", "PLTR",
        "SNOW", "COIN", "DDOG", "CRWD", "ZM", "MDB", "TEAM", "COST", "AVGO",
        "CSCO", "JPM", "BAC", "WFC", "GS", "MS", "C", "KO", "PEP", "JNJ", "PG",
        "UNH", "V", "MA", "DIS", "HD", "MCD", "WMT", "CVS", "PFE", "ABBV", "TMO",
        "ABT", "LLY", "MRK", "BMY", "NKE", "CVX", "VZ", "ACN", "DHR"
    );

    private static final Set<String> NYSE_LISTED = Set.of(
        "JPM", "BAC", "WFC", "GS", "MS", "C", "KO", "PEP", "JNJ", "PG", "UNH", "V",
        "MA", "DIS", "HD", "MCD", "WMT", "CVS", "PFE", "ABBV", "TMO", "ABT", "LLY",
        "MRK", "BMY", "NKE", "CVX", "VZ", "ACN", "DHR", "UBER", "SHOP", "PLTR",
        "SNOW", "CRM", "ORCL"
    );

    private static final Set<String> COMMON_WORDS = Set.of(
        "THE", "AND", "FOR", "ARE", "BUT", "NOT", "YOU", "ALL", "CAN", "HER",
        "WAS", "ONE", "OUR", "HAD"
    );

    private static final List<String> CONTEXT_WORDS = List.of(
        "ação", "papel", "stock", "ticker", "cotação", "preço", "price",
        "comprar", "vender", "buy", "sell", "análise", "analysis",
        "empresa", "company", "mercado", "market", "bolsa", "exchange"
    );

    private SymbolClassifier() {}

    /**
     * Classify a bare ticker.
     *
     * @param symbol raw ticker; {@code null} or blank yields {@link MarketRegion#UNKNOWN}
     * @return classification with confidence in [0, 1]
     */
    public static Classification classify(String symbol) {
        return classify(symbol, null);
    }

    /**
     * Classify a ticker found inside a piece of free text. The text only affects
     * confidence, never the region.
     *
     * @param symbol raw ticker
     * @param text   surrounding message, may be {@code null}
     */
    public static Classification classify(String symbol, String text) {
        String normalized = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);

        MarketRegion region = regionOf(normalized);
        double confidence = BASE_CONFIDENCE;

        // ── pattern and issuer lists ───────────────────────────────────────
        if (region != MarketRegion.UNKNOWN) {
            confidence += PATTERN_BOOST;
        }
        if (KNOWN_BR_ISSUERS.contains(normalized)) {
            confidence += KNOWN_BR_BOOST;
        } else if (KNOWN_US_ISSUERS.contains(normalized)) {
            confidence += KNOWN_US_BOOST;
        }
        if (COMMON_WORDS.contains(normalized)) {
            confidence -= COMMON_WORD_PENALTY;
        }

        // ── contextual hints (text-detection path only) ────────────────────
        if (text != null && !text.isBlank() && !normalized.isEmpty()) {
            confidence += contextBoost(normalized, text);
        }

        return new Classification(
            normalized,
            region,
            exchangeOf(normalized, region),
            region == MarketRegion.BR ? "BRL" : "USD",
            clamp(confidence)
        );
    }

    public static List<Classification> classifyAll(List<String> symbols) {
        return symbols.stream().map(SymbolClassifier::classify).toList();
    }

    public static boolean isBrazilian(String symbol) {
        return classify(symbol).region() == MarketRegion.BR;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static MarketRegion regionOf(String symbol) {
        if (BR_PATTERN.matcher(symbol).matches()) {
            return MarketRegion.BR;
        }
        if (US_PATTERN.matcher(symbol).matches()) {
            return MarketRegion.US;
        }
        return MarketRegion.UNKNOWN;
    }

    private static Exchange exchangeOf(String symbol, MarketRegion region) {
        return switch (region) {
            case BR      -> Exchange.B3;
            case US      -> NYSE_LISTED.contains(symbol) ? Exchange.NYSE : Exchange.NASDAQ;
            case UNKNOWN -> Exchange.UNKNOWN;
        };
    }

    private static double contextBoost(String symbol, String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        double boost = 0.0;
        for (String word : CONTEXT_WORDS) {
            if (lower.contains(word)) {
                boost += CONTEXT_WORD_BOOST;
            }
        }
        if (text.contains("$" + symbol) || text.contains("ticker: " + symbol)) {
            boost += MARKUP_BOOST;
        }
        return boost;
    }

    /** Clamps to [0, 1] and rounds to two decimals so that scores compare exactly. */
    private static double clamp(double value) {
        double bounded = Math.max(0.0, Math.min(1.0, value));
        return Math.round(bounded * 100.0) / 100.0;
    }
}
