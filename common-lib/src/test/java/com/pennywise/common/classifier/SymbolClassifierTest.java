package com.pennywise.common.classifier;

import com.pennywise.common.model.Classification;
import com.pennywise.common.model.Exchange;
import com.pennywise.common.model.MarketRegion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link SymbolClassifier}.
 */
class SymbolClassifierTest {

    // ── region rules ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("classify(symbol): region, exchange, currency")
    class RegionTests {

        @Test
        @DisplayName("PETR4 → BR / B3 / BRL, known issuer")
        void brazilianKnownIssuer() {
            Classification c = SymbolClassifier.classify("PETR4");
            assertEquals("PETR4", c.symbol());
            assertEquals(MarketRegion.BR, c.region());
            assertEquals(Exchange.B3, c.exchange());
            assertEquals("BRL", c.currency());
            assertEquals(0.9, c.confidence());
        }

        @Test
        @DisplayName("KLBN11 (unit, two digits) → BR")
        void brazilianUnit() {
            Classification c = SymbolClassifier.classify("KLBN11");
            assertEquals(MarketRegion.BR, c.region());
            assertEquals(0.9, c.confidence());
        }

        @Test
        @DisplayName("AAPL → US / NASDAQ / USD")
        void usNasdaq() {
            Classification c = SymbolClassifier.classify("AAPL");
            assertEquals(MarketRegion.US, c.region());
            assertEquals(Exchange.NASDAQ, c.exchange());
            assertEquals("USD", c.currency());
            assertEquals(0.8, c.confidence());
        }

        @Test
        @DisplayName("JPM → US / NYSE")
        void usNyse() {
            assertEquals(Exchange.NYSE, SymbolClassifier.classify("JPM").exchange());
        }

        @Test
        @DisplayName("unlisted but well-formed tickers score pattern confidence only")
        void unlistedTickers() {
            assertEquals(0.3, SymbolClassifier.classify("ABCD3").confidence());
            assertEquals(0.3, SymbolClassifier.classify("ZZZZ").confidence());
        }

        @Test
        @DisplayName("123 → UNKNOWN with base confidence")
        void digitsOnly() {
            Classification c = SymbolClassifier.classify("123");
            assertEquals(MarketRegion.UNKNOWN, c.region());
            assertEquals(Exchange.UNKNOWN, c.exchange());
            assertEquals(0.1, c.confidence());
        }

        @Test
        @DisplayName("BRK.A → UNKNOWN (dots are not part of either pattern)")
        void dottedTicker() {
            assertEquals(MarketRegion.UNKNOWN, SymbolClassifier.classify("BRK.A").region());
        }

        @Test
        @DisplayName("common English word is penalised to zero")
        void commonWord() {
            Classification c = SymbolClassifier.classify("THE");
            assertEquals(MarketRegion.US, c.region());
            assertEquals(0.0, c.confidence());
        }

        @Test
        @DisplayName("input is trimmed and upper-cased")
        void normalisesInput() {
            Classification c = SymbolClassifier.classify("  petr4 ");
            assertEquals("PETR4", c.symbol());
            assertEquals(MarketRegion.BR, c.region());
        }

        @Test
        @DisplayName("null and blank → UNKNOWN, never throws")
        void nullAndBlank() {
            assertEquals(MarketRegion.UNKNOWN, SymbolClassifier.classify(null).region());
            assertEquals(MarketRegion.UNKNOWN, SymbolClassifier.classify("   ").region());
        }

        @Test
        @DisplayName("same input always yields the same classification")
        void deterministic() {
            assertEquals(SymbolClassifier.classify("VALE3"), SymbolClassifier.classify("VALE3"));
        }
    }

    // ── text path ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("classify(symbol, text): contextual confidence")
    class TextTests {

        @Test
        @DisplayName("$ markup and market vocabulary push confidence to the cap")
        void markupAndContext() {
            assertEquals(1.0, SymbolClassifier.classify("AAPL", "what is the price of $AAPL").confidence());
        }

        @Test
        @DisplayName("each context word adds a tenth")
        void contextWords() {
            assertEquals(0.5, SymbolClassifier.classify("ZZZZ", "buy ZZZZ stock").confidence());
        }

        @Test
        @DisplayName("text never changes the region")
        void textDoesNotChangeRegion() {
            assertEquals(MarketRegion.UNKNOWN,
                SymbolClassifier.classify("123", "ticker: 123 stock price").region());
        }
    }

    // ── helpers ───────────────────────────────────────────────────────────

    @Test
    @DisplayName("classifyAll keeps input order")
    void classifyAllKeepsOrder() {
        List<Classification> all = SymbolClassifier.classifyAll(List.of("AAPL", "PETR4", "123"));
        assertEquals(List.of(MarketRegion.US, MarketRegion.BR, MarketRegion.UNKNOWN),
            all.stream().map(Classification::region).toList());
    }

    @Test
    @DisplayName("isBrazilian")
    void isBrazilian() {
        assertTrue(SymbolClassifier.isBrazilian("itub4"));
        assertFalse(SymbolClassifier.isBrazilian("MSFT"));
    }
}
