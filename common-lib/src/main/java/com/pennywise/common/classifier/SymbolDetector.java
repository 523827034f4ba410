package com.pennywise.common.classifier;

import com.pennywise.common.model.DetectedSymbol;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds ticker candidates in chat-style free text and scores them with the
 * text-aware path of {@link SymbolClassifier}.
 *
 * <p>Candidates scoring {@value #MIN_CONFIDENCE} or less are dropped; when a symbol
 * matches several patterns the highest-scoring occurrence wins. Output is ordered by
 * confidence, highest first. Keyword prefixes match in any case; the ticker itself
 * must be upper case.
 */
public final class SymbolDetector {

    static final double MIN_CONFIDENCE = 0.3;
    private static final int CONTEXT_RADIUS = 20;

    private static final List<Pattern> SYMBOL_PATTERNS = List.of(
        Pattern.compile("\\b([A-Z]{4}[0-9]{1,2})\\b"),                          // B3: PETR4, KLBN11
        Pattern.compile("\\b([A-Z]{2,5})\\b"),                                   // US: AAPL
        Pattern.compile("\\$([A-Z]{2,5})\\b"),                                   // $AAPL
        Pattern.compile("(?i:ticker):\\s*([A-Z]{2,6}[0-9]*)"),
        Pattern.compile("(?i:/analyze)\\s+([A-Z]{2,6}[0-9]*)"),
        Pattern.compile("(?iu:ação)\\s+([A-Z]{2,6}[0-9]*)"),
        Pattern.compile("(?iu:papel)\\s+([A-Z]{2,6}[0-9]*)")
    );

    private SymbolDetector() {}

    public static List<DetectedSymbol> detect(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        Map<String, DetectedSymbol> detected = new LinkedHashMap<>();
        for (Pattern pattern : SYMBOL_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String symbol = matcher.group(1).toUpperCase(Locale.ROOT);
                double confidence = SymbolClassifier.classify(symbol, text).confidence();
                if (confidence <= MIN_CONFIDENCE) {
                    continue;
                }
                DetectedSymbol existing = detected.get(symbol);
                if (existing == null || confidence > existing.confidence()) {
                    detected.put(symbol, new DetectedSymbol(
                        symbol, contextOf(text, matcher.start(1), symbol.length()), confidence));
                }
            }
        }

        List<DetectedSymbol> result = new ArrayList<>(detected.values());
        result.sort(Comparator.comparingDouble(DetectedSymbol::confidence).reversed());
        return result;
    }

    private static String contextOf(String text, int index, int length) {
        int start = Math.max(0, index - CONTEXT_RADIUS);
        int end   = Math.min(text.length(), index + length + CONTEXT_RADIUS);
        return text.substring(start, end).trim();
    }
}
