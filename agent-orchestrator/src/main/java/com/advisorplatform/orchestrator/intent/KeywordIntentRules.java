package com.advisorplatform.orchestrator.intent;

import com.advisorplatform.common.model.Intent;
import com.advisorplatform.common.model.IntentClassification;
import com.advisorplatform.common.model.SpecialistTag;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic intent classification used when no small model is live, or when its
 * output cannot be validated.
 */
public final class KeywordIntentRules {

    private static final Pattern DOLLAR_TICKER = Pattern.compile("\\$([A-Za-z]{1,5}(?:\\.[A-Za-z]{1,2})?)\\b");
    private static final Pattern BARE_TICKER   = Pattern.compile("\\b([A-Z]{2,5}(?:\\.[A-Z]{1,2})?)\\b");

    // upper-case words that are not tickers
    private static final Set<String> NOT_TICKERS = Set.of(
        "I", "A", "AN", "THE", "AND", "OR", "BUY", "SELL", "HOLD", "ETF", "ETFS", "USD", "GBP", "EUR",
        "IPO", "CEO", "CFO", "AI", "US", "UK", "EU", "ISA", "SIPP", "IRA", "RSI", "MACD", "SMA", "EMA",
        "P", "E", "PE", "EPS", "GDP", "CPI", "FED", "OK", "IS", "IT", "MY", "ME", "DO", "TO", "OF", "IN",
        "ON", "AT", "BE", "NOW", "WHAT", "WHY", "HOW", "SHOULD", "CAN");

    private static final List<String> PRICE_WORDS       = List.of("price", "quote", "trading at", "how much is");
    private static final List<String> POSITION_WORDS    = List.of("my portfolio", "my position", "my holdings",
                                                                  "i own", "i hold", "rebalance", "should i sell");
    private static final List<String> EDUCATIONAL_WORDS = List.of("what is", "what are", "explain", "how does",
                                                                  "how do", "define", "difference between");

    private KeywordIntentRules() { /* utility class */ }

    public static IntentClassification classify(String query, String tickerHint) {
        String lower = query == null ? "" : query.toLowerCase(Locale.ROOT);
        String ticker = hasText(tickerHint) ? tickerHint.trim().toUpperCase(Locale.ROOT)
                                            : extractTicker(query).orElse(null);

        Intent intent;
        String reason;
        if (containsAny(lower, POSITION_WORDS)) {
            intent = Intent.POSITION_REVIEW;
            reason = "keyword: position review";
        } else if (containsAny(lower, PRICE_WORDS) && !lower.contains("analy")) {
            intent = Intent.PRICE_CHECK;
            reason = "keyword: price check";
        } else if (ticker == null && containsAny(lower, EDUCATIONAL_WORDS)) {
            intent = Intent.EDUCATIONAL;
            reason = "keyword: educational, no instrument";
        } else {
            intent = Intent.MARKET_ANALYSIS;
            reason = "default: market analysis";
        }

        Set<SpecialistTag> specialists = intent.defaultSpecialists();
        if (intent != Intent.EDUCATIONAL) {
            if (lower.contains("sentiment") || lower.contains("news") || lower.contains("social")) {
                specialists.add(SpecialistTag.SENTIMENT);
                specialists.add(SpecialistTag.RESEARCH);
            }
            if (lower.contains("whale") || lower.contains("institutional") || lower.contains("block trade")) {
                specialists.add(SpecialistTag.WHALE);
            }
            if (lower.contains("forecast") || lower.contains("predict") || lower.contains("outlook")
                    || lower.contains("target")) {
                specialists.add(SpecialistTag.FORECAST);
            }
        }
        return new IntentClassification(intent, specialists, ticker, reason);
    }

    static Optional<String> extractTicker(String query) {
        if (query == null) return Optional.empty();
        Matcher dollar = DOLLAR_TICKER.matcher(query);
        if (dollar.find()) {
            return Optional.of(dollar.group(1).toUpperCase(Locale.ROOT));
        }
        Matcher bare = BARE_TICKER.matcher(query);
        while (bare.find()) {
            String candidate = bare.group(1);
            if (!NOT_TICKERS.contains(candidate)) return Optional.of(candidate);
        }
        return Optional.empty();
    }

    private static boolean containsAny(String text, List<String> needles) {
        return needles.stream().anyMatch(text::contains);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
