package com.advisorplatform.orchestrator.intent;

import com.advisorplatform.common.model.Intent;
import com.advisorplatform.common.model.IntentClassification;
import com.advisorplatform.common.model.ModelTier;
import com.advisorplatform.common.model.SpecialistTag;
import com.advisorplatform.orchestrator.gateway.ModelGateway;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies a request into an {@link IntentClassification}.
 *
 * <p>With a live small model the model is asked for a JSON object; its specialist list is
 * validated against the closed {@link SpecialistTag} enum and unknown identifiers are
 * dropped. Anything that fails (no live model, call error, unparseable output) falls back
 * to {@link KeywordIntentRules}. Classification never fails the request.
 */
@Service
public class IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    static final int MAX_TOKENS = 160;

    private final ModelGateway gateway;
    private final ObjectMapper objectMapper;

    public IntentClassifier(ModelGateway gateway, ObjectMapper objectMapper) {
        this.gateway      = gateway;
        this.objectMapper = objectMapper;
    }

    public Mono<IntentClassification> classify(String query, String tickerHint) {
        if (!gateway.isLive(ModelTier.SMALL)) {
            IntentClassification rules = KeywordIntentRules.classify(query, tickerHint);
            log.info("[Intent] keyword classification intent={} specialists={} ticker={}",
                rules.intent(), rules.specialists(), rules.ticker());
            return Mono.just(rules);
        }

        return gateway.generate(ModelTier.SMALL, buildPrompt(query, tickerHint), MAX_TOKENS, 0.0)
            .map(result -> {
                if (!result.isOk()) {
                    log.warn("[Intent] model unavailable, using keyword rules. kind={} reason={}",
                        result.kind(), result.message());
                    return KeywordIntentRules.classify(query, tickerHint);
                }
                return parse(result.value().text(), query, tickerHint);
            })
            .doOnNext(c -> log.info("[Intent] classified intent={} specialists={} ticker={} reason={}",
                c.intent(), c.specialists(), c.ticker(), c.reason()));
    }

    IntentClassification parse(String responseText, String query, String tickerHint) {
        try {
            String cleaned = responseText
                .replaceAll("```json", "")
                .replaceAll("```", "")
                .trim();
            JsonNode json = objectMapper.readTree(cleaned);
            if (!json.isObject() || !json.hasNonNull("intent")) {
                throw new IllegalArgumentException("missing intent field");
            }

            Intent intent = Intent.parseOrDefault(json.path("intent").asText());
            Set<SpecialistTag> requested = EnumSet.noneOf(SpecialistTag.class);
            for (JsonNode tag : json.path("specialists")) {
                SpecialistTag.parse(tag.asText()).ifPresentOrElse(
                    requested::add,
                    () -> log.warn("[Intent] dropping unknown specialist '{}'", tag.asText()));
            }
            Set<SpecialistTag> specialists = requested.isEmpty() && intent != Intent.EDUCATIONAL
                ? intent.defaultSpecialists()
                : requested;

            String ticker = tickerHint != null && !tickerHint.isBlank()
                ? tickerHint.trim().toUpperCase(Locale.ROOT)
                : normalizeTicker(json.path("ticker").asText(null));
            if (ticker == null) {
                ticker = KeywordIntentRules.extractTicker(query).orElse(null);
            }
            String reason = json.path("reason").asText("model classification");
            return new IntentClassification(intent, specialists, ticker, reason);
        } catch (Exception e) {
            log.warn("[Intent] unparseable classification, using keyword rules. reason={} response={}",
                e.getMessage(), responseText);
            return KeywordIntentRules.classify(query, tickerHint);
        }
    }

    private static String normalizeTicker(String raw) {
        if (raw == null || raw.isBlank() || "null".equalsIgnoreCase(raw)) return null;
        String t = raw.trim().replace("$", "").toUpperCase(Locale.ROOT);
        return t.matches("[A-Z]{1,5}(\\.[A-Z]{1,2})?") ? t : null;
    }

    private static String buildPrompt(String query, String tickerHint) {
        return """
            Classify the client request for a financial advisory system.
            Respond ONLY with valid JSON (no markdown):
            {"intent":"PRICE_CHECK|MARKET_ANALYSIS|POSITION_REVIEW|EDUCATIONAL",
             "specialists":["quant","sentiment","forecast","research","whale"],
             "ticker":"<symbol or null>",
             "reason":"<one short sentence>"}
            Only list specialists the request needs. EDUCATIONAL requests need none.
            Request: %s
            Ticker hint: %s
            """.formatted(query, tickerHint == null ? "none" : tickerHint);
    }
}
