package com.advisorplatform.orchestrator.intent;

import com.advisorplatform.common.model.Intent;
import com.advisorplatform.common.model.IntentClassification;
import com.advisorplatform.common.model.ModelTier;
import com.advisorplatform.common.model.SpecialistTag;
import com.advisorplatform.common.result.RetryPolicy;
import com.advisorplatform.orchestrator.gateway.Generation;
import com.advisorplatform.orchestrator.gateway.ModelBackend;
import com.advisorplatform.orchestrator.gateway.ModelGateway;
import com.advisorplatform.orchestrator.gateway.TemplateBackend;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IntentClassifierTest {

    private static ModelGateway gateway(ModelBackend small) {
        return new ModelGateway(
            Map.of(ModelTier.SMALL, small, ModelTier.LARGE, new TemplateBackend(ModelTier.LARGE)),
            Map.of(ModelTier.SMALL, Duration.ofSeconds(1), ModelTier.LARGE, Duration.ofSeconds(1)),
            RetryPolicy.none());
    }

    private static ModelBackend answering(String text) {
        return new ModelBackend() {
            @Override
            public Mono<Generation> generate(String prompt, int maxTokens, double temperature) {
                return Mono.just(new Generation(text, List.of(0.1), ModelTier.SMALL, "live-small", false));
            }
            @Override public String label() { return "live-small"; }
            @Override public boolean live() { return true; }
        };
    }

    @Nested
    @DisplayName("keyword rules")
    class Keywords {

        @Test
        @DisplayName("position wording selects the position-review specialists")
        void positionReview() {
            IntentClassification c = KeywordIntentRules.classify("Should I rebalance my position in $msft?", null);
            assertThat(c.intent()).isEqualTo(Intent.POSITION_REVIEW);
            assertThat(c.ticker()).isEqualTo("MSFT");
            assertThat(c.specialists())
                .containsExactlyInAnyOrder(SpecialistTag.QUANT, SpecialistTag.SENTIMENT, SpecialistTag.RESEARCH);
        }

        @Test
        @DisplayName("a plain price question only needs quant")
        void priceCheck() {
            IntentClassification c = KeywordIntentRules.classify("What is the price of NVDA today", null);
            assertThat(c.intent()).isEqualTo(Intent.PRICE_CHECK);
            assertThat(c.specialists()).containsExactly(SpecialistTag.QUANT);
        }

        @Test
        @DisplayName("a concept question without an instrument needs no specialists")
        void educational() {
            IntentClassification c = KeywordIntentRules.classify("Explain what a covered call is", null);
            assertThat(c.intent()).isEqualTo(Intent.EDUCATIONAL);
            assertThat(c.specialists()).isEmpty();
            assertThat(c.ticker()).isNull();
        }

        @Test
        @DisplayName("common upper-case words are not mistaken for tickers")
        void notTickers() {
            assertThat(KeywordIntentRules.extractTicker("Should I BUY the ETF or HOLD")).isEmpty();
            assertThat(KeywordIntentRules.extractTicker("Is TSLA a buy")).contains("TSLA");
        }

        @Test
        @DisplayName("the ticker hint wins over anything in the text")
        void tickerHint() {
            assertThat(KeywordIntentRules.classify("Thoughts on AMZN?", "aapl").ticker()).isEqualTo("AAPL");
        }
    }

    @Nested
    @DisplayName("model classification")
    class Model {

        private final ObjectMapper objectMapper = new ObjectMapper();

        @Test
        @DisplayName("unknown specialist identifiers are dropped, never dispatched")
        void unknownTagsDropped() {
            IntentClassifier classifier = new IntentClassifier(gateway(answering("""
                ```json
                {"intent":"MARKET_ANALYSIS","specialists":["quant","astrology","whale"],
                 "ticker":"$nvda","reason":"wants a view"}
                ```""")), objectMapper);

            StepVerifier.create(classifier.classify("What do you think of Nvidia?", null))
                .assertNext(c -> {
                    assertThat(c.intent()).isEqualTo(Intent.MARKET_ANALYSIS);
                    assertThat(c.specialists()).containsExactlyInAnyOrder(SpecialistTag.QUANT, SpecialistTag.WHALE);
                    assertThat(c.ticker()).isEqualTo("NVDA");
                    assertThat(c.reason()).isEqualTo("wants a view");
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("unparseable model output falls back to the keyword rules")
        void garbageFallsBack() {
            IntentClassifier classifier = new IntentClassifier(gateway(answering("I think it is analysis")), objectMapper);

            StepVerifier.create(classifier.classify("Review my holdings in AAPL", null))
                .assertNext(c -> {
                    assertThat(c.intent()).isEqualTo(Intent.POSITION_REVIEW);
                    assertThat(c.reason()).startsWith("keyword");
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("an empty specialist list takes the intent defaults")
        void emptyListTakesDefaults() {
            IntentClassifier classifier = new IntentClassifier(gateway(answering(
                "{\"intent\":\"PRICE_CHECK\",\"specialists\":[],\"ticker\":null}")), objectMapper);

            IntentClassification c = classifier.parse(
                "{\"intent\":\"PRICE_CHECK\",\"specialists\":[],\"ticker\":null}", "price of $IBM", null);
            assertThat(c.specialists()).containsExactly(SpecialistTag.QUANT);
            assertThat(c.ticker()).isEqualTo("IBM");
        }

        @Test
        @DisplayName("with no live small model the keyword rules answer directly")
        void templateUsesRules() {
            IntentClassifier classifier = new IntentClassifier(gateway(new TemplateBackend(ModelTier.SMALL)), objectMapper);

            StepVerifier.create(classifier.classify("Any whale activity in $AMD?", null))
                .assertNext(c -> {
                    assertThat(c.ticker()).isEqualTo("AMD");
                    assertThat(c.specialists()).contains(SpecialistTag.WHALE);
                })
                .verifyComplete();
        }
    }
}
