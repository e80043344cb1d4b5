package com.advisorplatform.orchestrator.gateway;

import com.advisorplatform.common.exception.AdvisoryException;
import com.advisorplatform.common.model.ModelTier;
import com.advisorplatform.common.result.ErrorKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions backend for any OpenAI-compatible server (vLLM, llama.cpp, LM Studio,
 * hosted APIs).
 *
 * <p>Entropy comes from {@code logprobs/top_logprobs} when the server returns them. When it
 * does not, or logprobs are disabled for the tier, {@code k - 1} extra samples are drawn
 * and their disagreement with the primary answer is used as a uniform per-token entropy.
 */
public class OpenAiCompatibleBackend implements ModelBackend {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleBackend.class);

    static final int    TOP_LOGPROBS           = 5;
    static final double MIN_SAMPLE_TEMPERATURE = 0.7;

    private final ModelTier    tier;
    private final WebClient    client;
    private final String       model;
    private final String       apiKey;
    private final boolean      requestLogprobs;
    private final int          selfConsistencySamples;
    private final ObjectMapper objectMapper;

    public OpenAiCompatibleBackend(ModelTier tier, WebClient client, String model, String apiKey,
                                   boolean requestLogprobs, int selfConsistencySamples,
                                   ObjectMapper objectMapper) {
        this.tier                   = tier;
        this.client                 = client;
        this.model                  = model;
        this.apiKey                 = apiKey;
        this.requestLogprobs        = requestLogprobs;
        this.selfConsistencySamples = Math.max(2, selfConsistencySamples);
        this.objectMapper           = objectMapper;
    }

    @Override
    public Mono<Generation> generate(String prompt, int maxTokens, double temperature) {
        return complete(prompt, maxTokens, temperature, requestLogprobs)
            .flatMap(primary -> primary.tokenEntropies() != null
                ? Mono.just(new Generation(primary.text(), primary.tokenEntropies(), tier, model, false))
                : approximate(prompt, maxTokens, temperature, primary.text()));
    }

    @Override
    public String label() {
        return model;
    }

    @Override
    public boolean live() {
        return true;
    }

    // ── self-consistency ────────────────────────────────────────────────────

    private Mono<Generation> approximate(String prompt, int maxTokens, double temperature, String primaryText) {
        double sampleTemperature = Math.max(temperature, MIN_SAMPLE_TEMPERATURE);
        return Flux.range(0, selfConsistencySamples - 1)
            .flatMap(i -> complete(prompt, maxTokens, sampleTemperature, false).map(Completion::text))
            .collectList()
            .map(extra -> {
                List<String> samples = new ArrayList<>(extra.size() + 1);
                samples.add(primaryText);
                samples.addAll(extra);
                double d = TokenEntropy.disagreement(samples);
                log.debug("[Gateway] self-consistency tier={} samples={} disagreement={}", tier, samples.size(), d);
                return new Generation(primaryText, TokenEntropy.uniform(primaryText, d), tier, model, true);
            })
            .onErrorResume(e -> {
                log.warn("[Gateway] self-consistency sampling failed, assuming maximal entropy. tier={} reason={}",
                    tier, e.getMessage());
                return Mono.just(new Generation(primaryText, TokenEntropy.uniform(primaryText, 1.0), tier, model, true));
            });
    }

    // ── HTTP ────────────────────────────────────────────────────────────────

    private Mono<Completion> complete(String prompt, int maxTokens, double temperature, boolean logprobs) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", model);
        requestBody.put("max_tokens", maxTokens);
        requestBody.put("temperature", temperature);
        requestBody.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        if (logprobs) {
            requestBody.put("logprobs", true);
            requestBody.put("top_logprobs", TOP_LOGPROBS);
        }

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson -> {
                WebClient.RequestBodySpec spec = client.post().uri("/v1/chat/completions");
                if (apiKey != null && !apiKey.isBlank()) {
                    spec = spec.header("Authorization", "Bearer " + apiKey);
                }
                return spec.bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class);
            })
            .map(this::parseCompletion)
            .onErrorMap(this::classify);
    }

    Completion parseCompletion(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new AdvisoryException(ErrorKind.SCHEMA_VIOLATION, "unparseable completion body", e);
        }
        JsonNode choice = root.path("choices").path(0);
        String text = choice.path("message").path("content").asText("");
        if (text.isBlank()) {
            throw new AdvisoryException(ErrorKind.SCHEMA_VIOLATION, "empty completion from " + model);
        }

        JsonNode content = choice.path("logprobs").path("content");
        if (!content.isArray() || content.isEmpty()) {
            return new Completion(text, null);
        }
        List<Double> entropies = new ArrayList<>(content.size());
        boolean anyAlternatives = false;
        for (JsonNode token : content) {
            List<Double> alternatives = new ArrayList<>();
            for (JsonNode alt : token.path("top_logprobs")) {
                alternatives.add(alt.path("logprob").asDouble());
            }
            anyAlternatives |= alternatives.size() >= 2;
            entropies.add(TokenEntropy.normalized(alternatives));
        }
        if (!anyAlternatives) {
            // chosen-token logprobs alone say nothing about the spread
            log.debug("[Gateway] logprobs without top_logprobs alternatives, falling back to sampling. tier={}", tier);
            return new Completion(text, null);
        }
        return new Completion(text, entropies);
    }

    private Throwable classify(Throwable e) {
        if (e instanceof AdvisoryException) return e;
        if (e instanceof WebClientResponseException wre) {
            int status = wre.getStatusCode().value();
            ErrorKind kind = status >= 500 || status == 429 ? ErrorKind.BACKEND_UNAVAILABLE : ErrorKind.SCHEMA_VIOLATION;
            return new AdvisoryException(kind, tier + " backend returned HTTP " + status, e);
        }
        if (e instanceof WebClientRequestException) {
            return new AdvisoryException(ErrorKind.BACKEND_UNAVAILABLE, tier + " backend unreachable: " + e.getMessage(), e);
        }
        return e;
    }

    /** {@code tokenEntropies} is {@code null} when the server sent no usable top-k alternatives. */
    record Completion(String text, List<Double> tokenEntropies) {}
}
