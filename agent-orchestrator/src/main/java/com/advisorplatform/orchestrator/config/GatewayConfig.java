package com.advisorplatform.orchestrator.config;

import com.advisorplatform.common.model.ModelTier;
import com.advisorplatform.common.result.RetryPolicy;
import com.advisorplatform.orchestrator.gateway.ModelBackend;
import com.advisorplatform.orchestrator.gateway.ModelGateway;
import com.advisorplatform.orchestrator.gateway.OpenAiCompatibleBackend;
import com.advisorplatform.orchestrator.gateway.TemplateBackend;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the two gateway tiers. A tier without {@code base-url} runs the deterministic
 * {@link TemplateBackend}; otherwise it gets an {@link OpenAiCompatibleBackend} on its own
 * Reactor Netty connection pool. The pools are the only resource shared across requests.
 */
@Configuration
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    @Value("${gateway.small.base-url:}")
    private String smallBaseUrl;

    @Value("${gateway.small.model:small-model}")
    private String smallModel;

    @Value("${gateway.small.api-key:}")
    private String smallApiKey;

    @Value("${gateway.small.timeout:PT8S}")
    private Duration smallTimeout;

    @Value("${gateway.small.logprobs:true}")
    private boolean smallLogprobs;

    @Value("${gateway.large.base-url:}")
    private String largeBaseUrl;

    @Value("${gateway.large.model:large-model}")
    private String largeModel;

    @Value("${gateway.large.api-key:}")
    private String largeApiKey;

    @Value("${gateway.large.timeout:PT30S}")
    private Duration largeTimeout;

    @Value("${gateway.large.logprobs:true}")
    private boolean largeLogprobs;

    @Value("${gateway.pool.max-connections:16}")
    private int maxConnections;

    @Value("${gateway.pool.pending-acquire-max:64}")
    private int pendingAcquireMax;

    @Value("${gateway.self-consistency-samples:3}")
    private int selfConsistencySamples;

    @Bean
    public ModelGateway modelGateway(ObjectMapper objectMapper, RetryPolicy retryPolicy) {
        ModelBackend small = backend(ModelTier.SMALL, smallBaseUrl, smallModel, smallApiKey,
            smallTimeout, smallLogprobs, objectMapper);
        ModelBackend large = backend(ModelTier.LARGE, largeBaseUrl, largeModel, largeApiKey,
            largeTimeout, largeLogprobs, objectMapper);
        return new ModelGateway(
            Map.of(ModelTier.SMALL, small, ModelTier.LARGE, large),
            Map.of(ModelTier.SMALL, smallTimeout, ModelTier.LARGE, largeTimeout),
            retryPolicy);
    }

    private ModelBackend backend(ModelTier tier, String baseUrl, String model, String apiKey,
                                 Duration timeout, boolean logprobs, ObjectMapper objectMapper) {
        if (baseUrl == null || baseUrl.isBlank()) {
            log.warn("[Gateway] No base URL configured for tier={}, using deterministic template backend", tier);
            return new TemplateBackend(tier);
        }
        log.info("[Gateway] tier={} model={} baseUrl={} timeout={} logprobs={}", tier, model, baseUrl, timeout, logprobs);

        ConnectionProvider pool = ConnectionProvider.builder("gateway-" + tier.name().toLowerCase(Locale.ROOT))
            .maxConnections(maxConnections)
            .pendingAcquireMaxCount(pendingAcquireMax)
            .pendingAcquireTimeout(timeout)
            .build();
        HttpClient httpClient = HttpClient.create(pool)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .responseTimeout(timeout);
        WebClient client = WebClient.builder()
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
        return new OpenAiCompatibleBackend(tier, client, model, apiKey, logprobs, selfConsistencySamples, objectMapper);
    }
}
