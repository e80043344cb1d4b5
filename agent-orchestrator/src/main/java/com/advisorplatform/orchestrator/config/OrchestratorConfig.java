package com.advisorplatform.orchestrator.config;

import com.advisorplatform.common.confidence.ConfidenceEstimator;
import com.advisorplatform.common.confidence.ConfidenceWeights;
import com.advisorplatform.common.confidence.WeightedConfidenceEstimator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Value("${services.action-gateway.base-url:http://localhost:8085}")
    private String actionGatewayUrl;

    @Value("${confidence.agreement-weight:0.40}")
    private double agreementWeight;

    @Value("${confidence.stability-weight:0.35}")
    private double stabilityWeight;

    @Value("${confidence.router-weight:0.25}")
    private double routerWeight;

    @Value("${confidence.turn-penalty:0.25}")
    private double turnPenalty;

    @Value("${confidence.exhausted-cap:0.60}")
    private double exhaustedCap;

    @Value("${confidence.degraded-cap:0.50}")
    private double degradedCap;

    @Bean
    public WebClient actionGatewayClient(WebClient.Builder builder) {
        return builder.baseUrl(actionGatewayUrl).build();
    }

    @Bean
    public ConfidenceEstimator confidenceEstimator() {
        ConfidenceWeights weights = new ConfidenceWeights(agreementWeight, stabilityWeight, routerWeight,
            turnPenalty, exhaustedCap, degradedCap);
        log.info("[Confidence] weights agreement={} stability={} router={} turnPenalty={} exhaustedCap={} degradedCap={}",
            agreementWeight, stabilityWeight, routerWeight, turnPenalty, exhaustedCap, degradedCap);
        return new WeightedConfidenceEstimator(weights);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
