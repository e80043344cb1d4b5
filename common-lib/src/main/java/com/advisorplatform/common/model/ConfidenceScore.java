package com.advisorplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Final advisory confidence, computed once at debate termination.
 *
 * <p>{@code value} is always in [0, 1]. The three breakdown terms are the normalized
 * inputs the estimator combined; {@code capReason} names the ceiling applied, if any.
 */
public record ConfidenceScore(
    @JsonProperty("value") double value,
    @JsonProperty("specialistAgreement") double specialistAgreement,
    @JsonProperty("debateStability") double debateStability,
    @JsonProperty("routerConfidence") double routerConfidence,
    @JsonProperty("capped") boolean capped,
    @JsonProperty("capReason") String capReason,
    @JsonProperty("robustness") RobustnessLabel robustness
) {
    public ConfidenceScore {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException("confidence out of range: " + value);
        }
    }
}
