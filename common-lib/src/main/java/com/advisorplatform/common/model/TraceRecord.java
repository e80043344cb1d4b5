package com.advisorplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One row per executed agent hop. Append-only; identity is (correlationId, hopIndex).
 *
 * <p>Digests are hex SHA-256 of the hop's input and output text, so records can be
 * reconciled against stream events without storing prompts verbatim.
 */
public record TraceRecord(
    @JsonProperty("correlationId") String correlationId,
    @JsonProperty("hopIndex") int hopIndex,
    @JsonProperty("component") String component,
    @JsonProperty("inputDigest") String inputDigest,
    @JsonProperty("outputDigest") String outputDigest,
    @JsonProperty("latencyMs") long latencyMs,
    @JsonProperty("outcome") HopOutcome outcome,
    @JsonProperty("modelLabel") String modelLabel,
    @JsonProperty("timestamp") Instant timestamp
) {
}
