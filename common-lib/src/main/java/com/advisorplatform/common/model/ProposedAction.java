package com.advisorplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A real-world side effect the orchestrator recommends but never performs.
 *
 * <p>Proposals are handed to the external authorization boundary, which must sign
 * {@code digest} before any execution system acts on them.
 */
public record ProposedAction(
    @JsonProperty("proposalId") String proposalId,
    @JsonProperty("correlationId") String correlationId,
    @JsonProperty("action") ActionType action,
    @JsonProperty("ticker") String ticker,
    @JsonProperty("rationale") String rationale,
    @JsonProperty("digest") String digest,
    @JsonProperty("requiresAuthorization") boolean requiresAuthorization
) {
}
