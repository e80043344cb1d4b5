package com.advisorplatform.orchestrator.stream;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of {@code POST /api/v1/advisory/stream}. Only {@code query} is required. */
public record AdvisoryRequest(
    @JsonProperty("query") String query,
    @JsonProperty("ticker") String ticker,
    @JsonProperty("accountScope") String accountScope
) {
    public boolean valid() {
        return query != null && !query.isBlank();
    }
}
