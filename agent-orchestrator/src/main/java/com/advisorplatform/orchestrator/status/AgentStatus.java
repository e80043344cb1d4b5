package com.advisorplatform.orchestrator.status;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record AgentStatus(
    @JsonProperty("component") String component,
    @JsonProperty("status") String status,
    @JsonProperty("activeRequests") int activeRequests,
    @JsonProperty("lastActiveAt") Instant lastActiveAt
) {
    public static final String WORKING = "working";
    public static final String READY   = "ready";
}
