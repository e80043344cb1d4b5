package com.advisorplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Envelope for every event pushed to the client. {@code seq} starts at 1 and increases
 * by one per event within a session.
 */
public record StreamEvent(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("correlationId") String correlationId,
    @JsonProperty("seq") long seq,
    @JsonProperty("type") StreamEventType type,
    @JsonProperty("payload") Object payload,
    @JsonProperty("ts") Instant ts
) {
}
