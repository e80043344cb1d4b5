package com.advisorplatform.orchestrator.event;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Payload of the terminal {@code aborted} event. */
public record AbortedPayload(
    @JsonProperty("reason") String reason,
    @JsonProperty("lastSeqBeforeAbort") long lastSeqBeforeAbort
) {
}
