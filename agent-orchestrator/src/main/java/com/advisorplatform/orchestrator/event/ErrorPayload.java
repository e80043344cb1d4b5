package com.advisorplatform.orchestrator.event;

import com.advisorplatform.common.model.OrchestrationState;
import com.advisorplatform.common.result.ErrorKind;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Payload of the terminal {@code error} event. */
public record ErrorPayload(
    @JsonProperty("kind") ErrorKind kind,
    @JsonProperty("message") String message,
    @JsonProperty("failedIn") OrchestrationState failedIn
) {
}
