package com.advisorplatform.orchestrator.event;

import com.advisorplatform.common.model.OrchestrationState;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Payload of a {@code status} event: the state just entered and a short human-readable detail. */
public record StatusPayload(
    @JsonProperty("state") OrchestrationState state,
    @JsonProperty("detail") String detail
) {
}
