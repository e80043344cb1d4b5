package com.advisorplatform.orchestrator.event;

import com.advisorplatform.common.model.ConfidenceScore;
import com.advisorplatform.common.model.DebateOutcome;
import com.advisorplatform.common.model.Intent;
import com.advisorplatform.common.model.ProposedAction;
import com.advisorplatform.common.model.SpecialistTag;
import com.advisorplatform.common.model.Stance;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Payload of the terminal {@code final} event.
 *
 * <p>{@code unresolvedDisagreement} carries the critic's last rationale verbatim whenever
 * the debate ended without approval (flagged, exhausted or out of time); otherwise null.
 */
public record FinalPayload(
    @JsonProperty("ticker") String ticker,
    @JsonProperty("intent") Intent intent,
    @JsonProperty("thesis") String thesis,
    @JsonProperty("recommendation") String recommendation,
    @JsonProperty("confidence") ConfidenceScore confidence,
    @JsonProperty("debateOutcome") DebateOutcome debateOutcome,
    @JsonProperty("debateTurns") int debateTurns,
    @JsonProperty("unresolvedDisagreement") String unresolvedDisagreement,
    @JsonProperty("specialists") List<SpecialistSummary> specialists,
    @JsonProperty("segments") int segments,
    @JsonProperty("escalatedSegments") int escalatedSegments,
    @JsonProperty("degradedReasons") List<String> degradedReasons,
    @JsonProperty("proposedAction") ProposedAction proposedAction
) {

    public record SpecialistSummary(
        @JsonProperty("tag") SpecialistTag tag,
        @JsonProperty("ok") boolean ok,
        @JsonProperty("stance") Stance stance,
        @JsonProperty("cached") boolean cached,
        @JsonProperty("error") String error
    ) {
    }
}
