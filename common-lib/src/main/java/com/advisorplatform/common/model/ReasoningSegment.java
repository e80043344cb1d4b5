package com.advisorplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One committed span of the stitched reasoning trajectory.
 *
 * <p>{@code escalated} is true when the small model's draft was discarded and the
 * large model's output spliced in its place. {@code lowConfidence} is set when the
 * committed text still exceeded the secondary entropy threshold.
 */
public record ReasoningSegment(
    @JsonProperty("index") int index,
    @JsonProperty("phase") SegmentPhase phase,
    @JsonProperty("text") String text,
    @JsonProperty("sourceModel") ModelTier sourceModel,
    @JsonProperty("entropy") EntropySummary entropy,
    @JsonProperty("escalated") boolean escalated,
    @JsonProperty("lowConfidence") boolean lowConfidence
) {
}
