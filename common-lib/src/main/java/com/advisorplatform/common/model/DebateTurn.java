package com.advisorplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One critic review in the debate. {@code turnIndex} is 1-based.
 *
 * <p>{@code degradedReason} is set when the verdict stands in for a review that could not
 * be obtained (critic call failed or its output was rejected); such a turn is always a
 * {@link Verdict#FLAG}.
 */
public record DebateTurn(
    @JsonProperty("turnIndex") int turnIndex,
    @JsonProperty("speaker") Speaker speaker,
    @JsonProperty("verdict") Verdict verdict,
    @JsonProperty("rationale") String rationale,
    @JsonProperty("degradedReason") String degradedReason
) {
    public DebateTurn {
        if (turnIndex < 1) {
            throw new IllegalArgumentException("turnIndex must be >= 1, got " + turnIndex);
        }
        if (verdict != null && verdict.requiresRationale() && (rationale == null || rationale.isBlank())) {
            throw new IllegalArgumentException(verdict + " requires a rationale");
        }
    }

    public static DebateTurn critic(int turnIndex, Verdict verdict, String rationale) {
        return new DebateTurn(turnIndex, Speaker.CRITIC, verdict, rationale, null);
    }

    /** Soft FLAG recorded in place of a review the critic could not deliver. */
    public static DebateTurn unavailable(int turnIndex, String reason) {
        return new DebateTurn(turnIndex, Speaker.CRITIC, Verdict.FLAG, "critic unavailable: " + reason, reason);
    }

    public boolean degraded() {
        return degradedReason != null;
    }
}
