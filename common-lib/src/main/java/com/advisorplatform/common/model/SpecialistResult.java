package com.advisorplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Output of a single specialist invocation. Created once, never mutated.
 *
 * <p>A failed invocation still yields a {@code SpecialistResult}: {@code error} is
 * populated, {@code stance} is {@link Stance#NEUTRAL} and the payload is empty.
 */
public record SpecialistResult(
    @JsonProperty("specialistTag") SpecialistTag specialistTag,
    @JsonProperty("structuredPayload") Map<String, Object> structuredPayload,
    @JsonProperty("narrativeText") String narrativeText,
    @JsonProperty("stance") Stance stance,
    @JsonProperty("latencyMs") long latencyMs,
    @JsonProperty("cached") boolean cached,
    @JsonProperty("error") String error
) {
    public SpecialistResult {
        structuredPayload = structuredPayload == null ? Map.of() : Map.copyOf(structuredPayload);
        stance = stance == null ? Stance.NEUTRAL : stance;
    }

    public static SpecialistResult success(SpecialistTag tag, Map<String, Object> payload,
                                           String narrative, Stance stance) {
        return new SpecialistResult(tag, payload, narrative, stance, 0L, false, null);
    }

    public static SpecialistResult failure(SpecialistTag tag, String error, long latencyMs) {
        return new SpecialistResult(tag, Map.of(), "", Stance.NEUTRAL, latencyMs, false,
            error == null ? "unknown error" : error);
    }

    public boolean succeeded() {
        return error == null;
    }

    public SpecialistResult withLatency(long latencyMs) {
        return new SpecialistResult(specialistTag, structuredPayload, narrativeText, stance,
            latencyMs, cached, error);
    }

    public SpecialistResult asCached() {
        return new SpecialistResult(specialistTag, structuredPayload, narrativeText, stance,
            0L, true, error);
    }
}
