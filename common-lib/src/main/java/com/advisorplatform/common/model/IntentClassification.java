package com.advisorplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumSet;
import java.util.Set;

/**
 * Typed result of intent classification: which specialists to dispatch and for which ticker.
 * The specialist set only ever contains members of the closed {@link SpecialistTag} enum.
 */
public record IntentClassification(
    @JsonProperty("intent") Intent intent,
    @JsonProperty("specialists") Set<SpecialistTag> specialists,
    @JsonProperty("ticker") String ticker,
    @JsonProperty("reason") String reason
) {
    public IntentClassification {
        specialists = specialists == null || specialists.isEmpty()
            ? EnumSet.noneOf(SpecialistTag.class)
            : EnumSet.copyOf(specialists);
    }

    public static IntentClassification fallback(String ticker, String reason) {
        return new IntentClassification(Intent.MARKET_ANALYSIS,
            Intent.MARKET_ANALYSIS.defaultSpecialists(), ticker, reason);
    }
}
