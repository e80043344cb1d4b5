package com.advisorplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Aggregate of per-token normalized entropies for one generation.
 * All values lie in [0, 1]; an empty token list summarises to maximal uncertainty.
 */
public record EntropySummary(
    @JsonProperty("mean") double mean,
    @JsonProperty("max") double max,
    @JsonProperty("tokenCount") int tokenCount,
    @JsonProperty("approximated") boolean approximated
) {
    public static EntropySummary of(List<Double> perToken, boolean approximated) {
        if (perToken == null || perToken.isEmpty()) {
            return new EntropySummary(1.0, 1.0, 0, approximated);
        }
        double sum = 0.0;
        double max = 0.0;
        for (double e : perToken) {
            double clamped = Math.max(0.0, Math.min(1.0, e));
            sum += clamped;
            max = Math.max(max, clamped);
        }
        return new EntropySummary(sum / perToken.size(), max, perToken.size(), approximated);
    }
}
