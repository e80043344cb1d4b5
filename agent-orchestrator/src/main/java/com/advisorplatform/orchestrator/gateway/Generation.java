package com.advisorplatform.orchestrator.gateway;

import com.advisorplatform.common.model.EntropySummary;
import com.advisorplatform.common.model.ModelTier;

import java.util.List;

/**
 * Output of one gateway call: the generated text and one normalized entropy value per
 * generated token (or a uniform approximation when the backend exposes no logprobs).
 */
public record Generation(
    String       text,
    List<Double> perTokenEntropy,
    ModelTier    tier,
    String       modelLabel,
    boolean      entropyApproximated
) {
    public Generation {
        perTokenEntropy = perTokenEntropy == null ? List.of() : List.copyOf(perTokenEntropy);
    }

    public EntropySummary entropy() {
        return EntropySummary.of(perTokenEntropy, entropyApproximated);
    }
}
