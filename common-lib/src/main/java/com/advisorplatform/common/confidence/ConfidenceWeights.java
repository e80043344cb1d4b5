package com.advisorplatform.common.confidence;

/**
 * Configurable inputs of {@link WeightedConfidenceEstimator}.
 *
 * @param agreementWeight  weight of specialist agreement
 * @param stabilityWeight  weight of debate stability
 * @param routerWeight     weight of router confidence
 * @param turnPenalty      stability lost per debate turn beyond the first
 * @param exhaustedCap     ceiling when the debate or the time budget ran out
 * @param degradedCap      ceiling when fewer than half of the selected specialists succeeded
 */
public record ConfidenceWeights(
    double agreementWeight,
    double stabilityWeight,
    double routerWeight,
    double turnPenalty,
    double exhaustedCap,
    double degradedCap
) {
    public ConfidenceWeights {
        if (agreementWeight < 0 || stabilityWeight < 0 || routerWeight < 0) {
            throw new IllegalArgumentException("confidence weights must be non-negative");
        }
        if (agreementWeight + stabilityWeight + routerWeight <= 0.0) {
            throw new IllegalArgumentException("confidence weights must not all be zero");
        }
    }

    public static ConfidenceWeights defaults() {
        return new ConfidenceWeights(0.40, 0.35, 0.25, 0.25, 0.60, 0.50);
    }

    public double total() {
        return agreementWeight + stabilityWeight + routerWeight;
    }
}
