package com.advisorplatform.orchestrator.router;

import com.advisorplatform.common.model.ModelTier;

/**
 * Entropy-to-tier mapping used by {@link RStitchRouter}.
 *
 * <ul>
 *   <li>mean entropy ≤ τ → keep the {@code SMALL} draft</li>
 *   <li>mean entropy &gt; τ → re-issue on {@code LARGE}</li>
 *   <li>committed entropy &gt; τ₂ → emit, but flagged low-confidence</li>
 * </ul>
 *
 * <p>Pure static utility, deterministic for fixed thresholds.
 */
public final class DelegationPolicy {

    private DelegationPolicy() { /* utility class */ }

    public static ModelTier select(double meanEntropy, double threshold) {
        return meanEntropy <= threshold ? ModelTier.SMALL : ModelTier.LARGE;
    }

    public static boolean lowConfidence(double meanEntropy, double secondaryThreshold) {
        return meanEntropy > secondaryThreshold;
    }
}
