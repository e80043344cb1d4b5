package com.advisorplatform.common.model;

/**
 * How the proposer/critic debate ended.
 *
 * <p>{@link #EXHAUSTED} and {@link #BUDGET_EXHAUSTED} both finalize with the last thesis
 * and a capped confidence; neither is an error.
 */
public enum DebateOutcome {
    APPROVED,
    FLAGGED,
    EXHAUSTED,
    BUDGET_EXHAUSTED;

    public boolean capsConfidence() {
        return this == EXHAUSTED || this == BUDGET_EXHAUSTED;
    }
}
