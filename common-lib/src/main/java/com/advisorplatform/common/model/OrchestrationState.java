package com.advisorplatform.common.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Orchestrator lifecycle. {@link #DONE} and {@link #ABORTED} are terminal.
 *
 * <pre>
 *   CLASSIFYING → GATHERING → DRAFTING → DEBATING → FINALIZING → DONE
 *                                 ↑          │
 *                                 └──────────┘  (once per refutation)
 * </pre>
 * Any non-terminal state may move to ABORTED.
 */
public enum OrchestrationState {
    CLASSIFYING,
    GATHERING,
    DRAFTING,
    DEBATING,
    FINALIZING,
    DONE,
    ABORTED;

    public boolean isTerminal() {
        return this == DONE || this == ABORTED;
    }

    public boolean canTransitionTo(OrchestrationState next) {
        if (isTerminal()) return false;
        if (next == ABORTED) return true;
        return allowedNext().contains(next);
    }

    private Set<OrchestrationState> allowedNext() {
        return switch (this) {
            case CLASSIFYING -> EnumSet.of(GATHERING);
            case GATHERING   -> EnumSet.of(DRAFTING);
            case DRAFTING    -> EnumSet.of(DEBATING);
            case DEBATING    -> EnumSet.of(DRAFTING, FINALIZING);
            case FINALIZING  -> EnumSet.of(DONE);
            case DONE, ABORTED -> EnumSet.noneOf(OrchestrationState.class);
        };
    }
}
