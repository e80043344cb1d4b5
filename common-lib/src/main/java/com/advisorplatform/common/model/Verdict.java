package com.advisorplatform.common.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Critic verdicts. {@link #REFUTE} blocks finalization until the proposer rebuts.
 */
public enum Verdict {
    APPROVE,
    FLAG,
    REFUTE;

    public static Optional<Verdict> parse(String raw) {
        if (raw == null) return Optional.empty();
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        // risk reviewers historically answered APPROVED / FLAGGED / BLOCKED
        return switch (normalized) {
            case "APPROVE", "APPROVED" -> Optional.of(APPROVE);
            case "FLAG", "FLAGGED" -> Optional.of(FLAG);
            case "REFUTE", "REFUTED", "BLOCK", "BLOCKED" -> Optional.of(REFUTE);
            default -> Optional.empty();
        };
    }

    public boolean requiresRationale() {
        return this != APPROVE;
    }
}
