package com.advisorplatform.common.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of specialist capabilities the orchestrator may dispatch.
 *
 * <p>Intent classification output is validated against this enum before any
 * specialist is invoked. Unknown identifiers are dropped, never dispatched.
 */
public enum SpecialistTag {
    QUANT,
    SENTIMENT,
    FORECAST,
    RESEARCH,
    WHALE;

    /**
     * Resolves a free-form identifier (e.g. {@code "quant"}, {@code " Whale "}) to a tag.
     * Returns empty for anything outside the closed set.
     */
    public static Optional<SpecialistTag> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(t -> t.name().equals(normalized))
            .findFirst();
    }

    public static Set<SpecialistTag> none() {
        return EnumSet.noneOf(SpecialistTag.class);
    }

    /** Lower-case identifier used in stream payloads and trace component names. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
