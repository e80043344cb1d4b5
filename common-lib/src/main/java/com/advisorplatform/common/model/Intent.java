package com.advisorplatform.common.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Request intents and the specialists each one needs by default.
 */
public enum Intent {
    PRICE_CHECK(EnumSet.of(SpecialistTag.QUANT)),
    MARKET_ANALYSIS(EnumSet.of(SpecialistTag.QUANT, SpecialistTag.FORECAST, SpecialistTag.RESEARCH,
                               SpecialistTag.SENTIMENT, SpecialistTag.WHALE)),
    POSITION_REVIEW(EnumSet.of(SpecialistTag.QUANT, SpecialistTag.SENTIMENT, SpecialistTag.RESEARCH)),
    EDUCATIONAL(EnumSet.noneOf(SpecialistTag.class));

    private final Set<SpecialistTag> defaultSpecialists;

    Intent(Set<SpecialistTag> defaultSpecialists) {
        this.defaultSpecialists = defaultSpecialists;
    }

    public Set<SpecialistTag> defaultSpecialists() {
        return defaultSpecialists.isEmpty()
            ? EnumSet.noneOf(SpecialistTag.class)
            : EnumSet.copyOf(defaultSpecialists);
    }

    /** Lenient parse; anything unrecognised falls back to {@link #MARKET_ANALYSIS}. */
    public static Intent parseOrDefault(String raw) {
        if (raw == null) return MARKET_ANALYSIS;
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        for (Intent i : values()) {
            if (i.name().equals(normalized)) return i;
        }
        return MARKET_ANALYSIS;
    }
}
