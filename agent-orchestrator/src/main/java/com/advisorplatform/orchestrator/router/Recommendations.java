package com.advisorplatform.orchestrator.router;

import com.advisorplatform.common.model.SpecialistResult;
import com.advisorplatform.common.model.Stance;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recommendation helpers shared by thesis planning, the rule-based critic and the
 * action gate. A thesis states its recommendation on a {@code Recommendation: X} line;
 * after a rebuttal the last such line wins.
 */
public final class Recommendations {

    public static final String BUY       = "BUY";
    public static final String SELL      = "SELL";
    public static final String HOLD      = "HOLD";
    public static final String REBALANCE = "REBALANCE";

    private static final Pattern RECOMMENDATION =
        Pattern.compile("(?i)recommendation:\\s*\\**\\s*(BUY|SELL|HOLD|REBALANCE)\\b");

    private Recommendations() { /* utility class */ }

    public static Optional<String> extract(String thesis) {
        if (thesis == null) return Optional.empty();
        Matcher m = RECOMMENDATION.matcher(thesis);
        String last = null;
        while (m.find()) {
            last = m.group(1).toUpperCase(Locale.ROOT);
        }
        return Optional.ofNullable(last);
    }

    /** Stance counts over succeeded results only. */
    public static Map<Stance, Integer> stanceTally(List<SpecialistResult> results) {
        Map<Stance, Integer> tally = new EnumMap<>(Stance.class);
        for (Stance s : Stance.values()) tally.put(s, 0);
        for (SpecialistResult r : results) {
            if (r.succeeded()) tally.merge(r.stance(), 1, Integer::sum);
        }
        return tally;
    }

    /**
     * Strict majority stance among succeeded results, or {@link Stance#NEUTRAL} on a tie
     * or when nothing succeeded.
     */
    public static Stance majorityStance(List<SpecialistResult> results) {
        Map<Stance, Integer> tally = stanceTally(results);
        int bullish = tally.get(Stance.BULLISH);
        int bearish = tally.get(Stance.BEARISH);
        int neutral = tally.get(Stance.NEUTRAL);
        if (bullish > bearish && bullish > neutral) return Stance.BULLISH;
        if (bearish > bullish && bearish > neutral) return Stance.BEARISH;
        return Stance.NEUTRAL;
    }

    public static String fromStance(Stance stance) {
        return switch (stance) {
            case BULLISH -> BUY;
            case BEARISH -> SELL;
            case NEUTRAL -> HOLD;
        };
    }

    public static boolean conflicting(List<SpecialistResult> results) {
        Map<Stance, Integer> tally = stanceTally(results);
        return tally.get(Stance.BULLISH) > 0 && tally.get(Stance.BEARISH) > 0;
    }
}
