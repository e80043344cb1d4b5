package com.advisorplatform.orchestrator.gateway;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Entropy arithmetic for the gateway. Pure static functions, no state.
 *
 * <p>Per-token entropy is Shannon entropy over the top-k alternatives the backend
 * returned for that position, renormalized to a probability distribution and divided by
 * {@code ln(k)} so the result lies in [0, 1]. One alternative, or none, means zero.
 */
public final class TokenEntropy {

    private TokenEntropy() { /* utility class */ }

    public static double normalized(Collection<Double> topLogprobs) {
        if (topLogprobs == null || topLogprobs.size() < 2) return 0.0;

        double total = 0.0;
        List<Double> probs = new ArrayList<>(topLogprobs.size());
        for (double lp : topLogprobs) {
            double p = Math.exp(lp);
            probs.add(p);
            total += p;
        }
        if (total <= 0.0) return 1.0;

        double h = 0.0;
        for (double p : probs) {
            double q = p / total;
            if (q > 0.0) h -= q * Math.log(q);
        }
        double normalized = h / Math.log(probs.size());
        return Math.max(0.0, Math.min(1.0, normalized));
    }

    /**
     * Self-consistency approximation: the share of samples disagreeing with the modal
     * answer, scaled so that k mutually different samples give 1.0 and k identical ones 0.0.
     */
    public static double disagreement(List<String> samples) {
        if (samples == null || samples.size() < 2) return 0.0;

        Map<String, Integer> counts = new HashMap<>();
        for (String s : samples) {
            counts.merge(canonical(s), 1, Integer::sum);
        }
        int modal = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        int k = samples.size();
        double ratio = 1.0 - (double) modal / k;
        return Math.min(1.0, ratio * k / (k - 1));
    }

    /** A uniform per-token list of {@code value}, one entry per whitespace-separated token. */
    public static List<Double> uniform(String text, double value) {
        int tokens = Math.max(1, text == null ? 0 : text.trim().split("\\s+").length);
        List<Double> out = new ArrayList<>(tokens);
        for (int i = 0; i < tokens; i++) out.add(value);
        return out;
    }

    // samples that differ only in case, whitespace or punctuation count as agreeing
    static String canonical(String s) {
        if (s == null) return "";
        return s.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9 ]", " ")
            .replaceAll("\\s+", " ")
            .trim();
    }
}
