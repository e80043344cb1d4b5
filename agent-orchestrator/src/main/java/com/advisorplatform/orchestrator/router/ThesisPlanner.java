package com.advisorplatform.orchestrator.router;

import com.advisorplatform.common.model.DebateTurn;
import com.advisorplatform.common.model.DecisionContext;
import com.advisorplatform.common.model.SpecialistResult;
import com.advisorplatform.common.model.SpecialistTag;
import com.advisorplatform.common.model.Stance;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a {@link DecisionContext} into the ordered segment outline the Router drafts.
 *
 * <p>Thesis: market foundation, then one segment per evidence layer that has results
 * (technicals, sentiment/research, institutional flow, forward projection), then the
 * synthesis carrying the recommendation. Rebuttal: address the critique, then the
 * revised recommendation.
 */
public final class ThesisPlanner {

    static final String FOUNDATION   = "Market foundation";
    static final String TECHNICALS   = "Technical picture";
    static final String NARRATIVE    = "Sentiment and research";
    static final String FLOW         = "Institutional flow";
    static final String PROJECTION   = "Forward projection";
    static final String SYNTHESIS    = "Synthesis and recommendation";
    static final String REBUTTAL     = "Response to critique";
    static final String REVISED      = "Revised recommendation";

    private ThesisPlanner() { /* utility class */ }

    public static List<SegmentOutline> thesisPlan(DecisionContext ctx) {
        Map<SpecialistTag, SpecialistResult> byTag = new EnumMap<>(SpecialistTag.class);
        for (SpecialistResult r : ctx.specialistResults()) byTag.put(r.specialistTag(), r);

        List<SegmentOutline> plan = new ArrayList<>();
        plan.add(new SegmentOutline(FOUNDATION,
            "Frame the question and the instrument for the client.",
            foundationEvidence(ctx)));

        addLayer(plan, byTag, TECHNICALS,
            "Summarize price trend, momentum and indicator readings.", SpecialistTag.QUANT);
        addLayer(plan, byTag, NARRATIVE,
            "Summarize news flow, social tone and catalysts.", SpecialistTag.SENTIMENT, SpecialistTag.RESEARCH);
        addLayer(plan, byTag, FLOW,
            "Describe large-trade activity and what it implies.", SpecialistTag.WHALE);
        addLayer(plan, byTag, PROJECTION,
            "Describe the projected path and how reliable the fit is.", SpecialistTag.FORECAST);

        plan.add(new SegmentOutline(SYNTHESIS,
            "Weigh the evidence above and end with one line 'Recommendation: BUY|SELL|HOLD|REBALANCE'.",
            synthesisEvidence(ctx.specialistResults())));
        return plan;
    }

    public static List<SegmentOutline> rebuttalPlan(DecisionContext ctx, DebateTurn critique) {
        List<SpecialistResult> results = ctx.specialistResults();
        String original = Recommendations.extract(ctx.thesis()).orElse(Recommendations.HOLD);
        String evidenceView = Recommendations.fromStance(Recommendations.majorityStance(results));
        // a refuted call that already matches the evidence majority is stepped down to HOLD
        String revised = evidenceView.equals(original) ? Recommendations.HOLD : evidenceView;

        List<String> rebuttalEvidence = new ArrayList<>();
        rebuttalEvidence.add("Critique: " + critique.rationale());
        for (SpecialistResult r : results) {
            if (r.succeeded() && r.stance() != Stance.NEUTRAL) {
                rebuttalEvidence.add(label(r.specialistTag()) + " reads " + r.stance().name().toLowerCase(Locale.ROOT) + ".");
            }
        }

        return List.of(
            new SegmentOutline(REBUTTAL,
                "Address the critique point by point; concede what the evidence does not support.",
                rebuttalEvidence),
            new SegmentOutline(REVISED,
                "State the revised position and end with one line 'Recommendation: BUY|SELL|HOLD|REBALANCE'.",
                List.of("Original recommendation was " + original + ".",
                        "Recommendation: " + revised)));
    }

    // ── evidence ────────────────────────────────────────────────────────────

    private static List<String> foundationEvidence(DecisionContext ctx) {
        List<String> lines = new ArrayList<>();
        String ticker = ctx.ticker() != null && !ctx.ticker().isBlank() ? ctx.ticker() : "no specific ticker";
        lines.add("Instrument: " + ticker + ", account scope " + ctx.accountScope());
        if (ctx.intent() != null) {
            lines.add("Request type: " + ctx.intent().intent().name().toLowerCase(Locale.ROOT).replace('_', ' '));
        }
        int total = ctx.selectedSpecialistCount();
        if (total > 0) {
            lines.add(ctx.succeededResults().size() + " of " + total + " specialists reported");
        }
        return lines;
    }

    private static void addLayer(List<SegmentOutline> plan, Map<SpecialistTag, SpecialistResult> byTag,
                                 String title, String instruction, SpecialistTag... tags) {
        List<String> evidence = new ArrayList<>();
        for (SpecialistTag tag : tags) {
            SpecialistResult r = byTag.get(tag);
            if (r == null) continue;
            evidence.add(r.succeeded()
                ? r.narrativeText()
                : label(tag) + " evidence unavailable (" + r.error() + ")");
        }
        if (!evidence.isEmpty()) {
            plan.add(new SegmentOutline(title, instruction, evidence));
        }
    }

    private static List<String> synthesisEvidence(List<SpecialistResult> results) {
        List<String> lines = new ArrayList<>();
        Map<Stance, Integer> tally = Recommendations.stanceTally(results);
        if (results.isEmpty()) {
            lines.add("No market evidence applies; answer from general principles");
        } else {
            lines.add("Evidence stance: " + tally.get(Stance.BULLISH) + " bullish, "
                + tally.get(Stance.BEARISH) + " bearish, " + tally.get(Stance.NEUTRAL) + " neutral");
        }
        if (Recommendations.conflicting(results)) {
            lines.add("Specialist signals are conflicting");
        }
        lines.add("Recommendation: " + Recommendations.fromStance(Recommendations.majorityStance(results)));
        return lines;
    }

    private static String label(SpecialistTag tag) {
        String id = tag.id();
        return Character.toUpperCase(id.charAt(0)) + id.substring(1);
    }
}
