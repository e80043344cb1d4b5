package com.advisorplatform.common.confidence;

import com.advisorplatform.common.model.ConfidenceScore;
import com.advisorplatform.common.model.DebateOutcome;
import com.advisorplatform.common.model.DebateTurn;
import com.advisorplatform.common.model.DecisionContext;
import com.advisorplatform.common.model.ReasoningSegment;
import com.advisorplatform.common.model.RobustnessLabel;
import com.advisorplatform.common.model.SpecialistResult;
import com.advisorplatform.common.model.Stance;
import com.advisorplatform.common.model.Verdict;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Default {@link ConfidenceEstimator}: a normalized weighted sum of three terms.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>{@code agreement = (succeeded / selected) × majorityStanceShare};
 *       {@value #NEUTRAL_TERM} when no specialist was selected.</li>
 *   <li>{@code stability = clamp(1 − turnPenalty × (turns − 1)) × outcomeFactor(lastVerdict)}
 *       with APPROVE=1.0, FLAG=0.6, REFUTE=0.2; {@value #NEUTRAL_TERM} when no turn completed.</li>
 *   <li>{@code router = mean(1 − segment.entropy.mean)} over committed segments; 0 when none.</li>
 *   <li>{@code value = Σ(wᵢ × termᵢ) / Σwᵢ}.</li>
 *   <li>Caps: exhausted debate or budget → {@code exhaustedCap}; fewer than half of the
 *       selected specialists succeeded → {@code degradedCap}. The lowest cap wins.</li>
 * </ol>
 *
 * <p>This class is stateless and thread-safe.
 */
public class WeightedConfidenceEstimator implements ConfidenceEstimator {

    private static final double NEUTRAL_TERM = 0.5;

    private static final Map<Verdict, Double> OUTCOME_FACTORS = Map.of(
        Verdict.APPROVE, 1.0,
        Verdict.FLAG,    0.6,
        Verdict.REFUTE,  0.2
    );

    private final ConfidenceWeights weights;

    public WeightedConfidenceEstimator(ConfidenceWeights weights) {
        this.weights = weights;
    }

    @Override
    public ConfidenceScore estimate(DecisionContext ctx, DebateOutcome outcome) {
        double agreement = specialistAgreement(ctx.specialistResults());
        double stability = debateStability(ctx.debate());
        double router    = routerConfidence(ctx.segments());

        double value = (weights.agreementWeight() * agreement
                      + weights.stabilityWeight() * stability
                      + weights.routerWeight()    * router) / weights.total();
        value = clamp(value);

        List<String> capReasons = new ArrayList<>();
        if (outcome != null && outcome.capsConfidence() && value > weights.exhaustedCap()) {
            value = weights.exhaustedCap();
            capReasons.add(outcome == DebateOutcome.BUDGET_EXHAUSTED ? "budget_exhausted" : "debate_exhausted");
        }
        if (isDegraded(ctx.specialistResults()) && value > weights.degradedCap()) {
            value = weights.degradedCap();
            capReasons.add("degraded_evidence");
        }

        return new ConfidenceScore(
            value, agreement, stability, router,
            !capReasons.isEmpty(),
            capReasons.isEmpty() ? null : String.join(",", capReasons),
            RobustnessLabel.of(value));
    }

    double specialistAgreement(List<SpecialistResult> results) {
        if (results.isEmpty()) return NEUTRAL_TERM;

        Map<Stance, Integer> stanceCounts = new EnumMap<>(Stance.class);
        int succeeded = 0;
        for (SpecialistResult r : results) {
            if (!r.succeeded()) continue;
            succeeded++;
            stanceCounts.merge(r.stance(), 1, Integer::sum);
        }
        if (succeeded == 0) return 0.0;

        int majority = stanceCounts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        double successRatio  = (double) succeeded / results.size();
        double majorityShare = (double) majority / succeeded;
        return clamp(successRatio * majorityShare);
    }

    double debateStability(List<DebateTurn> debate) {
        if (debate.isEmpty()) return NEUTRAL_TERM;

        double turnFactor = clamp(1.0 - weights.turnPenalty() * (debate.size() - 1));
        Verdict last      = debate.get(debate.size() - 1).verdict();
        return clamp(turnFactor * OUTCOME_FACTORS.getOrDefault(last, 0.0));
    }

    double routerConfidence(List<ReasoningSegment> segments) {
        if (segments.isEmpty()) return 0.0;
        return clamp(segments.stream()
            .mapToDouble(s -> 1.0 - s.entropy().mean())
            .average()
            .orElse(0.0));
    }

    private boolean isDegraded(List<SpecialistResult> results) {
        if (results.isEmpty()) return false;
        long succeeded = results.stream().filter(SpecialistResult::succeeded).count();
        return succeeded * 2 < results.size();
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
