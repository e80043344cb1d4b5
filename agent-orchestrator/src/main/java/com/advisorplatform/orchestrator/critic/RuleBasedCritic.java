package com.advisorplatform.orchestrator.critic;

import com.advisorplatform.common.model.DebateTurn;
import com.advisorplatform.common.model.DecisionContext;
import com.advisorplatform.common.model.ReasoningSegment;
import com.advisorplatform.common.model.Stance;
import com.advisorplatform.common.model.Verdict;
import com.advisorplatform.orchestrator.router.Recommendations;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic risk review used when no large model is live.
 *
 * <ul>
 *   <li>REFUTE a BUY the evidence majority reads bearish, or a SELL it reads bullish</li>
 *   <li>FLAG degraded evidence, low-confidence segments, or a directional call on conflicting signals</li>
 *   <li>APPROVE otherwise</li>
 * </ul>
 */
public class RuleBasedCritic implements Critic {

    @Override
    public Mono<DebateTurn> review(DecisionContext ctx, int turnIndex) {
        return Mono.fromCallable(() -> evaluate(ctx, turnIndex));
    }

    DebateTurn evaluate(DecisionContext ctx, int turnIndex) {
        String recommendation = Recommendations.extract(ctx.thesis()).orElse(Recommendations.HOLD);
        Stance majority = Recommendations.majorityStance(ctx.specialistResults());

        if (Recommendations.BUY.equals(recommendation) && majority == Stance.BEARISH) {
            return DebateTurn.critic(turnIndex, Verdict.REFUTE,
                "Thesis recommends BUY but the specialist majority reads bearish; the upside case is unsupported.");
        }
        if (Recommendations.SELL.equals(recommendation) && majority == Stance.BULLISH) {
            return DebateTurn.critic(turnIndex, Verdict.REFUTE,
                "Thesis recommends SELL but the specialist majority reads bullish; the downside case is unsupported.");
        }

        List<String> concerns = new ArrayList<>();
        if (ctx.degraded()) {
            concerns.add("evidence is degraded (" + String.join("; ", ctx.degradedReasons()) + ")");
        }
        long lowConfidence = ctx.segments().stream().filter(ReasoningSegment::lowConfidence).count();
        if (lowConfidence > 0) {
            concerns.add(lowConfidence + " reasoning segment(s) remain low-confidence");
        }
        if (!Recommendations.HOLD.equals(recommendation) && Recommendations.conflicting(ctx.specialistResults())) {
            concerns.add("a " + recommendation.toLowerCase(Locale.ROOT) + " call rests on conflicting specialist signals");
        }
        if (!concerns.isEmpty()) {
            String rationale = String.join("; ", concerns);
            return DebateTurn.critic(turnIndex, Verdict.FLAG,
                Character.toUpperCase(rationale.charAt(0)) + rationale.substring(1) + ".");
        }
        return DebateTurn.critic(turnIndex, Verdict.APPROVE, "Thesis is consistent with the specialist evidence.");
    }
}
