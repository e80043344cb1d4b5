package com.advisorplatform.orchestrator.router;

import com.advisorplatform.common.model.DebateTurn;
import com.advisorplatform.common.model.DecisionContext;
import com.advisorplatform.common.model.Intent;
import com.advisorplatform.common.model.IntentClassification;
import com.advisorplatform.common.model.SpecialistResult;
import com.advisorplatform.common.model.SpecialistTag;
import com.advisorplatform.common.model.Stance;
import com.advisorplatform.common.model.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ThesisPlannerTest {

    private static SpecialistResult ok(SpecialistTag tag, Stance stance) {
        return SpecialistResult.success(tag, Map.of(), tag.id() + " reads " + stance, stance);
    }

    private static DecisionContext ctx(List<SpecialistResult> results) {
        Instant now = Instant.parse("2026-03-02T14:00:00Z");
        return DecisionContext.assemble("corr-1", "Review my position in AAPL", "all", "AAPL", now, now.plusSeconds(90))
            .withIntent(new IntentClassification(Intent.POSITION_REVIEW,
                EnumSet.of(SpecialistTag.QUANT, SpecialistTag.SENTIMENT, SpecialistTag.RESEARCH), "AAPL", "test"))
            .withSpecialistResults(results);
    }

    @Nested
    @DisplayName("thesis plan")
    class Thesis {

        @Test
        @DisplayName("foundation first, synthesis last, one layer per evidence group present")
        void layout() {
            List<SegmentOutline> plan = ThesisPlanner.thesisPlan(ctx(List.of(
                ok(SpecialistTag.QUANT, Stance.BULLISH),
                ok(SpecialistTag.SENTIMENT, Stance.BULLISH),
                ok(SpecialistTag.RESEARCH, Stance.NEUTRAL))));

            assertThat(plan).extracting(SegmentOutline::title).containsExactly(
                ThesisPlanner.FOUNDATION, ThesisPlanner.TECHNICALS, ThesisPlanner.NARRATIVE, ThesisPlanner.SYNTHESIS);
            assertThat(plan.get(3).evidence()).contains("Recommendation: BUY");
        }

        @Test
        @DisplayName("a failed specialist shows up as unavailable evidence")
        void failedEvidence() {
            List<SegmentOutline> plan = ThesisPlanner.thesisPlan(ctx(List.of(
                ok(SpecialistTag.QUANT, Stance.BULLISH),
                SpecialistResult.failure(SpecialistTag.RESEARCH, "BACKEND_TIMEOUT: slow", 10))));

            SegmentOutline narrative = plan.stream()
                .filter(o -> o.title().equals(ThesisPlanner.NARRATIVE)).findFirst().orElseThrow();
            assertThat(narrative.evidence()).singleElement().asString().contains("evidence unavailable");
            assertThat(plan.get(0).evidence()).contains("1 of 2 specialists reported");
        }

        @Test
        @DisplayName("conflicting stances are called out and resolve to HOLD")
        void conflicting() {
            SegmentOutline synthesis = last(ThesisPlanner.thesisPlan(ctx(List.of(
                ok(SpecialistTag.QUANT, Stance.BULLISH),
                ok(SpecialistTag.SENTIMENT, Stance.BEARISH)))));

            assertThat(synthesis.evidence()).contains("Specialist signals are conflicting", "Recommendation: HOLD");
        }
    }

    @Nested
    @DisplayName("rebuttal plan")
    class Rebuttal {

        @Test
        @DisplayName("a refuted BUY against bearish evidence is revised to SELL")
        void revisesToEvidence() {
            DecisionContext c = ctx(List.of(
                    ok(SpecialistTag.QUANT, Stance.BEARISH),
                    ok(SpecialistTag.SENTIMENT, Stance.BEARISH)))
                .withDraft(List.of(), "Synthesis: buy.\n\nRecommendation: BUY");

            List<SegmentOutline> plan = ThesisPlanner.rebuttalPlan(c,
                DebateTurn.critic(1, Verdict.REFUTE, "Evidence is bearish."));

            assertThat(plan).extracting(SegmentOutline::title)
                .containsExactly(ThesisPlanner.REBUTTAL, ThesisPlanner.REVISED);
            assertThat(plan.get(0).evidence().get(0)).isEqualTo("Critique: Evidence is bearish.");
            assertThat(plan.get(1).evidence()).contains("Recommendation: SELL");
        }

        @Test
        @DisplayName("a refuted call that already matches the evidence steps down to HOLD")
        void stepsDownToHold() {
            DecisionContext c = ctx(List.of(ok(SpecialistTag.QUANT, Stance.BULLISH)))
                .withDraft(List.of(), "Recommendation: BUY");

            SegmentOutline revised = last(ThesisPlanner.rebuttalPlan(c,
                DebateTurn.critic(1, Verdict.REFUTE, "Too aggressive.")));
            assertThat(revised.evidence()).contains("Recommendation: HOLD");
        }
    }

    @Test
    @DisplayName("the last recommendation line wins")
    void lastRecommendationWins() {
        assertThat(Recommendations.extract("Recommendation: BUY\n\nRevised. Recommendation: **hold**"))
            .contains(Recommendations.HOLD);
        assertThat(Recommendations.extract("no call here")).isEmpty();
    }

    private static SegmentOutline last(List<SegmentOutline> plan) {
        return plan.get(plan.size() - 1);
    }
}
