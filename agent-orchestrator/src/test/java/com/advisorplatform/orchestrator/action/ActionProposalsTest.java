package com.advisorplatform.orchestrator.action;

import com.advisorplatform.common.model.ActionType;
import com.advisorplatform.common.model.DecisionContext;
import com.advisorplatform.common.model.EntropySummary;
import com.advisorplatform.common.model.ModelTier;
import com.advisorplatform.common.model.ProposedAction;
import com.advisorplatform.common.model.ReasoningSegment;
import com.advisorplatform.common.model.SegmentPhase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ActionProposalsTest {

    private static final Instant NOW = Instant.parse("2026-03-02T14:00:00Z");

    private static DecisionContext drafted(String ticker, String... segmentTexts) {
        DecisionContext ctx = DecisionContext.assemble("corr-1", "Should I add to MSFT?", "all",
            ticker, NOW, NOW.plusSeconds(90));
        List<ReasoningSegment> segments = new ArrayList<>();
        for (int i = 0; i < segmentTexts.length; i++) {
            segments.add(new ReasoningSegment(i, SegmentPhase.THESIS, segmentTexts[i], ModelTier.SMALL,
                EntropySummary.of(List.of(0.1), false), false, false));
        }
        return ctx.withDraft(segments, String.join("\n\n", segmentTexts));
    }

    @Test
    @DisplayName("a BUY thesis becomes a proposal that requires authorization and carries a verifiable digest")
    void buyProposes() {
        DecisionContext ctx = drafted("MSFT",
            "Fundamentals are solid.",
            "Signals lean bullish. Recommendation: BUY");

        Optional<ProposedAction> proposal = ActionProposals.from(ctx);

        assertThat(proposal).isPresent();
        ProposedAction action = proposal.get();
        assertThat(action.action()).isEqualTo(ActionType.BUY);
        assertThat(action.ticker()).isEqualTo("MSFT");
        assertThat(action.correlationId()).isEqualTo("corr-1");
        assertThat(action.requiresAuthorization()).isTrue();
        assertThat(action.rationale()).isEqualTo("Signals lean bullish. Recommendation: BUY");
        assertThat(action.digest()).isEqualTo(ActionProposals.digest(action.proposalId(), "corr-1",
            ActionType.BUY, "MSFT", action.rationale()));
    }

    @Test
    @DisplayName("a revised recommendation later in the thesis wins")
    void lastRecommendationWins() {
        DecisionContext ctx = drafted("MSFT",
            "Recommendation: BUY",
            "The critic raised valuation risk. Recommendation: SELL");

        assertThat(ActionProposals.from(ctx)).get()
            .extracting(ProposedAction::action).isEqualTo(ActionType.SELL);
    }

    @Test
    @DisplayName("HOLD proposes nothing")
    void holdProposesNothing() {
        assertThat(ActionProposals.from(drafted("MSFT", "Recommendation: HOLD"))).isEmpty();
    }

    @Test
    @DisplayName("no ticker, no proposal")
    void noTicker() {
        assertThat(ActionProposals.from(drafted(null, "Recommendation: BUY"))).isEmpty();
    }

    @Test
    @DisplayName("a long rationale is capped")
    void rationaleCapped() {
        String longText = "x".repeat(ActionProposals.MAX_RATIONALE + 50) + " Recommendation: REBALANCE";
        ProposedAction action = ActionProposals.from(drafted("MSFT", longText)).orElseThrow();

        assertThat(action.action()).isEqualTo(ActionType.REBALANCE);
        assertThat(action.rationale()).hasSize(ActionProposals.MAX_RATIONALE);
    }

    @Test
    @DisplayName("the digest changes when any signed field changes")
    void digestCoversFields() {
        String base = ActionProposals.digest("p-1", "corr-1", ActionType.BUY, "MSFT", "why");
        assertThat(base).isEqualTo(ActionProposals.digest("p-1", "corr-1", ActionType.BUY, "MSFT", "why"));
        assertThat(base).isNotEqualTo(ActionProposals.digest("p-1", "corr-1", ActionType.SELL, "MSFT", "why"));
        assertThat(base).isNotEqualTo(ActionProposals.digest("p-1", "corr-1", ActionType.BUY, "AAPL", "why"));
    }
}
