package com.advisorplatform.orchestrator.action;

import com.advisorplatform.common.model.ActionType;
import com.advisorplatform.common.model.DecisionContext;
import com.advisorplatform.common.model.ProposedAction;
import com.advisorplatform.common.model.ReasoningSegment;
import com.advisorplatform.common.trace.Digests;
import com.advisorplatform.orchestrator.router.Recommendations;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Sensitive-action gate: a thesis that ends on a trade recommendation becomes a
 * {@link ProposedAction} that always requires human authorization. HOLD proposes nothing.
 */
public final class ActionProposals {

    static final int MAX_RATIONALE = 600;

    private ActionProposals() { /* utility class */ }

    public static Optional<ProposedAction> from(DecisionContext ctx) {
        Optional<ActionType> action = Recommendations.extract(ctx.thesis()).flatMap(ActionProposals::toAction);
        if (action.isEmpty() || ctx.ticker() == null || ctx.ticker().isBlank()) {
            return Optional.empty();
        }

        String proposalId = UUID.randomUUID().toString();
        String rationale  = rationale(ctx.segments());
        String digest     = digest(proposalId, ctx.correlationId(), action.get(), ctx.ticker(), rationale);
        return Optional.of(new ProposedAction(proposalId, ctx.correlationId(), action.get(),
            ctx.ticker(), rationale, digest, true));
    }

    /** SHA-256 over the fields the authorization boundary signs, pipe-joined in declaration order. */
    public static String digest(String proposalId, String correlationId, ActionType action,
                                String ticker, String rationale) {
        return Digests.sha256(String.join("|", proposalId, correlationId, action.name(), ticker, rationale));
    }

    static Optional<ActionType> toAction(String recommendation) {
        return switch (recommendation) {
            case Recommendations.BUY       -> Optional.of(ActionType.BUY);
            case Recommendations.SELL      -> Optional.of(ActionType.SELL);
            case Recommendations.REBALANCE -> Optional.of(ActionType.REBALANCE);
            default                        -> Optional.empty();
        };
    }

    // the last committed segment carries the (possibly revised) recommendation
    private static String rationale(List<ReasoningSegment> segments) {
        if (segments.isEmpty()) return "";
        String text = segments.get(segments.size() - 1).text();
        return text.length() <= MAX_RATIONALE ? text : text.substring(0, MAX_RATIONALE);
    }
}
