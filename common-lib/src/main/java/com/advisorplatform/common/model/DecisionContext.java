package com.advisorplatform.common.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable snapshot of one advisory request as it moves through the orchestrator.
 *
 * <p><strong>Ownership:</strong> a {@code DecisionContext} belongs to exactly one request's
 * coordinating pipeline. Each phase receives the current snapshot and returns a new one via
 * the {@code withX} copy-factories; nothing is mutated in place and no instance is ever
 * shared with another request.
 *
 * <h3>Lifecycle</h3>
 * <ol>
 *   <li>{@link #assemble} at request entry: query, scope, correlation id, deadline.</li>
 *   <li>{@link #withIntent} after classification.</li>
 *   <li>{@link #withSpecialistResults} once the specialist burst has settled.</li>
 *   <li>{@link #withDraft} after every Router pass (initial thesis and each rebuttal).</li>
 *   <li>{@link #withDebateTurn} after every critic review.</li>
 *   <li>{@link #withConfidence} once, at debate termination.</li>
 * </ol>
 *
 * <p>{@link #transitionTo} enforces the {@link OrchestrationState} graph.
 */
public record DecisionContext(
    String                  correlationId,
    String                  query,
    String                  accountScope,
    String                  ticker,
    Instant                 receivedAt,
    Instant                 deadline,
    OrchestrationState      state,
    IntentClassification    intent,
    List<SpecialistResult>  specialistResults,
    List<ReasoningSegment>  segments,
    String                  thesis,
    List<DebateTurn>        debate,
    ConfidenceScore         confidence,
    List<String>            degradedReasons,
    ProposedAction          proposedAction
) {

    public DecisionContext {
        specialistResults = List.copyOf(specialistResults);
        segments          = List.copyOf(segments);
        debate            = List.copyOf(debate);
        degradedReasons   = List.copyOf(degradedReasons);
    }

    /**
     * Initial assembly at request entry. Everything downstream of classification is empty.
     */
    public static DecisionContext assemble(String correlationId, String query, String accountScope,
                                           String ticker, Instant receivedAt, Instant deadline) {
        return new DecisionContext(
            correlationId, query, accountScope == null ? "all" : accountScope, ticker,
            receivedAt, deadline,
            OrchestrationState.CLASSIFYING,
            null,        // intent           : set after CLASSIFYING
            List.of(),   // specialistResults: set after GATHERING
            List.of(),   // segments         : appended per DRAFTING pass
            null,        // thesis           : replaced per DRAFTING pass
            List.of(),   // debate           : appended per critic review
            null,        // confidence       : computed once at FINALIZING
            List.of(),
            null
        );
    }

    public DecisionContext transitionTo(OrchestrationState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next
                + " correlationId=" + correlationId);
        }
        return new DecisionContext(correlationId, query, accountScope, ticker, receivedAt, deadline,
            next, intent, specialistResults, segments, thesis, debate, confidence,
            degradedReasons, proposedAction);
    }

    public DecisionContext withIntent(IntentClassification classification) {
        String resolvedTicker = ticker != null && !ticker.isBlank() ? ticker : classification.ticker();
        return new DecisionContext(correlationId, query, accountScope, resolvedTicker, receivedAt, deadline,
            state, classification, specialistResults, segments, thesis, debate, confidence,
            degradedReasons, proposedAction);
    }

    public DecisionContext withSpecialistResults(List<SpecialistResult> results) {
        return new DecisionContext(correlationId, query, accountScope, ticker, receivedAt, deadline,
            state, intent, results, segments, thesis, debate, confidence,
            degradedReasons, proposedAction);
    }

    /** Appends the segments of one Router pass and replaces the running thesis with their stitch. */
    public DecisionContext withDraft(List<ReasoningSegment> newSegments, String stitchedThesis) {
        List<ReasoningSegment> all = new ArrayList<>(segments);
        all.addAll(newSegments);
        return new DecisionContext(correlationId, query, accountScope, ticker, receivedAt, deadline,
            state, intent, specialistResults, all, stitchedThesis, debate, confidence,
            degradedReasons, proposedAction);
    }

    public DecisionContext withDebateTurn(DebateTurn turn) {
        List<DebateTurn> all = new ArrayList<>(debate);
        all.add(turn);
        return new DecisionContext(correlationId, query, accountScope, ticker, receivedAt, deadline,
            state, intent, specialistResults, segments, thesis, all, confidence,
            degradedReasons, proposedAction);
    }

    public DecisionContext withConfidence(ConfidenceScore score) {
        if (confidence != null) {
            throw new IllegalStateException("Confidence already computed. correlationId=" + correlationId);
        }
        return new DecisionContext(correlationId, query, accountScope, ticker, receivedAt, deadline,
            state, intent, specialistResults, segments, thesis, debate, score,
            degradedReasons, proposedAction);
    }

    public DecisionContext withDegraded(String reason) {
        List<String> all = new ArrayList<>(degradedReasons);
        all.add(reason);
        return new DecisionContext(correlationId, query, accountScope, ticker, receivedAt, deadline,
            state, intent, specialistResults, segments, thesis, debate, confidence,
            all, proposedAction);
    }

    public DecisionContext withProposedAction(ProposedAction action) {
        return new DecisionContext(correlationId, query, accountScope, ticker, receivedAt, deadline,
            state, intent, specialistResults, segments, thesis, debate, confidence,
            degradedReasons, action);
    }

    // ── derived views ───────────────────────────────────────────────────────

    public List<SpecialistResult> succeededResults() {
        return specialistResults.stream().filter(SpecialistResult::succeeded).toList();
    }

    public int selectedSpecialistCount() {
        return specialistResults.size();
    }

    public boolean degraded() {
        return !degradedReasons.isEmpty();
    }

    public Verdict lastVerdict() {
        return debate.isEmpty() ? null : debate.get(debate.size() - 1).verdict();
    }

    public boolean deadlineExceeded(Instant now) {
        return deadline != null && !now.isBefore(deadline);
    }
}
