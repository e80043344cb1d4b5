package com.advisorplatform.orchestrator.service;

import com.advisorplatform.common.confidence.ConfidenceEstimator;
import com.advisorplatform.common.exception.AdvisoryException;
import com.advisorplatform.common.model.ConfidenceScore;
import com.advisorplatform.common.model.ContextSnapshot;
import com.advisorplatform.common.model.DebateOutcome;
import com.advisorplatform.common.model.DebateTurn;
import com.advisorplatform.common.model.DecisionContext;
import com.advisorplatform.common.model.HopOutcome;
import com.advisorplatform.common.model.OrchestrationState;
import com.advisorplatform.common.model.ProposedAction;
import com.advisorplatform.common.model.ReasoningSegment;
import com.advisorplatform.common.model.SegmentPhase;
import com.advisorplatform.common.model.SpecialistResult;
import com.advisorplatform.common.model.SpecialistTag;
import com.advisorplatform.common.model.StreamEventType;
import com.advisorplatform.common.model.Verdict;
import com.advisorplatform.common.result.ErrorKind;
import com.advisorplatform.common.trace.TraceContextUtil;
import com.advisorplatform.orchestrator.action.ActionProposalPublisher;
import com.advisorplatform.orchestrator.action.ActionProposals;
import com.advisorplatform.orchestrator.critic.Critic;
import com.advisorplatform.orchestrator.event.ErrorPayload;
import com.advisorplatform.orchestrator.event.FinalPayload;
import com.advisorplatform.orchestrator.event.StatusPayload;
import com.advisorplatform.orchestrator.intent.IntentClassifier;
import com.advisorplatform.orchestrator.logger.DecisionFlowLogger;
import com.advisorplatform.orchestrator.router.RStitchRouter;
import com.advisorplatform.orchestrator.router.Recommendations;
import com.advisorplatform.orchestrator.router.SegmentOutcome;
import com.advisorplatform.orchestrator.router.SegmentOutline;
import com.advisorplatform.orchestrator.router.SegmentStitcher;
import com.advisorplatform.orchestrator.router.ThesisPlanner;
import com.advisorplatform.orchestrator.status.AgentStatusRegistry;
import com.advisorplatform.orchestrator.stream.AdvisoryEventSink;
import com.advisorplatform.orchestrator.trace.TraceRecorder;
import com.advisorplatform.orchestrator.trace.TraceRecorder.RequestTrace;
import com.advisorplatform.specialist.service.SpecialistDispatchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The proposer: drives one request through
 * {@code CLASSIFYING → GATHERING → DRAFTING → DEBATING → FINALIZING → DONE}.
 *
 * <p>Every state change emits a {@code status} event; every agent hop is handed to the
 * trace writer under the request's correlation id. The returned {@code Mono} always
 * completes with the last {@link DecisionContext}: unrecoverable failures are reported
 * through an {@code error} event and an {@code ABORTED} context, never as an error signal.
 * Cancelling the subscription cancels the specialist burst and the Router in flight.
 *
 * <p>The debate is bounded by {@code orchestrator.max-debate-turns}. A REFUTE before the
 * last turn loops back to DRAFTING for a rebuttal; APPROVE and FLAG finalize; a REFUTE
 * on the last turn finalizes as exhausted. When the request budget runs out mid-debate
 * the last thesis is finalized immediately with capped confidence.
 *
 * <p>The first review always runs, even on a spent budget: it may use up to half of
 * {@code orchestrator.hard-stop-grace} past the deadline. A thesis the critic never
 * reviewed is finalized with capped confidence and a disagreement note, and proposes no action.
 */
@Service
public class OrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorService.class);

    static final String NOT_REVIEWED = "thesis not reviewed: budget exhausted";

    private final IntentClassifier          intentClassifier;
    private final SpecialistDispatchService dispatchService;
    private final RStitchRouter             router;
    private final Critic                    critic;
    private final ConfidenceEstimator       confidenceEstimator;
    private final ActionProposalPublisher   actionPublisher;
    private final TraceRecorder             traceRecorder;
    private final AgentStatusRegistry       statusRegistry;
    private final DecisionFlowLogger        decisionFlowLogger;
    private final Clock                     clock;
    private final int                       maxDebateTurns;
    private final Duration                  specialistTimeout;
    private final Duration                  hardStopGrace;

    public OrchestratorService(IntentClassifier intentClassifier,
                               SpecialistDispatchService dispatchService,
                               RStitchRouter router,
                               Critic critic,
                               ConfidenceEstimator confidenceEstimator,
                               ActionProposalPublisher actionPublisher,
                               TraceRecorder traceRecorder,
                               AgentStatusRegistry statusRegistry,
                               DecisionFlowLogger decisionFlowLogger,
                               Clock clock,
                               @Value("${orchestrator.max-debate-turns:2}") int maxDebateTurns,
                               @Value("${orchestrator.specialist-timeout:PT10S}") Duration specialistTimeout,
                               @Value("${orchestrator.hard-stop-grace:PT15S}") Duration hardStopGrace) {
        if (maxDebateTurns < 1) {
            throw new IllegalArgumentException("orchestrator.max-debate-turns must be >= 1");
        }
        this.intentClassifier    = intentClassifier;
        this.dispatchService     = dispatchService;
        this.router              = router;
        this.critic              = critic;
        this.confidenceEstimator = confidenceEstimator;
        this.actionPublisher     = actionPublisher;
        this.traceRecorder       = traceRecorder;
        this.statusRegistry      = statusRegistry;
        this.decisionFlowLogger  = decisionFlowLogger;
        this.clock               = clock;
        this.maxDebateTurns      = maxDebateTurns;
        this.specialistTimeout   = specialistTimeout;
        this.hardStopGrace       = hardStopGrace;
    }

    /**
     * Runs the full lifecycle for {@code initial}, publishing into {@code sink}.
     *
     * @param initial context built by {@link DecisionContext#assemble}, state CLASSIFYING
     */
    public Mono<DecisionContext> orchestrate(DecisionContext initial, AdvisoryEventSink sink) {
        return Mono.defer(() -> {
            RequestTrace trace = traceRecorder.open(initial.correlationId());
            // Latest snapshot, read by the error and cancel handlers.
            AtomicReference<DecisionContext> latest = new AtomicReference<>(initial);
            Duration hardStop = initial.deadline() != null
                ? Duration.between(clock.instant(), initial.deadline()).plus(hardStopGrace)
                : Duration.ofMinutes(5);
            if (hardStop.compareTo(hardStopGrace) < 0) {
                hardStop = hardStopGrace;
            }
            Duration hardStopLimit = hardStop;

            log.info("Advisory orchestration started. correlationId={} ticker={} scope={}",
                initial.correlationId(), initial.ticker(), initial.accountScope());
            emitStatus(sink, initial, "classifying request");

            Mono<DecisionContext> pipeline = Mono.just(initial)
                .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.REQUEST_RECEIVED))
                .flatMap(ctx -> classify(ctx, trace))
                .doOnNext(latest::set)
                .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.INTENT_CLASSIFIED))
                .map(ctx -> transition(ctx, OrchestrationState.GATHERING, sink,
                    "dispatching " + ctx.intent().specialists().size() + " specialists"))
                .doOnNext(latest::set)
                .flatMap(ctx -> gather(ctx, sink, trace))
                .doOnNext(latest::set)
                .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.SPECIALISTS_SETTLED))
                .map(ctx -> transition(ctx, OrchestrationState.DRAFTING, sink, "drafting thesis"))
                .doOnNext(latest::set)
                .flatMap(ctx -> draft(ctx, SegmentPhase.THESIS, ThesisPlanner.thesisPlan(ctx), sink, trace))
                .doOnNext(latest::set)
                .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.THESIS_DRAFTED))
                .map(ctx -> transition(ctx, OrchestrationState.DEBATING, sink, "risk review, turn 1"))
                .doOnNext(latest::set)
                .flatMap(ctx -> debate(ctx, 1, sink, trace, latest))
                .map(debated -> finalizeDecision(debated, sink, trace))
                .doOnNext(latest::set)
                .timeout(hardStopLimit, Mono.<DecisionContext>error(() -> new AdvisoryException(
                    ErrorKind.BACKEND_TIMEOUT, "request exceeded its hard stop of " + hardStopLimit.toMillis() + "ms")))
                .onErrorResume(e -> Mono.just(fail(latest.get(), e, sink, trace)))
                .doOnCancel(() -> {
                    DecisionContext ctx = latest.get();
                    trace.hop("orchestrator:abort", ctx.state().name(), "cancelled", 0L, HopOutcome.ERROR, null);
                    log.warn("Advisory orchestration cancelled. correlationId={} state={}",
                        ctx.correlationId(), ctx.state());
                });

            return TraceContextUtil.withTraceId(pipeline, initial.correlationId());
        });
    }

    // ── CLASSIFYING ─────────────────────────────────────────────────────────

    private Mono<DecisionContext> classify(DecisionContext ctx, RequestTrace trace) {
        long start = System.nanoTime();
        return statusRegistry.track(AgentStatusRegistry.INTENT, intentClassifier.classify(ctx.query(), ctx.ticker()))
            .map(classification -> {
                trace.hop("intent", ctx.query(), classification.intent() + " " + classification.specialists()
                    + " " + classification.ticker(), elapsedMs(start), HopOutcome.OK, null);
                return ctx.withIntent(classification);
            });
    }

    // ── GATHERING ───────────────────────────────────────────────────────────

    private Mono<DecisionContext> gather(DecisionContext ctx, AdvisoryEventSink sink, RequestTrace trace) {
        ContextSnapshot snapshot = ContextSnapshot.of(ctx);
        Set<SpecialistTag> pending = ConcurrentHashMap.newKeySet();
        pending.addAll(ctx.intent().specialists());
        pending.forEach(tag -> statusRegistry.markWorking(AgentStatusRegistry.specialist(tag)));

        return dispatchService.burst(ctx.query(), snapshot, ctx.intent().specialists(), specialistTimeout)
            .doOnNext(result -> {
                if (pending.remove(result.specialistTag())) {
                    statusRegistry.markReady(AgentStatusRegistry.specialist(result.specialistTag()));
                }
                sink.emit(StreamEventType.SPECIALIST_RESULT, result);
                trace.hop("specialist:" + result.specialistTag().id(),
                    ctx.query() + "|" + snapshot.ticker(),
                    result.succeeded() ? result.narrativeText() : result.error(),
                    result.latencyMs(),
                    result.succeeded() ? HopOutcome.OK : HopOutcome.ERROR,
                    null);
            })
            .collectSortedList((a, b) -> a.specialistTag().compareTo(b.specialistTag()))
            // tags whose result never arrived (cancelled, unregistered) go back to ready
            .doFinally(signal -> pending.forEach(tag -> {
                if (pending.remove(tag)) statusRegistry.markReady(AgentStatusRegistry.specialist(tag));
            }))
            .map(results -> settle(ctx, results));
    }

    private DecisionContext settle(DecisionContext ctx, List<SpecialistResult> results) {
        DecisionContext next = ctx.withSpecialistResults(results);
        int total = results.size();
        int ok = next.succeededResults().size();
        log.info("Specialist burst settled. correlationId={} ok={} total={}", ctx.correlationId(), ok, total);

        if (total > 0 && ok == 0) {
            throw new AdvisoryException(ErrorKind.ALL_SPECIALISTS_FAILED,
                "all " + total + " selected specialists failed");
        }
        if (ok * 2 < total) {
            next = next.withDegraded("only " + ok + " of " + total + " specialists succeeded");
        }
        return next;
    }

    // ── DRAFTING ────────────────────────────────────────────────────────────

    private Mono<DecisionContext> draft(DecisionContext ctx, SegmentPhase phase, List<SegmentOutline> plan,
                                        AdvisoryEventSink sink, RequestTrace trace) {
        String component = "router:" + phase.name().toLowerCase(Locale.ROOT);
        String priorText = phase == SegmentPhase.THESIS ? "" : ctx.thesis();

        return statusRegistry.track(AgentStatusRegistry.ROUTER,
                router.draft(ctx.query(), phase, plan, priorText, ctx.segments().size())
                    .doOnNext(outcome -> recordSegment(outcome, component, sink, trace))
                    .collectList())
            .map(outcomes -> {
                List<ReasoningSegment> committed = new ArrayList<>();
                DecisionContext next = ctx;
                for (SegmentOutcome o : outcomes) {
                    if (o.committed()) {
                        committed.add(o.segment());
                    } else {
                        next = next.withDegraded("segment '" + o.title() + "' dropped: " + o.droppedReason());
                    }
                }
                String pass = RStitchRouter.stitch(committed);
                String thesis = phase == SegmentPhase.THESIS ? pass : SegmentStitcher.append(ctx.thesis(), pass);
                return next.withDraft(committed, thesis);
            });
    }

    private void recordSegment(SegmentOutcome outcome, String component, AdvisoryEventSink sink, RequestTrace trace) {
        if (outcome.committed()) {
            ReasoningSegment segment = outcome.segment();
            sink.emit(StreamEventType.REASONING_SEGMENT, segment);
            trace.hop(component + ":" + segment.index(), outcome.prompt(), segment.text(), outcome.latencyMs(),
                segment.lowConfidence() ? HopOutcome.DEGRADED : HopOutcome.OK, outcome.modelLabel());
        } else {
            trace.hop(component + ":dropped", outcome.prompt(), outcome.droppedReason(), outcome.latencyMs(),
                HopOutcome.DEGRADED, outcome.modelLabel());
        }
    }

    // ── DEBATING ────────────────────────────────────────────────────────────

    /** Context at the end of the debate and how the debate ended. */
    record Debated(DecisionContext ctx, DebateOutcome outcome) {}

    private Mono<Debated> debate(DecisionContext ctx, int turn, AdvisoryEventSink sink,
                                 RequestTrace trace, AtomicReference<DecisionContext> latest) {
        Instant now = clock.instant();
        if (turn > 1 && ctx.deadlineExceeded(now)) {
            log.warn("Request budget exhausted before critic turn. correlationId={} turn={}", ctx.correlationId(), turn);
            return Mono.just(new Debated(ctx, DebateOutcome.BUDGET_EXHAUSTED));
        }
        Duration window = reviewWindow(turn, ctx.deadline() != null
            ? Duration.between(now, ctx.deadline())
            : Duration.ofMinutes(5));
        long start = System.nanoTime();

        return statusRegistry.track(AgentStatusRegistry.CRITIC, critic.review(ctx, turn))
            .timeout(window)
            .flatMap(verdictTurn -> {
                DecisionContext reviewed = ctx.withDebateTurn(verdictTurn);
                if (verdictTurn.degraded()) {
                    reviewed = reviewed.withDegraded("critic turn " + turn + " unavailable: " + verdictTurn.degradedReason());
                }
                latest.set(reviewed);
                sink.emit(StreamEventType.DEBATE_TURN, verdictTurn);
                trace.hop("critic:turn:" + turn, reviewed.thesis(),
                    verdictTurn.verdict() + " " + (verdictTurn.rationale() == null ? "" : verdictTurn.rationale()),
                    elapsedMs(start), verdictTurn.degraded() ? HopOutcome.DEGRADED : HopOutcome.OK, null);
                decisionFlowLogger.logWithTraceId(DecisionFlowLogger.CRITIC_REVIEWED, ctx.correlationId());

                if (verdictTurn.verdict() == Verdict.APPROVE) {
                    return Mono.just(new Debated(reviewed, DebateOutcome.APPROVED));
                }
                if (verdictTurn.verdict() == Verdict.FLAG) {
                    return Mono.just(new Debated(reviewed, DebateOutcome.FLAGGED));
                }
                if (turn >= maxDebateTurns) {
                    log.info("Debate exhausted without approval. correlationId={} turns={}", ctx.correlationId(), turn);
                    return Mono.just(new Debated(reviewed, DebateOutcome.EXHAUSTED));
                }
                return rebut(reviewed, verdictTurn, sink, trace, latest)
                    .flatMap(rebutted -> debate(rebutted, turn + 1, sink, trace, latest));
            })
            .onErrorResume(TimeoutException.class, e -> {
                DecisionContext current = latest.get();
                if (current.debate().isEmpty()) {
                    log.warn("Critic did not review the thesis within {}ms, finalizing unreviewed. correlationId={}",
                        window.toMillis(), current.correlationId());
                    current = current.withDegraded(NOT_REVIEWED);
                } else {
                    log.warn("Request budget exhausted mid-debate, finalizing. correlationId={} state={}",
                        current.correlationId(), current.state());
                }
                return Mono.just(new Debated(backToDebating(current, sink), DebateOutcome.BUDGET_EXHAUSTED));
            });
    }

    // the first review is never skipped; past the deadline it runs on part of the hard-stop grace
    private Duration reviewWindow(int turn, Duration remaining) {
        if (turn > 1) {
            return remaining;
        }
        Duration extension = hardStopGrace.dividedBy(2);
        return remaining.isNegative() ? extension : remaining.plus(extension);
    }

    private Mono<DecisionContext> rebut(DecisionContext reviewed, DebateTurn refutation, AdvisoryEventSink sink,
                                        RequestTrace trace, AtomicReference<DecisionContext> latest) {
        DecisionContext drafting = transition(reviewed, OrchestrationState.DRAFTING, sink,
            "drafting rebuttal to refutation on turn " + refutation.turnIndex());
        latest.set(drafting);
        Duration remaining = drafting.deadline() != null
            ? Duration.between(clock.instant(), drafting.deadline())
            : Duration.ofMinutes(5);
        if (remaining.isNegative() || remaining.isZero()) {
            return Mono.error(new TimeoutException("no budget left for rebuttal"));
        }

        return draft(drafting, SegmentPhase.REBUTTAL, ThesisPlanner.rebuttalPlan(drafting, refutation), sink, trace)
            .timeout(remaining)
            .doOnNext(latest::set)
            .doOnNext(ctx -> decisionFlowLogger.logWithTraceId(DecisionFlowLogger.REBUTTAL_DRAFTED, ctx.correlationId()))
            .map(ctx -> transition(ctx, OrchestrationState.DEBATING, sink,
                "risk review, turn " + (refutation.turnIndex() + 1)))
            .doOnNext(latest::set);
    }

    private DecisionContext backToDebating(DecisionContext ctx, AdvisoryEventSink sink) {
        return ctx.state() == OrchestrationState.DRAFTING
            ? transition(ctx, OrchestrationState.DEBATING, sink, "budget exhausted during rebuttal")
            : ctx;
    }

    // ── FINALIZING ──────────────────────────────────────────────────────────

    private DecisionContext finalizeDecision(Debated debated, AdvisoryEventSink sink, RequestTrace trace) {
        long start = System.nanoTime();
        DecisionContext ctx = transition(debated.ctx(), OrchestrationState.FINALIZING, sink,
            "finalizing, debate " + debated.outcome().name().toLowerCase(Locale.ROOT));

        ConfidenceScore score = confidenceEstimator.estimate(ctx, debated.outcome());
        ctx = ctx.withConfidence(score);

        // nothing leaves for authorization unless the critic has seen the thesis
        ProposedAction action = ctx.debate().isEmpty() ? null : ActionProposals.from(ctx).orElse(null);
        if (action != null) {
            ctx = ctx.withProposedAction(action);
            actionPublisher.publish(action);
        }

        FinalPayload payload = toFinalPayload(ctx, debated.outcome());
        trace.hop("finalize", ctx.thesis(), payload.recommendation() + " " + score.value(),
            elapsedMs(start), ctx.degraded() ? HopOutcome.DEGRADED : HopOutcome.OK, null);
        sink.emit(StreamEventType.FINAL, payload);

        DecisionContext done = ctx.transitionTo(OrchestrationState.DONE);
        decisionFlowLogger.logTransition(OrchestrationState.FINALIZING, OrchestrationState.DONE, done.correlationId());
        decisionFlowLogger.logDecisionContext(done);
        return done;
    }

    private FinalPayload toFinalPayload(DecisionContext ctx, DebateOutcome outcome) {
        String disagreement = null;
        if (ctx.debate().isEmpty()) {
            disagreement = NOT_REVIEWED;
        } else if (outcome != DebateOutcome.APPROVED) {
            disagreement = ctx.debate().get(ctx.debate().size() - 1).rationale();
        }
        List<FinalPayload.SpecialistSummary> specialists = ctx.specialistResults().stream()
            .map(r -> new FinalPayload.SpecialistSummary(r.specialistTag(), r.succeeded(), r.stance(),
                r.cached(), r.error()))
            .toList();
        int escalated = (int) ctx.segments().stream().filter(ReasoningSegment::escalated).count();

        return new FinalPayload(
            ctx.ticker(),
            ctx.intent() != null ? ctx.intent().intent() : null,
            ctx.thesis(),
            Recommendations.extract(ctx.thesis()).orElse(Recommendations.HOLD),
            ctx.confidence(),
            outcome,
            ctx.debate().size(),
            disagreement,
            specialists,
            ctx.segments().size(),
            escalated,
            ctx.degradedReasons(),
            ctx.proposedAction());
    }

    // ── failure ─────────────────────────────────────────────────────────────

    private DecisionContext fail(DecisionContext ctx, Throwable e, AdvisoryEventSink sink, RequestTrace trace) {
        ErrorKind kind = ErrorKind.classify(e);
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        if (kind == ErrorKind.INTERNAL) {
            log.error("Advisory orchestration failed. correlationId={} state={}", ctx.correlationId(), ctx.state(), e);
        } else {
            log.warn("Advisory orchestration aborted. correlationId={} state={} kind={} reason={}",
                ctx.correlationId(), ctx.state(), kind, message);
        }

        trace.hop("orchestrator:error", ctx.state().name(), kind + ": " + message, 0L, HopOutcome.ERROR, null);
        sink.emit(StreamEventType.ERROR, new ErrorPayload(kind, message, ctx.state()));
        if (ctx.state().isTerminal()) {
            return ctx;
        }
        decisionFlowLogger.logTransition(ctx.state(), OrchestrationState.ABORTED, ctx.correlationId());
        return ctx.transitionTo(OrchestrationState.ABORTED);
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    private DecisionContext transition(DecisionContext ctx, OrchestrationState next, AdvisoryEventSink sink,
                                       String detail) {
        DecisionContext moved = ctx.transitionTo(next);
        decisionFlowLogger.logTransition(ctx.state(), next, ctx.correlationId());
        emitStatus(sink, moved, detail);
        return moved;
    }

    private static void emitStatus(AdvisoryEventSink sink, DecisionContext ctx, String detail) {
        sink.emit(StreamEventType.STATUS, new StatusPayload(ctx.state(), detail));
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
