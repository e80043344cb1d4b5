package com.advisorplatform.orchestrator.service;

import com.advisorplatform.common.confidence.ConfidenceWeights;
import com.advisorplatform.common.confidence.WeightedConfidenceEstimator;
import com.advisorplatform.common.model.ActionType;
import com.advisorplatform.common.model.ContextSnapshot;
import com.advisorplatform.common.model.DebateOutcome;
import com.advisorplatform.common.model.DebateTurn;
import com.advisorplatform.common.model.DecisionContext;
import com.advisorplatform.common.model.HopOutcome;
import com.advisorplatform.common.model.ModelTier;
import com.advisorplatform.common.model.OrchestrationState;
import com.advisorplatform.common.model.ProposedAction;
import com.advisorplatform.common.model.SpecialistResult;
import com.advisorplatform.common.model.SpecialistTag;
import com.advisorplatform.common.model.Stance;
import com.advisorplatform.common.model.StreamEvent;
import com.advisorplatform.common.model.StreamEventType;
import com.advisorplatform.common.model.TraceRecord;
import com.advisorplatform.common.model.Verdict;
import com.advisorplatform.common.result.ErrorKind;
import com.advisorplatform.common.result.Result;
import com.advisorplatform.common.result.RetryPolicy;
import com.advisorplatform.orchestrator.action.ActionProposals;
import com.advisorplatform.orchestrator.critic.Critic;
import com.advisorplatform.orchestrator.event.ErrorPayload;
import com.advisorplatform.orchestrator.event.FinalPayload;
import com.advisorplatform.orchestrator.event.StatusPayload;
import com.advisorplatform.orchestrator.gateway.ModelGateway;
import com.advisorplatform.orchestrator.gateway.TemplateBackend;
import com.advisorplatform.orchestrator.intent.IntentClassifier;
import com.advisorplatform.orchestrator.logger.DecisionFlowLogger;
import com.advisorplatform.orchestrator.router.RStitchRouter;
import com.advisorplatform.orchestrator.status.AgentStatus;
import com.advisorplatform.orchestrator.status.AgentStatusRegistry;
import com.advisorplatform.orchestrator.stream.StreamSession;
import com.advisorplatform.orchestrator.trace.TraceRecorder;
import com.advisorplatform.specialist.agent.Specialist;
import com.advisorplatform.specialist.cache.SpecialistResultCache;
import com.advisorplatform.specialist.service.SpecialistDispatchService;
import com.advisorplatform.specialist.service.SpecialistRegistry;
import com.advisorplatform.trace.service.TraceService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class OrchestratorServiceTest {

    private static final String QUERY  = "Review my position in AAPL";
    private static final String TICKER = "AAPL";

    private final Clock clock = Clock.systemUTC();
    private final List<TraceRecord> hops = new CopyOnWriteArrayList<>();
    private final List<ProposedAction> proposals = new CopyOnWriteArrayList<>();
    private final AgentStatusRegistry statusRegistry = new AgentStatusRegistry(clock);

    /** Trace writer that keeps hops in memory, synchronously. */
    private final TraceService traceService = new TraceService(null, 0, Duration.ZERO) {
        @Override
        public void record(TraceRecord record) {
            hops.add(record);
        }
    };

    // ── fixture ─────────────────────────────────────────────────────────────

    private static Specialist specialist(SpecialistTag tag, Result<SpecialistResult> outcome) {
        return new Specialist() {
            @Override public SpecialistTag tag() { return tag; }

            @Override
            public Mono<Result<SpecialistResult>> invoke(String query, ContextSnapshot snapshot, Duration timeout) {
                return Mono.just(outcome);
            }
        };
    }

    private static Result<SpecialistResult> reads(SpecialistTag tag, Stance stance) {
        return Result.ok(SpecialistResult.success(tag, Map.of("signal", stance.name()),
            tag.id() + " signals point " + stance.name().toLowerCase(Locale.ROOT) + " for the stock", stance));
    }

    private static Specialist delayed(Specialist delegate, Duration delay) {
        return new Specialist() {
            @Override public SpecialistTag tag() { return delegate.tag(); }

            @Override
            public Mono<Result<SpecialistResult>> invoke(String query, ContextSnapshot snapshot, Duration timeout) {
                return Mono.delay(delay).then(delegate.invoke(query, snapshot, timeout));
            }
        };
    }

    private static List<Specialist> allBullish() {
        return List.of(
            specialist(SpecialistTag.QUANT, reads(SpecialistTag.QUANT, Stance.BULLISH)),
            specialist(SpecialistTag.SENTIMENT, reads(SpecialistTag.SENTIMENT, Stance.BULLISH)),
            specialist(SpecialistTag.RESEARCH, reads(SpecialistTag.RESEARCH, Stance.BULLISH)));
    }

    private static Critic verdicts(Verdict... sequence) {
        AtomicInteger call = new AtomicInteger();
        return (ctx, turn) -> {
            Verdict v = sequence[Math.min(call.getAndIncrement(), sequence.length - 1)];
            return Mono.just(DebateTurn.critic(turn, v,
                v == Verdict.APPROVE ? null : "Turn " + turn + " objection: downside risk is understated."));
        };
    }

    private OrchestratorService service(List<Specialist> specialists, Critic critic) {
        return service(specialists, critic, Duration.ofSeconds(5));
    }

    private OrchestratorService service(List<Specialist> specialists, Critic critic, Duration hardStopGrace) {
        ModelGateway gateway = new ModelGateway(
            Map.of(ModelTier.SMALL, new TemplateBackend(ModelTier.SMALL),
                   ModelTier.LARGE, new TemplateBackend(ModelTier.LARGE)),
            Map.of(ModelTier.SMALL, Duration.ofSeconds(1), ModelTier.LARGE, Duration.ofSeconds(1)),
            RetryPolicy.none());

        return new OrchestratorService(
            new IntentClassifier(gateway, new ObjectMapper()),
            new SpecialistDispatchService(new SpecialistRegistry(specialists),
                new SpecialistResultCache(clock, false)),
            new RStitchRouter(gateway, 0.4, 0.7, 256, 0.2),
            critic,
            new WeightedConfidenceEstimator(ConfidenceWeights.defaults()),
            proposals::add,
            new TraceRecorder(traceService, clock),
            statusRegistry,
            new DecisionFlowLogger(),
            clock,
            2,
            Duration.ofSeconds(2),
            hardStopGrace);
    }

    private DecisionContext request(Duration budget) {
        Instant now = clock.instant();
        return DecisionContext.assemble(UUID.randomUUID().toString(), QUERY, "all", TICKER, now, now.plus(budget));
    }

    /** Outcome of one complete run: the last context plus every event the session saw. */
    private record Run(DecisionContext ctx, List<StreamEvent> events) {

        List<StreamEvent> ofType(StreamEventType type) {
            return events.stream().filter(e -> e.type() == type).toList();
        }

        StreamEvent last() {
            return events.get(events.size() - 1);
        }

        FinalPayload fin() {
            return (FinalPayload) last().payload();
        }
    }

    private Run run(OrchestratorService service) {
        return run(service, Duration.ofSeconds(30));
    }

    private Run run(OrchestratorService service, Duration budget) {
        DecisionContext ctx = request(budget);
        StreamSession session = new StreamSession("s-" + ctx.correlationId(), ctx.correlationId(), clock);
        DecisionContext done = service.orchestrate(ctx, session).block(Duration.ofSeconds(10));
        List<StreamEvent> events = session.events(0).collectList().block(Duration.ofSeconds(1));
        return new Run(done, events);
    }

    // ── scenarios ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("happy path")
    class HappyPath {

        @Test
        @DisplayName("consistent evidence approved on the first turn finalizes with a BUY proposal")
        void approvedFirstTurn() {
            Run run = run(service(allBullish(), verdicts(Verdict.APPROVE)));

            assertThat(run.ctx().state()).isEqualTo(OrchestrationState.DONE);
            assertThat(run.last().type()).isEqualTo(StreamEventType.FINAL);
            FinalPayload fin = run.fin();
            assertThat(fin.recommendation()).isEqualTo("BUY");
            assertThat(fin.debateOutcome()).isEqualTo(DebateOutcome.APPROVED);
            assertThat(fin.debateTurns()).isEqualTo(1);
            assertThat(fin.unresolvedDisagreement()).isNull();
            assertThat(fin.confidence().capped()).isFalse();
            assertThat(fin.confidence().value()).isBetween(0.0, 1.0);

            assertThat(proposals).singleElement().satisfies(p -> {
                assertThat(p.action()).isEqualTo(ActionType.BUY);
                assertThat(p.requiresAuthorization()).isTrue();
                assertThat(p.digest()).isEqualTo(ActionProposals.digest(
                    p.proposalId(), p.correlationId(), p.action(), p.ticker(), p.rationale()));
            });
            assertThat(fin.proposedAction()).isEqualTo(proposals.get(0));
        }

        @Test
        @DisplayName("seq is gap-free from 1 and exactly one terminal event closes the stream")
        void eventOrdering() {
            Run run = run(service(allBullish(), verdicts(Verdict.APPROVE)));

            assertThat(run.events()).extracting(StreamEvent::seq)
                .containsExactlyElementsOf(IntStream.rangeClosed(1, run.events().size())
                    .mapToObj(Long::valueOf).toList());
            assertThat(run.events()).filteredOn(e -> e.type().isTerminal()).hasSize(1);
            assertThat(run.events()).allMatch(e -> e.correlationId().equals(run.ctx().correlationId()));
        }

        @Test
        @DisplayName("every state change is announced with a status event, in order")
        void statusSequence() {
            Run run = run(service(allBullish(), verdicts(Verdict.APPROVE)));

            assertThat(run.ofType(StreamEventType.STATUS))
                .extracting(e -> ((StatusPayload) e.payload()).state())
                .containsExactly(
                    OrchestrationState.CLASSIFYING, OrchestrationState.GATHERING, OrchestrationState.DRAFTING,
                    OrchestrationState.DEBATING, OrchestrationState.FINALIZING);
        }

        @Test
        @DisplayName("one trace hop per agent hop, indices gap-free under one correlation id")
        void traceHops() {
            Run run = run(service(allBullish(), verdicts(Verdict.APPROVE)));

            int segments = run.ofType(StreamEventType.REASONING_SEGMENT).size();
            // intent + 3 specialists + segments + 1 critic turn + finalize
            assertThat(hops).hasSize(1 + 3 + segments + 1 + 1);
            assertThat(hops).extracting(TraceRecord::hopIndex)
                .containsExactlyInAnyOrderElementsOf(IntStream.range(0, hops.size()).boxed().toList());
            assertThat(hops).allMatch(h -> h.correlationId().equals(run.ctx().correlationId()));
            assertThat(hops).extracting(TraceRecord::component)
                .contains("intent", "specialist:quant", "specialist:sentiment", "specialist:research",
                    "router:thesis:0", "critic:turn:1", "finalize");
        }

        @Test
        @DisplayName("all components are back to ready once the request completes")
        void statusRegistryIdle() {
            run(service(allBullish(), verdicts(Verdict.APPROVE)));

            assertThat(statusRegistry.snapshot())
                .allMatch(s -> s.status().equals(AgentStatus.READY) && s.activeRequests() == 0);
        }
    }

    @Nested
    @DisplayName("partial failure")
    class PartialFailure {

        @Test
        @DisplayName("a failed specialist is reported and lowers confidence; the request still finalizes")
        void researchFails() {
            double baseline = run(service(allBullish(), verdicts(Verdict.APPROVE))).fin().confidence().value();
            hops.clear();

            Run run = run(service(List.of(
                specialist(SpecialistTag.QUANT, reads(SpecialistTag.QUANT, Stance.BULLISH)),
                specialist(SpecialistTag.SENTIMENT, reads(SpecialistTag.SENTIMENT, Stance.BULLISH)),
                specialist(SpecialistTag.RESEARCH, Result.err(ErrorKind.BACKEND_TIMEOUT, "news feed slow"))),
                verdicts(Verdict.APPROVE)));

            List<StreamEvent> results = run.ofType(StreamEventType.SPECIALIST_RESULT);
            assertThat(results).hasSize(3);
            assertThat(results).filteredOn(e -> ((SpecialistResult) e.payload()).succeeded()).hasSize(2);
            assertThat(results).filteredOn(e -> !((SpecialistResult) e.payload()).succeeded()).singleElement()
                .satisfies(e -> assertThat(((SpecialistResult) e.payload()).error()).contains("BACKEND_TIMEOUT"));

            assertThat(run.last().type()).isEqualTo(StreamEventType.FINAL);
            assertThat(run.fin().confidence().value()).isLessThan(baseline);
            assertThat(run.fin().specialists()).filteredOn(s -> !s.ok()).hasSize(1);
        }

        @Test
        @DisplayName("every specialist failing aborts with an error event")
        void allFail() {
            Run run = run(service(List.of(
                specialist(SpecialistTag.QUANT, Result.err(ErrorKind.BACKEND_UNAVAILABLE, "down")),
                specialist(SpecialistTag.SENTIMENT, Result.err(ErrorKind.BACKEND_UNAVAILABLE, "down")),
                specialist(SpecialistTag.RESEARCH, Result.err(ErrorKind.BACKEND_TIMEOUT, "slow"))),
                verdicts(Verdict.APPROVE)));

            assertThat(run.ctx().state()).isEqualTo(OrchestrationState.ABORTED);
            assertThat(run.last().type()).isEqualTo(StreamEventType.ERROR);
            ErrorPayload error = (ErrorPayload) run.last().payload();
            assertThat(error.kind()).isEqualTo(ErrorKind.ALL_SPECIALISTS_FAILED);
            assertThat(error.failedIn()).isEqualTo(OrchestrationState.GATHERING);
            assertThat(run.ofType(StreamEventType.FINAL)).isEmpty();
            assertThat(run.ofType(StreamEventType.SPECIALIST_RESULT)).hasSize(3);
            assertThat(hops).extracting(TraceRecord::component).contains("orchestrator:error");
            assertThat(proposals).isEmpty();
        }
    }

    @Nested
    @DisplayName("debate")
    class Debate {

        @Test
        @DisplayName("refute then approve: two critic turns, a rebuttal, and lower confidence")
        void refuteThenApprove() {
            double baseline = run(service(allBullish(), verdicts(Verdict.APPROVE))).fin().confidence().value();
            proposals.clear();

            Run run = run(service(allBullish(), verdicts(Verdict.REFUTE, Verdict.APPROVE)));

            assertThat(run.ofType(StreamEventType.DEBATE_TURN)).hasSize(2)
                .extracting(e -> ((DebateTurn) e.payload()).turnIndex()).containsExactly(1, 2);
            assertThat(run.ofType(StreamEventType.STATUS))
                .extracting(e -> ((StatusPayload) e.payload()).state())
                .containsSubsequence(OrchestrationState.DEBATING, OrchestrationState.DRAFTING,
                    OrchestrationState.DEBATING, OrchestrationState.FINALIZING);
            FinalPayload fin = run.fin();
            assertThat(fin.debateOutcome()).isEqualTo(DebateOutcome.APPROVED);
            assertThat(fin.confidence().value()).isLessThan(baseline);
            // a refuted BUY that already matched the evidence is stepped down
            assertThat(fin.recommendation()).isEqualTo("HOLD");
            assertThat(proposals).isEmpty();
        }

        @Test
        @DisplayName("refuted on every turn: the debate is exhausted and confidence capped")
        void exhausted() {
            Run run = run(service(allBullish(), verdicts(Verdict.REFUTE)));

            FinalPayload fin = run.fin();
            assertThat(run.ofType(StreamEventType.DEBATE_TURN)).hasSize(2);
            assertThat(fin.debateOutcome()).isEqualTo(DebateOutcome.EXHAUSTED);
            assertThat(fin.confidence().value()).isLessThanOrEqualTo(0.6);
            assertThat(fin.confidence().capped()).isTrue();
            assertThat(fin.unresolvedDisagreement()).isEqualTo("Turn 2 objection: downside risk is understated.");
        }

        @Test
        @DisplayName("a flag finalizes at once with the concern attached")
        void flagged() {
            Run run = run(service(allBullish(), verdicts(Verdict.FLAG)));

            FinalPayload fin = run.fin();
            assertThat(fin.debateTurns()).isEqualTo(1);
            assertThat(fin.debateOutcome()).isEqualTo(DebateOutcome.FLAGGED);
            assertThat(fin.unresolvedDisagreement()).contains("objection");
        }

        @Test
        @DisplayName("a budget spent before the debate still gets the thesis reviewed once")
        void budgetSpentBeforeDebate() {
            AtomicInteger criticCalls = new AtomicInteger();
            Critic counting = (ctx, turn) -> {
                criticCalls.incrementAndGet();
                return Mono.just(DebateTurn.critic(turn, Verdict.APPROVE, null));
            };
            List<Specialist> slowQuant = List.of(
                delayed(specialist(SpecialistTag.QUANT, reads(SpecialistTag.QUANT, Stance.BULLISH)), Duration.ofMillis(500)),
                specialist(SpecialistTag.SENTIMENT, reads(SpecialistTag.SENTIMENT, Stance.BULLISH)),
                specialist(SpecialistTag.RESEARCH, reads(SpecialistTag.RESEARCH, Stance.BULLISH)));

            Run run = run(service(slowQuant, counting), Duration.ofMillis(300));

            assertThat(criticCalls).hasValue(1);
            assertThat(run.ofType(StreamEventType.DEBATE_TURN)).hasSize(1);
            FinalPayload fin = run.fin();
            assertThat(fin.debateOutcome()).isEqualTo(DebateOutcome.APPROVED);
            assertThat(fin.recommendation()).isEqualTo("BUY");
            assertThat(proposals).hasSize(1);
        }

        @Test
        @DisplayName("a critic that cannot answer within the grace window leaves the thesis unreviewed, capped and unproposed")
        void criticNeverAnswers() {
            Critic slow = (ctx, turn) -> Mono.delay(Duration.ofSeconds(3))
                .thenReturn(DebateTurn.critic(turn, Verdict.APPROVE, null));

            Run run = run(service(allBullish(), slow, Duration.ofSeconds(1)), Duration.ofMillis(500));

            assertThat(run.last().type()).isEqualTo(StreamEventType.FINAL);
            FinalPayload fin = run.fin();
            assertThat(fin.debateOutcome()).isEqualTo(DebateOutcome.BUDGET_EXHAUSTED);
            assertThat(fin.debateTurns()).isZero();
            assertThat(fin.unresolvedDisagreement()).isEqualTo(OrchestratorService.NOT_REVIEWED);
            assertThat(fin.degradedReasons()).contains(OrchestratorService.NOT_REVIEWED);
            assertThat(fin.confidence().value()).isLessThanOrEqualTo(0.6);
            assertThat(fin.thesis()).contains("Recommendation: BUY");
            assertThat(fin.proposedAction()).isNull();
            assertThat(proposals).isEmpty();
        }

        @Test
        @DisplayName("running out of budget after a refutation finalizes the current thesis with capped confidence")
        void budgetExhaustedMidDebate() {
            Critic refuting = (ctx, turn) -> Mono.delay(Duration.ofMillis(300))
                .thenReturn(DebateTurn.critic(turn, Verdict.REFUTE, "Turn " + turn + " objection: valuation is stretched."));

            Run run = run(service(allBullish(), refuting), Duration.ofMillis(500));

            assertThat(run.last().type()).isEqualTo(StreamEventType.FINAL);
            FinalPayload fin = run.fin();
            assertThat(fin.debateOutcome()).isEqualTo(DebateOutcome.BUDGET_EXHAUSTED);
            assertThat(fin.debateTurns()).isEqualTo(1);
            assertThat(fin.unresolvedDisagreement()).isEqualTo("Turn 1 objection: valuation is stretched.");
            assertThat(fin.confidence().value()).isLessThanOrEqualTo(0.6);
        }

        @Test
        @DisplayName("a critic that could not deliver a review marks the decision degraded")
        void unavailableCriticDegrades() {
            Critic broken = (ctx, turn) -> Mono.just(DebateTurn.unavailable(turn, "SCHEMA_VIOLATION: critic output is not JSON"));

            Run run = run(service(allBullish(), broken));

            FinalPayload fin = run.fin();
            assertThat(fin.debateOutcome()).isEqualTo(DebateOutcome.FLAGGED);
            assertThat(fin.unresolvedDisagreement()).startsWith("critic unavailable:");
            assertThat(fin.degradedReasons()).anySatisfy(reason -> assertThat(reason)
                .contains("critic turn 1 unavailable").contains("SCHEMA_VIOLATION"));
            assertThat(hops).filteredOn(h -> h.component().equals("critic:turn:1"))
                .singleElement().extracting(TraceRecord::outcome).isEqualTo(HopOutcome.DEGRADED);
        }
    }

    @Test
    @DisplayName("abort mid-debate cancels the work and ends the stream with aborted")
    void abortMidDebate() throws InterruptedException {
        CountDownLatch reviewing = new CountDownLatch(1);
        Critic hanging = (ctx, turn) -> Mono.<DebateTurn>never().doOnSubscribe(s -> reviewing.countDown());
        OrchestratorService service = service(allBullish(), hanging);

        DecisionContext ctx = request(Duration.ofSeconds(30));
        StreamSession session = new StreamSession("s-abort", ctx.correlationId(), clock);
        Disposable work = service.orchestrate(ctx, session).subscribe();
        session.bindOrchestration(work);

        assertThat(reviewing.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(session.abort("client abort")).isTrue();

        List<StreamEvent> events = session.events(0).collectList().block(Duration.ofSeconds(1));
        assertThat(events.get(events.size() - 1).type()).isEqualTo(StreamEventType.ABORTED);
        assertThat(events).noneMatch(e -> e.type() == StreamEventType.FINAL);
        assertThat(work.isDisposed()).isTrue();
        assertThat(hops).extracting(TraceRecord::component).contains("orchestrator:abort");
        assertThat(statusRegistry.snapshot())
            .filteredOn(s -> s.component().equals(AgentStatusRegistry.CRITIC))
            .singleElement()
            .satisfies(s -> assertThat(s.activeRequests()).isZero());
    }

    @Test
    @DisplayName("the first specialist result is streamed before drafting starts")
    void specialistsStreamBeforeDrafting() {
        Run run = run(service(allBullish(), verdicts(Verdict.APPROVE)));

        List<StreamEventType> types = new ArrayList<>();
        run.events().forEach(e -> types.add(e.type()));
        assertThat(types.indexOf(StreamEventType.SPECIALIST_RESULT))
            .isLessThan(types.indexOf(StreamEventType.REASONING_SEGMENT));
        assertThat(types.lastIndexOf(StreamEventType.REASONING_SEGMENT))
            .isLessThan(types.indexOf(StreamEventType.DEBATE_TURN));
    }
}
