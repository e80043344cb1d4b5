package com.advisorplatform.orchestrator.logger;

import com.advisorplatform.common.model.DecisionContext;
import com.advisorplatform.common.model.OrchestrationState;
import com.advisorplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability component for the advisory lifecycle inside the orchestration pipeline.
 *
 * <p>Logs each stage of a request without introducing any business logic or modifying
 * pipeline behavior. All methods are pure side-effects.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}      request accepted, session opened</li>
 *   <li>{@link #INTENT_CLASSIFIED}     specialists selected</li>
 *   <li>{@link #SPECIALISTS_SETTLED}   burst joined, partial failures included</li>
 *   <li>{@link #THESIS_DRAFTED}        Router committed the thesis segments</li>
 *   <li>{@link #CRITIC_REVIEWED}       one per debate turn</li>
 *   <li>{@link #REBUTTAL_DRAFTED}      one per refutation answered</li>
 *   <li>{@link #FINAL_PUBLISHED}       confidence computed, final event emitted</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads traceId from Reactor Context):
 * <pre>
 *     .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.SPECIALISTS_SETTLED))
 * </pre>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String REQUEST_RECEIVED    = "REQUEST_RECEIVED";
    public static final String INTENT_CLASSIFIED   = "INTENT_CLASSIFIED";
    public static final String SPECIALISTS_SETTLED = "SPECIALISTS_SETTLED";
    public static final String THESIS_DRAFTED      = "THESIS_DRAFTED";
    public static final String CRITIC_REVIEWED     = "CRITIC_REVIEWED";
    public static final String REBUTTAL_DRAFTED    = "REBUTTAL_DRAFTED";
    public static final String FINAL_PUBLISHED     = "FINAL_PUBLISHED";

    /**
     * Returns a {@code doOnEach} consumer that logs the lifecycle stage.
     *
     * <p>Reads traceId from the Reactor Context embedded in the {@link Signal}, never from
     * MDC. Only fires on {@code onNext} signals.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[DecisionFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[DecisionFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    public void logTransition(OrchestrationState from, OrchestrationState to, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[DecisionFlow] transition {} -> {} traceId={}", from, to, traceId)
        );
    }

    /**
     * Compact summary of a finalized {@link DecisionContext}. Called once per request.
     */
    public void logDecisionContext(DecisionContext ctx) {
        TraceContextUtil.withMdc(ctx.correlationId(), () ->
            log.info("[DecisionFlow] stage={} ticker={} intent={} specialistsOk={}/{} segments={} "
                     + "debateTurns={} lastVerdict={} confidence={} robustness={} degraded={} traceId={}",
                     FINAL_PUBLISHED,
                     ctx.ticker(),
                     ctx.intent() != null ? ctx.intent().intent() : "N/A",
                     ctx.succeededResults().size(), ctx.selectedSpecialistCount(),
                     ctx.segments().size(),
                     ctx.debate().size(),
                     ctx.lastVerdict(),
                     ctx.confidence() != null ? ctx.confidence().value() : "N/A",
                     ctx.confidence() != null ? ctx.confidence().robustness() : "N/A",
                     ctx.degradedReasons(),
                     ctx.correlationId())
        );
    }
}
