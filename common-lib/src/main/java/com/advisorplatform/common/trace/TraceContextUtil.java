package com.advisorplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Reactive correlation-id propagation.
 *
 * <p>The Reactor Context is the single source of truth for the correlation id inside a
 * request's pipeline. MDC is written only as a temporary bridge during a log statement,
 * never as a persistent ThreadLocal store. The MDC key stays {@code traceId} so the
 * Logback pattern does not depend on the domain naming.
 *
 * <p>Usage in reactive chains:
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, ctx.correlationId());
 * </pre>
 *
 * <p>Usage inside doOnEach:
 * <pre>
 *     signal -> TraceContextUtil.getTraceId(signal.getContextView())
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";

    private TraceContextUtil() {}

    /**
     * Stores {@code traceId} in the Reactor Context of {@code mono}.
     * {@code contextWrite} propagates upstream, so call this at the end of assembly.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    public static <T> Flux<T> withTraceId(Flux<T> flux, String traceId) {
        return flux.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /**
     * Returns the traceId from {@code ctx}, or {@code "unknown"}. Never {@code null}.
     */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code traceId} into MDC for the duration of {@code logAction} only.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
