package com.advisorplatform.trace.store;

import com.advisorplatform.common.model.TraceRecord;
import com.advisorplatform.trace.model.TraceSummary;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only store of agent hops keyed by (correlationId, hopIndex).
 *
 * <p>Current implementation: {@link R2dbcTraceStore}.
 */
public interface TraceStore {

    /**
     * Appends {@code record}. Idempotent: a second append for the same
     * (correlationId, hopIndex) leaves the stored row untouched.
     *
     * @return {@code true} if a row was inserted, {@code false} if it already existed
     */
    Mono<Boolean> append(TraceRecord record);

    /** All hops of one request, ordered by hop index. */
    Flux<TraceRecord> findByCorrelationId(String correlationId);

    Flux<TraceSummary> recent(int limit);
}
