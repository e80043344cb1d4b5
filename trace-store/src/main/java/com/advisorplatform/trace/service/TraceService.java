package com.advisorplatform.trace.service;

import com.advisorplatform.common.model.TraceRecord;
import com.advisorplatform.trace.model.TraceSummary;
import com.advisorplatform.trace.store.TraceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Write and query facade over {@link TraceStore}.
 *
 * <p>{@link #record} is fire-and-forget: it returns immediately, the write runs on
 * {@code boundedElastic} with a bounded backoff retry, and a final failure is logged at
 * WARN and dropped. A trace write never fails or delays the request that produced it.
 */
@Service
public class TraceService {

    private static final Logger log = LoggerFactory.getLogger(TraceService.class);

    private final TraceStore store;
    private final int        writeRetries;
    private final Duration   retryBackoff;

    public TraceService(TraceStore store,
                        @Value("${trace.write-retries:3}") int writeRetries,
                        @Value("${trace.retry-backoff:PT0.1S}") Duration retryBackoff) {
        this.store        = store;
        this.writeRetries = writeRetries;
        this.retryBackoff = retryBackoff;
    }

    public void record(TraceRecord record) {
        write(record).subscribe(
            inserted -> log.debug("[Trace] hop persisted. correlationId={} hop={} component={} inserted={}",
                record.correlationId(), record.hopIndex(), record.component(), inserted),
            err -> log.warn("[Trace] hop write failed (non-critical). correlationId={} hop={} component={} reason={}",
                record.correlationId(), record.hopIndex(), record.component(), err.getMessage())
        );
    }

    /**
     * The write {@link #record} subscribes to. Exposed for callers that need to await
     * persistence, such as replay tooling and tests.
     */
    public Mono<Boolean> write(TraceRecord record) {
        return Mono.defer(() -> store.append(record))
            .subscribeOn(Schedulers.boundedElastic())
            .retryWhen(Retry.backoff(writeRetries, retryBackoff));
    }

    public Flux<TraceRecord> getTrace(String correlationId) {
        return store.findByCorrelationId(correlationId);
    }

    public Flux<TraceSummary> recent(int limit) {
        return store.recent(Math.max(1, Math.min(limit, 500)));
    }
}
