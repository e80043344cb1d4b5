package com.advisorplatform.trace.store;

import com.advisorplatform.common.model.HopOutcome;
import com.advisorplatform.common.model.TraceRecord;
import com.advisorplatform.trace.model.TraceRecordEntity;
import com.advisorplatform.trace.model.TraceSummary;
import com.advisorplatform.trace.repository.TraceRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * {@link TraceStore} on Spring Data R2DBC.
 *
 * <p>Idempotency rests on the unique key (correlation_id, hop_index): an existence check
 * skips the common duplicate, and a concurrent duplicate that slips past the check is
 * rejected by the constraint and reported as "already present".
 */
@Component
public class R2dbcTraceStore implements TraceStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcTraceStore.class);

    private final TraceRecordRepository repository;

    public R2dbcTraceStore(TraceRecordRepository repository) {
        this.repository = repository;
    }

    @Override
    public Mono<Boolean> append(TraceRecord record) {
        return repository.existsByCorrelationIdAndHopIndex(record.correlationId(), record.hopIndex())
            .flatMap(exists -> {
                if (exists) {
                    log.debug("[TraceStore] duplicate hop ignored. correlationId={} hop={}",
                        record.correlationId(), record.hopIndex());
                    return Mono.just(false);
                }
                return repository.save(toEntity(record)).thenReturn(true);
            })
            .onErrorResume(DataIntegrityViolationException.class, e -> {
                log.debug("[TraceStore] concurrent duplicate hop rejected by key. correlationId={} hop={}",
                    record.correlationId(), record.hopIndex());
                return Mono.just(false);
            });
    }

    @Override
    public Flux<TraceRecord> findByCorrelationId(String correlationId) {
        return repository.findByCorrelationIdOrderByHopIndexAsc(correlationId).map(this::toRecord);
    }

    @Override
    public Flux<TraceSummary> recent(int limit) {
        return repository.findRecentCorrelations(limit);
    }

    // ── mapping ─────────────────────────────────────────────────────────────

    private TraceRecordEntity toEntity(TraceRecord r) {
        TraceRecordEntity e = new TraceRecordEntity();
        e.setCorrelationId(r.correlationId());
        e.setHopIndex(r.hopIndex());
        e.setComponent(r.component());
        e.setInputDigest(r.inputDigest());
        e.setOutputDigest(r.outputDigest());
        e.setLatencyMs(r.latencyMs());
        e.setOutcome(r.outcome() != null ? r.outcome().name() : HopOutcome.OK.name());
        e.setModelLabel(r.modelLabel());
        Instant ts = r.timestamp() != null ? r.timestamp() : Instant.now();
        e.setRecordedAt(LocalDateTime.ofInstant(ts, ZoneOffset.UTC));
        return e;
    }

    private TraceRecord toRecord(TraceRecordEntity e) {
        return new TraceRecord(
            e.getCorrelationId(),
            e.getHopIndex(),
            e.getComponent(),
            e.getInputDigest(),
            e.getOutputDigest(),
            e.getLatencyMs(),
            e.getOutcome() != null ? HopOutcome.valueOf(e.getOutcome()) : HopOutcome.OK,
            e.getModelLabel(),
            e.getRecordedAt() != null ? e.getRecordedAt().toInstant(ZoneOffset.UTC) : null);
    }
}
