package com.advisorplatform.trace.repository;

import com.advisorplatform.trace.model.TraceRecordEntity;
import com.advisorplatform.trace.model.TraceSummary;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface TraceRecordRepository extends ReactiveCrudRepository<TraceRecordEntity, Long> {

    Flux<TraceRecordEntity> findByCorrelationIdOrderByHopIndexAsc(String correlationId);

    Mono<Boolean> existsByCorrelationIdAndHopIndex(String correlationId, int hopIndex);

    Mono<Long> countByCorrelationId(String correlationId);

    /**
     * Most recently active correlation ids, newest first, with their hop counts.
     */
    @Query("""
        SELECT correlation_id,
               COUNT(*)         AS hop_count,
               MIN(recorded_at) AS first_recorded_at,
               MAX(recorded_at) AS last_recorded_at
        FROM trace_record
        GROUP BY correlation_id
        ORDER BY last_recorded_at DESC
        LIMIT :limit
        """)
    Flux<TraceSummary> findRecentCorrelations(int limit);
}
