package com.advisorplatform.specialist.service;

import com.advisorplatform.common.model.ContextSnapshot;
import com.advisorplatform.common.model.SpecialistResult;
import com.advisorplatform.common.model.SpecialistTag;
import com.advisorplatform.common.result.ErrorKind;
import com.advisorplatform.common.result.Result;
import com.advisorplatform.specialist.agent.Specialist;
import com.advisorplatform.specialist.cache.SpecialistResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Runs one concurrent burst of specialists for a request.
 *
 * <p>Every selected specialist is subscribed at once; each yields exactly one
 * {@link SpecialistResult}, successful or not. A failing specialist never cancels its
 * siblings. Cancelling the returned publisher cancels every in-flight invocation.
 */
@Service
public class SpecialistDispatchService {

    private static final Logger log = LoggerFactory.getLogger(SpecialistDispatchService.class);

    private final SpecialistRegistry    registry;
    private final SpecialistResultCache cache;

    public SpecialistDispatchService(SpecialistRegistry registry, SpecialistResultCache cache) {
        this.registry = registry;
        this.cache    = cache;
    }

    /**
     * Emits one result per selected specialist, in completion order.
     */
    public Flux<SpecialistResult> burst(String query, ContextSnapshot snapshot,
                                        Collection<SpecialistTag> tags, Duration timeout) {
        List<Specialist> selected = registry.select(tags);
        log.info("[Dispatch] burst specialists={} ticker={} correlationId={}",
            selected.stream().map(s -> s.tag().id()).toList(), snapshot.ticker(), snapshot.correlationId());

        return Flux.fromIterable(selected)
            .flatMap(specialist -> invokeOne(specialist, query, snapshot, timeout), Math.max(1, selected.size()));
    }

    /**
     * Waits for the whole burst to settle. Results are sorted by tag for a stable order.
     */
    public Mono<List<SpecialistResult>> dispatchAll(String query, ContextSnapshot snapshot,
                                                    Collection<SpecialistTag> tags, Duration timeout) {
        return burst(query, snapshot, tags, timeout)
            .collectSortedList(Comparator.comparing(SpecialistResult::specialistTag));
    }

    private Mono<SpecialistResult> invokeOne(Specialist specialist, String query,
                                             ContextSnapshot snapshot, Duration timeout) {
        SpecialistTag tag = specialist.tag();
        SpecialistResult hit = cache.get(tag, snapshot.ticker());
        if (hit != null) {
            log.info("[Dispatch] cache hit tag={} ticker={}", tag.id(), snapshot.ticker());
            return Mono.just(hit);
        }

        return Mono.defer(() -> {
                long start = System.nanoTime();
                return specialist.invoke(query, snapshot, timeout)
                    .defaultIfEmpty(Result.err(ErrorKind.SCHEMA_VIOLATION,
                        "specialist returned no result"))
                    .map(result -> toSpecialistResult(tag, result, elapsedMs(start)));
            })
            .onErrorResume(e -> {
                // Specialist contract says invoke never errors; isolate anyway
                log.error("[Dispatch] tag={} escaped with error correlationId={}", tag.id(),
                    snapshot.correlationId(), e);
                return Mono.just(SpecialistResult.failure(tag, "INTERNAL: " + e.getMessage(), 0L));
            })
            .doOnNext(r -> {
                if (r.succeeded()) cache.put(tag, snapshot.ticker(), r);
                log.info("[Dispatch] tag={} complete ok={} stance={} latencyMs={}",
                    tag.id(), r.succeeded(), r.stance(), r.latencyMs());
            });
    }

    private SpecialistResult toSpecialistResult(SpecialistTag tag, Result<SpecialistResult> result, long latencyMs) {
        if (result.isOk()) {
            return result.value().withLatency(latencyMs);
        }
        return SpecialistResult.failure(tag, result.kind() + ": " + result.message(), latencyMs);
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
