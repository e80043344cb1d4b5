package com.advisorplatform.trace.controller;

import com.advisorplatform.common.model.TraceRecord;
import com.advisorplatform.trace.model.TraceSummary;
import com.advisorplatform.trace.service.TraceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/traces")
public class TraceController {

    private static final Logger log = LoggerFactory.getLogger(TraceController.class);

    private final TraceService traceService;

    public TraceController(TraceService traceService) {
        this.traceService = traceService;
    }

    @GetMapping("/recent")
    public Flux<TraceSummary> recent(@RequestParam(defaultValue = "20") int limit) {
        log.info("Recent traces requested. limit={}", limit);
        return traceService.recent(limit);
    }

    /** Ordered hops of one request; 404 when nothing was recorded under the id. */
    @GetMapping("/{correlationId}")
    public Mono<ResponseEntity<List<TraceRecord>>> trace(@PathVariable String correlationId) {
        log.info("Trace query received. correlationId={}", correlationId);
        return traceService.getTrace(correlationId)
            .collectList()
            .map(records -> records.isEmpty()
                ? ResponseEntity.notFound().<List<TraceRecord>>build()
                : ResponseEntity.ok(records))
            .doOnError(e -> log.error("Trace endpoint error. correlationId={}", correlationId, e));
    }
}
