package com.advisorplatform.orchestrator.controller;

import com.advisorplatform.common.model.StreamEvent;
import com.advisorplatform.orchestrator.stream.AdvisoryRequest;
import com.advisorplatform.orchestrator.stream.AdvisoryStreamService;
import com.advisorplatform.orchestrator.stream.StreamSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * Advisory event stream over Server-Sent Events.
 *
 * <p>Each SSE frame carries {@code id = seq}, {@code event = type} and the full
 * {@link StreamEvent} envelope as data, so a client can resume either with
 * {@code ?lastAckedSeq=k} or with the standard {@code Last-Event-ID} header.
 */
@RestController
@RequestMapping("/api/v1/advisory")
public class AdvisoryStreamController {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryStreamController.class);

    static final String SESSION_HEADER = "X-Session-Id";

    private final AdvisoryStreamService streamService;

    public AdvisoryStreamController(AdvisoryStreamService streamService) {
        this.streamService = streamService;
    }

    @PostMapping(path = "/stream",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<Flux<ServerSentEvent<StreamEvent>>> stream(@RequestBody AdvisoryRequest request) {
        if (request == null || !request.valid()) {
            log.warn("Advisory request rejected: empty query");
            return ResponseEntity.badRequest().build();
        }
        StreamSession session = streamService.start(request);
        log.info("Advisory stream opened. sessionId={} correlationId={} ticker={}",
            session.sessionId(), session.correlationId(), request.ticker());
        return sse(session, 0L);
    }

    @GetMapping(path = "/stream/{sessionId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<Flux<ServerSentEvent<StreamEvent>>> resume(
            @PathVariable String sessionId,
            @RequestParam(required = false) Long lastAckedSeq,
            @RequestHeader(value = "Last-Event-ID", required = false) String lastEventId) {
        long acked = resolveAcked(lastAckedSeq, lastEventId);
        return streamService.find(sessionId)
            .map(session -> {
                log.info("Advisory stream resumed. sessionId={} lastAckedSeq={} lastEventSeq={}",
                    sessionId, acked, session.lastEventSeq());
                return sse(session, acked);
            })
            .orElseGet(() -> {
                log.warn("Resume rejected, session expired or unknown. sessionId={}", sessionId);
                return ResponseEntity.status(HttpStatus.GONE).<Flux<ServerSentEvent<StreamEvent>>>build();
            });
    }

    @DeleteMapping("/stream/{sessionId}")
    public ResponseEntity<Void> abort(@PathVariable String sessionId) {
        return streamService.abort(sessionId)
            .map(aborted -> aborted
                ? ResponseEntity.accepted().<Void>build()
                : ResponseEntity.status(HttpStatus.CONFLICT).<Void>build())
            .orElseGet(() -> ResponseEntity.status(HttpStatus.GONE).build());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private ResponseEntity<Flux<ServerSentEvent<StreamEvent>>> sse(StreamSession session, long lastAckedSeq) {
        Flux<ServerSentEvent<StreamEvent>> body = session.events(lastAckedSeq)
            .map(event -> ServerSentEvent.<StreamEvent>builder()
                .id(String.valueOf(event.seq()))
                .event(event.type().wireName())
                .data(event)
                .build());
        return ResponseEntity.ok()
            .cacheControl(CacheControl.noCache())
            .header("X-Accel-Buffering", "no")
            .header(SESSION_HEADER, session.sessionId())
            .contentType(MediaType.TEXT_EVENT_STREAM)
            .body(body);
    }

    // explicit query parameter wins over the header
    private static long resolveAcked(Long lastAckedSeq, String lastEventId) {
        if (lastAckedSeq != null) return Math.max(0L, lastAckedSeq);
        if (lastEventId != null && !lastEventId.isBlank()) {
            try {
                return Math.max(0L, Long.parseLong(lastEventId.trim()));
            } catch (NumberFormatException e) {
                log.warn("Ignoring malformed Last-Event-ID '{}'", lastEventId);
            }
        }
        return 0L;
    }
}
