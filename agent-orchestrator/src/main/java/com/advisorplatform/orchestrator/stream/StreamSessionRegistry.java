package com.advisorplatform.orchestrator.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live stream sessions by id. A session with no attached client is kept for the idle
 * window, then evicted by {@link #sweep}; eviction cancels an orchestration still running.
 */
@Component
public class StreamSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(StreamSessionRegistry.class);

    private final Map<String, StreamSession> sessions = new ConcurrentHashMap<>();
    private final Clock                      clock;
    private final Duration                   idleTimeout;

    public StreamSessionRegistry(Clock clock,
                                 @Value("${stream.idle-timeout:PT60S}") Duration idleTimeout) {
        this.clock       = clock;
        this.idleTimeout = idleTimeout;
    }

    public StreamSession create(String correlationId) {
        StreamSession session = new StreamSession(UUID.randomUUID().toString(), correlationId, clock);
        sessions.put(session.sessionId(), session);
        log.info("[Stream] session opened sessionId={} correlationId={}", session.sessionId(), correlationId);
        return session;
    }

    /** Empty when the id is unknown or the session has expired (expired sessions are evicted here). */
    public Optional<StreamSession> find(String sessionId) {
        StreamSession session = sessions.get(sessionId);
        if (session == null) return Optional.empty();
        if (session.isExpired(clock.instant(), idleTimeout)) {
            evict(session);
            return Optional.empty();
        }
        return Optional.of(session);
    }

    @Scheduled(fixedDelayString = "${stream.sweep-interval:PT10S}")
    public void sweep() {
        Instant now = clock.instant();
        int before = sessions.size();
        sessions.values().stream()
            .filter(s -> s.isExpired(now, idleTimeout))
            .toList()
            .forEach(this::evict);
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.info("[Stream] sweep evicted={} remaining={}", evicted, sessions.size());
        }
    }

    public int size() {
        return sessions.size();
    }

    private void evict(StreamSession session) {
        if (sessions.remove(session.sessionId(), session) && !session.isTerminal()) {
            session.abort("session expired");
            log.warn("[Stream] expired session with running orchestration cancelled. sessionId={} correlationId={}",
                session.sessionId(), session.correlationId());
        }
    }
}
