package com.advisorplatform.orchestrator.stream;

import com.advisorplatform.common.model.StreamEvent;
import com.advisorplatform.common.model.StreamEventType;
import com.advisorplatform.orchestrator.event.AbortedPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-request event buffer decoupling the orchestration pipeline from HTTP subscribers.
 *
 * <p>Every event is kept in a replay sink, so a client that reconnects receives exactly
 * the events after its last acknowledged sequence number, and events emitted while no
 * client was attached (including the terminal one) are held until resume or expiry. The
 * orchestration subscription is owned here, not by any HTTP exchange: a disconnect only
 * stops delivery, while {@link #abort} cancels the work.
 */
public class StreamSession implements AdvisoryEventSink {

    private static final Logger log = LoggerFactory.getLogger(StreamSession.class);

    private final String                   sessionId;
    private final String                   correlationId;
    private final Instant                  createdAt;
    private final Clock                    clock;
    private final Sinks.Many<StreamEvent>  events = Sinks.many().replay().all();
    private final AtomicInteger            subscribers = new AtomicInteger();

    private long              lastSeq;
    private boolean           terminal;
    private Disposable        orchestration;
    private volatile Instant  lastActivity;

    public StreamSession(String sessionId, String correlationId, Clock clock) {
        this.sessionId     = sessionId;
        this.correlationId = correlationId;
        this.clock         = clock;
        this.createdAt     = clock.instant();
        this.lastActivity  = createdAt;
    }

    @Override
    public synchronized StreamEvent emit(StreamEventType type, Object payload) {
        if (terminal) {
            log.debug("[Stream] dropping {} after terminal event. sessionId={}", type.wireName(), sessionId);
            return null;
        }
        StreamEvent event = new StreamEvent(sessionId, correlationId, ++lastSeq, type, payload, clock.instant());
        events.tryEmitNext(event);
        if (type.isTerminal()) {
            terminal = true;
            events.tryEmitComplete();
            log.info("[Stream] terminal event={} seq={} sessionId={} correlationId={}",
                type.wireName(), lastSeq, sessionId, correlationId);
        }
        return event;
    }

    /**
     * Events with {@code seq > lastAckedSeq}, live. Completes after the terminal event.
     */
    public Flux<StreamEvent> events(long lastAckedSeq) {
        return events.asFlux()
            .filter(e -> e.seq() > lastAckedSeq)
            .doOnSubscribe(s -> {
                subscribers.incrementAndGet();
                lastActivity = clock.instant();
                log.info("[Stream] client attached sessionId={} fromSeq={}", sessionId, lastAckedSeq + 1);
            })
            .doFinally(signal -> {
                subscribers.decrementAndGet();
                lastActivity = clock.instant();
                log.info("[Stream] client detached sessionId={} signal={}", sessionId, signal);
            });
    }

    /** Takes ownership of the orchestration subscription. */
    public synchronized void bindOrchestration(Disposable subscription) {
        if (terminal && !subscription.isDisposed()) {
            subscription.dispose();
            return;
        }
        this.orchestration = subscription;
    }

    /**
     * Cancels the orchestration and emits the terminal {@code aborted} event.
     *
     * @return {@code false} if the stream had already terminated
     */
    public synchronized boolean abort(String reason) {
        if (terminal) return false;
        long before = lastSeq;
        if (orchestration != null) {
            orchestration.dispose();
        }
        emit(StreamEventType.ABORTED, new AbortedPayload(reason, before));
        return true;
    }

    /** No client attached and idle for longer than {@code idleTimeout}. */
    public boolean isExpired(Instant now, Duration idleTimeout) {
        return subscribers.get() == 0 && Duration.between(lastActivity, now).compareTo(idleTimeout) > 0;
    }

    public synchronized boolean isTerminal() {
        return terminal;
    }

    public synchronized long lastEventSeq() {
        return lastSeq;
    }

    public String sessionId()      { return sessionId; }
    public String correlationId()  { return correlationId; }
    public Instant createdAt()     { return createdAt; }
    public int subscriberCount()   { return subscribers.get(); }
}
