package com.advisorplatform.trace.service;

import com.advisorplatform.common.model.HopOutcome;
import com.advisorplatform.common.model.TraceRecord;
import com.advisorplatform.trace.model.TraceSummary;
import com.advisorplatform.trace.store.TraceStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class TraceServiceTest {

    private static final TraceRecord HOP =
        new TraceRecord("c-1", 0, "intent", "a", "b", 5L, HopOutcome.OK, null, Instant.now());

    /** Store that fails the first {@code failures} appends. */
    private static final class FlakyStore implements TraceStore {
        final AtomicInteger attempts = new AtomicInteger();
        final int failures;

        FlakyStore(int failures) {
            this.failures = failures;
        }

        @Override
        public Mono<Boolean> append(TraceRecord record) {
            int n = attempts.incrementAndGet();
            return n <= failures
                ? Mono.error(new IllegalStateException("connection reset"))
                : Mono.just(true);
        }

        @Override
        public Flux<TraceRecord> findByCorrelationId(String correlationId) {
            return Flux.empty();
        }

        @Override
        public Flux<TraceSummary> recent(int limit) {
            return Flux.empty();
        }
    }

    @Test
    @DisplayName("transient write failures are retried up to the configured bound")
    void retriesTransientFailures() {
        FlakyStore store = new FlakyStore(2);
        TraceService service = new TraceService(store, 3, Duration.ofMillis(1));

        StepVerifier.create(service.write(HOP))
            .expectNext(true)
            .verifyComplete();
        assertThat(store.attempts.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("record() returns immediately and swallows a persistent failure")
    void recordNeverThrows() {
        FlakyStore store = new FlakyStore(Integer.MAX_VALUE);
        TraceService service = new TraceService(store, 1, Duration.ofMillis(1));

        service.record(HOP);

        // the failing write settles in the background; the caller saw nothing
        StepVerifier.create(service.write(HOP))
            .expectError()
            .verify(Duration.ofSeconds(5));
    }
}
