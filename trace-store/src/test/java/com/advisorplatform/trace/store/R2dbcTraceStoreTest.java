package com.advisorplatform.trace.store;

import com.advisorplatform.common.model.HopOutcome;
import com.advisorplatform.common.model.TraceRecord;
import com.advisorplatform.trace.repository.TraceRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.r2dbc.DataR2dbcTest;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataR2dbcTest
class R2dbcTraceStoreTest {

    @Autowired
    private TraceRecordRepository repository;

    private R2dbcTraceStore store;

    @BeforeEach
    void setUp() {
        store = new R2dbcTraceStore(repository);
        repository.deleteAll().block();
    }

    private static TraceRecord hop(String correlationId, int index, String component, Instant ts) {
        return new TraceRecord(correlationId, index, component,
            "in-" + index, "out-" + index, 12L, HopOutcome.OK, "small-model", ts);
    }

    @Nested
    @DisplayName("append")
    class Append {

        @Test
        @DisplayName("first write inserts and reports true")
        void insertsNewHop() {
            StepVerifier.create(store.append(hop("c-1", 0, "intent", Instant.now())))
                .expectNext(true)
                .verifyComplete();

            StepVerifier.create(repository.countByCorrelationId("c-1"))
                .expectNext(1L)
                .verifyComplete();
        }

        @Test
        @DisplayName("repeated (correlationId, hopIndex) is a no-op reporting false")
        void duplicateIsIgnored() {
            Instant ts = Instant.parse("2026-01-05T10:00:00Z");
            store.append(hop("c-2", 3, "critic", ts)).block();

            TraceRecord changed = new TraceRecord("c-2", 3, "critic", "other", "other", 99L,
                HopOutcome.ERROR, null, ts);
            StepVerifier.create(store.append(changed))
                .expectNext(false)
                .verifyComplete();

            StepVerifier.create(store.findByCorrelationId("c-2"))
                .assertNext(r -> {
                    assertThat(r.outputDigest()).isEqualTo("out-3");
                    assertThat(r.outcome()).isEqualTo(HopOutcome.OK);
                })
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("hops come back ordered by hop index regardless of write order")
        void orderedByHopIndex() {
            Instant now = Instant.parse("2026-01-05T10:00:00Z");
            store.append(hop("c-3", 2, "router:thesis:0", now)).block();
            store.append(hop("c-3", 0, "intent", now)).block();
            store.append(hop("c-3", 1, "specialist:quant", now)).block();

            StepVerifier.create(store.findByCorrelationId("c-3").map(TraceRecord::hopIndex))
                .expectNext(0, 1, 2)
                .verifyComplete();
        }

        @Test
        @DisplayName("timestamps survive the round trip in UTC")
        void timestampPreserved() {
            Instant ts = Instant.parse("2026-03-01T08:15:30Z");
            store.append(hop("c-4", 0, "intent", ts)).block();

            StepVerifier.create(store.findByCorrelationId("c-4"))
                .assertNext(r -> assertThat(r.timestamp()).isEqualTo(ts))
                .verifyComplete();
        }

        @Test
        @DisplayName("recent lists most recently active correlations first with hop counts")
        void recentSummaries() {
            Instant older = Instant.parse("2026-01-01T00:00:00Z");
            Instant newer = Instant.parse("2026-01-02T00:00:00Z");
            store.append(hop("old", 0, "intent", older)).block();
            store.append(hop("new", 0, "intent", newer)).block();
            store.append(hop("new", 1, "critic", newer.plusSeconds(5))).block();

            StepVerifier.create(store.recent(10))
                .assertNext(s -> {
                    assertThat(s.correlationId()).isEqualTo("new");
                    assertThat(s.hopCount()).isEqualTo(2L);
                })
                .assertNext(s -> assertThat(s.correlationId()).isEqualTo("old"))
                .verifyComplete();
        }
    }
}
