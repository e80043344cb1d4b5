package com.advisorplatform.orchestrator.trace;

import com.advisorplatform.common.model.HopOutcome;
import com.advisorplatform.common.model.TraceRecord;
import com.advisorplatform.common.trace.Digests;
import com.advisorplatform.trace.service.TraceService;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out one {@link RequestTrace} per request. Hop indices are allocated per request
 * in call order; specialist hops of one burst may be numbered in completion order.
 */
@Component
public class TraceRecorder {

    private final TraceService traceService;
    private final Clock        clock;

    public TraceRecorder(TraceService traceService, Clock clock) {
        this.traceService = traceService;
        this.clock        = clock;
    }

    public RequestTrace open(String correlationId) {
        return new RequestTrace(correlationId);
    }

    public final class RequestTrace {

        private final String        correlationId;
        private final AtomicInteger nextHop = new AtomicInteger();

        private RequestTrace(String correlationId) {
            this.correlationId = correlationId;
        }

        /** Digests the hop's input and output and hands the record to the fire-and-forget writer. */
        public TraceRecord hop(String component, String input, String output, long latencyMs,
                               HopOutcome outcome, String modelLabel) {
            TraceRecord record = new TraceRecord(
                correlationId,
                nextHop.getAndIncrement(),
                component,
                Digests.sha256(input),
                Digests.sha256(output),
                latencyMs,
                outcome,
                modelLabel,
                clock.instant());
            traceService.record(record);
            return record;
        }

        public int hopCount() {
            return nextHop.get();
        }

        public String correlationId() {
            return correlationId;
        }
    }
}
