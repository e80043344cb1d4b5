package com.advisorplatform.orchestrator.stream;

import com.advisorplatform.common.model.DecisionContext;
import com.advisorplatform.orchestrator.service.OrchestratorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Starts orchestrations and binds each one to a {@link StreamSession}.
 *
 * <p>The orchestration is subscribed here, independently of any HTTP response, so a client
 * disconnect never cancels it; only {@link #abort} or session expiry does.
 */
@Service
public class AdvisoryStreamService {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryStreamService.class);

    private final OrchestratorService   orchestratorService;
    private final StreamSessionRegistry registry;
    private final Clock                 clock;
    private final Duration              requestBudget;

    public AdvisoryStreamService(OrchestratorService orchestratorService,
                                 StreamSessionRegistry registry,
                                 Clock clock,
                                 @Value("${orchestrator.request-budget:PT90S}") Duration requestBudget) {
        this.orchestratorService = orchestratorService;
        this.registry            = registry;
        this.clock               = clock;
        this.requestBudget       = requestBudget;
    }

    public StreamSession start(AdvisoryRequest request) {
        String correlationId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        String ticker = request.ticker() == null || request.ticker().isBlank()
            ? null
            : request.ticker().trim().toUpperCase(Locale.ROOT);
        DecisionContext ctx = DecisionContext.assemble(correlationId, request.query().trim(),
            request.accountScope(), ticker, now, now.plus(requestBudget));

        StreamSession session = registry.create(correlationId);
        Disposable subscription = orchestratorService.orchestrate(ctx, session)
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe(
                done -> log.info("Advisory request complete. correlationId={} sessionId={} state={}",
                    correlationId, session.sessionId(), done.state()),
                err -> log.error("Advisory orchestration escaped with error. correlationId={} sessionId={}",
                    correlationId, session.sessionId(), err)
            );
        session.bindOrchestration(subscription);
        return session;
    }

    public Optional<StreamSession> find(String sessionId) {
        return registry.find(sessionId);
    }

    /**
     * @return empty if the session is unknown or expired, otherwise whether the abort took
     *         effect ({@code false} when the stream had already terminated)
     */
    public Optional<Boolean> abort(String sessionId) {
        return registry.find(sessionId).map(session -> {
            boolean aborted = session.abort("client abort");
            log.info("Abort requested. sessionId={} correlationId={} aborted={}",
                sessionId, session.correlationId(), aborted);
            return aborted;
        });
    }
}
