package com.advisorplatform.orchestrator.critic;

import com.advisorplatform.common.model.DebateTurn;
import com.advisorplatform.common.model.DecisionContext;
import com.advisorplatform.common.model.ModelTier;
import com.advisorplatform.common.model.SpecialistResult;
import com.advisorplatform.common.result.ErrorKind;
import com.advisorplatform.orchestrator.gateway.ModelGateway;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Contrarian risk reviewer.
 *
 * <p>Live mode prompts the {@code LARGE} tier and validates its JSON verdict with
 * {@link CriticVerdictParser}. When the large tier is the local template backend the
 * review is delegated to {@link RuleBasedCritic}. A failed call or invalid output becomes
 * a {@code FLAG} with rationale {@code "critic unavailable: ..."}, marked degraded.
 */
@Component
public class RiskCritic implements Critic {

    private static final Logger log = LoggerFactory.getLogger(RiskCritic.class);

    static final int MAX_TOKENS = 300;

    private final ModelGateway        gateway;
    private final CriticVerdictParser parser;
    private final RuleBasedCritic     rules;

    public RiskCritic(ModelGateway gateway, ObjectMapper objectMapper) {
        this.gateway = gateway;
        this.parser  = new CriticVerdictParser(objectMapper);
        this.rules   = new RuleBasedCritic();
    }

    @Override
    public Mono<DebateTurn> review(DecisionContext ctx, int turnIndex) {
        if (!gateway.isLive(ModelTier.LARGE)) {
            return rules.review(ctx, turnIndex)
                .doOnNext(t -> log.info("[Critic] rule-based verdict={} turn={} correlationId={}",
                    t.verdict(), turnIndex, ctx.correlationId()));
        }

        return gateway.generate(ModelTier.LARGE, buildPrompt(ctx), MAX_TOKENS, 0.0)
            .map(result -> {
                if (!result.isOk()) {
                    return unavailable(turnIndex, result.kind(), result.message());
                }
                return parser.parse(result.value().text(), turnIndex);
            })
            .onErrorResume(e -> Mono.just(unavailable(turnIndex, ErrorKind.classify(e), e.getMessage())))
            .doOnNext(t -> log.info("[Critic] verdict={} turn={} correlationId={}",
                t.verdict(), turnIndex, ctx.correlationId()));
    }

    private DebateTurn unavailable(int turnIndex, ErrorKind kind, String message) {
        log.warn("[Critic] review unavailable, flagging. turn={} kind={} reason={}", turnIndex, kind, message);
        return DebateTurn.unavailable(turnIndex, kind + ": " + message);
    }

    private static String buildPrompt(DecisionContext ctx) {
        StringBuilder evidence = new StringBuilder();
        for (SpecialistResult r : ctx.specialistResults()) {
            evidence.append("- ").append(r.specialistTag().id()).append(": ");
            evidence.append(r.succeeded() ? r.stance() + ". " + r.narrativeText() : "FAILED (" + r.error() + ")");
            evidence.append('\n');
        }
        return """
            You are a contrarian risk reviewer. Your job is to find what is wrong with the
            investment thesis below: unsupported claims, ignored contrary evidence, missing
            risks, and recommendations that do not follow from the evidence.

            Client question: %s
            Ticker: %s

            Specialist evidence:
            %s
            Thesis:
            %s

            Verdicts:
              APPROVE - the thesis follows from the evidence
              FLAG    - acceptable, but a material concern must be disclosed (rationale required)
              REFUTE  - the recommendation is not supported and must be rebutted (rationale required)

            Respond ONLY with valid JSON (no markdown):
            {"verdict":"APPROVE|FLAG|REFUTE","rationale":"<specific concern, or empty for APPROVE>"}
            """.formatted(ctx.query(), ctx.ticker(), evidence, ctx.thesis());
    }
}
