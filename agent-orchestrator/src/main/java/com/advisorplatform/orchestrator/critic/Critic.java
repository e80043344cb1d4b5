package com.advisorplatform.orchestrator.critic;

import com.advisorplatform.common.model.DebateTurn;
import com.advisorplatform.common.model.DecisionContext;
import reactor.core.publisher.Mono;

/**
 * Adversarial reviewer of the running thesis. Returns exactly one verdict per call and
 * never errors: an unavailable reviewer is reported as a {@code FLAG}, never as a silent
 * approval.
 */
public interface Critic {

    /**
     * @param ctx       context holding the current thesis and the specialist evidence
     * @param turnIndex 1-based debate turn this review produces
     */
    Mono<DebateTurn> review(DecisionContext ctx, int turnIndex);
}
