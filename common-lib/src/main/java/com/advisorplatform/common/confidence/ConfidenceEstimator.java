package com.advisorplatform.common.confidence;

import com.advisorplatform.common.model.ConfidenceScore;
import com.advisorplatform.common.model.DebateOutcome;
import com.advisorplatform.common.model.DecisionContext;

/**
 * Strategy contract for turning a finished debate into a scalar confidence.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently</li>
 *   <li><b>Pure</b>: no logging, no reactive types, no side effects</li>
 *   <li><b>Deterministic</b>: identical inputs always produce an identical score</li>
 * </ul>
 *
 * <p>Current implementation: {@link WeightedConfidenceEstimator}.
 */
public interface ConfidenceEstimator {

    /**
     * @param ctx     context holding specialist results, committed segments and the debate
     * @param outcome how the debate terminated
     * @return a score in [0, 1], never {@code null}
     */
    ConfidenceScore estimate(DecisionContext ctx, DebateOutcome outcome);
}
