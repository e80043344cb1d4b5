package com.advisorplatform.orchestrator.action;

import com.advisorplatform.common.model.ProposedAction;

/**
 * Hands a {@link ProposedAction} to the external authorization boundary.
 *
 * <p>Fire-and-forget: implementations never block and never fail the caller. The core
 * only proposes; execution happens, if at all, on the far side of the boundary.
 */
public interface ActionProposalPublisher {

    void publish(ProposedAction action);
}
