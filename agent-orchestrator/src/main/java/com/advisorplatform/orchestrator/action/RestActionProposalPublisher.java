package com.advisorplatform.orchestrator.action;

import com.advisorplatform.common.model.ProposedAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * REST-based {@link ActionProposalPublisher}: POSTs the proposal to the action gateway.
 */
@Component
public class RestActionProposalPublisher implements ActionProposalPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestActionProposalPublisher.class);

    private final WebClient actionGatewayClient;

    public RestActionProposalPublisher(WebClient actionGatewayClient) {
        this.actionGatewayClient = actionGatewayClient;
    }

    @Override
    public void publish(ProposedAction action) {
        actionGatewayClient.post()
            .uri("/api/v1/authorizations/proposals")
            .header("X-Trace-Id", action.correlationId())
            .bodyValue(action)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Action proposal published. correlationId={} proposalId={} action={} status={}",
                                action.correlationId(), action.proposalId(), action.action(), r.getStatusCode()),
                err -> log.warn("Action proposal publish failed (non-critical). correlationId={} proposalId={}",
                                action.correlationId(), action.proposalId(), err)
            );
    }
}
