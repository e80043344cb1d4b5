package com.advisorplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only view of the request handed to every specialist in a burst.
 * Specialists never see the {@link DecisionContext} itself.
 */
public record ContextSnapshot(
    @JsonProperty("correlationId") String correlationId,
    @JsonProperty("ticker") String ticker,
    @JsonProperty("accountScope") String accountScope,
    @JsonProperty("intent") Intent intent
) {
    public static ContextSnapshot of(DecisionContext ctx) {
        return new ContextSnapshot(ctx.correlationId(), ctx.ticker(), ctx.accountScope(),
            ctx.intent() != null ? ctx.intent().intent() : Intent.MARKET_ANALYSIS);
    }

    public boolean hasTicker() {
        return ticker != null && !ticker.isBlank();
    }
}
