package com.advisorplatform.specialist.port;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Narrow view of the external market-data provider. Every specialist input comes
 * through here; the provider itself is outside this system.
 *
 * <p>Implementations MUST be non-blocking and map transport failures onto
 * {@link com.advisorplatform.common.result.ErrorKind} via
 * {@link com.advisorplatform.common.exception.AdvisoryException}.
 */
public interface MarketDataPort {

    /** Closing prices, newest-first. */
    Mono<List<Double>> closingPrices(String ticker, int bars);

    Mono<List<Headline>> headlines(String ticker, int limit);

    Mono<List<SocialPost>> socialPosts(String ticker, int limit);

    Mono<List<Trade>> recentTrades(String ticker, int limit);
}
