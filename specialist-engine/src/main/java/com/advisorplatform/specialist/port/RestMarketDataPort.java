package com.advisorplatform.specialist.port;

import com.advisorplatform.common.exception.AdvisoryException;
import com.advisorplatform.common.result.ErrorKind;
import com.advisorplatform.common.result.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * {@link MarketDataPort} backed by the market-data gateway's REST API.
 *
 * <pre>
 *   GET /api/v1/market-data/{ticker}/closes?bars=n     → [double]  (newest-first)
 *   GET /api/v1/market-data/{ticker}/headlines?limit=n → [Headline]
 *   GET /api/v1/market-data/{ticker}/social?limit=n    → [SocialPost]
 *   GET /api/v1/market-data/{ticker}/trades?limit=n    → [Trade]
 * </pre>
 *
 * <p>5xx responses map to {@link ErrorKind#BACKEND_UNAVAILABLE} and are retried through
 * the shared {@link RetryPolicy}; 4xx responses are treated as a schema violation.
 */
public class RestMarketDataPort implements MarketDataPort {

    private static final Logger log = LoggerFactory.getLogger(RestMarketDataPort.class);

    private static final ParameterizedTypeReference<List<Double>> PRICES = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<Headline>> HEADLINES = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<SocialPost>> POSTS = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<Trade>> TRADES = new ParameterizedTypeReference<>() {};

    private final WebClient   webClient;
    private final RetryPolicy retryPolicy;

    public RestMarketDataPort(WebClient marketDataWebClient, RetryPolicy retryPolicy) {
        this.webClient   = marketDataWebClient;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public Mono<List<Double>> closingPrices(String ticker, int bars) {
        return fetch("/api/v1/market-data/{ticker}/closes?bars={n}", ticker, bars, PRICES);
    }

    @Override
    public Mono<List<Headline>> headlines(String ticker, int limit) {
        return fetch("/api/v1/market-data/{ticker}/headlines?limit={n}", ticker, limit, HEADLINES);
    }

    @Override
    public Mono<List<SocialPost>> socialPosts(String ticker, int limit) {
        return fetch("/api/v1/market-data/{ticker}/social?limit={n}", ticker, limit, POSTS);
    }

    @Override
    public Mono<List<Trade>> recentTrades(String ticker, int limit) {
        return fetch("/api/v1/market-data/{ticker}/trades?limit={n}", ticker, limit, TRADES);
    }

    private <T> Mono<List<T>> fetch(String uri, String ticker, int n,
                                    ParameterizedTypeReference<List<T>> type) {
        return webClient.get()
            .uri(uri, ticker, n)
            .retrieve()
            .onStatus(HttpStatusCode::is5xxServerError, resp -> Mono.error(new AdvisoryException(
                ErrorKind.BACKEND_UNAVAILABLE, "market data server error " + resp.statusCode())))
            .onStatus(HttpStatusCode::is4xxClientError, resp -> Mono.error(new AdvisoryException(
                ErrorKind.SCHEMA_VIOLATION, "market data rejected request " + resp.statusCode())))
            .bodyToMono(type)
            .defaultIfEmpty(List.of())
            .retryWhen(retryPolicy.asRetry())
            .doOnError(e -> log.warn("[MarketData] fetch failed uri={} ticker={} error={}",
                uri, ticker, e.getMessage()));
    }
}
