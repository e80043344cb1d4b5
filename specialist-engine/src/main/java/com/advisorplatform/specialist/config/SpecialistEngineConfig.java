package com.advisorplatform.specialist.config;

import com.advisorplatform.common.result.RetryPolicy;
import com.advisorplatform.specialist.cache.SpecialistResultCache;
import com.advisorplatform.specialist.port.MarketDataPort;
import com.advisorplatform.specialist.port.RestMarketDataPort;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class SpecialistEngineConfig {

    @Value("${services.market-data.base-url:http://localhost:8081}")
    private String marketDataBaseUrl;

    @Value("${services.market-data.timeout-seconds:10}")
    private int marketDataTimeoutSeconds;

    @Value("${specialists.cache.enabled:true}")
    private boolean cacheEnabled;

    @Bean
    public WebClient marketDataWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .responseTimeout(Duration.ofSeconds(marketDataTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(marketDataTimeoutSeconds, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(marketDataBaseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public RetryPolicy retryPolicy() {
        return RetryPolicy.defaults();
    }

    @Bean
    public MarketDataPort marketDataPort(WebClient marketDataWebClient, RetryPolicy retryPolicy) {
        return new RestMarketDataPort(marketDataWebClient, retryPolicy);
    }

    @Bean
    public SpecialistResultCache specialistResultCache() {
        return new SpecialistResultCache(Clock.systemUTC(), cacheEnabled);
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String sanitized = clientRequest.url().toString().replaceAll("apikey=[^&]+", "apikey=***");
            LoggerFactory.getLogger(SpecialistEngineConfig.class)
                .debug("Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }
}
