package com.advisorplatform.specialist.agent;

import com.advisorplatform.common.exception.AgentException;
import com.advisorplatform.common.model.ContextSnapshot;
import com.advisorplatform.common.model.SpecialistResult;
import com.advisorplatform.common.model.SpecialistTag;
import com.advisorplatform.common.model.Stance;
import com.advisorplatform.specialist.port.MarketDataPort;
import com.advisorplatform.specialist.port.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Block-trade detector. Trades with notional ≥ $50k count as whale prints; their
 * average price against the tape's average decides accumulation vs distribution.
 */
@Component
public class WhaleSpecialist extends AbstractSpecialist {

    private static final Logger log = LoggerFactory.getLogger(WhaleSpecialist.class);

    static final int    TRADE_LIMIT          = 500;
    static final double WHALE_THRESHOLD_USD  = 50_000.0;
    private static final int    UNUSUAL_COUNT = 3;
    private static final double PRICE_BAND    = 0.001;

    public WhaleSpecialist(MarketDataPort marketData) {
        super(marketData);
    }

    @Override
    public SpecialistTag tag() { return SpecialistTag.WHALE; }

    @Override
    protected Mono<SpecialistResult> analyze(String query, ContextSnapshot snapshot) {
        String ticker = requireTicker(snapshot);
        return marketData.recentTrades(ticker, TRADE_LIMIT).map(trades -> compute(ticker, trades));
    }

    SpecialistResult compute(String ticker, List<Trade> trades) {
        if (trades == null || trades.isEmpty()) {
            throw new AgentException(tag(), "No recent trade data for " + ticker);
        }

        List<Trade> whales = trades.stream().filter(t -> t.notional() >= WHALE_THRESHOLD_USD).toList();
        double whaleVolume = whales.stream().mapToDouble(Trade::notional).sum();
        boolean unusual    = whales.size() > UNUSUAL_COUNT;

        Stance stance = Stance.NEUTRAL;
        if (!whales.isEmpty()) {
            double tapeAvg  = trades.stream().mapToDouble(Trade::price).average().orElse(0.0);
            double whaleAvg = whales.stream().mapToDouble(Trade::price).average().orElse(0.0);
            if (whaleAvg > tapeAvg * (1 + PRICE_BAND))      stance = Stance.BULLISH;
            else if (whaleAvg < tapeAvg * (1 - PRICE_BAND)) stance = Stance.BEARISH;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ticker",           ticker);
        payload.put("tradesScanned",    trades.size());
        payload.put("blockTrades",      whales.size());
        payload.put("whaleVolumeUsd",   round(whaleVolume, 2));
        payload.put("unusualVolume",    unusual);
        payload.put("sentimentImpact",  stance.name());

        String narrative;
        if (whales.isEmpty()) {
            narrative = "No significant block trades on " + ticker + "; flow appears retail-driven.";
        } else {
            narrative = String.format("Detected %d block trades on %s totalling $%.2fM. %s",
                whales.size(), ticker, whaleVolume / 1e6,
                switch (stance) {
                    case BULLISH -> "Prints above the tape suggest institutional accumulation.";
                    case BEARISH -> "Prints below the tape suggest institutional distribution.";
                    default      -> "Institutional flow is mixed.";
                });
        }

        log.info("[Whale] ticker={} trades={} blocks={} volumeUsd={} stance={}",
            ticker, trades.size(), whales.size(), round(whaleVolume, 0), stance);
        return SpecialistResult.success(tag(), payload, narrative, stance);
    }
}
