package com.advisorplatform.specialist.agent;

import com.advisorplatform.common.exception.AgentException;
import com.advisorplatform.common.model.ContextSnapshot;
import com.advisorplatform.common.model.SpecialistResult;
import com.advisorplatform.common.model.SpecialistTag;
import com.advisorplatform.common.model.Stance;
import com.advisorplatform.specialist.indicator.TechnicalIndicators;
import com.advisorplatform.specialist.port.MarketDataPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Technical analysis over recent closes: RSI(14), SMA(20/50), EMA(12), MACD, volatility.
 *
 * <p>Stance votes on five factors (trend, MACD sign, price vs SMA20, price vs EMA12,
 * 5-bar momentum): score ≥ 2 → BULLISH, ≤ −2 → BEARISH, otherwise NEUTRAL.
 */
@Component
public class QuantSpecialist extends AbstractSpecialist {

    private static final Logger log = LoggerFactory.getLogger(QuantSpecialist.class);

    static final int LOOKBACK = 60;
    static final int MIN_BARS = 26;

    public QuantSpecialist(MarketDataPort marketData) {
        super(marketData);
    }

    @Override
    public SpecialistTag tag() { return SpecialistTag.QUANT; }

    @Override
    protected Mono<SpecialistResult> analyze(String query, ContextSnapshot snapshot) {
        String ticker = requireTicker(snapshot);
        return marketData.closingPrices(ticker, LOOKBACK).map(prices -> compute(ticker, prices));
    }

    SpecialistResult compute(String ticker, List<Double> prices) {
        if (prices == null || prices.size() < MIN_BARS) {
            throw new AgentException(tag(), "Insufficient price history for " + ticker
                + " (need " + MIN_BARS + "+ bars, got " + (prices == null ? 0 : prices.size()) + ")");
        }

        double price  = prices.get(0);
        double rsi    = TechnicalIndicators.rsi(prices, 14);
        double sma20  = TechnicalIndicators.sma(prices, 20);
        double sma50  = TechnicalIndicators.sma(prices, 50);
        double ema12  = TechnicalIndicators.ema(prices, 12);
        double macd   = TechnicalIndicators.macd(prices);
        double stdDev = TechnicalIndicators.stdDev(prices, 20);

        String trend     = TechnicalIndicators.trendSignal(sma20, sma50, price);
        String rsiSignal = TechnicalIndicators.rsiSignal(rsi);
        int score        = biasScore(trend, macd, price, sma20, ema12, prices);

        Stance stance = score >= 2 ? Stance.BULLISH : score <= -2 ? Stance.BEARISH : Stance.NEUTRAL;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ticker",       ticker);
        payload.put("currentPrice", round(price, 2));
        payload.put("rsi",          Double.isNaN(rsi) ? "N/A" : round(rsi, 2));
        payload.put("rsiSignal",    rsiSignal);
        payload.put("sma20",        Double.isNaN(sma20) ? "N/A" : round(sma20, 2));
        payload.put("sma50",        Double.isNaN(sma50) ? "N/A" : round(sma50, 2));
        payload.put("macd",         Double.isNaN(macd) ? "N/A" : round(macd, 4));
        payload.put("volatility",   Double.isNaN(stdDev) ? "N/A" : round(stdDev, 2));
        payload.put("trend",        trend);
        payload.put("biasScore",    score);

        String narrative = String.format(
            "%s trades at %.2f with RSI %.1f (%s); trend is %s and MACD is %s. Technical bias: %s.",
            ticker, price, Double.isNaN(rsi) ? 50.0 : rsi, rsiSignal.toLowerCase(),
            trend.toLowerCase().replace('_', ' '),
            Double.isNaN(macd) ? "unavailable" : (macd >= 0 ? "positive" : "negative"),
            stance.name().toLowerCase());

        log.info("[Quant] ticker={} trend={} rsi={} macd={} score={} stance={}",
            ticker, trend, round(rsi, 2), round(macd, 4), score, stance);
        return SpecialistResult.success(tag(), payload, narrative, stance);
    }

    private int biasScore(String trend, double macd, double price, double sma20, double ema12,
                          List<Double> prices) {
        int score = 0;

        if ("UPTREND".equals(trend))        score++;
        else if ("DOWNTREND".equals(trend)) score--;

        if (!Double.isNaN(macd)) {
            if (macd > 0) score++;
            else if (macd < 0) score--;
        }

        if (!Double.isNaN(sma20) && sma20 > 0) {
            if (price > sma20) score++;
            else if (price < sma20) score--;
        }

        if (!Double.isNaN(ema12) && ema12 > 0) {
            if (price > ema12) score++;
            else if (price < ema12) score--;
        }

        // prices[4] = 4 bars ago
        if (prices.size() >= 5) {
            if (prices.get(0) > prices.get(4)) score++;
            else if (prices.get(0) < prices.get(4)) score--;
        }
        return score;
    }
}
