package com.advisorplatform.specialist.agent;

import com.advisorplatform.common.exception.AgentException;
import com.advisorplatform.common.model.ContextSnapshot;
import com.advisorplatform.common.model.SpecialistResult;
import com.advisorplatform.common.model.SpecialistTag;
import com.advisorplatform.common.model.Stance;
import com.advisorplatform.specialist.indicator.TechnicalIndicators;
import com.advisorplatform.specialist.indicator.Trendline;
import com.advisorplatform.specialist.port.MarketDataPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Short-horizon projection from a least-squares trendline over the last 30 closes.
 * Projects 1, 2 and 5 bars ahead; stance follows the next-bar projection when it moves
 * more than 0.25% from the current close.
 */
@Component
public class ForecastSpecialist extends AbstractSpecialist {

    private static final Logger log = LoggerFactory.getLogger(ForecastSpecialist.class);

    static final int WINDOW   = 30;
    static final int MIN_BARS = 20;
    private static final double MOVE_THRESHOLD = 0.0025;

    public ForecastSpecialist(MarketDataPort marketData) {
        super(marketData);
    }

    @Override
    public SpecialistTag tag() { return SpecialistTag.FORECAST; }

    @Override
    protected Mono<SpecialistResult> analyze(String query, ContextSnapshot snapshot) {
        String ticker = requireTicker(snapshot);
        return marketData.closingPrices(ticker, WINDOW).map(prices -> compute(ticker, prices));
    }

    SpecialistResult compute(String ticker, List<Double> prices) {
        if (prices == null || prices.size() < MIN_BARS) {
            throw new AgentException(tag(), "Insufficient history for forecasting " + ticker
                + " (need " + MIN_BARS + "+ bars)");
        }
        Trendline fit = TechnicalIndicators.trendline(prices, WINDOW);

        double current = prices.get(0);
        double next    = fit.project(1);
        double second  = fit.project(2);
        double week    = fit.project(5);
        double change  = (next - current) / current;

        Stance stance = change > MOVE_THRESHOLD ? Stance.BULLISH
                      : change < -MOVE_THRESHOLD ? Stance.BEARISH
                      : Stance.NEUTRAL;
        String fitQuality = fit.rSquared() > 0.7 ? "HIGH" : fit.rSquared() > 0.3 ? "MEDIUM" : "LOW";

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ticker",        ticker);
        payload.put("currentPrice",  round(current, 2));
        payload.put("forecastNext",  round(next, 2));
        payload.put("forecast2",     round(second, 2));
        payload.put("forecast5",     round(week, 2));
        payload.put("slopePerBar",   round(fit.slope(), 4));
        payload.put("rSquared",      round(fit.rSquared(), 3));
        payload.put("fitQuality",    fitQuality);
        payload.put("trend",         stance.name());

        String narrative = String.format(
            "Linear projection for %s points to %.2f next bar and %.2f in five bars (%+.2f%% next bar, fit %s).",
            ticker, next, week, change * 100, fitQuality.toLowerCase());

        log.info("[Forecast] ticker={} next={} change={} r2={} stance={}",
            ticker, round(next, 2), round(change, 4), round(fit.rSquared(), 3), stance);
        return SpecialistResult.success(tag(), payload, narrative, stance);
    }
}
