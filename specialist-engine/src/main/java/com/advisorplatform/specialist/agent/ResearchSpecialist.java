package com.advisorplatform.specialist.agent;

import com.advisorplatform.common.model.ContextSnapshot;
import com.advisorplatform.common.model.SpecialistResult;
import com.advisorplatform.common.model.SpecialistTag;
import com.advisorplatform.common.model.Stance;
import com.advisorplatform.specialist.port.Headline;
import com.advisorplatform.specialist.port.MarketDataPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Headline digest: scans recent news for known catalysts and nets their polarity.
 */
@Component
public class ResearchSpecialist extends AbstractSpecialist {

    private static final Logger log = LoggerFactory.getLogger(ResearchSpecialist.class);

    static final int HEADLINE_LIMIT = 10;

    /** Catalyst keyword → polarity (+1 supportive, −1 adverse, 0 event without direction). */
    static final Map<String, Integer> CATALYSTS = Map.ofEntries(
        Map.entry("earnings beat", +1),
        Map.entry("raises guidance", +1),
        Map.entry("upgrade", +1),
        Map.entry("buyback", +1),
        Map.entry("partnership", +1),
        Map.entry("approval", +1),
        Map.entry("earnings miss", -1),
        Map.entry("cuts guidance", -1),
        Map.entry("downgrade", -1),
        Map.entry("lawsuit", -1),
        Map.entry("investigation", -1),
        Map.entry("recall", -1),
        Map.entry("layoffs", -1),
        Map.entry("acquisition", 0),
        Map.entry("earnings", 0),
        Map.entry("merger", 0)
    );

    public ResearchSpecialist(MarketDataPort marketData) {
        super(marketData);
    }

    @Override
    public SpecialistTag tag() { return SpecialistTag.RESEARCH; }

    @Override
    protected Mono<SpecialistResult> analyze(String query, ContextSnapshot snapshot) {
        String ticker = requireTicker(snapshot);
        return marketData.headlines(ticker, HEADLINE_LIMIT).map(headlines -> compute(ticker, headlines));
    }

    SpecialistResult compute(String ticker, List<Headline> headlines) {
        List<String> catalysts = new ArrayList<>();
        int net = 0;
        for (Headline h : headlines) {
            String title = h.title() == null ? "" : h.title().toLowerCase(Locale.ROOT);
            // longest keyword first so "earnings beat" wins over "earnings"
            String hit = CATALYSTS.keySet().stream()
                .filter(title::contains)
                .max((a, b) -> Integer.compare(a.length(), b.length()))
                .orElse(null);
            if (hit != null) {
                catalysts.add(hit);
                net += CATALYSTS.get(hit);
            }
        }

        Stance stance = net > 0 ? Stance.BULLISH : net < 0 ? Stance.BEARISH : Stance.NEUTRAL;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ticker",        ticker);
        payload.put("headlineCount", headlines.size());
        payload.put("catalysts",     catalysts);
        payload.put("netCatalyst",   net);
        payload.put("headlines",     headlines.stream().limit(5).map(Headline::title).toList());

        String narrative = headlines.isEmpty()
            ? "No recent news coverage found for " + ticker + "."
            : String.format("%d recent headlines on %s; catalysts: %s. News flow reads %s.",
                headlines.size(), ticker,
                catalysts.isEmpty() ? "none identified" : String.join(", ", catalysts),
                stance.name().toLowerCase());

        log.info("[Research] ticker={} headlines={} catalysts={} stance={}",
            ticker, headlines.size(), catalysts.size(), stance);
        return SpecialistResult.success(tag(), payload, narrative, stance);
    }
}
