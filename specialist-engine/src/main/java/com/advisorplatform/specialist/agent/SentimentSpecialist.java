package com.advisorplatform.specialist.agent;

import com.advisorplatform.common.model.ContextSnapshot;
import com.advisorplatform.common.model.SpecialistResult;
import com.advisorplatform.common.model.SpecialistTag;
import com.advisorplatform.common.model.Stance;
import com.advisorplatform.specialist.port.Headline;
import com.advisorplatform.specialist.port.MarketDataPort;
import com.advisorplatform.specialist.port.SocialPost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lexicon sentiment over headlines and social posts, engagement-weighted.
 *
 * <p>Each text scores {@code (pos − neg) / (pos + neg)} in [−1, 1]; the aggregate is the
 * weighted mean. ≥ 0.15 → BULLISH, ≤ −0.15 → BEARISH. No discussion at all yields a
 * neutral success rather than a failure.
 */
@Component
public class SentimentSpecialist extends AbstractSpecialist {

    private static final Logger log = LoggerFactory.getLogger(SentimentSpecialist.class);

    private static final double LABEL_THRESHOLD = 0.15;
    private static final int    HEADLINE_WEIGHT = 5;

    static final Set<String> POSITIVE = Set.of(
        "beat", "beats", "surge", "surges", "rally", "rallies", "upgrade", "upgraded", "bullish",
        "growth", "record", "strong", "outperform", "gain", "gains", "soar", "soars", "breakout",
        "buy", "moon", "raises", "tops");
    static final Set<String> NEGATIVE = Set.of(
        "miss", "misses", "plunge", "plunges", "downgrade", "downgraded", "bearish", "lawsuit",
        "weak", "underperform", "loss", "losses", "crash", "drop", "drops", "fraud", "recall",
        "probe", "sell", "cuts", "slump", "warning");

    public SentimentSpecialist(MarketDataPort marketData) {
        super(marketData);
    }

    @Override
    public SpecialistTag tag() { return SpecialistTag.SENTIMENT; }

    @Override
    protected Mono<SpecialistResult> analyze(String query, ContextSnapshot snapshot) {
        String ticker = requireTicker(snapshot);
        return Mono.zip(marketData.headlines(ticker, 20), marketData.socialPosts(ticker, 50))
            .map(t -> compute(ticker, t.getT1(), t.getT2()));
    }

    SpecialistResult compute(String ticker, List<Headline> headlines, List<SocialPost> posts) {
        double weightedSum = 0.0;
        long   totalWeight = 0;
        Set<String> platforms = new LinkedHashSet<>();
        List<String> topDiscussions = new ArrayList<>();

        for (Headline h : headlines) {
            weightedSum += score(h.title()) * HEADLINE_WEIGHT;
            totalWeight += HEADLINE_WEIGHT;
            platforms.add("news");
        }
        for (SocialPost p : posts) {
            int weight = Math.max(1, p.engagement());
            weightedSum += score(p.text()) * weight;
            totalWeight += weight;
            platforms.add(p.platform());
            if (topDiscussions.size() < 5) topDiscussions.add(p.text());
        }

        if (totalWeight == 0) {
            Map<String, Object> empty = new LinkedHashMap<>();
            empty.put("ticker", ticker);
            empty.put("sentimentScore", 0.0);
            empty.put("sentimentLabel", Stance.NEUTRAL.name());
            empty.put("mentionVolume", "NONE");
            return SpecialistResult.success(tag(), empty,
                "No social or news discussion found for " + ticker + ".", Stance.NEUTRAL);
        }

        double avg = weightedSum / totalWeight;
        Stance stance = avg >= LABEL_THRESHOLD ? Stance.BULLISH
                      : avg <= -LABEL_THRESHOLD ? Stance.BEARISH
                      : Stance.NEUTRAL;
        int mentions = headlines.size() + posts.size();
        String volume = mentions >= 10 ? "HIGH" : mentions >= 5 ? "MEDIUM" : "LOW";

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ticker",         ticker);
        payload.put("sentimentScore", round(avg, 3));
        payload.put("sentimentLabel", stance.name());
        payload.put("mentionVolume",  volume);
        payload.put("mentions",       mentions);
        payload.put("platforms",      List.copyOf(platforms));
        payload.put("topDiscussions", topDiscussions);

        String narrative = String.format("Crowd sentiment on %s is %s (score %+.2f) across %d mentions, volume %s.",
            ticker, stance.name().toLowerCase(), avg, mentions, volume.toLowerCase());

        log.info("[Sentiment] ticker={} score={} mentions={} stance={}", ticker, round(avg, 3), mentions, stance);
        return SpecialistResult.success(tag(), payload, narrative, stance);
    }

    static double score(String text) {
        if (text == null || text.isBlank()) return 0.0;
        int pos = 0;
        int neg = 0;
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z]+")) {
            if (POSITIVE.contains(token)) pos++;
            else if (NEGATIVE.contains(token)) neg++;
        }
        return pos + neg == 0 ? 0.0 : (double) (pos - neg) / (pos + neg);
    }
}
