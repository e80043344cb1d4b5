package com.advisorplatform.specialist.cache;

import com.advisorplatform.common.model.SpecialistResult;
import com.advisorplatform.common.model.SpecialistTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-lived in-memory cache of successful specialist results, one entry per
 * (tag, ticker). TTL follows how fast each input goes stale: trade flow and technicals
 * expire within a minute, news-driven results linger for ten.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}. Pure synchronous lookups, safe to call
 * inside reactive chains.
 */
public class SpecialistResultCache {

    private static final Logger log = LoggerFactory.getLogger(SpecialistResultCache.class);

    private static final Map<SpecialistTag, Duration> TTL_BY_TAG = Map.of(
        SpecialistTag.QUANT,     Duration.ofSeconds(60),
        SpecialistTag.WHALE,     Duration.ofSeconds(60),
        SpecialistTag.FORECAST,  Duration.ofMinutes(5),
        SpecialistTag.SENTIMENT, Duration.ofMinutes(10),
        SpecialistTag.RESEARCH,  Duration.ofMinutes(10)
    );

    private record Entry(SpecialistResult result, Instant storedAt) {}

    private final ConcurrentHashMap<String, Entry> store = new ConcurrentHashMap<>();
    private final Clock clock;
    private final boolean enabled;

    public SpecialistResultCache(Clock clock, boolean enabled) {
        this.clock   = clock;
        this.enabled = enabled;
    }

    /**
     * Returns the cached result marked {@code cached=true}, or {@code null} when absent,
     * expired or caching is disabled. Expired entries are evicted on read.
     */
    public SpecialistResult get(SpecialistTag tag, String ticker) {
        if (!enabled || ticker == null) return null;
        String key = key(tag, ticker);
        Entry entry = store.get(key);
        if (entry == null) return null;
        if (isExpired(tag, entry)) {
            store.remove(key, entry);
            return null;
        }
        return entry.result().asCached();
    }

    /** Only successful results are cached. */
    public void put(SpecialistTag tag, String ticker, SpecialistResult result) {
        if (!enabled || ticker == null || !result.succeeded()) return;
        store.put(key(tag, ticker), new Entry(result, clock.instant()));
        log.debug("CACHE_REFRESH tag={} ticker={} ttlSeconds={}", tag.id(), ticker, ttl(tag).toSeconds());
    }

    public int size() {
        return store.size();
    }

    private boolean isExpired(SpecialistTag tag, Entry entry) {
        return clock.instant().isAfter(entry.storedAt().plus(ttl(tag)));
    }

    private static Duration ttl(SpecialistTag tag) {
        return TTL_BY_TAG.getOrDefault(tag, Duration.ofSeconds(60));
    }

    private static String key(SpecialistTag tag, String ticker) {
        return tag.name() + ":" + ticker.toUpperCase(Locale.ROOT);
    }
}
