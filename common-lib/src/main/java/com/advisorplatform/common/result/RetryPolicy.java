package com.advisorplatform.common.result;

import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * The single retry table, keyed by {@link ErrorKind}.
 *
 * <p>Components never hand-roll retry loops; they call {@link #asRetry()} and get a
 * Reactor {@link Retry} that consults this table per failure. Kinds absent from the
 * table are not retried.
 *
 * <pre>
 *   BACKEND_TIMEOUT      1 retry,  backoff 200ms
 *   BACKEND_UNAVAILABLE  2 retries, backoff 100ms, doubling
 *   everything else      no retry
 * </pre>
 */
public final class RetryPolicy {

    public record Rule(int maxRetries, Duration backoff) {
        public Rule {
            if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        }
    }

    private final Map<ErrorKind, Rule> rules;

    private RetryPolicy(Map<ErrorKind, Rule> rules) {
        this.rules = rules.isEmpty() ? new EnumMap<>(ErrorKind.class) : new EnumMap<>(rules);
    }

    public static RetryPolicy defaults() {
        return of(Map.of(
            ErrorKind.BACKEND_TIMEOUT,     new Rule(1, Duration.ofMillis(200)),
            ErrorKind.BACKEND_UNAVAILABLE, new Rule(2, Duration.ofMillis(100))
        ));
    }

    public static RetryPolicy of(Map<ErrorKind, Rule> rules) {
        return new RetryPolicy(rules);
    }

    public static RetryPolicy none() {
        return new RetryPolicy(Map.of());
    }

    public int maxRetries(ErrorKind kind) {
        Rule rule = rules.get(kind);
        return rule == null ? 0 : rule.maxRetries();
    }

    public boolean isRetryable(ErrorKind kind) {
        return maxRetries(kind) > 0;
    }

    /**
     * Reactor retry spec driven by this table. Backoff doubles per consecutive attempt.
     * When retries are exhausted the original failure propagates unchanged.
     */
    public Retry asRetry() {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            ErrorKind kind    = ErrorKind.classify(failure);
            Rule rule         = rules.get(kind);
            long attempt      = signal.totalRetriesInARow();
            if (rule == null || attempt >= rule.maxRetries()) {
                return Mono.<Long>error(failure);
            }
            Duration delay = rule.backoff().multipliedBy(1L << Math.min(attempt, 10));
            return delay.isZero() ? Mono.just(attempt) : Mono.delay(delay).thenReturn(attempt);
        }));
    }
}
