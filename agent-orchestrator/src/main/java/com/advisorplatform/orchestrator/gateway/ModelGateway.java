package com.advisorplatform.orchestrator.gateway;

import com.advisorplatform.common.model.ModelTier;
import com.advisorplatform.common.result.ErrorKind;
import com.advisorplatform.common.result.Result;
import com.advisorplatform.common.result.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

/**
 * Uniform entry point to the small and large generation tiers.
 *
 * <p>Every call is bounded by the tier's timeout and retried from the shared
 * {@link RetryPolicy} table; whatever is still failing afterwards comes back as a
 * {@link Result.Err}, never as an error signal. Callers decide on fallbacks (the Router
 * switches tiers, the critic degrades to a flag).
 */
public class ModelGateway {

    private static final Logger log = LoggerFactory.getLogger(ModelGateway.class);

    private final Map<ModelTier, ModelBackend> backends;
    private final Map<ModelTier, Duration>     timeouts;
    private final RetryPolicy                  retryPolicy;

    public ModelGateway(Map<ModelTier, ModelBackend> backends,
                        Map<ModelTier, Duration> timeouts,
                        RetryPolicy retryPolicy) {
        if (!backends.keySet().containsAll(EnumSet.allOf(ModelTier.class))) {
            throw new IllegalArgumentException("A backend is required for every tier, got " + backends.keySet());
        }
        this.backends    = new EnumMap<>(backends);
        this.timeouts    = new EnumMap<>(timeouts);
        this.retryPolicy = retryPolicy;
    }

    public Mono<Result<Generation>> generate(ModelTier tier, String prompt, int maxTokens, double temperature) {
        ModelBackend backend = backends.get(tier);
        Duration timeout = timeouts.getOrDefault(tier, Duration.ofSeconds(30));

        return Mono.defer(() -> backend.generate(prompt, maxTokens, temperature))
            .timeout(timeout)
            .retryWhen(retryPolicy.asRetry())
            .map(Result::ok)
            .doOnNext(r -> log.debug("[Gateway] tier={} model={} tokens={} meanEntropy={}",
                tier, backend.label(), r.value().perTokenEntropy().size(), r.value().entropy().mean()))
            .onErrorResume(e -> {
                Result<Generation> err = Result.err(e);
                if (err.kind() == ErrorKind.BACKEND_TIMEOUT) {
                    err = Result.err(ErrorKind.BACKEND_TIMEOUT, tier + " timed out after " + timeout.toMillis() + "ms");
                }
                log.warn("[Gateway] generation failed tier={} model={} kind={} reason={}",
                    tier, backend.label(), err.kind(), err.message());
                return Mono.just(err);
            });
    }

    public boolean isLive(ModelTier tier) {
        return backends.get(tier).live();
    }

    public String label(ModelTier tier) {
        return backends.get(tier).label();
    }
}
