package com.advisorplatform.orchestrator.gateway;

import com.advisorplatform.common.exception.AdvisoryException;
import com.advisorplatform.common.model.ModelTier;
import com.advisorplatform.common.result.ErrorKind;
import com.advisorplatform.common.result.RetryPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelGatewayTest {

    /** Backend that fails with {@code failure} for the first {@code failures} calls. */
    private static final class ScriptedBackend implements ModelBackend {
        final AtomicInteger calls = new AtomicInteger();
        final int failures;
        final ErrorKind failure;

        ScriptedBackend(int failures, ErrorKind failure) {
            this.failures = failures;
            this.failure  = failure;
        }

        @Override
        public Mono<Generation> generate(String prompt, int maxTokens, double temperature) {
            if (calls.incrementAndGet() <= failures) {
                return Mono.error(new AdvisoryException(failure, "scripted"));
            }
            return Mono.just(new Generation("ok.", List.of(0.1), ModelTier.SMALL, "scripted", false));
        }

        @Override public String label() { return "scripted"; }
        @Override public boolean live() { return true; }
    }

    private static final RetryPolicy FAST_RETRIES = RetryPolicy.of(Map.of(
        ErrorKind.BACKEND_UNAVAILABLE, new RetryPolicy.Rule(2, Duration.ZERO),
        ErrorKind.BACKEND_TIMEOUT,     new RetryPolicy.Rule(1, Duration.ZERO)));

    private static ModelGateway gateway(ModelBackend small, Duration timeout, RetryPolicy policy) {
        return new ModelGateway(
            Map.of(ModelTier.SMALL, small, ModelTier.LARGE, new TemplateBackend(ModelTier.LARGE)),
            Map.of(ModelTier.SMALL, timeout, ModelTier.LARGE, timeout),
            policy);
    }

    @Test
    @DisplayName("unavailable backend is retried and the eventual success returned as Ok")
    void retriesUnavailable() {
        ScriptedBackend backend = new ScriptedBackend(2, ErrorKind.BACKEND_UNAVAILABLE);

        StepVerifier.create(gateway(backend, Duration.ofSeconds(1), FAST_RETRIES)
                .generate(ModelTier.SMALL, "p", 16, 0.2))
            .assertNext(r -> {
                assertThat(r.isOk()).isTrue();
                assertThat(r.value().text()).isEqualTo("ok.");
            })
            .verifyComplete();
        assertThat(backend.calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("retries are bounded; the failure is returned as Err, not signalled")
    void exhaustedRetriesBecomeErr() {
        ScriptedBackend backend = new ScriptedBackend(10, ErrorKind.BACKEND_UNAVAILABLE);

        StepVerifier.create(gateway(backend, Duration.ofSeconds(1), FAST_RETRIES)
                .generate(ModelTier.SMALL, "p", 16, 0.2))
            .assertNext(r -> assertThat(r.kind()).isEqualTo(ErrorKind.BACKEND_UNAVAILABLE))
            .verifyComplete();
        assertThat(backend.calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("schema violations are never retried")
    void schemaViolationNotRetried() {
        ScriptedBackend backend = new ScriptedBackend(1, ErrorKind.SCHEMA_VIOLATION);

        StepVerifier.create(gateway(backend, Duration.ofSeconds(1), FAST_RETRIES)
                .generate(ModelTier.SMALL, "p", 16, 0.2))
            .assertNext(r -> assertThat(r.kind()).isEqualTo(ErrorKind.SCHEMA_VIOLATION))
            .verifyComplete();
        assertThat(backend.calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("a silent backend times out as BACKEND_TIMEOUT")
    void timeout() {
        ModelBackend silent = new ModelBackend() {
            @Override public Mono<Generation> generate(String p, int m, double t) { return Mono.never(); }
            @Override public String label() { return "silent"; }
            @Override public boolean live() { return true; }
        };

        StepVerifier.create(gateway(silent, Duration.ofMillis(50), RetryPolicy.none())
                .generate(ModelTier.SMALL, "p", 16, 0.2))
            .assertNext(r -> {
                assertThat(r.kind()).isEqualTo(ErrorKind.BACKEND_TIMEOUT);
                assertThat(r.message()).contains("timed out after 50ms");
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("both tiers must have a backend")
    void requiresEveryTier() {
        assertThatThrownBy(() -> new ModelGateway(
                Map.of(ModelTier.SMALL, new TemplateBackend(ModelTier.SMALL)),
                Map.of(), RetryPolicy.none()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
