package com.advisorplatform.orchestrator.gateway;

import reactor.core.publisher.Mono;

/**
 * A single text-generation backend behind one {@link com.advisorplatform.common.model.ModelTier}.
 *
 * <p>Implementations signal failures as {@link com.advisorplatform.common.exception.AdvisoryException}
 * carrying the matching {@link com.advisorplatform.common.result.ErrorKind}; retry and
 * {@code Result} conversion happen in {@link ModelGateway}.
 */
public interface ModelBackend {

    Mono<Generation> generate(String prompt, int maxTokens, double temperature);

    /** Model label for logs and trace records, e.g. {@code llama-3.1-8b} or {@code template-small}. */
    String label();

    /** {@code false} for the deterministic local backend. */
    boolean live();
}
