package com.advisorplatform.specialist.agent;

import com.advisorplatform.common.model.ContextSnapshot;
import com.advisorplatform.common.model.SpecialistResult;
import com.advisorplatform.common.model.SpecialistTag;
import com.advisorplatform.common.result.Result;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Independently invocable analysis unit. Specialists are opaque to the orchestrator:
 * it only sees the tag and the typed result.
 *
 * <p>{@link #invoke} never signals an error; failures come back as {@link Result.Err}.
 */
public interface Specialist {

    SpecialistTag tag();

    Mono<Result<SpecialistResult>> invoke(String query, ContextSnapshot snapshot, Duration timeout);
}
