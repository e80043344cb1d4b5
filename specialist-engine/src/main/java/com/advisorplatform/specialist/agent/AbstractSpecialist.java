package com.advisorplatform.specialist.agent;

import com.advisorplatform.common.exception.AdvisoryException;
import com.advisorplatform.common.exception.AgentException;
import com.advisorplatform.common.model.ContextSnapshot;
import com.advisorplatform.common.model.SpecialistResult;
import com.advisorplatform.common.result.ErrorKind;
import com.advisorplatform.common.result.Result;
import com.advisorplatform.specialist.port.MarketDataPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Template for market-data backed specialists: subclasses fetch through the
 * {@link MarketDataPort} and compute; this class owns the timeout and the
 * conversion of every failure into a {@link Result.Err}.
 */
public abstract class AbstractSpecialist implements Specialist {

    private static final Logger log = LoggerFactory.getLogger(AbstractSpecialist.class);

    protected final MarketDataPort marketData;

    protected AbstractSpecialist(MarketDataPort marketData) {
        this.marketData = marketData;
    }

    @Override
    public final Mono<Result<SpecialistResult>> invoke(String query, ContextSnapshot snapshot, Duration timeout) {
        return Mono.defer(() -> analyze(query, snapshot))
            .timeout(timeout)
            .map(Result::ok)
            .onErrorResume(e -> {
                Result<SpecialistResult> err = toErr(e, timeout);
                log.warn("[Specialist] tag={} failed kind={} reason={} correlationId={}",
                    tag().id(), err.kind(), err.message(), snapshot.correlationId());
                return Mono.just(err);
            });
    }

    /**
     * Performs the analysis. May signal {@link AgentException} for unusable input;
     * must not block.
     */
    protected abstract Mono<SpecialistResult> analyze(String query, ContextSnapshot snapshot);

    protected String requireTicker(ContextSnapshot snapshot) {
        if (!snapshot.hasTicker()) {
            throw new AgentException(tag(), "No ticker provided");
        }
        return snapshot.ticker();
    }

    private Result<SpecialistResult> toErr(Throwable e, Duration timeout) {
        if (e instanceof TimeoutException) {
            return Result.err(ErrorKind.BACKEND_TIMEOUT, "timed out after " + timeout.toMillis() + "ms");
        }
        if (e instanceof AgentException) {
            return Result.err(ErrorKind.SCHEMA_VIOLATION, e.getMessage());
        }
        if (e instanceof AdvisoryException ae) {
            return Result.err(ae.getKind(), ae.getMessage());
        }
        return Result.err(e);
    }

    protected static double round(double v, int places) {
        if (Double.isNaN(v) || Double.isInfinite(v)) return v;
        double scale = Math.pow(10, places);
        return Math.round(v * scale) / scale;
    }
}
