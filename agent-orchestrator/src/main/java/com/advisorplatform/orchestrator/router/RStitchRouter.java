package com.advisorplatform.orchestrator.router;

import com.advisorplatform.common.model.ModelTier;
import com.advisorplatform.common.model.ReasoningSegment;
import com.advisorplatform.common.model.SegmentPhase;
import com.advisorplatform.common.result.ErrorKind;
import com.advisorplatform.common.result.Result;
import com.advisorplatform.orchestrator.gateway.Generation;
import com.advisorplatform.orchestrator.gateway.ModelGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entropy-guided small/large delegation, one segment at a time.
 *
 * <p>Each planned segment is first drafted by the {@code SMALL} tier. If its mean token
 * entropy is at or below τ the draft is committed; otherwise the same prompt is re-issued
 * to {@code LARGE} and that output is spliced in its place. Committed text above τ₂ is
 * still emitted, flagged {@code lowConfidence}. Segments are strictly sequential: the
 * next prompt sees everything committed so far, and a small draft and its large re-issue
 * never run concurrently.
 *
 * <p>Fallbacks:
 * <ul>
 *   <li>small tier unavailable or timed out → segment generated on the large tier directly</li>
 *   <li>large tier fails on escalation → the small draft is kept, flagged low-confidence</li>
 *   <li>invalid output (or nothing usable after stitching checks) → segment dropped</li>
 * </ul>
 */
@Component
public class RStitchRouter {

    private static final Logger log = LoggerFactory.getLogger(RStitchRouter.class);

    private final ModelGateway gateway;
    private final double       entropyThreshold;
    private final double       lowConfidenceThreshold;
    private final int          maxTokensPerSegment;
    private final double       temperature;

    public RStitchRouter(ModelGateway gateway,
                         @Value("${router.entropy-threshold:0.4}") double entropyThreshold,
                         @Value("${router.low-confidence-threshold:0.7}") double lowConfidenceThreshold,
                         @Value("${router.max-tokens-per-segment:256}") int maxTokensPerSegment,
                         @Value("${router.temperature:0.2}") double temperature) {
        if (lowConfidenceThreshold < entropyThreshold) {
            throw new IllegalArgumentException("router.low-confidence-threshold (" + lowConfidenceThreshold
                + ") must not be below router.entropy-threshold (" + entropyThreshold + ")");
        }
        this.gateway                = gateway;
        this.entropyThreshold       = entropyThreshold;
        this.lowConfidenceThreshold = lowConfidenceThreshold;
        this.maxTokensPerSegment    = maxTokensPerSegment;
        this.temperature            = temperature;
    }

    /**
     * Drafts {@code plan} in order.
     *
     * @param priorText  text already committed by earlier passes (empty for the first thesis)
     * @param firstIndex index assigned to the first committed segment of this pass
     */
    public Flux<SegmentOutcome> draft(String query, SegmentPhase phase, List<SegmentOutline> plan,
                                      String priorText, int firstIndex) {
        return Flux.defer(() -> {
            StringBuilder committed = new StringBuilder(priorText == null ? "" : priorText);
            AtomicInteger nextIndex = new AtomicInteger(firstIndex);

            return Flux.fromIterable(plan)
                .concatMap(outline -> {
                    String prompt = SegmentPrompts.build(query, phase, committed.toString(), outline);
                    return routeSegment(phase, outline.title(), prompt, nextIndex.get())
                        .doOnNext(outcome -> {
                            if (outcome.committed()) {
                                nextIndex.incrementAndGet();
                                if (committed.length() > 0) committed.append(SegmentStitcher.SEPARATOR);
                                committed.append(outcome.segment().text());
                            }
                        });
                });
        });
    }

    /** Joins the committed segments of one pass in order. */
    public static String stitch(List<ReasoningSegment> segments) {
        return SegmentStitcher.stitch(segments.stream().map(ReasoningSegment::text).toList());
    }

    // ── per-segment delegation ──────────────────────────────────────────────

    private Mono<SegmentOutcome> routeSegment(SegmentPhase phase, String title, String prompt, int index) {
        long start = System.nanoTime();
        return gateway.generate(ModelTier.SMALL, prompt, maxTokensPerSegment, temperature)
            .flatMap(small -> {
                if (!small.isOk()) {
                    if (small.kind() == ErrorKind.SCHEMA_VIOLATION) {
                        return Mono.just(dropped(title, prompt, ModelTier.SMALL,
                            "small model output invalid: " + small.message(), start));
                    }
                    log.warn("[Router] small tier failed, generating on large. segment='{}' kind={}", title, small.kind());
                    return gateway.generate(ModelTier.LARGE, prompt, maxTokensPerSegment, temperature)
                        .map(large -> large.isOk()
                            ? commit(phase, title, prompt, index, large.value(), false, start)
                            : dropped(title, prompt, ModelTier.LARGE,
                                "both tiers failed: " + small.kind() + ", " + large.kind(), start));
                }

                Generation draft = small.value();
                double entropy = draft.entropy().mean();
                if (DelegationPolicy.select(entropy, entropyThreshold) == ModelTier.SMALL) {
                    return Mono.just(commit(phase, title, prompt, index, draft, false, start));
                }

                log.info("[Router] escalating segment='{}' smallEntropy={} threshold={}",
                    title, round(entropy), entropyThreshold);
                return gateway.generate(ModelTier.LARGE, prompt, maxTokensPerSegment, temperature)
                    .map(large -> large.isOk()
                        ? commit(phase, title, prompt, index, large.value(), true, start)
                        : keepSmallDraft(phase, title, prompt, index, draft, large, start));
            });
    }

    private SegmentOutcome commit(SegmentPhase phase, String title, String prompt, int index,
                                  Generation generation, boolean escalated, long start) {
        return commit(phase, title, prompt, index, generation, escalated,
            DelegationPolicy.lowConfidence(generation.entropy().mean(), lowConfidenceThreshold), start);
    }

    private SegmentOutcome keepSmallDraft(SegmentPhase phase, String title, String prompt, int index,
                                          Generation draft, Result<Generation> largeFailure, long start) {
        log.warn("[Router] large tier failed on escalation, keeping small draft as low-confidence. segment='{}' kind={}",
            title, largeFailure.kind());
        return commit(phase, title, prompt, index, draft, false, true, start);
    }

    private SegmentOutcome commit(SegmentPhase phase, String title, String prompt, int index,
                                  Generation generation, boolean escalated, boolean lowConfidence, long start) {
        String text = SegmentStitcher.sanitize(generation.text());
        if (text.isEmpty()) {
            return dropped(title, prompt, generation.tier(), "no usable text after stitching checks", start);
        }
        ReasoningSegment segment = new ReasoningSegment(index, phase, text, generation.tier(),
            generation.entropy(), escalated, lowConfidence);
        log.info("[Router] committed segment index={} title='{}' source={} entropy={} escalated={} lowConfidence={}",
            index, title, generation.tier(), round(generation.entropy().mean()), escalated, lowConfidence);
        return new SegmentOutcome(title, segment, null, prompt, generation.modelLabel(), elapsedMs(start));
    }

    private SegmentOutcome dropped(String title, String prompt, ModelTier lastTier, String reason, long start) {
        log.warn("[Router] segment dropped title='{}' reason={}", title, reason);
        return new SegmentOutcome(title, null, reason, prompt, gateway.label(lastTier), elapsedMs(start));
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    private static double round(double v) {
        return Math.round(v * 1000.0) / 1000.0;
    }
}
