package com.advisorplatform.orchestrator.router;

import com.advisorplatform.common.model.ReasoningSegment;

/**
 * What the Router did with one planned segment. Exactly one of {@code segment} and
 * {@code droppedReason} is non-null.
 *
 * @param prompt     the prompt the segment was generated from, for trace digests
 * @param modelLabel label of the model whose text was committed, or of the last model tried
 */
public record SegmentOutcome(
    String           title,
    ReasoningSegment segment,
    String           droppedReason,
    String           prompt,
    String           modelLabel,
    long             latencyMs
) {
    public boolean committed() {
        return segment != null;
    }
}
