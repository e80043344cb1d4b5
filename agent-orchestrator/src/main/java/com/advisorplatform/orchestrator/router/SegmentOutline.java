package com.advisorplatform.orchestrator.router;

import java.util.List;

/**
 * One planned reasoning segment: what to write and which evidence lines it may use.
 */
public record SegmentOutline(String title, String instruction, List<String> evidence) {

    public SegmentOutline {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
