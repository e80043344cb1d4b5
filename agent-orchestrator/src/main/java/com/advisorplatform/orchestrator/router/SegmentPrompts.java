package com.advisorplatform.orchestrator.router;

import com.advisorplatform.common.model.SegmentPhase;

/**
 * Prompt layout for one Router segment. The committed text so far is always included so
 * the model continues the trajectory instead of restarting it.
 */
public final class SegmentPrompts {

    private SegmentPrompts() { /* utility class */ }

    public static String build(String query, SegmentPhase phase, String committed, SegmentOutline outline) {
        StringBuilder sb = new StringBuilder();
        sb.append(phase == SegmentPhase.REBUTTAL
                ? "You are revising an investment advisory thesis after a risk review.\n"
                : "You are drafting one section of an investment advisory thesis.\n");
        sb.append("Client question: ").append(query).append('\n');
        sb.append("### COMMITTED\n");
        sb.append(committed == null || committed.isBlank() ? "(nothing yet)" : committed).append('\n');
        sb.append("### SEGMENT: ").append(outline.title()).append('\n');
        sb.append(outline.instruction()).append('\n');
        sb.append("### EVIDENCE\n");
        for (String line : outline.evidence()) {
            sb.append("- ").append(line).append('\n');
        }
        sb.append("### RULES\n");
        sb.append("Write two to four complete sentences for this section only. ");
        sb.append("Do not repeat committed text. Use only the evidence listed.\n");
        return sb.toString();
    }
}
