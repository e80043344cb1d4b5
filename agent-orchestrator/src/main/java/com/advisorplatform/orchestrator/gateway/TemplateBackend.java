package com.advisorplatform.orchestrator.gateway;

import com.advisorplatform.common.model.ModelTier;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic local backend used when a tier has no base URL configured.
 *
 * <p>It understands the segment prompt layout written by
 * {@link com.advisorplatform.orchestrator.router.SegmentPrompts}: the output is the
 * segment title followed by the evidence lines, verbatim. Entropy is fixed per tier and
 * raised when the evidence carries an uncertainty marker, so delegation behaves the
 * same way on every run.
 */
public class TemplateBackend implements ModelBackend {

    static final String SEGMENT_MARKER  = "### SEGMENT:";
    static final String EVIDENCE_MARKER = "- ";

    private static final List<String> UNCERTAINTY_MARKERS =
        List.of("unavailable", "conflicting", "mixed", "critique");

    private final ModelTier tier;

    public TemplateBackend(ModelTier tier) {
        this.tier = tier;
    }

    @Override
    public Mono<Generation> generate(String prompt, int maxTokens, double temperature) {
        return Mono.fromCallable(() -> {
            String text = render(prompt, maxTokens);
            return new Generation(text, TokenEntropy.uniform(text, entropyFor(prompt)), tier, label(), false);
        });
    }

    @Override
    public String label() {
        return "template-" + tier.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean live() {
        return false;
    }

    double entropyFor(String prompt) {
        boolean uncertain = evidenceLines(prompt).stream()
            .map(l -> l.toLowerCase(Locale.ROOT))
            .anyMatch(l -> UNCERTAINTY_MARKERS.stream().anyMatch(l::contains));
        if (tier == ModelTier.SMALL) {
            return uncertain ? 0.65 : 0.20;
        }
        return uncertain ? 0.30 : 0.10;
    }

    private String render(String prompt, int maxTokens) {
        String title = "Analysis";
        for (String line : prompt.split("\n")) {
            if (line.startsWith(SEGMENT_MARKER)) {
                title = line.substring(SEGMENT_MARKER.length()).trim();
            }
        }
        List<String> evidence = evidenceLines(prompt);
        StringBuilder sb = new StringBuilder(title).append(':');
        if (evidence.isEmpty()) {
            sb.append(" No supporting evidence was gathered.");
        }
        for (String e : evidence) {
            sb.append(' ').append(e.endsWith(".") ? e : e + ".");
        }
        String[] words = sb.toString().split(" ");
        if (words.length <= maxTokens) return sb.toString();
        return String.join(" ", Arrays.copyOf(words, maxTokens));
    }

    private static List<String> evidenceLines(String prompt) {
        List<String> lines = new ArrayList<>();
        boolean inEvidence = false;
        for (String line : prompt.split("\n")) {
            if (line.startsWith("### EVIDENCE")) {
                inEvidence = true;
                continue;
            }
            if (line.startsWith("###")) {
                inEvidence = false;
                continue;
            }
            if (inEvidence && line.startsWith(EVIDENCE_MARKER)) {
                lines.add(line.substring(EVIDENCE_MARKER.length()).trim());
            }
        }
        return lines;
    }
}
