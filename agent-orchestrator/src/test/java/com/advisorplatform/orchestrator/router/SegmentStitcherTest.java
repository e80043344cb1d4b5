package com.advisorplatform.orchestrator.router;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SegmentStitcherTest {

    @Test
    @DisplayName("trailing connective is cut back to the last complete sentence")
    void cutsToLastSentence() {
        assertThat(SegmentStitcher.sanitize("Trend is intact. Momentum is fading and"))
            .isEqualTo("Trend is intact.");
    }

    @Test
    @DisplayName("without an earlier sentence, dangling words are trimmed off the end")
    void trimsDanglingWords() {
        assertThat(SegmentStitcher.sanitize("The trend is up and the")).isEqualTo("The trend is up.");
    }

    @Test
    @DisplayName("trailing separators are stripped and terminal punctuation added")
    void terminalPunctuation() {
        assertThat(SegmentStitcher.sanitize("  Momentum holds,  ")).isEqualTo("Momentum holds.");
        assertThat(SegmentStitcher.sanitize("Strong close!")).isEqualTo("Strong close!");
    }

    @Test
    @DisplayName("nothing usable yields an empty string")
    void unusable() {
        assertThat(SegmentStitcher.sanitize(null)).isEmpty();
        assertThat(SegmentStitcher.sanitize("  ;- ")).isEmpty();
        assertThat(SegmentStitcher.sanitize("and")).isEmpty();
    }

    @Test
    void stitchAndAppend() {
        assertThat(SegmentStitcher.stitch(List.of("One.", "Two."))).isEqualTo("One.\n\nTwo.");
        assertThat(SegmentStitcher.append("One.", "Two.")).isEqualTo("One.\n\nTwo.");
        assertThat(SegmentStitcher.append(null, "Two.")).isEqualTo("Two.");
        assertThat(SegmentStitcher.append("One.", "")).isEqualTo("One.");
    }
}
