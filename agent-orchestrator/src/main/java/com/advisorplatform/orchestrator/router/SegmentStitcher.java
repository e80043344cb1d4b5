package com.advisorplatform.orchestrator.router;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Textual stitching of committed segments with boundary sanity checks.
 *
 * <p>A segment must not end on a dangling clause: trailing separators are stripped, a
 * trailing connective word is cut back to the last complete sentence, and the result
 * always ends with terminal punctuation.
 */
public final class SegmentStitcher {

    static final String SEPARATOR = "\n\n";

    private static final Set<String> DANGLING = Set.of(
        "and", "or", "but", "because", "which", "that", "with", "the", "a", "an",
        "to", "of", "for", "while", "although", "if", "so");

    private SegmentStitcher() { /* utility class */ }

    /** Returns the cleaned segment text, or an empty string if nothing usable remains. */
    public static String sanitize(String raw) {
        if (raw == null) return "";
        String text = raw.strip();
        text = text.replaceAll("[\\s,;:\\-]+$", "");
        if (text.isEmpty()) return "";

        if (endsWithDanglingWord(text)) {
            int lastStop = lastSentenceStop(text);
            if (lastStop > 0) {
                text = text.substring(0, lastStop + 1);
            } else {
                while (endsWithDanglingWord(text)) {
                    int cut = text.lastIndexOf(' ');
                    if (cut < 0) return "";
                    text = text.substring(0, cut).replaceAll("[\\s,;:\\-]+$", "");
                    if (text.isEmpty()) return "";
                }
            }
        }
        if (!endsWithStop(text)) {
            text = text + ".";
        }
        return text;
    }

    public static String stitch(List<String> segmentTexts) {
        return String.join(SEPARATOR, segmentTexts);
    }

    /** Appends a rebuttal pass to an existing thesis. */
    public static String append(String thesis, String addition) {
        if (thesis == null || thesis.isBlank()) return addition;
        if (addition == null || addition.isBlank()) return thesis;
        return thesis + SEPARATOR + addition;
    }

    private static boolean endsWithDanglingWord(String text) {
        if (endsWithStop(text)) return false;
        int space = text.lastIndexOf(' ');
        String last = (space < 0 ? text : text.substring(space + 1)).toLowerCase(Locale.ROOT);
        return DANGLING.contains(last);
    }

    private static boolean endsWithStop(String text) {
        char c = text.charAt(text.length() - 1);
        return c == '.' || c == '!' || c == '?' || c == ')' || c == '"';
    }

    private static int lastSentenceStop(String text) {
        return Math.max(text.lastIndexOf(". "), Math.max(text.lastIndexOf("! "), text.lastIndexOf("? ")));
    }
}
