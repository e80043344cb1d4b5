package com.advisorplatform.orchestrator.critic;

import com.advisorplatform.common.exception.AdvisoryException;
import com.advisorplatform.common.model.DebateTurn;
import com.advisorplatform.common.model.Verdict;
import com.advisorplatform.common.result.ErrorKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Validates critic model output: a JSON object whose {@code verdict} is one of the closed
 * {@link Verdict} values, with a non-blank {@code rationale} for FLAG and REFUTE.
 */
public class CriticVerdictParser {

    private final ObjectMapper objectMapper;

    public CriticVerdictParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws AdvisoryException with {@link ErrorKind#SCHEMA_VIOLATION} on anything invalid
     */
    public DebateTurn parse(String responseText, int turnIndex) {
        JsonNode json;
        try {
            String cleaned = responseText
                .replaceAll("```json", "")
                .replaceAll("```", "")
                .trim();
            json = objectMapper.readTree(cleaned);
        } catch (Exception e) {
            throw new AdvisoryException(ErrorKind.SCHEMA_VIOLATION, "critic output is not JSON", e);
        }
        if (json == null || !json.isObject()) {
            throw new AdvisoryException(ErrorKind.SCHEMA_VIOLATION, "critic output is not a JSON object");
        }

        String rawVerdict = json.path("verdict").asText(null);
        Verdict verdict = Verdict.parse(rawVerdict).orElseThrow(() ->
            new AdvisoryException(ErrorKind.SCHEMA_VIOLATION, "unknown verdict '" + rawVerdict + "'"));

        String rationale = json.path("rationale").asText("").trim();
        if (verdict.requiresRationale() && rationale.isEmpty()) {
            throw new AdvisoryException(ErrorKind.SCHEMA_VIOLATION, verdict + " without rationale");
        }
        return DebateTurn.critic(turnIndex, verdict, rationale.isEmpty() ? null : rationale);
    }
}
