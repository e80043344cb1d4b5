package com.advisorplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Event types of the advisory stream. {@link #FINAL}, {@link #ERROR} and
 * {@link #ABORTED} are terminal: exactly one of them ends every stream.
 */
public enum StreamEventType {
    STATUS,
    SPECIALIST_RESULT,
    REASONING_SEGMENT,
    DEBATE_TURN,
    FINAL,
    ERROR,
    ABORTED;

    public boolean isTerminal() {
        return this == FINAL || this == ERROR || this == ABORTED;
    }

    /** Wire name, e.g. {@code specialist_result}. Also the JSON form. */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
