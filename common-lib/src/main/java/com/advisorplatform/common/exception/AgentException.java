package com.advisorplatform.common.exception;

import com.advisorplatform.common.model.SpecialistTag;

/**
 * Failure raised by a single specialist. Never escapes the dispatch burst: it is
 * recorded on that specialist's result and the burst carries on.
 */
public class AgentException extends RuntimeException {
    private final SpecialistTag tag;

    public AgentException(SpecialistTag tag, String message) {
        super("[" + tag.id() + "] " + message);
        this.tag = tag;
    }

    public AgentException(SpecialistTag tag, String message, Throwable cause) {
        super("[" + tag.id() + "] " + message, cause);
        this.tag = tag;
    }

    public SpecialistTag getTag() {
        return tag;
    }
}
