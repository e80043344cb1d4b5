package com.advisorplatform.common.result;

import com.advisorplatform.common.exception.AdvisoryException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Closed error taxonomy shared by every component.
 *
 * <p>Whether a kind is retried, and how often, is decided in exactly one place:
 * {@link RetryPolicy}.
 */
public enum ErrorKind {
    /** Backend down or refusing connections. Retryable, bounded; triggers tier fallback. */
    BACKEND_UNAVAILABLE,
    /** Backend did not answer in time. Retried once with backoff. */
    BACKEND_TIMEOUT,
    /** Output did not match the expected shape. Never retried. */
    SCHEMA_VIOLATION,
    /** Every selected specialist failed; the request aborts with an error event. */
    ALL_SPECIALISTS_FAILED,
    /** Debate hit its turn limit without approval. Finalizes with capped confidence. */
    DEBATE_EXHAUSTED,
    /** Resume attempted on an unknown or evicted stream session. */
    SESSION_EXPIRED,
    /** Anything not covered above. Never retried. */
    INTERNAL;

    /**
     * Maps an arbitrary failure onto the taxonomy. {@link AdvisoryException} carries its
     * own kind; timeouts and I/O failures map to the backend kinds.
     */
    public static ErrorKind classify(Throwable error) {
        Throwable t = error;
        while (t != null) {
            if (t instanceof AdvisoryException ae) return ae.getKind();
            if (t instanceof TimeoutException) return BACKEND_TIMEOUT;
            if (t instanceof IOException) return BACKEND_UNAVAILABLE;
            t = t.getCause() == t ? null : t.getCause();
        }
        return INTERNAL;
    }
}
