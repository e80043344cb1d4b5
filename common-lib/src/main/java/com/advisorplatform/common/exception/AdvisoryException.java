package com.advisorplatform.common.exception;

import com.advisorplatform.common.result.ErrorKind;

/**
 * Unchecked failure tagged with an {@link ErrorKind}. Raised inside reactive chains and
 * converted to a {@code Result} or a degraded value at component boundaries.
 */
public class AdvisoryException extends RuntimeException {

    private final ErrorKind kind;

    public AdvisoryException(ErrorKind kind, String message) {
        super(kind + ": " + message);
        this.kind = kind;
    }

    public AdvisoryException(ErrorKind kind, String message, Throwable cause) {
        super(kind + ": " + message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
