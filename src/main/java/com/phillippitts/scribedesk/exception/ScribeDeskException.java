package com.phillippitts.scribedesk.exception;

import java.util.Objects;

/**
 * Base exception for all scribedesk application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public abstract class ScribeDeskException extends RuntimeException {

    private final FailureKind kind;

    protected ScribeDeskException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    protected ScribeDeskException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FailureKind getKind() {
        return kind;
    }
}
