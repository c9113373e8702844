package com.phillippitts.scribedesk.exception;

/**
 * Thrown when a command is not valid in the current session state: starting while a run is
 * active, switching speakers when none are defined, or referring to an unknown speaker,
 * segment, note or text position.
 *
 * <p>Never fatal; the session state is left unchanged.
 */
public class InvalidOperationException extends ScribeDeskException {

    public InvalidOperationException(String message) {
        super(FailureKind.INVALID_OPERATION, message);
    }
}
