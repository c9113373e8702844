package com.phillippitts.scribedesk.exception;

/**
 * Thrown when the recognizer fails on an individual frame, or is used outside its
 * {@code READY} state.
 *
 * <p>Per-frame failures are non-fatal: the session skips the frame and keeps consuming.
 */
public class RecognitionException extends ScribeDeskException {

    private final String engineName;

    public RecognitionException(String message, String engineName) {
        super(FailureKind.RECOGNITION, message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public RecognitionException(String message, String engineName, Throwable cause) {
        super(FailureKind.RECOGNITION, message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
