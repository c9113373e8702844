package com.phillippitts.scribedesk.exception;

/**
 * Thrown when the microphone cannot be opened for a start attempt.
 * The session does not reach {@code READY} when this is raised.
 */
public class AudioCaptureException extends ScribeDeskException {

    private final String reason;

    public AudioCaptureException(String reason, String message) {
        super(FailureKind.CAPTURE, message);
        this.reason = reason;
    }

    public AudioCaptureException(String reason, String message, Throwable cause) {
        super(FailureKind.CAPTURE, message, cause);
        this.reason = reason;
    }

    /**
     * Short machine-readable reason, e.g. {@code MIC_UNAVAILABLE} or {@code MIC_PERMISSION_DENIED}.
     */
    public String getReason() {
        return reason;
    }
}
