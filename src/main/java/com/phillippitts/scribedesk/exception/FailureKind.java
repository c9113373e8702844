package com.phillippitts.scribedesk.exception;

/**
 * Distinct failure categories surfaced by session commands.
 *
 * <p>Callers branch on the kind rather than on message text; a capture failure is never
 * reported as a model-load failure and vice versa.
 */
public enum FailureKind {
    /** Audio device missing, busy, or access denied. */
    CAPTURE,
    /** Recognition model path missing, unreadable, or corrupt. */
    MODEL_LOAD,
    /** Recognizer error on an individual frame (non-fatal). */
    RECOGNITION,
    /** Export could not be written; no partial file is left behind. */
    EXPORT,
    /** Command not valid in the current state (e.g. no speakers defined). */
    INVALID_OPERATION
}
