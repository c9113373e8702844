package com.phillippitts.scribedesk.domain;

/**
 * Lifecycle of a transcription run as observed by the UI poll loop.
 *
 * <pre>
 * IDLE -> LOADING (start) -> READY (model loaded) -> STOPPING (stop) -> IDLE
 * LOADING -> FAILED (asynchronous model-load failure) -> IDLE (next stop/start)
 * </pre>
 */
public enum SessionStatus {
    IDLE,
    LOADING,
    READY,
    STOPPING,
    FAILED;

    /** True while capture/recognition threads may be running. */
    public boolean isActive() {
        return this == LOADING || this == READY || this == STOPPING;
    }
}
