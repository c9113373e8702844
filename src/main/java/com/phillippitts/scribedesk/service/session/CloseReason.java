package com.phillippitts.scribedesk.service.session;

import java.util.Locale;

/**
 * Why a segment closed.
 */
public enum CloseReason {
    /** Recognizer endpointed the utterance. */
    FINAL,
    /** Active speaker changed. */
    SWITCH,
    /** Session stopped while the segment was open. */
    STOP;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
