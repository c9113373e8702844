package com.phillippitts.scribedesk.service.session;

import com.phillippitts.scribedesk.domain.RecognitionEvent;
import com.phillippitts.scribedesk.exception.FailureKind;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable messages posted by the capture and recognition threads for the poll loop.
 */
public interface SessionEvent {

    /** First frame of the run was captured; the mapper is anchored at {@code at}. */
    record StreamAnchored(Instant at) implements SessionEvent {
        public StreamAnchored {
            Objects.requireNonNull(at, "at");
        }
    }

    /** The model finished loading; frames are being recognized. */
    record Ready(String engineName) implements SessionEvent {
    }

    /** The run cannot continue. */
    record Failed(FailureKind kind, String message) implements SessionEvent {
        public Failed {
            Objects.requireNonNull(kind, "kind");
        }
    }

    /** Recognizer output for the controller and live preview. */
    record Recognized(RecognitionEvent event) implements SessionEvent {
        public Recognized {
            Objects.requireNonNull(event, "event");
        }
    }
}
