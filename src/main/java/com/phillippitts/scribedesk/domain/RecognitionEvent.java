package com.phillippitts.scribedesk.domain;

import java.util.Objects;

/**
 * Typed output of the recognition engine for one consumed frame.
 *
 * <p>Exactly two shapes exist: {@link Partial} for the utterance still being spoken and
 * {@link Final} when the recognizer endpoints an utterance.
 */
public interface RecognitionEvent {

    String text();

    /**
     * Tentative text for the current utterance; superseded by the next partial or final.
     */
    record Partial(String text) implements RecognitionEvent {
        public Partial {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /**
     * Finalized utterance.
     *
     * @param text            recognized text (never blank)
     * @param relativeEndTime seconds since the recognizer's own stream start at which the
     *                        utterance ended
     */
    record Final(String text, double relativeEndTime) implements RecognitionEvent {
        public Final {
            Objects.requireNonNull(text, "text must not be null");
            if (relativeEndTime < 0.0 || Double.isNaN(relativeEndTime)) {
                throw new IllegalArgumentException("relativeEndTime must be >= 0, got: " + relativeEndTime);
            }
        }
    }
}
