package com.phillippitts.scribedesk.domain;

import java.util.Objects;

/**
 * A closed transcript segment.
 *
 * <p>Instances only exist once a segment has closed, so the time range and speaker are fixed.
 * The text held here is what the recognizer produced; user edits live in the protected text
 * model and never flow back into this record.
 *
 * @param id             stable segment identifier
 * @param order          append position, strictly increasing from 0
 * @param speakerId      owning speaker's stable id
 * @param range          wall-clock interval
 * @param recognizedText text as recognized at close time
 */
public record Segment(long id, long order, String speakerId, TimeRange range, String recognizedText) {

    public Segment {
        if (order < 0) {
            throw new IllegalArgumentException("order must be >= 0, got: " + order);
        }
        Objects.requireNonNull(speakerId, "speakerId must not be null");
        Objects.requireNonNull(range, "range must not be null");
        Objects.requireNonNull(recognizedText, "recognizedText must not be null");
    }
}
