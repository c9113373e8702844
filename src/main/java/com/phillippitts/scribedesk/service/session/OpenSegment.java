package com.phillippitts.scribedesk.service.session;

import java.time.Instant;
import java.util.Objects;

/**
 * The single in-progress segment.
 *
 * @param speakerId     owning speaker
 * @param startTime     fixed start; the end is decided when the segment closes
 * @param committedText text already finalized into this segment but not yet emitted
 *                      (only non-empty when text was buffered while no speaker was active)
 * @param partialText   latest partial result for the utterance in progress
 */
public record OpenSegment(String speakerId, Instant startTime, String committedText, String partialText) {

    public OpenSegment {
        Objects.requireNonNull(speakerId, "speakerId");
        Objects.requireNonNull(startTime, "startTime");
        committedText = committedText == null ? "" : committedText;
        partialText = partialText == null ? "" : partialText;
    }

    static OpenSegment empty(String speakerId, Instant startTime) {
        return new OpenSegment(speakerId, startTime, "", "");
    }

    OpenSegment withPartial(String partial) {
        return new OpenSegment(speakerId, startTime, committedText, partial);
    }

    /**
     * Best-available text: committed text followed by the latest partial.
     */
    public String accumulatedText() {
        return TextJoin.join(committedText, partialText);
    }

    public boolean hasText() {
        return !accumulatedText().isEmpty();
    }
}
