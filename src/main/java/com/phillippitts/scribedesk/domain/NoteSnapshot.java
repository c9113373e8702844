package com.phillippitts.scribedesk.domain;

import java.util.Objects;

/**
 * Frozen copy of a segment's time range and speaker appearance, taken when a note is created.
 *
 * <p>Never re-synchronized: renaming the speaker or editing the segment text afterwards leaves
 * the snapshot as it was.
 *
 * @param range        segment interval at creation time
 * @param speakerName  speaker name at creation time
 * @param speakerColor speaker colour at creation time
 */
public record NoteSnapshot(TimeRange range, String speakerName, String speakerColor) {

    public NoteSnapshot {
        Objects.requireNonNull(range, "range must not be null");
        Objects.requireNonNull(speakerName, "speakerName must not be null");
        Objects.requireNonNull(speakerColor, "speakerColor must not be null");
    }
}
