package com.phillippitts.scribedesk.domain;

import java.util.Objects;

/**
 * A user annotation bound to a snapshot of one segment.
 *
 * <p>There is deliberately no segment id here: after creation a note has no live relation to
 * the segment it was made from.
 *
 * @param id       note identifier, increasing in creation order
 * @param snapshot frozen segment state
 * @param text     editable note body (empty on creation)
 */
public record Note(long id, NoteSnapshot snapshot, String text) {

    public Note {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    public Note withText(String newText) {
        return new Note(id, snapshot, newText);
    }
}
