package com.phillippitts.scribedesk.service.session;

import com.phillippitts.scribedesk.domain.Note;
import com.phillippitts.scribedesk.domain.NoteSnapshot;
import com.phillippitts.scribedesk.domain.Segment;
import com.phillippitts.scribedesk.domain.Speaker;
import com.phillippitts.scribedesk.exception.InvalidOperationException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Notes bound to frozen snapshots of segments.
 *
 * <p>A snapshot copies the segment's time range and its speaker's name and colour as they are
 * at creation time. The store keeps no reference to the segment afterwards, so later renames
 * and text edits never reach an existing note.
 *
 * <p>Not thread-safe: callers serialize access through the session lock.
 */
@Component
public class NoteStore {

    private final TranscriptSegmentStore segments;
    private final SpeakerRegistry speakers;

    private final Map<Long, Note> notes = new LinkedHashMap<>();
    private long nextId = 1;

    public NoteStore(TranscriptSegmentStore segments, SpeakerRegistry speakers) {
        this.segments = Objects.requireNonNull(segments, "segments");
        this.speakers = Objects.requireNonNull(speakers, "speakers");
    }

    /**
     * Creates an empty note over the current state of a closed segment.
     *
     * @throws InvalidOperationException if the segment is unknown
     */
    public Note createNote(long segmentId) {
        Segment segment = segments.require(segmentId);
        Speaker speaker = speakers.require(segment.speakerId());
        NoteSnapshot snapshot = new NoteSnapshot(segment.range(), speaker.name(), speaker.color());
        Note note = new Note(nextId++, snapshot, "");
        notes.put(note.id(), note);
        return note;
    }

    /**
     * @throws InvalidOperationException if the note is unknown
     */
    public Note editNote(long noteId, String newText) {
        Note current = notes.get(noteId);
        if (current == null) {
            throw new InvalidOperationException("Unknown note: " + noteId);
        }
        Note updated = current.withText(newText == null ? "" : newText);
        notes.put(noteId, updated);
        return updated;
    }

    /** Notes in creation order. */
    public List<Note> listNotes() {
        return List.copyOf(notes.values());
    }
}
