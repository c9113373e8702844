package com.phillippitts.scribedesk.service.export;

import com.phillippitts.scribedesk.config.session.SessionProperties;
import com.phillippitts.scribedesk.domain.Note;
import com.phillippitts.scribedesk.domain.Segment;
import com.phillippitts.scribedesk.domain.Speaker;
import com.phillippitts.scribedesk.exception.ExportException;
import com.phillippitts.scribedesk.service.session.NoteStore;
import com.phillippitts.scribedesk.service.session.ProtectedTextModel;
import com.phillippitts.scribedesk.service.session.SpeakerRegistry;
import com.phillippitts.scribedesk.service.session.TranscriptSegmentStore;
import com.phillippitts.scribedesk.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Flattens speakers, transcript and notes into one JSON document and writes it atomically.
 *
 * <p>Document shape:
 * <pre>
 * {
 *   "metadata":   { "exported_at": "2025-01-31T14:15:20.000+01:00" },
 *   "speakers":   [ { "name": ..., "color": "#rrggbb" } ],
 *   "transcript": [ { "timestamp": "HH:MM:SS.mmm-HH:MM:SS.mmm", "speaker": ..., "text": ... } ],
 *   "notes":      [ { "timestamp": ..., "speaker": ..., "text": ... } ]
 * }
 * </pre>
 * Transcript text is the live edited body; speaker names are current; notes use their snapshot.
 */
@Component
public class ExportSerializer {

    private static final Logger LOG = LogManager.getLogger(ExportSerializer.class);

    private static final DateTimeFormatter EXPORTED_AT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSXXX", Locale.ROOT);
    private static final int INDENT = 2;

    private final SpeakerRegistry speakers;
    private final TranscriptSegmentStore segments;
    private final ProtectedTextModel textModel;
    private final NoteStore notes;
    private final ZoneId zone;
    private final Clock clock;

    @Autowired
    public ExportSerializer(SpeakerRegistry speakers,
                            TranscriptSegmentStore segments,
                            ProtectedTextModel textModel,
                            NoteStore notes,
                            SessionProperties properties,
                            Clock clock) {
        this(speakers, segments, textModel, notes, properties.zoneId(), clock);
    }

    // Package-private for tests
    ExportSerializer(SpeakerRegistry speakers,
                     TranscriptSegmentStore segments,
                     ProtectedTextModel textModel,
                     NoteStore notes,
                     ZoneId zone,
                     Clock clock) {
        this.speakers = Objects.requireNonNull(speakers, "speakers");
        this.segments = Objects.requireNonNull(segments, "segments");
        this.textModel = Objects.requireNonNull(textModel, "textModel");
        this.notes = Objects.requireNonNull(notes, "notes");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Builds the export document from the current state.
     */
    public JSONObject buildDocument() {
        JSONObject doc = new JSONObject();
        doc.put("metadata", new JSONObject().put("exported_at", EXPORTED_AT.format(clock.instant().atZone(zone))));

        JSONArray speakerArray = new JSONArray();
        for (Speaker s : speakers.speakers()) {
            speakerArray.put(new JSONObject().put("name", s.name()).put("color", s.color()));
        }
        doc.put("speakers", speakerArray);

        JSONArray transcript = new JSONArray();
        for (Segment seg : segments.segments()) {
            String speakerName = speakers.find(seg.speakerId()).map(Speaker::name).orElse(seg.speakerId());
            transcript.put(entry(TimeUtils.formatRange(seg.range(), zone), speakerName,
                    textModel.currentBodyText(seg.id())));
        }
        doc.put("transcript", transcript);

        JSONArray noteArray = new JSONArray();
        for (Note n : notes.listNotes()) {
            noteArray.put(entry(TimeUtils.formatRange(n.snapshot().range(), zone),
                    n.snapshot().speakerName(), n.text()));
        }
        doc.put("notes", noteArray);
        return doc;
    }

    /**
     * Writes the document to {@code target}, replacing any existing file.
     *
     * <p>The document is written to a temporary file next to the target and then moved into
     * place, so the target either holds the complete new document or is left as it was.
     *
     * @throws ExportException if the document cannot be written
     */
    public void export(Path target) {
        Objects.requireNonNull(target, "target");
        Path absolute = target.toAbsolutePath();
        byte[] bytes = buildDocument().toString(INDENT).getBytes(StandardCharsets.UTF_8);
        Path tmp = null;
        try {
            tmp = Files.createTempFile(absolute.getParent(), "." + absolute.getFileName() + "-", ".tmp");
            Files.write(tmp, bytes);
            moveIntoPlace(tmp, absolute);
            LOG.info("Exported {} transcript entries and {} notes ({} bytes)",
                    segments.size(), notes.listNotes().size(), bytes.length);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(tmp);
            LOG.warn("Export failed: {}", e.toString());
            throw new ExportException(absolute.toString(), "Failed to export transcript: " + e.getMessage(), e);
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported for {}; falling back to replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Could not delete temporary export file {}: {}", tmp, e.toString());
        }
    }

    private static JSONObject entry(String timestamp, String speaker, String text) {
        return new JSONObject()
                .put("timestamp", timestamp)
                .put("speaker", speaker)
                .put("text", text);
    }
}
