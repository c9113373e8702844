package com.phillippitts.scribedesk.service.session;

import com.phillippitts.scribedesk.config.session.SessionProperties;
import com.phillippitts.scribedesk.domain.Segment;
import com.phillippitts.scribedesk.domain.Speaker;
import com.phillippitts.scribedesk.exception.InvalidOperationException;
import com.phillippitts.scribedesk.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Editable text projection of the closed segments.
 *
 * <p>The document is one line per closed segment, joined with {@code '\n'}:
 * <pre>
 * [HH:MM:SS.mmm-HH:MM:SS.mmm] Speaker Name: body text
 * </pre>
 * Everything up to and including {@code ": "} is the protected prefix; the rest is the body.
 * Edits are accepted only when the whole affected range lies inside one body and the inserted
 * text contains no line break. Rejected edits leave the model unchanged.
 *
 * <p>Lines are keyed by segment id and reference their speaker by id, so renaming a speaker
 * re-renders that speaker's prefixes and the line colour always follows the speaker.
 *
 * <p>Not thread-safe: callers serialize access through the session lock.
 */
@Component
public class ProtectedTextModel {

    private static final Logger LOG = LogManager.getLogger(ProtectedTextModel.class);

    private final SpeakerRegistry speakers;
    private final ZoneId zone;

    private final List<Line> lines = new ArrayList<>();
    private final Map<Long, Line> bySegment = new HashMap<>();

    @Autowired
    public ProtectedTextModel(SpeakerRegistry speakers, SessionProperties properties) {
        this(speakers, properties.zoneId());
    }

    ProtectedTextModel(SpeakerRegistry speakers, ZoneId zone) {
        this.speakers = Objects.requireNonNull(speakers, "speakers");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    /**
     * Appends the rendered line for a newly closed segment.
     *
     * @throws IllegalArgumentException if the segment already has a line
     */
    public void appendFinalizedLine(Segment segment) {
        Objects.requireNonNull(segment, "segment");
        if (bySegment.containsKey(segment.id())) {
            throw new IllegalArgumentException("Segment already rendered: " + segment.id());
        }
        String timestamp = TimeUtils.formatRange(segment.range(), zone);
        Line line = new Line(segment.id(), segment.speakerId(), timestamp, segment.recognizedText());
        line.prefix = renderPrefix(timestamp, segment.speakerId());
        lines.add(line);
        bySegment.put(segment.id(), line);
    }

    /**
     * Replaces {@code deleteLength} characters at {@code position} with {@code insertText}.
     *
     * @return true if the edit was applied; false if it touched a prefix, spanned lines, fell
     *         outside the document or inserted a line break
     */
    public boolean applyEdit(int position, int deleteLength, String insertText) {
        String insert = insertText == null ? "" : insertText;
        if (position < 0 || deleteLength < 0 || insert.indexOf('\n') >= 0 || insert.indexOf('\r') >= 0) {
            return false;
        }
        long end = (long) position + deleteLength;
        int lineStart = 0;
        for (Line line : lines) {
            int bodyStart = lineStart + line.prefix.length();
            int bodyEnd = bodyStart + line.body.length();
            if (position >= bodyStart && end <= bodyEnd) {
                int from = position - bodyStart;
                int to = (int) (end - bodyStart);
                line.body = line.body.substring(0, from) + insert + line.body.substring(to);
                return true;
            }
            if (position <= bodyEnd) {
                break;
            }
            lineStart = bodyEnd + 1;
        }
        LOG.debug("Rejected edit at {} (delete {}, insert {} chars)", position, deleteLength, insert.length());
        return false;
    }

    /**
     * Maps a document position to the segment whose line contains it (prefix included).
     */
    public Optional<Long> locateLine(int position) {
        if (position < 0) {
            return Optional.empty();
        }
        int lineStart = 0;
        for (Line line : lines) {
            int lineEnd = lineStart + line.length();
            if (position <= lineEnd) {
                return Optional.of(line.segmentId);
            }
            lineStart = lineEnd + 1;
        }
        return Optional.empty();
    }

    /**
     * @return the live, possibly edited, body of a segment's line
     * @throws InvalidOperationException if the segment has no line
     */
    public String currentBodyText(long segmentId) {
        Line line = bySegment.get(segmentId);
        if (line == null) {
            throw new InvalidOperationException("No transcript line for segment: " + segmentId);
        }
        return line.body;
    }

    /**
     * Re-renders the prefixes of every line owned by {@code speaker}.
     */
    public void onSpeakerChanged(Speaker speaker) {
        for (Line line : lines) {
            if (line.speakerId.equals(speaker.id())) {
                line.prefix = renderPrefix(line.timestamp, line.speakerId);
            }
        }
    }

    /** The whole document. */
    public String text() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            Line line = lines.get(i);
            sb.append(line.prefix).append(line.body);
        }
        return sb.toString();
    }

    /**
     * Lines in order, each with the current colour of its speaker.
     */
    public List<StyledLine> styledLines() {
        List<StyledLine> out = new ArrayList<>(lines.size());
        for (Line line : lines) {
            String color = speakers.find(line.speakerId).map(Speaker::color).orElse("#000000");
            out.add(new StyledLine(line.segmentId, line.speakerId, line.prefix, line.body, color));
        }
        return out;
    }

    public int lineCount() {
        return lines.size();
    }

    private String renderPrefix(String timestamp, String speakerId) {
        String name = speakers.find(speakerId).map(Speaker::name).orElse(speakerId);
        return "[" + timestamp + "] " + name + ": ";
    }

    /**
     * One rendered line.
     *
     * @param segmentId owning segment
     * @param speakerId owning speaker
     * @param prefix    protected {@code [start-end] Name: } header
     * @param body      editable text
     * @param color     current colour of the owning speaker
     */
    public record StyledLine(long segmentId, String speakerId, String prefix, String body, String color) {
    }

    private static final class Line {
        final long segmentId;
        final String speakerId;
        final String timestamp;
        String prefix;
        String body;

        Line(long segmentId, String speakerId, String timestamp, String body) {
            this.segmentId = segmentId;
            this.speakerId = speakerId;
            this.timestamp = timestamp;
            this.body = body;
        }

        int length() {
            return prefix.length() + body.length();
        }
    }
}
