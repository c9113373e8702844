package com.phillippitts.scribedesk.service.session;

import com.phillippitts.scribedesk.domain.RecognitionEvent;
import com.phillippitts.scribedesk.domain.Segment;
import com.phillippitts.scribedesk.domain.TimeRange;
import com.phillippitts.scribedesk.service.metrics.SessionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides when the open segment closes and the next one opens.
 *
 * <p>States are {@code NoOpenSegment} and {@code OpenSegment(speakerId, accumulatedText, startTime)};
 * the open segment is published through {@link TranscriptSegmentStore#openSegment()}.
 *
 * <ul>
 *   <li>A final closes the open segment at its mapped end time and opens a new one for the
 *       same speaker starting where the old one ended.</li>
 *   <li>A speaker switch closes the open segment at the switch time if it has text, or
 *       discards it otherwise, then opens a segment for the new speaker at that time.</li>
 *   <li>While no speaker is active, final and partial text is buffered and carried into the
 *       segment opened when a speaker is first activated.</li>
 * </ul>
 *
 * <p>An end time earlier than its segment's start is clamped to the start. Events outside a
 * run (before {@link #onSessionStart()} or after {@link #flush(Instant)}) are ignored.
 *
 * <p>Not thread-safe: callers serialize access through the session lock.
 */
@Component
public class SegmentFinalizationController {

    private static final Logger LOG = LogManager.getLogger(SegmentFinalizationController.class);

    private final SpeakerRegistry speakers;
    private final TranscriptSegmentStore store;
    private final TimestampMapper mapper;
    private final SessionMetrics metrics;

    private boolean running;
    private OpenSegment open;
    private String pendingCommitted = "";
    private String pendingPartial = "";

    public SegmentFinalizationController(SpeakerRegistry speakers,
                                         TranscriptSegmentStore store,
                                         TimestampMapper mapper,
                                         SessionMetrics metrics) {
        this.speakers = Objects.requireNonNull(speakers, "speakers");
        this.store = Objects.requireNonNull(store, "store");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Begins a run at the mapper's stream start. Opens a segment if a speaker is active.
     *
     * @throws IllegalStateException if the mapper has not been anchored
     */
    public void onSessionStart() {
        Instant start = mapper.streamStart()
                .orElseThrow(() -> new IllegalStateException("Stream start not anchored"));
        running = true;
        pendingCommitted = "";
        pendingPartial = "";
        setOpen(speakers.activeSpeakerId().map(id -> OpenSegment.empty(id, start)).orElse(null));
        LOG.debug("Run started at {} (open segment: {})", start, open != null);
    }

    /**
     * Updates the live text of the open segment. Never closes anything.
     */
    public void onPartial(String text) {
        if (!running) {
            return;
        }
        if (open == null) {
            pendingPartial = text == null ? "" : text;
            return;
        }
        setOpen(open.withPartial(text));
    }

    /**
     * Closes the open segment with the final's text and opens the next one for the same speaker.
     *
     * @return the closed segment, or empty if the text was blank, no run is active, or the text
     *         was buffered because no speaker is active
     */
    public Optional<Segment> onFinal(RecognitionEvent.Final event) {
        Objects.requireNonNull(event, "event");
        if (!running || event.text().isBlank()) {
            return Optional.empty();
        }
        if (open == null) {
            pendingCommitted = TextJoin.join(pendingCommitted, event.text());
            pendingPartial = "";
            LOG.debug("No active speaker; buffered final ({} chars pending)", pendingCommitted.length());
            return Optional.empty();
        }
        Instant end = clamp(mapper.toAbsolute(event.relativeEndTime()), open.startTime());
        String text = TextJoin.join(open.committedText(), event.text());
        Segment closed = close(open, end, text, CloseReason.FINAL);
        setOpen(OpenSegment.empty(closed.speakerId(), end));
        return Optional.of(closed);
    }

    /**
     * Applies a change of the active speaker at {@code at}.
     *
     * <p>Call after the registry's active speaker changed. Switching to the speaker that already
     * owns the open segment is a no-op.
     *
     * @return the segment closed early, if the open segment had text
     */
    public Optional<Segment> onSpeakerSwitch(String newSpeakerId, Instant at) {
        Objects.requireNonNull(newSpeakerId, "newSpeakerId");
        Objects.requireNonNull(at, "at");
        if (!running) {
            return Optional.empty();
        }
        if (open == null) {
            setOpen(new OpenSegment(newSpeakerId, at, pendingCommitted, pendingPartial));
            pendingCommitted = "";
            pendingPartial = "";
            return Optional.empty();
        }
        if (open.speakerId().equals(newSpeakerId)) {
            return Optional.empty();
        }
        Instant closeAt = clamp(at, open.startTime());
        Optional<Segment> closed = Optional.empty();
        if (open.hasText()) {
            closed = Optional.of(close(open, closeAt, open.accumulatedText(), CloseReason.SWITCH));
        } else {
            LOG.debug("Discarding empty open segment of {}", open.speakerId());
        }
        setOpen(OpenSegment.empty(newSpeakerId, closeAt));
        return closed;
    }

    /**
     * Ends the run: closes the open segment at {@code at} if it has text.
     *
     * @return the segment closed, if any
     */
    public Optional<Segment> flush(Instant at) {
        Objects.requireNonNull(at, "at");
        if (!running) {
            return Optional.empty();
        }
        Optional<Segment> closed = Optional.empty();
        if (open != null && open.hasText()) {
            closed = Optional.of(close(open, clamp(at, open.startTime()), open.accumulatedText(), CloseReason.STOP));
        }
        String lost = TextJoin.join(pendingCommitted, pendingPartial);
        if (!lost.isEmpty()) {
            LOG.warn("Run stopped with {} chars of text and no active speaker; text dropped", lost.length());
        }
        running = false;
        pendingCommitted = "";
        pendingPartial = "";
        setOpen(null);
        return closed;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Text received while no speaker was active, waiting for the first activation.
     */
    public String bufferedText() {
        return TextJoin.join(pendingCommitted, pendingPartial);
    }

    private Segment close(OpenSegment segment, Instant end, String text, CloseReason reason) {
        Segment closed = store.append(segment.speakerId(), new TimeRange(segment.startTime(), end), text);
        metrics.incrementSegments(reason.tag());
        LOG.debug("Segment {} closed ({}): speaker={}", closed.id(), reason.tag(), closed.speakerId());
        return closed;
    }

    private void setOpen(OpenSegment segment) {
        open = segment;
        store.setOpenSegment(segment);
    }

    private static Instant clamp(Instant end, Instant start) {
        return end.isBefore(start) ? start : end;
    }
}
