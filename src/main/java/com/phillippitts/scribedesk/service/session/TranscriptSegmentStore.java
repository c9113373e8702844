package com.phillippitts.scribedesk.service.session;

import com.phillippitts.scribedesk.domain.Segment;
import com.phillippitts.scribedesk.domain.TimeRange;
import com.phillippitts.scribedesk.exception.InvalidOperationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Ordered, append-only list of closed segments plus a view of the one open segment.
 *
 * <p>Segments are never reordered or removed; {@code order} equals the list position and ids
 * start at 1. Listeners are notified after each append.
 *
 * <p>Not thread-safe: callers serialize access through the session lock.
 */
@Component
public class TranscriptSegmentStore {

    private final List<Segment> closed = new ArrayList<>();
    private final List<Consumer<Segment>> appendListeners = new CopyOnWriteArrayList<>();
    private OpenSegment open;

    /**
     * Appends a closed segment.
     *
     * @return the stored segment
     */
    public Segment append(String speakerId, TimeRange range, String text) {
        long order = closed.size();
        Segment segment = new Segment(order + 1, order, speakerId, range, text);
        closed.add(segment);
        for (Consumer<Segment> l : appendListeners) {
            l.accept(segment);
        }
        return segment;
    }

    public List<Segment> segments() {
        return List.copyOf(closed);
    }

    public Optional<Segment> find(long segmentId) {
        if (segmentId < 1 || segmentId > closed.size()) {
            return Optional.empty();
        }
        return Optional.of(closed.get((int) (segmentId - 1)));
    }

    /**
     * @throws InvalidOperationException if no closed segment has this id
     */
    public Segment require(long segmentId) {
        return find(segmentId).orElseThrow(() -> new InvalidOperationException("Unknown segment: " + segmentId));
    }

    public Optional<Segment> last() {
        return closed.isEmpty() ? Optional.empty() : Optional.of(closed.get(closed.size() - 1));
    }

    public int size() {
        return closed.size();
    }

    public Optional<OpenSegment> openSegment() {
        return Optional.ofNullable(open);
    }

    void setOpenSegment(OpenSegment segment) {
        this.open = segment;
    }

    public void addAppendListener(Consumer<Segment> listener) {
        appendListeners.add(Objects.requireNonNull(listener, "listener"));
    }
}
