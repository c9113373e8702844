package com.phillippitts.scribedesk.service.session;

import com.phillippitts.scribedesk.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Converts recognizer-relative offsets into wall-clock instants.
 *
 * <p>The anchor is set once per run, at the first captured frame, and cleared on stop. No drift
 * correction is applied. Safe to use from the capture, recognition and poll threads.
 */
@Component
public class TimestampMapper {

    private final AtomicReference<Instant> streamStart = new AtomicReference<>();

    /**
     * Sets the stream start if it is not set yet.
     *
     * @return true if this call set the anchor
     */
    public boolean anchor(Instant wallClockNow) {
        Objects.requireNonNull(wallClockNow, "wallClockNow");
        return streamStart.compareAndSet(null, wallClockNow);
    }

    public Optional<Instant> streamStart() {
        return Optional.ofNullable(streamStart.get());
    }

    public boolean isAnchored() {
        return streamStart.get() != null;
    }

    /**
     * @param relativeSeconds offset since the recognizer's stream start
     * @return {@code streamStart + relativeSeconds}
     * @throws IllegalStateException if no anchor is set for the current run
     */
    public Instant toAbsolute(double relativeSeconds) {
        Instant start = streamStart.get();
        if (start == null) {
            throw new IllegalStateException("Stream start not anchored");
        }
        return start.plus(TimeUtils.secondsToDuration(relativeSeconds));
    }

    /** Clears the anchor so the next run can set its own. */
    public void reset() {
        streamStart.set(null);
    }
}
