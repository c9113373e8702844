package com.phillippitts.scribedesk.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Closed wall-clock interval of a segment.
 *
 * @param start inclusive start instant
 * @param end   end instant, never before {@code start}
 */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end " + end + " precedes start " + start);
        }
    }
}
