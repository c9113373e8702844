package com.phillippitts.scribedesk.util;

import com.phillippitts.scribedesk.domain.TimeRange;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Utility methods for time conversions, elapsed time calculations and transcript timestamp
 * rendering.
 *
 * <p>Transcript timestamps are always local wall-clock {@code HH:MM:SS.mmm}, independent of the
 * JVM default locale.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private static final double MICROS_PER_SECOND = 1_000_000d;

    private static final DateTimeFormatter CLOCK_FORMAT =
            DateTimeFormatter.ofPattern("HH:mm:ss.SSS", Locale.ROOT);

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Converts a fractional second offset (as reported by the recognizer) to a duration with
     * microsecond resolution.
     *
     * @param seconds non-negative offset in seconds
     * @return equivalent duration
     */
    public static Duration secondsToDuration(double seconds) {
        if (seconds < 0.0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) {
            throw new IllegalArgumentException("seconds must be a finite value >= 0, got: " + seconds);
        }
        long micros = Math.round(seconds * MICROS_PER_SECOND);
        return Duration.ofNanos(micros * 1_000L);
    }

    /**
     * Formats an instant as local {@code HH:MM:SS.mmm}.
     *
     * @param instant instant to render
     * @param zone    zone the wall clock is read in
     * @return formatted clock time
     */
    public static String formatClock(Instant instant, ZoneId zone) {
        Objects.requireNonNull(instant, "instant");
        Objects.requireNonNull(zone, "zone");
        return CLOCK_FORMAT.format(instant.atZone(zone));
    }

    /**
     * Formats a range as {@code HH:MM:SS.mmm-HH:MM:SS.mmm}.
     *
     * @param range range to render
     * @param zone  zone the wall clock is read in
     * @return formatted range
     */
    public static String formatRange(TimeRange range, ZoneId zone) {
        Objects.requireNonNull(range, "range");
        return formatClock(range.start(), zone) + "-" + formatClock(range.end(), zone);
    }
}
