package com.phillippitts.scribedesk.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for transcription sessions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Frames consumed by the recognizer, and frames it failed on</li>
 *   <li>Segments closed, by close reason (final, switch, stop)</li>
 *   <li>Capture back-pressure (frame queue full)</li>
 *   <li>Model load latency</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class SessionMetrics {

    static final String METRIC_PREFIX = "scribedesk.session";

    private final MeterRegistry registry;

    public SessionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementFrames() {
        Counter.builder(METRIC_PREFIX + ".frames")
                .description("Audio frames consumed by the recognizer")
                .register(registry)
                .increment();
    }

    public void incrementFrameErrors(String engineName) {
        Counter.builder(METRIC_PREFIX + ".frame.errors")
                .description("Audio frames the recognizer failed to process")
                .tag("engine", engineName)
                .register(registry)
                .increment();
    }

    /**
     * @param reason close reason tag ({@code final}, {@code switch} or {@code stop})
     */
    public void incrementSegments(String reason) {
        Counter.builder(METRIC_PREFIX + ".segments")
                .description("Transcript segments closed")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementBackpressure() {
        Counter.builder(METRIC_PREFIX + ".capture.backpressure")
                .description("Times the capture thread waited on a full frame queue")
                .register(registry)
                .increment();
    }

    /**
     * @param durationNanos time taken to load the recognition model
     */
    public void recordModelLoad(String engineName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".model.load")
                .description("Time taken to load the recognition model")
                .tag("engine", engineName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
