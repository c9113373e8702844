package com.phillippitts.scribedesk.service.events;

import com.phillippitts.scribedesk.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.scribedesk.service.stt.EngineFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for background error events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        String key = "capture-" + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Capture error: reason={}. Check microphone device & permissions, then stop and restart.",
                    e.reason());
        }
    }

    @EventListener
    void onEngineFailure(EngineFailureEvent e) {
        String key = "engine-" + e.engine() + '-' + e.message();
        if (shouldLog(key)) {
            String cause = e.cause() == null ? "n/a" : e.cause().getClass().getSimpleName();
            LOG.warn("Recognition engine failure: engine={}, what={}, cause={}, context={}",
                    e.engine(), e.message(), cause, e.context());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
