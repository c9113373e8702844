package com.phillippitts.scribedesk.service.session;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drains the session outbox on a fixed interval ({@code session.poll-interval-ms}).
 *
 * <p>Single consumer: Spring's scheduler never overlaps runs of a fixed-delay task.
 */
@Component
class SessionEventPump {

    private static final Logger LOG = LogManager.getLogger(SessionEventPump.class);

    private final TranscriptionSession session;

    SessionEventPump(TranscriptionSession session) {
        this.session = session;
    }

    @Scheduled(fixedDelayString = "${session.poll-interval-ms:100}")
    void pump() {
        try {
            int n = session.drainEvents();
            if (n > 0) {
                LOG.trace("Applied {} session events", n);
            }
        } catch (RuntimeException e) {
            LOG.error("Failed to apply session events", e);
        }
    }
}
