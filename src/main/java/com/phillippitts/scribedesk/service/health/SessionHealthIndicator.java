package com.phillippitts.scribedesk.service.health;

import com.phillippitts.scribedesk.domain.SessionStatus;
import com.phillippitts.scribedesk.service.session.TranscriptionSession;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Health of the transcription session.
 *
 * <p>DOWN when the last run failed or the selected model directory is missing. Exposed via
 * /actuator/health.
 */
@Component
public class SessionHealthIndicator implements HealthIndicator {

    private final TranscriptionSession session;

    public SessionHealthIndicator(TranscriptionSession session) {
        this.session = session;
    }

    @Override
    public Health health() {
        TranscriptionSession.SessionView view = session.view();
        Path model = Paths.get(view.modelPath());
        boolean modelPresent = Files.isDirectory(model);

        Health.Builder builder = (modelPresent && view.status() != SessionStatus.FAILED)
                ? Health.up()
                : Health.down();
        builder.withDetail("status", view.status().name())
                .withDetail("model", modelPresent ? "accessible" : "NOT FOUND")
                .withDetail("segments", view.segmentCount());
        if (view.lastFailure() != null) {
            builder.withDetail("lastFailure", view.lastFailure());
        }
        return builder.build();
    }
}
