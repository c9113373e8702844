package com.phillippitts.scribedesk.service.stt;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a recognition engine fails to load a model or to process a frame.
 *
 * <p>PII note: Do not include transcript text in context. Restrict to technical diagnostics.
 */
public record EngineFailureEvent(
        String engine,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public EngineFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
