package com.phillippitts.scribedesk.service.audio.capture;

import java.time.Instant;

/**
 * Published when microphone capture fails after the line was opened (device unplugged, driver
 * error, ...).
 *
 * Payload contains a short reason and timestamp. Avoids any PII.
 */
public record CaptureErrorEvent(String reason, Instant at) { }
