package com.phillippitts.scribedesk.config.session;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

/**
 * Transcription session tuning. Binds to properties prefixed with "session".
 *
 * @param pollIntervalMs         interval at which the event outbox is drained
 * @param frameQueueCapacity     bounded capacity of the capture-to-recognizer frame queue
 * @param captureOfferTimeoutMs  how long one blocking put waits before a back-pressure warning
 * @param stopTimeoutMs          wait on the worker during stop before a still-running warning is logged
 * @param timeZone               zone used to render transcript clock times; blank = system zone
 */
@Validated
@ConfigurationProperties(prefix = "session")
public record SessionProperties(
        @Min(10) @Max(5_000)
        @DefaultValue("100")
        long pollIntervalMs,

        @Min(4) @Max(100_000)
        @DefaultValue("256")
        int frameQueueCapacity,

        @Min(1) @Max(10_000)
        @DefaultValue("200")
        long captureOfferTimeoutMs,

        @Min(100) @Max(600_000)
        @DefaultValue("10000")
        long stopTimeoutMs,

        @DefaultValue("")
        String timeZone
) {

    /**
     * Resolves the configured zone, defaulting to the system zone.
     */
    public ZoneId zoneId() {
        return (timeZone == null || timeZone.isBlank()) ? ZoneId.systemDefault() : ZoneId.of(timeZone);
    }
}
