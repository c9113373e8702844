package com.phillippitts.scribedesk.config.audio;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for microphone capture.
 *
 * Required format (enforced by service): 16 kHz, 16-bit PCM, mono, little-endian.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Size of one PCM frame read from the TargetDataLine, in milliseconds. */
    @Min(10)
    @Max(500)
    private final int chunkMillis;

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String deviceName;

    public AudioCaptureProperties(@DefaultValue("100") int chunkMillis, String deviceName) {
        this.chunkMillis = chunkMillis;
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
    }

    public int getChunkMillis() { return chunkMillis; }
    public String getDeviceName() { return deviceName; }
}
