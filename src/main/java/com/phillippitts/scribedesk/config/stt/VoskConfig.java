package com.phillippitts.scribedesk.config.stt;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Configuration properties for the Vosk recognition engine.
 * Binds to properties prefixed with "stt.vosk".
 *
 * <p>Example application.properties:
 * <pre>
 * stt.vosk.model-path=models/vosk-model-small-en-us-0.15
 * stt.vosk.models-dir=models
 * stt.vosk.sample-rate=16000
 * </pre>
 *
 * @param modelPath  Path to the Vosk model directory used by the next start
 * @param modelsDir  Directory scanned for selectable models
 * @param sampleRate Audio sample rate in Hz (must match capture format)
 */
@ConfigurationProperties(prefix = "stt.vosk")
@Validated
public record VoskConfig(
        @NotBlank(message = "Vosk model path must not be blank")
        @DefaultValue("models/vosk-model-small-en-us-0.15")
        String modelPath,

        @NotBlank(message = "Vosk models directory must not be blank")
        @DefaultValue("models")
        String modelsDir,

        @Positive(message = "Sample rate must be positive")
        @DefaultValue("16000")
        int sampleRate
) {
}
