package com.phillippitts.scribedesk.service.stt.vosk;

import com.phillippitts.scribedesk.config.stt.VoskConfig;
import com.phillippitts.scribedesk.domain.RecognitionEvent;
import com.phillippitts.scribedesk.exception.ModelLoadException;
import com.phillippitts.scribedesk.service.stt.AbstractRecognitionEngine;
import com.phillippitts.scribedesk.service.stt.EngineFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Vosk-based streaming implementation of {@link com.phillippitts.scribedesk.service.stt.RecognitionEngine}.
 *
 * <p>One recognizer lives from {@code start} to {@code stop}. Relative time is measured from the
 * first byte fed after {@code start}: final results carry the end of their last word, or the
 * current stream position when the recognizer reported no word timings.
 *
 * <p>Audio contract: raw PCM16LE mono at {@link VoskConfig#sampleRate()}.
 */
@Component
public class VoskRecognitionEngine extends AbstractRecognitionEngine {

    private static final Logger LOG = LogManager.getLogger(VoskRecognitionEngine.class);

    static final String ENGINE_NAME = "vosk";

    private static final int BYTES_PER_SAMPLE = 2;

    private final VoskConfig config;
    private final VoskRecognizer.Factory factory;
    private final ApplicationEventPublisher publisher;

    // @GuardedBy("lock")
    private VoskRecognizer recognizer;
    private long bytesFed;
    private String lastPartial = "";

    @Autowired
    public VoskRecognitionEngine(VoskConfig config, ApplicationEventPublisher publisher) {
        this(config, publisher, NativeVoskRecognizer::open);
    }

    // Package-private for tests
    VoskRecognitionEngine(VoskConfig config, ApplicationEventPublisher publisher, VoskRecognizer.Factory factory) {
        this.config = Objects.requireNonNull(config, "config");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    protected void doStart(String modelPath) {
        LOG.info("Loading Vosk model: modelPath={}, sampleRate={}", modelPath, config.sampleRate());
        try {
            recognizer = factory.open(modelPath, config.sampleRate());
        } catch (Throwable t) { // include UnsatisfiedLinkError, etc.
            recognizer = null;
            publisher.publishEvent(new EngineFailureEvent(ENGINE_NAME, Instant.now(), "initialize failure", t,
                    Map.of("modelPath", modelPath, "sampleRate", String.valueOf(config.sampleRate()))));
            throw new ModelLoadException(modelPath, "Failed to load Vosk model at: " + modelPath, t);
        }
        bytesFed = 0;
        lastPartial = "";
        LOG.info("Vosk model loaded");
    }

    @Override
    protected Optional<RecognitionEvent> doConsume(byte[] frame) {
        bytesFed += frame.length;
        if (recognizer.acceptWaveForm(frame, frame.length)) {
            lastPartial = "";
            return toFinal(recognizer.result()).map(RecognitionEvent.class::cast);
        }
        String partial = VoskJsonParser.parsePartial(recognizer.partialResult());
        if (partial.isEmpty() || partial.equals(lastPartial)) {
            return Optional.empty();
        }
        lastPartial = partial;
        return Optional.of(new RecognitionEvent.Partial(partial));
    }

    @Override
    protected Optional<RecognitionEvent.Final> doFinish() {
        lastPartial = "";
        return toFinal(recognizer.finalResult());
    }

    private Optional<RecognitionEvent.Final> toFinal(String json) {
        VoskJsonParser.VoskFinal parsed = VoskJsonParser.parseFinal(json);
        if (parsed.text().isEmpty()) {
            return Optional.empty();
        }
        double end = parsed.lastWordEnd().orElseGet(this::streamPositionSeconds);
        LOG.debug("Vosk final: {} chars ending at {}s", parsed.text().length(), end);
        return Optional.of(new RecognitionEvent.Final(parsed.text(), end));
    }

    private double streamPositionSeconds() {
        return (double) bytesFed / ((long) config.sampleRate() * BYTES_PER_SAMPLE);
    }

    @Override
    protected void doStop() {
        if (recognizer != null) {
            recognizer.close();
            recognizer = null;
        }
        bytesFed = 0;
        lastPartial = "";
        LOG.info("Vosk engine stopped");
    }

    @Override
    public String getEngineName() {
        return ENGINE_NAME;
    }
}
