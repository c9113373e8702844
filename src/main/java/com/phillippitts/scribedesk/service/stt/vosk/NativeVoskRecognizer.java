package com.phillippitts.scribedesk.service.stt.vosk;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.vosk.Model;
import org.vosk.Recognizer;

/**
 * {@link VoskRecognizer} backed by the Vosk JNI bindings. Owns both native handles.
 */
final class NativeVoskRecognizer implements VoskRecognizer {

    private static final Logger LOG = LogManager.getLogger(NativeVoskRecognizer.class);

    private final Model model;
    private final Recognizer recognizer;

    private NativeVoskRecognizer(Model model, Recognizer recognizer) {
        this.model = model;
        this.recognizer = recognizer;
    }

    /**
     * Loads the model and creates a recognizer that reports per-word timings.
     */
    static NativeVoskRecognizer open(String modelPath, float sampleRate) throws Exception {
        Model model = new Model(modelPath);
        try {
            Recognizer recognizer = new Recognizer(model, sampleRate);
            recognizer.setWords(true);
            return new NativeVoskRecognizer(model, recognizer);
        } catch (Throwable t) {
            model.close();
            throw t;
        }
    }

    @Override
    public boolean acceptWaveForm(byte[] data, int length) {
        return recognizer.acceptWaveForm(data, length);
    }

    @Override
    public String result() {
        return recognizer.getResult();
    }

    @Override
    public String partialResult() {
        return recognizer.getPartialResult();
    }

    @Override
    public String finalResult() {
        return recognizer.getFinalResult();
    }

    @Override
    public void close() {
        try {
            recognizer.close();
        } catch (Throwable t) {
            LOG.warn("Error closing recognizer", t);
        }
        try {
            model.close();
        } catch (Throwable t) {
            LOG.warn("Error closing model", t);
        }
    }
}
