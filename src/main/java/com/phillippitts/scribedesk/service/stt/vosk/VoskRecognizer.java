package com.phillippitts.scribedesk.service.stt.vosk;

/**
 * Narrow view of a streaming Vosk recognizer together with the model it was built on.
 *
 * <p>Exists so the engine can be exercised without the native library.
 */
public interface VoskRecognizer extends AutoCloseable {

    /**
     * @return true when the recognizer endpointed an utterance and {@link #result()} is ready
     */
    boolean acceptWaveForm(byte[] data, int length);

    String result();

    String partialResult();

    String finalResult();

    /** Releases the recognizer and its model. Must not throw. */
    @Override
    void close();

    /**
     * Creates recognizers for a model directory.
     */
    @FunctionalInterface
    interface Factory {
        VoskRecognizer open(String modelPath, float sampleRate) throws Exception;
    }
}
