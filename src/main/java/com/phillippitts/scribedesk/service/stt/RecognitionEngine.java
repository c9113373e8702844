package com.phillippitts.scribedesk.service.stt;

import com.phillippitts.scribedesk.domain.RecognitionEvent;

import java.util.Optional;

/**
 * Stateful streaming wrapper over an offline speech model.
 *
 * <p>Lifecycle: {@code start(modelPath)} loads the model (may take seconds), after which
 * {@link #isReady()} is true and frames may be consumed. {@link #stop()} releases the model
 * and resets all recognizer state; a later {@code start} begins a new relative-time axis.
 *
 * <p>Implementations are used by one recognition worker at a time.
 */
public interface RecognitionEngine {

    /**
     * Loads the model at {@code modelPath}. Blocks until the model is ready.
     *
     * @throws com.phillippitts.scribedesk.exception.ModelLoadException if the model cannot be loaded
     * @throws com.phillippitts.scribedesk.exception.InvalidOperationException if already started
     */
    void start(String modelPath);

    /**
     * Feeds one PCM frame.
     *
     * @param frame PCM16LE mono audio at the engine's sample rate
     * @return a partial or final result, or empty when nothing new was recognized
     * @throws com.phillippitts.scribedesk.exception.RecognitionException if the frame could not
     *         be processed; the engine stays usable
     */
    Optional<RecognitionEvent> consume(byte[] frame);

    /**
     * Flushes the utterance in progress, if any, after the last frame was consumed.
     *
     * @return the final result for pending audio, or empty when nothing was pending
     */
    Optional<RecognitionEvent.Final> finish();

    /**
     * Releases the model and resets state. Idempotent.
     */
    void stop();

    boolean isReady();

    String getEngineName();
}
