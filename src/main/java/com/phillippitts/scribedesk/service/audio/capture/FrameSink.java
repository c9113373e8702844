package com.phillippitts.scribedesk.service.audio.capture;

/**
 * Receives captured PCM frames on the capture thread.
 *
 * <p>Implementations may block to apply back-pressure; they must return promptly once the
 * capture source has been asked to stop.
 */
@FunctionalInterface
public interface FrameSink {

    /**
     * @param frame freshly allocated frame; ownership passes to the sink
     * @throws InterruptedException if the capture thread is interrupted while waiting
     */
    void accept(byte[] frame) throws InterruptedException;
}
