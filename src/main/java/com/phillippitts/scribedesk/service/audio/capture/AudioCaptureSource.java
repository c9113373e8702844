package com.phillippitts.scribedesk.service.audio.capture;

/**
 * Produces a sequence of fixed-size PCM frames from a microphone device.
 *
 * <p>At most one capture runs at a time. Frames are delivered on a dedicated capture thread.
 */
public interface AudioCaptureSource {

    /**
     * Opens the device and begins delivering frames to {@code sink}.
     *
     * <p>The device is opened before this method returns, so an unavailable microphone fails the
     * call instead of surfacing later on the capture thread.
     *
     * @param sink receiver for captured frames
     * @throws com.phillippitts.scribedesk.exception.AudioCaptureException if the device cannot be opened
     * @throws IllegalStateException if a capture is already running
     */
    void start(FrameSink sink);

    /**
     * Stops delivering frames and waits for the capture thread to finish. Idempotent.
     *
     * <p>No frame is delivered to the sink after this method returns.
     */
    void stop();

    /**
     * @return true while the capture thread is running
     */
    boolean isCapturing();
}
