package com.phillippitts.scribedesk.service.stt;

import com.phillippitts.scribedesk.domain.RecognitionEvent;
import com.phillippitts.scribedesk.exception.InvalidOperationException;
import com.phillippitts.scribedesk.exception.RecognitionException;
import jakarta.annotation.PreDestroy;

import java.util.Objects;
import java.util.Optional;

/**
 * Abstract base class for recognition engines providing common lifecycle and state management.
 *
 * <p>This class implements the Template Method pattern: {@link #start(String)},
 * {@link #consume(byte[])}, {@link #finish()} and {@link #stop()} handle state checks and
 * error wrapping, and delegate the engine-specific work to the {@code do*} hooks.
 *
 * <p><b>Thread Safety:</b> All hooks are invoked while holding {@link #lock}, so subclasses do
 * not need additional synchronization for their own fields.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li><b>Stopped:</b> created, or after {@link #stop()}</li>
 *   <li><b>Ready:</b> {@link #start(String)} returned successfully</li>
 * </ol>
 *
 * <p>{@link #stop()} is idempotent and also runs on container shutdown.
 */
public abstract class AbstractRecognitionEngine implements RecognitionEngine {

    /**
     * Lock for synchronizing state transitions and recognizer access.
     */
    protected final Object lock = new Object();

    /**
     * True between a successful start and the next stop. Guarded by {@link #lock}.
     */
    protected boolean ready = false;

    @Override
    public final void start(String modelPath) {
        Objects.requireNonNull(modelPath, "modelPath");
        synchronized (lock) {
            if (ready) {
                throw new InvalidOperationException(getEngineName() + " engine already started");
            }
            doStart(modelPath);
            ready = true;
        }
    }

    /**
     * Engine-specific model loading. Must release any partially created resources and throw
     * {@link com.phillippitts.scribedesk.exception.ModelLoadException} on failure.
     */
    protected abstract void doStart(String modelPath);

    @Override
    public final Optional<RecognitionEvent> consume(byte[] frame) {
        if (frame == null || frame.length == 0) {
            throw new IllegalArgumentException("frame must not be null or empty");
        }
        synchronized (lock) {
            ensureReady();
            try {
                return doConsume(frame);
            } catch (Exception e) {
                throw wrap(e, "frame processing failed");
            }
        }
    }

    protected abstract Optional<RecognitionEvent> doConsume(byte[] frame);

    @Override
    public final Optional<RecognitionEvent.Final> finish() {
        synchronized (lock) {
            ensureReady();
            try {
                return doFinish();
            } catch (Exception e) {
                throw wrap(e, "flush failed");
            }
        }
    }

    protected abstract Optional<RecognitionEvent.Final> doFinish();

    @Override
    @PreDestroy
    public final void stop() {
        synchronized (lock) {
            if (!ready) {
                return;
            }
            try {
                doStop();
            } finally {
                ready = false;
            }
        }
    }

    /**
     * Engine-specific cleanup. Should never throw; log errors instead.
     */
    protected abstract void doStop();

    @Override
    public final boolean isReady() {
        synchronized (lock) {
            return ready;
        }
    }

    /**
     * @throws RecognitionException if the engine has not been started or was stopped
     */
    protected final void ensureReady() {
        synchronized (lock) {
            if (!ready) {
                throw new RecognitionException(getEngineName() + " engine not started", getEngineName());
            }
        }
    }

    private RecognitionException wrap(Exception e, String what) {
        if (e instanceof RecognitionException re) {
            return re;
        }
        return new RecognitionException(getEngineName() + " " + what + ": " + e.getMessage(), getEngineName(), e);
    }
}
