package com.phillippitts.scribedesk.service.audio.capture;

import com.phillippitts.scribedesk.config.audio.AudioCaptureProperties;
import com.phillippitts.scribedesk.exception.AudioCaptureException;
import com.phillippitts.scribedesk.service.audio.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Java Sound based microphone capture that streams raw PCM16LE mono @16kHz frames.
 *
 * <p>The line is opened synchronously in {@link #start(FrameSink)}; reading happens on a daemon
 * thread named {@code audio-capture}. Frames are handed to the sink as they are read and never
 * dropped here: a slow sink slows the capture loop down.
 */
@Service
public class JavaSoundAudioCaptureSource implements AudioCaptureSource {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioCaptureSource.class);

    static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofSeconds(2);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final AudioCaptureProperties props;
    private final ApplicationEventPublisher publisher;
    private final DataLineProvider provider;

    private final Object lock = new Object();
    private Capture current;

    @Autowired
    public JavaSoundAudioCaptureSource(AudioCaptureProperties props, ApplicationEventPublisher publisher) {
        this(props, publisher, defaultProvider());
    }

    // Package-private for tests
    JavaSoundAudioCaptureSource(AudioCaptureProperties props,
                                ApplicationEventPublisher publisher,
                                DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
        this.provider = Objects.requireNonNull(provider);
    }

    @PostConstruct
    public void logSystemInfo() {
        String device = props.getDeviceName() != null ? props.getDeviceName() : "default";
        LOG.info("Audio capture initialized: OS={}, arch={}, device='{}', available-mixers={}, chunk={}ms",
                System.getProperty("os.name"), System.getProperty("os.arch"), device,
                AudioSystem.getMixerInfo().length, props.getChunkMillis());
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    private static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
                if (line == null) {
                    LOG.warn("Input device '{}' not found; falling back to system default", device.get());
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public void start(FrameSink sink) {
        Objects.requireNonNull(sink, "sink");
        synchronized (lock) {
            if (current != null && current.active.get()) {
                throw new IllegalStateException("Another capture is already active");
            }
            TargetDataLine line = openLine();
            Capture capture = new Capture(line);
            capture.active.set(true);
            int bytesPerChunk = AudioFormat.bytesForMillis(props.getChunkMillis());
            Map<String, String> mdc = ThreadContext.getImmutableContext();

            Thread t = new Thread(() -> {
                ThreadContext.putAll(mdc);
                try {
                    doCapture(capture, sink, bytesPerChunk);
                } finally {
                    ThreadContext.clearAll();
                }
            }, "audio-capture");
            t.setDaemon(true);
            capture.thread = t;
            current = capture;
            t.start();
        }
    }

    private TargetDataLine openLine() {
        try {
            return provider.open(AudioFormat.toJavaSound(), Optional.ofNullable(props.getDeviceName()));
        } catch (LineUnavailableException e) {
            LOG.warn("Microphone unavailable: {}", e.getMessage());
            throw new AudioCaptureException("MIC_UNAVAILABLE", "Microphone unavailable: " + e.getMessage(), e);
        } catch (SecurityException se) {
            LOG.warn("Microphone access denied: {}", se.getMessage());
            throw new AudioCaptureException("MIC_PERMISSION_DENIED", "Microphone access denied", se);
        } catch (RuntimeException e) {
            LOG.warn("Microphone could not be opened: {}", e.toString());
            throw new AudioCaptureException("MIC_UNAVAILABLE", "Microphone could not be opened", e);
        }
    }

    @Override
    public void stop() {
        Thread captureThread;
        synchronized (lock) {
            if (current == null) {
                return;
            }
            current.active.set(false);
            captureThread = current.thread;
            current = null;
        }
        // Join outside lock to avoid deadlock with a sink that is still blocking
        joinThread(captureThread, CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
    }

    @Override
    public boolean isCapturing() {
        synchronized (lock) {
            return current != null && current.active.get();
        }
    }

    private void doCapture(Capture c, FrameSink sink, int bytesPerChunk) {
        TargetDataLine line = c.line;
        long written = 0;
        try {
            line.start();
            byte[] buf = new byte[bytesPerChunk];
            while (c.active.get()) {
                int n = line.read(buf, 0, buf.length);
                if (n <= 0) {
                    continue;
                }
                if (!c.active.get()) {
                    break;
                }
                sink.accept(Arrays.copyOf(buf, n));
                written += n;
            }
            LOG.info("Audio capture completed: total {} bytes captured", written);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.info("Audio capture interrupted after {} bytes", written);
        } catch (Throwable t) {
            LOG.warn("Capture failed: {}", t.toString());
            publisher.publishEvent(new CaptureErrorEvent("CAPTURE_ERROR", Instant.now()));
        } finally {
            c.active.set(false);
            try {
                line.stop();
            } catch (Exception e) {
                LOG.debug("Error stopping line: {}", e.toString());
            }
            try {
                line.close();
            } catch (Exception e) {
                LOG.debug("Error closing line: {}", e.toString());
            }
        }
    }

    private void joinThread(Thread thread, long timeoutMs) {
        if (thread == null || !thread.isAlive() || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(timeoutMs);
            if (thread.isAlive()) {
                LOG.warn("Capture thread did not terminate within {}ms; interrupting", timeoutMs);
                thread.interrupt();
                thread.join(timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture thread to terminate");
        }
    }

    private static final class Capture {
        final TargetDataLine line;
        final AtomicBoolean active = new AtomicBoolean(false);
        volatile Thread thread;

        Capture(TargetDataLine line) {
            this.line = line;
        }
    }
}
