package com.phillippitts.scribedesk.service.session;

import com.phillippitts.scribedesk.config.session.SessionProperties;
import com.phillippitts.scribedesk.config.stt.ModelValidationService;
import com.phillippitts.scribedesk.config.stt.VoskConfig;
import com.phillippitts.scribedesk.domain.Note;
import com.phillippitts.scribedesk.domain.RecognitionEvent;
import com.phillippitts.scribedesk.domain.SessionStatus;
import com.phillippitts.scribedesk.domain.Speaker;
import com.phillippitts.scribedesk.exception.ExportException;
import com.phillippitts.scribedesk.exception.FailureKind;
import com.phillippitts.scribedesk.exception.InvalidOperationException;
import com.phillippitts.scribedesk.exception.RecognitionException;
import com.phillippitts.scribedesk.exception.ScribeDeskException;
import com.phillippitts.scribedesk.service.audio.capture.AudioCaptureSource;
import com.phillippitts.scribedesk.service.export.ExportSerializer;
import com.phillippitts.scribedesk.service.metrics.SessionMetrics;
import com.phillippitts.scribedesk.service.stt.EngineFailureEvent;
import com.phillippitts.scribedesk.service.stt.RecognitionEngine;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Entry point for every session command and the owner of all session state.
 *
 * <p><b>Threads:</b> the capture thread only anchors the {@link TimestampMapper} and puts frames
 * into a bounded queue (blocking when full). The recognition worker, running on the
 * {@code recognitionExecutor}, loads the model and feeds frames to the engine. Both post
 * immutable {@link SessionEvent}s to a per-run {@link RecognitionOutbox}; the outbox is applied
 * by {@link #drainEvents()} from the scheduled pump. Commands and the drain all run under one
 * lock, so the controller, stores and text model are only ever touched by one thread at a time.
 *
 * <p><b>Status:</b>
 * <pre>
 * IDLE -> LOADING (start) -> READY (model loaded) -> STOPPING -> IDLE (stop)
 * LOADING -> FAILED (model load failed) -> IDLE (stop) or LOADING (start)
 * </pre>
 */
@Service
public class TranscriptionSession {

    private static final Logger LOG = LogManager.getLogger(TranscriptionSession.class);

    private static final long WORKER_POLL_MILLIS = 50;

    private final SessionProperties properties;
    private final ModelValidationService models;
    private final AudioCaptureSource capture;
    private final RecognitionEngine engine;
    private final Executor recognitionExecutor;
    private final TimestampMapper mapper;
    private final SpeakerRegistry speakers;
    private final TranscriptSegmentStore segments;
    private final SegmentFinalizationController controller;
    private final ProtectedTextModel textModel;
    private final NoteStore notes;
    private final ExportSerializer exporter;
    private final SessionMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final Lock lock = new ReentrantLock();

    // Guarded by lock
    private volatile SessionStatus status = SessionStatus.IDLE;
    private Run current;
    private String selectedModelPath;
    private String livePartial = "";
    private String lastFailure;

    public TranscriptionSession(SessionProperties properties,
                                VoskConfig voskConfig,
                                ModelValidationService models,
                                AudioCaptureSource capture,
                                RecognitionEngine engine,
                                @Qualifier("recognitionExecutor") Executor recognitionExecutor,
                                TimestampMapper mapper,
                                SpeakerRegistry speakers,
                                TranscriptSegmentStore segments,
                                SegmentFinalizationController controller,
                                ProtectedTextModel textModel,
                                NoteStore notes,
                                ExportSerializer exporter,
                                SessionMetrics metrics,
                                ApplicationEventPublisher publisher,
                                Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.models = Objects.requireNonNull(models, "models");
        this.capture = Objects.requireNonNull(capture, "capture");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.recognitionExecutor = Objects.requireNonNull(recognitionExecutor, "recognitionExecutor");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.speakers = Objects.requireNonNull(speakers, "speakers");
        this.segments = Objects.requireNonNull(segments, "segments");
        this.controller = Objects.requireNonNull(controller, "controller");
        this.textModel = Objects.requireNonNull(textModel, "textModel");
        this.notes = Objects.requireNonNull(notes, "notes");
        this.exporter = Objects.requireNonNull(exporter, "exporter");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.selectedModelPath = voskConfig.modelPath();

        segments.addAppendListener(textModel::appendFinalizedLine);
        speakers.addChangeListener(textModel::onSpeakerChanged);
    }

    // ---------------------------------------------------------------- start / stop

    /**
     * Starts capture and recognition.
     *
     * <p>The model directory is validated and the microphone opened before this returns; the
     * model itself loads asynchronously (status {@code LOADING} until {@code READY}).
     *
     * @throws InvalidOperationException if a run is already active
     * @throws com.phillippitts.scribedesk.exception.ModelLoadException if the model path is unusable
     * @throws com.phillippitts.scribedesk.exception.AudioCaptureException if the microphone cannot be opened
     */
    public void start() {
        lock.lock();
        try {
            if (status.isActive()) {
                throw new InvalidOperationException("A transcription session is already running");
            }
            String modelPath = models.validateVoskModel(selectedModelPath).toString();
            Run run = new Run(UUID.randomUUID().toString(), properties.frameQueueCapacity());
            ThreadContext.put("sessionId", run.id);
            try {
                mapper.reset();
                livePartial = "";
                lastFailure = null;
                capture.start(frame -> enqueue(run, frame));
                try {
                    run.worker = CompletableFuture.runAsync(() -> recognize(run, modelPath), recognitionExecutor);
                } catch (RejectedExecutionException e) {
                    capture.stop();
                    throw new IllegalStateException("Recognition executor rejected the session worker", e);
                }
                current = run;
                status = SessionStatus.LOADING;
                LOG.info("Session started: model={}", modelPath);
            } finally {
                ThreadContext.remove("sessionId");
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the active run. Idempotent.
     *
     * <p>Capture is stopped first, queued frames are drained into the recognizer, the
     * recognizer's pending utterance is flushed, all outstanding events are applied and the open
     * segment is closed. No capture or recognition activity continues after this returns.
     */
    public void stop() {
        lock.lock();
        try {
            Run run = current;
            if (run == null) {
                if (status == SessionStatus.FAILED) {
                    status = SessionStatus.IDLE;
                }
                return;
            }
            status = SessionStatus.STOPPING;
            haltCapture(run);
            awaitWorker(run);
            run.outbox.drain(this::apply);
            controller.flush(clock.instant());
            livePartial = "";
            mapper.reset();
            current = null;
            status = SessionStatus.IDLE;
            LOG.info("Session stopped: {} segments in transcript", segments.size());
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    /**
     * Applies all events posted since the last drain. Called by the poll loop.
     *
     * @return number of events applied
     */
    public int drainEvents() {
        lock.lock();
        try {
            return applyPending();
        } finally {
            lock.unlock();
        }
    }

    // events recognized before a switch belong to the speaker active when they were recognized
    private int applyPending() {
        Run run = current;
        return run == null ? 0 : run.outbox.drain(this::apply);
    }

    // ---------------------------------------------------------------- speakers

    /**
     * Adds a speaker with the next palette colour; it becomes active if none was.
     */
    public Speaker addSpeaker(String name) {
        return withLock(() -> {
            applyPending();
            return afterAdd(speakers.addSpeaker(name));
        });
    }

    public Speaker addSpeaker(String name, String color) {
        return withLock(() -> {
            applyPending();
            return afterAdd(speakers.addSpeaker(name, color));
        });
    }

    private Speaker afterAdd(Speaker added) {
        if (speakers.activeSpeakerId().filter(added.id()::equals).isPresent()) {
            controller.onSpeakerSwitch(added.id(), clock.instant());
        }
        return added;
    }

    /**
     * Makes a speaker active, closing or discarding the open segment as needed.
     *
     * @throws InvalidOperationException if no speakers exist or the id is unknown
     */
    public void activateSpeaker(String speakerId) {
        lock.lock();
        try {
            applyPending();
            speakers.activate(speakerId);
            LOG.debug("Active speaker: {}", speakerId);
            controller.onSpeakerSwitch(speakerId, clock.instant());
        } finally {
            lock.unlock();
        }
    }

    public Speaker renameSpeaker(String speakerId, String newName) {
        return withLock(() -> speakers.rename(speakerId, newName));
    }

    public Speaker recolorSpeaker(String speakerId, String color) {
        return withLock(() -> speakers.recolor(speakerId, color));
    }

    public List<Speaker> speakers() {
        return withLock(speakers::speakers);
    }

    public Optional<String> activeSpeakerId() {
        return withLock(speakers::activeSpeakerId);
    }

    // ---------------------------------------------------------------- transcript & notes

    public String transcriptText() {
        return withLock(textModel::text);
    }

    public List<ProtectedTextModel.StyledLine> transcriptLines() {
        return withLock(textModel::styledLines);
    }

    /**
     * @return false if the edit touched a protected prefix and was rejected
     */
    public boolean applyEdit(int position, int deleteLength, String insertText) {
        return withLock(() -> textModel.applyEdit(position, deleteLength, insertText));
    }

    /**
     * Creates a note for the transcript line containing {@code position}.
     *
     * @throws InvalidOperationException if no line contains the position
     */
    public Note createNoteAt(int position) {
        return withLock(() -> {
            long segmentId = textModel.locateLine(position)
                    .orElseThrow(() -> new InvalidOperationException("No transcript line at position " + position));
            return notes.createNote(segmentId);
        });
    }

    public Note editNote(long noteId, String text) {
        return withLock(() -> notes.editNote(noteId, text));
    }

    public List<Note> notes() {
        return withLock(notes::listNotes);
    }

    /**
     * Writes the export document to {@code target}.
     *
     * @throws com.phillippitts.scribedesk.exception.ExportException if writing fails
     */
    public void export(Path target) {
        lock.lock();
        try {
            exporter.export(target);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes the export document to the file named by {@code targetPath}.
     *
     * @throws com.phillippitts.scribedesk.exception.ExportException if the path is malformed or writing fails
     */
    public void export(String targetPath) {
        Path target;
        try {
            target = Path.of(targetPath);
        } catch (InvalidPathException e) {
            throw new ExportException(targetPath, "Invalid export path: " + e.getReason(), e);
        }
        export(target);
    }

    // ---------------------------------------------------------------- models & status

    public List<Path> availableModels() {
        return models.listAvailableModels();
    }

    /**
     * Selects the model used by the next start.
     *
     * @throws InvalidOperationException if a run is active
     * @throws com.phillippitts.scribedesk.exception.ModelLoadException if the path is unusable
     */
    public void selectModel(String modelPath) {
        lock.lock();
        try {
            if (status.isActive()) {
                throw new InvalidOperationException("Cannot change model while a session is running");
            }
            selectedModelPath = models.validateVoskModel(modelPath).toString();
            LOG.info("Model selected: {}", selectedModelPath);
        } finally {
            lock.unlock();
        }
    }

    public SessionStatus status() {
        return status;
    }

    /**
     * Read-only view for the UI poll loop.
     */
    public SessionView view() {
        return withLock(() -> new SessionView(
                status,
                selectedModelPath,
                speakers.activeSpeakerId().orElse(null),
                livePartial,
                segments.openSegment().orElse(null),
                controller.bufferedText(),
                segments.size(),
                lastFailure));
    }

    // ---------------------------------------------------------------- background threads

    private void enqueue(Run run, byte[] frame) throws InterruptedException {
        if (mapper.anchor(clock.instant())) {
            mapper.streamStart().ifPresent(at -> run.outbox.post(new SessionEvent.StreamAnchored(at)));
        }
        long timeout = properties.captureOfferTimeoutMs();
        while (!run.queue.offer(frame, timeout, TimeUnit.MILLISECONDS)) {
            if (!run.capturing) {
                return;
            }
            metrics.incrementBackpressure();
            if (run.backpressureWarned.compareAndSet(false, true)) {
                LOG.warn("Frame queue full ({} frames); recognition is falling behind capture",
                        properties.frameQueueCapacity());
            }
        }
    }

    private void recognize(Run run, String modelPath) {
        long t0 = System.nanoTime();
        try {
            engine.start(modelPath);
        } catch (ScribeDeskException e) {
            LOG.error("Model load failed: {}", e.getMessage());
            run.outbox.post(new SessionEvent.Failed(FailureKind.MODEL_LOAD, e.getMessage()));
            return;
        } catch (RuntimeException e) {
            LOG.error("Model load failed", e);
            run.outbox.post(new SessionEvent.Failed(FailureKind.MODEL_LOAD, "Failed to load model: " + e.getMessage()));
            return;
        }
        metrics.recordModelLoad(engine.getEngineName(), System.nanoTime() - t0);
        run.outbox.post(new SessionEvent.Ready(engine.getEngineName()));
        try {
            while (true) {
                byte[] frame = run.queue.poll(WORKER_POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (frame == null) {
                    if (run.drainRequested) {
                        break;
                    }
                    continue;
                }
                consumeFrame(run, frame);
            }
            engine.finish().ifPresent(f -> run.outbox.post(new SessionEvent.Recognized(f)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Recognition worker interrupted; {} frames left unprocessed", run.queue.size());
        } catch (RecognitionException e) {
            LOG.warn("Recognizer flush failed: {}", e.getMessage());
        } finally {
            engine.stop();
        }
    }

    private void consumeFrame(Run run, byte[] frame) {
        try {
            engine.consume(frame).ifPresent(e -> run.outbox.post(new SessionEvent.Recognized(e)));
            metrics.incrementFrames();
        } catch (RecognitionException e) {
            metrics.incrementFrameErrors(engine.getEngineName());
            LOG.warn("Skipping frame: {}", e.getMessage());
            publisher.publishEvent(new EngineFailureEvent(engine.getEngineName(), clock.instant(),
                    "frame failure", e, Map.of("frameBytes", String.valueOf(frame.length))));
        }
    }

    // ---------------------------------------------------------------- event application (lock held)

    private void apply(SessionEvent event) {
        if (event instanceof SessionEvent.StreamAnchored) {
            controller.onSessionStart();
        } else if (event instanceof SessionEvent.Ready ready) {
            if (status == SessionStatus.LOADING) {
                status = SessionStatus.READY;
                LOG.info("Recognition ready: engine={}", ready.engineName());
            }
        } else if (event instanceof SessionEvent.Failed failed) {
            fail(failed);
        } else if (event instanceof SessionEvent.Recognized recognized) {
            applyRecognition(recognized.event());
        }
    }

    private void applyRecognition(RecognitionEvent event) {
        if (event instanceof RecognitionEvent.Partial partial) {
            livePartial = partial.text();
            controller.onPartial(partial.text());
        } else if (event instanceof RecognitionEvent.Final fin) {
            livePartial = "";
            controller.onFinal(fin);
        }
    }

    private void fail(SessionEvent.Failed failed) {
        Run run = current;
        lastFailure = failed.kind() + ": " + failed.message();
        if (run != null) {
            haltCapture(run);
            current = null;
        }
        controller.flush(clock.instant());
        mapper.reset();
        livePartial = "";
        status = SessionStatus.FAILED;
        LOG.warn("Session failed: kind={}", failed.kind());
    }

    private void haltCapture(Run run) {
        run.capturing = false;
        capture.stop();
        run.drainRequested = true;
    }

    private void awaitWorker(Run run) {
        CompletableFuture<Void> worker = run.worker;
        if (worker == null) {
            return;
        }
        boolean interrupted = false;
        boolean warned = false;
        try {
            while (true) {
                try {
                    worker.get(properties.stopTimeoutMs(), TimeUnit.MILLISECONDS);
                    return;
                } catch (TimeoutException e) {
                    if (!warned) {
                        LOG.warn("Recognition worker still running after {}ms; waiting for it to finish",
                                properties.stopTimeoutMs());
                        warned = true;
                    }
                } catch (ExecutionException e) {
                    LOG.error("Recognition worker failed", e.getCause());
                    return;
                } catch (InterruptedException e) {
                    // the worker only blocks in a bounded poll, so keep waiting and restore the flag after
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /** State of one start-to-stop run, shared with its background threads. */
    private static final class Run {
        final String id;
        final BlockingQueue<byte[]> queue;
        final RecognitionOutbox outbox = new RecognitionOutbox();
        final AtomicBoolean backpressureWarned = new AtomicBoolean(false);
        volatile boolean capturing = true;
        volatile boolean drainRequested = false;
        volatile CompletableFuture<Void> worker;

        Run(String id, int capacity) {
            this.id = id;
            this.queue = new ArrayBlockingQueue<>(capacity);
        }
    }

    /**
     * Snapshot of session state for display.
     *
     * @param status         lifecycle status
     * @param modelPath      model used by the next (or current) run
     * @param activeSpeaker  active speaker id, or null
     * @param livePartial    latest partial text, cleared when a segment closes
     * @param openSegment    segment in progress, or null
     * @param pendingText    text recognized while no speaker was active, kept for the first one
     * @param segmentCount   number of closed segments
     * @param lastFailure    description of the last asynchronous failure, or null
     */
    public record SessionView(SessionStatus status,
                              String modelPath,
                              String activeSpeaker,
                              String livePartial,
                              OpenSegment openSegment,
                              String pendingText,
                              int segmentCount,
                              String lastFailure) {
    }
}
