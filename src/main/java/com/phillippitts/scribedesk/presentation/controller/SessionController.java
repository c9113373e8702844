package com.phillippitts.scribedesk.presentation.controller;

import com.phillippitts.scribedesk.domain.Note;
import com.phillippitts.scribedesk.domain.Speaker;
import com.phillippitts.scribedesk.service.session.ProtectedTextModel;
import com.phillippitts.scribedesk.service.session.TranscriptionSession;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Synchronous command surface over the transcription session.
 *
 * <p>Each endpoint either succeeds or surfaces a typed failure through
 * {@code GlobalExceptionHandler}.
 */
@RestController
public class SessionController {

    private final TranscriptionSession session;

    public SessionController(TranscriptionSession session) {
        this.session = session;
    }

    @PostMapping("/session/start")
    public TranscriptionSession.SessionView start() {
        session.start();
        return session.view();
    }

    @PostMapping("/session/stop")
    public TranscriptionSession.SessionView stop() {
        session.stop();
        return session.view();
    }

    @GetMapping("/session")
    public TranscriptionSession.SessionView status() {
        return session.view();
    }

    @GetMapping("/models")
    public List<String> models() {
        return session.availableModels().stream().map(Path::toString).collect(Collectors.toList());
    }

    @PutMapping("/models/selected")
    public TranscriptionSession.SessionView selectModel(@Valid @RequestBody ModelRequest request) {
        session.selectModel(request.path());
        return session.view();
    }

    @GetMapping("/speakers")
    public List<Speaker> speakers() {
        return session.speakers();
    }

    @PostMapping("/speakers")
    @ResponseStatus(HttpStatus.CREATED)
    public Speaker addSpeaker(@Valid @RequestBody SpeakerRequest request) {
        return request.color() == null
                ? session.addSpeaker(request.name())
                : session.addSpeaker(request.name(), request.color());
    }

    @PutMapping("/speakers/{id}/name")
    public Speaker rename(@PathVariable("id") String id, @Valid @RequestBody RenameRequest request) {
        return session.renameSpeaker(id, request.name());
    }

    @PutMapping("/speakers/{id}/color")
    public Speaker recolor(@PathVariable("id") String id, @Valid @RequestBody RecolorRequest request) {
        return session.recolorSpeaker(id, request.color());
    }

    @PostMapping("/speakers/{id}/activate")
    public TranscriptionSession.SessionView activate(@PathVariable("id") String id) {
        session.activateSpeaker(id);
        return session.view();
    }

    @GetMapping("/transcript")
    public TranscriptView transcript() {
        return new TranscriptView(session.transcriptText(), session.transcriptLines());
    }

    @PostMapping("/transcript/edits")
    public EditResult edit(@Valid @RequestBody EditRequest request) {
        boolean applied = session.applyEdit(request.position(), request.deleteLength(),
                request.insertText() == null ? "" : request.insertText());
        return new EditResult(applied);
    }

    @GetMapping("/notes")
    public List<Note> notes() {
        return session.notes();
    }

    @PostMapping("/notes")
    @ResponseStatus(HttpStatus.CREATED)
    public Note createNote(@Valid @RequestBody NoteRequest request) {
        return session.createNoteAt(request.position());
    }

    @PutMapping("/notes/{id}")
    public Note editNote(@PathVariable("id") long id, @RequestBody NoteTextRequest request) {
        return session.editNote(id, request.text());
    }

    @PostMapping("/export")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void export(@Valid @RequestBody ExportRequest request) {
        session.export(request.path());
    }

    public record ModelRequest(@NotBlank String path) {}

    public record SpeakerRequest(@NotBlank String name, String color) {}

    public record RenameRequest(@NotBlank String name) {}

    public record RecolorRequest(@NotBlank String color) {}

    public record EditRequest(@Min(0) int position, @Min(0) int deleteLength, String insertText) {}

    public record EditResult(boolean applied) {}

    public record NoteRequest(@NotNull @Min(0) Integer position) {}

    public record NoteTextRequest(String text) {}

    public record ExportRequest(@NotBlank String path) {}

    public record TranscriptView(String text, List<ProtectedTextModel.StyledLine> lines) {}
}
