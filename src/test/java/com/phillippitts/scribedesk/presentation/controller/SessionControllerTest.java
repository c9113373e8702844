package com.phillippitts.scribedesk.presentation.controller;

import com.phillippitts.scribedesk.domain.SessionStatus;
import com.phillippitts.scribedesk.domain.Speaker;
import com.phillippitts.scribedesk.exception.AudioCaptureException;
import com.phillippitts.scribedesk.exception.ExportException;
import com.phillippitts.scribedesk.exception.InvalidOperationException;
import com.phillippitts.scribedesk.exception.ModelLoadException;
import com.phillippitts.scribedesk.service.session.TranscriptionSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SessionController.class)
class SessionControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private TranscriptionSession session;

    @BeforeEach
    void setUp() {
        when(session.view()).thenReturn(new TranscriptionSession.SessionView(
                SessionStatus.LOADING, "models/small-en", "spk-1", "", null, "", 0, null));
    }

    @Test
    void startReturnsSessionView() throws Exception {
        mvc.perform(post("/session/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("LOADING"))
                .andExpect(jsonPath("$.activeSpeaker").value("spk-1"));

        verify(session).start();
    }

    @Test
    void captureFailureOnStartIsServiceUnavailableWithCaptureKind() throws Exception {
        doThrow(new AudioCaptureException("MIC_UNAVAILABLE", "no device")).when(session).start();

        mvc.perform(post("/session/start"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.kind").value("CAPTURE"));
    }

    @Test
    void modelLoadFailureOnStartIsServiceUnavailableWithModelLoadKind() throws Exception {
        doThrow(new ModelLoadException("/m")).when(session).start();

        mvc.perform(post("/session/start"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.kind").value("MODEL_LOAD"));
    }

    @Test
    void activatingWithoutSpeakersIsConflict() throws Exception {
        doThrow(new InvalidOperationException("No speakers defined")).when(session).activateSpeaker("spk-9");

        mvc.perform(post("/speakers/spk-9/activate"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("INVALID_OPERATION"))
                .andExpect(jsonPath("$.details").value("No speakers defined"));
    }

    @Test
    void addSpeakerWithColorReturnsCreated() throws Exception {
        when(session.addSpeaker("Alice", "#1f77b4")).thenReturn(new Speaker("spk-1", "Alice", "#1f77b4"));

        mvc.perform(post("/speakers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Alice\", \"color\": \"#1f77b4\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("spk-1"))
                .andExpect(jsonPath("$.color").value("#1f77b4"));
    }

    @Test
    void addSpeakerWithoutColorUsesPalette() throws Exception {
        when(session.addSpeaker("Bob")).thenReturn(new Speaker("spk-2", "Bob", "#ff7f0e"));

        mvc.perform(post("/speakers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Bob\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Bob"));
    }

    @Test
    void blankSpeakerNameIsBadRequest() throws Exception {
        mvc.perform(post("/speakers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ValidationError"));

        verify(session, never()).addSpeaker(anyString());
    }

    @Test
    void rejectedEditReportsNotApplied() throws Exception {
        when(session.applyEdit(anyInt(), anyInt(), anyString())).thenReturn(false);

        mvc.perform(post("/transcript/edits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"position\": 3, \"deleteLength\": 2, \"insertText\": \"x\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.applied").value(false));

        verify(session).applyEdit(3, 2, "x");
    }

    @Test
    void listsAvailableModels() throws Exception {
        when(session.availableModels()).thenReturn(List.of(Path.of("models/a"), Path.of("models/b")));

        mvc.perform(get("/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("models/a"))
                .andExpect(jsonPath("$[1]").value("models/b"));
    }

    @Test
    void selectModelDelegatesAndReturnsView() throws Exception {
        mvc.perform(put("/models/selected")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\": \"models/b\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.modelPath").value("models/small-en"));

        verify(session).selectModel("models/b");
    }

    @Test
    void exportReturnsNoContent() throws Exception {
        mvc.perform(post("/export")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\": \"out/session.json\"}"))
                .andExpect(status().isNoContent());

        verify(session).export("out/session.json");
    }

    @Test
    void exportFailureIsServerErrorWithExportKind() throws Exception {
        doThrow(new ExportException("out/session.json", "Export failed", new IOException("disk full")))
                .when(session).export(anyString());

        mvc.perform(post("/export")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\": \"out/session.json\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.kind").value("EXPORT"));
    }
}
