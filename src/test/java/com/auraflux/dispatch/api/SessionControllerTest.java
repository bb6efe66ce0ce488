package com.auraflux.dispatch.api;

import com.auraflux.core.dispatch.AgentTaskRequest;
import com.auraflux.core.dispatch.Lane;
import com.auraflux.core.dispatch.TaskAcceptance;
import com.auraflux.core.dispatch.TaskDispatcher;
import com.auraflux.core.engine.ChatService;
import com.auraflux.core.engine.PhaseStateMachine;
import com.auraflux.core.engine.SessionEditor;
import com.auraflux.core.error.ChatUnavailableException;
import com.auraflux.core.error.DuplicateInFlightException;
import com.auraflux.core.error.GateDeniedException;
import com.auraflux.core.error.ItemLockedException;
import com.auraflux.core.error.ItemNotFoundException;
import com.auraflux.core.error.LaneSaturatedException;
import com.auraflux.core.error.QuestionLockedException;
import com.auraflux.core.error.SessionNotFoundException;
import com.auraflux.core.error.TaskTypeUnknownException;
import com.auraflux.core.error.VersionConflictException;
import com.auraflux.core.gate.GateDecision;
import com.auraflux.core.model.Author;
import com.auraflux.core.model.ChatEntry;
import com.auraflux.core.model.ItemStatus;
import com.auraflux.core.model.Phase;
import com.auraflux.core.model.SessionSnapshot;
import com.auraflux.core.model.TestSnapshots;
import com.auraflux.core.reconcile.ResultReconciler;
import com.auraflux.core.reconcile.TaskFailure;
import com.auraflux.core.state.SessionStateStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SessionController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class SessionControllerTest {

    private static final String ID = "s-1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private SessionStateStore store;

    @MockitoBean
    private SessionEditor editor;

    @MockitoBean
    private PhaseStateMachine stateMachine;

    @MockitoBean
    private TaskDispatcher dispatcher;

    @MockitoBean
    private ResultReconciler reconciler;

    @MockitoBean
    private ChatService chatService;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    // ── Sessions ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("sessions")
    class SessionTests {

        @Test
        @DisplayName("POST /sessions returns 201 with the new snapshot")
        void create() throws Exception {
            when(editor.createSession("How does heat affect sleep?"))
                    .thenReturn(TestSnapshots.fresh(ID, "How does heat affect sleep?"));

            mockMvc.perform(post("/api/v1/sessions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(new CreateSessionRequest("How does heat affect sleep?"))))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.session_id").value(ID))
                    .andExpect(jsonPath("$.phase").value("INITIATION"))
                    .andExpect(jsonPath("$.version").value(1))
                    .andExpect(jsonPath("$.question.text").value("How does heat affect sleep?"));
        }

        @Test
        @DisplayName("GET /sessions/{id} returns the latest snapshot")
        void getSession() throws Exception {
            when(store.get(ID)).thenReturn(TestSnapshots.readyForExploration(ID, 3));

            mockMvc.perform(get("/api/v1/sessions/{id}", ID))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.keywords", hasSize(3)))
                    .andExpect(jsonPath("$.question.status").value("LOCKED"));
        }

        @Test
        @DisplayName("GET /sessions/{id} for an unknown session returns 404")
        void notFound() throws Exception {
            when(store.get("missing")).thenThrow(new SessionNotFoundException("Session missing not found"));

            mockMvc.perform(get("/api/v1/sessions/{id}", "missing"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                    .andExpect(jsonPath("$.reasons").doesNotExist());
        }

        @Test
        @DisplayName("GET /sessions/{id}/history lists every version")
        void history() throws Exception {
            SessionSnapshot v1 = TestSnapshots.fresh(ID, "q");
            when(store.get(ID)).thenReturn(v1);
            when(store.history(ID)).thenReturn(List.of(v1, v1.committedAs(2, Instant.now())));

            mockMvc.perform(get("/api/v1/sessions/{id}/history", ID))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$", hasSize(2)))
                    .andExpect(jsonPath("$[1].version").value(2));
        }
    }

    // ── Transitions ──────────────────────────────────────────────────

    @Nested
    @DisplayName("transitions")
    class TransitionTests {

        @Test
        @DisplayName("an allowed transition returns the new snapshot")
        void allowed() throws Exception {
            when(stateMachine.requestTransition(ID, Phase.EXPLORATION, 4L))
                    .thenReturn(TestSnapshots.inPhase(ID, Phase.EXPLORATION));

            mockMvc.perform(post("/api/v1/sessions/{id}/transitions", ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(new TransitionRequest(Phase.EXPLORATION, 4L))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.phase").value("EXPLORATION"));
        }

        @Test
        @DisplayName("a denied transition returns 422 with every reason")
        void denied() throws Exception {
            when(stateMachine.requestTransition(ID, Phase.EXPLORATION, 1L)).thenThrow(new GateDeniedException(
                    Phase.INITIATION, Phase.EXPLORATION,
                    List.of("Research question must be locked", "At least 3 keywords are required (currently 0)")));

            mockMvc.perform(post("/api/v1/sessions/{id}/transitions", ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(new TransitionRequest(Phase.EXPLORATION, 1L))))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.code").value("GATE_DENIED"))
                    .andExpect(jsonPath("$.reasons", hasSize(2)))
                    .andExpect(jsonPath("$.reasons[0]").value("Research question must be locked"));
        }

        @Test
        @DisplayName("a stale expected version returns 409")
        void conflict() throws Exception {
            when(stateMachine.requestTransition(ID, Phase.EXPLORATION, 1L))
                    .thenThrow(new VersionConflictException(ID, 1L, 3L));

            mockMvc.perform(post("/api/v1/sessions/{id}/transitions", ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(new TransitionRequest(Phase.EXPLORATION, 1L))))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value("VERSION_CONFLICT"));
        }

        @Test
        @DisplayName("a missing expected version returns 400")
        void missingVersion() throws Exception {
            mockMvc.perform(post("/api/v1/sessions/{id}/transitions", ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"target_phase\": \"EXPLORATION\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
        }

        @Test
        @DisplayName("an unknown phase name returns 400")
        void unknownPhase() throws Exception {
            mockMvc.perform(post("/api/v1/sessions/{id}/transitions", ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"target_phase\": \"DONE\", \"expected_version\": 1}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("GET /gate previews the checklist")
        void preview() throws Exception {
            when(stateMachine.preview(ID, Phase.EXPLORATION)).thenReturn(
                    new GateDecision(Phase.INITIATION, Phase.EXPLORATION, false,
                            List.of("Research question must be locked")));

            mockMvc.perform(get("/api/v1/sessions/{id}/gate", ID).param("target", "EXPLORATION"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.allowed").value(false))
                    .andExpect(jsonPath("$.reasons", hasSize(1)));
        }
    }

    // ── Edits ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("edits")
    class EditTests {

        @Test
        @DisplayName("PUT /question on a locked question returns 409")
        void editLocked() throws Exception {
            when(editor.editQuestion(ID, 2L, "new")).thenThrow(new QuestionLockedException("locked"));

            mockMvc.perform(put("/api/v1/sessions/{id}/question", ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"expected_version\": 2, \"text\": \"new\"}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value("QUESTION_LOCKED"));
        }

        @Test
        @DisplayName("POST /keywords passes the keywords through")
        void keywords() throws Exception {
            when(editor.addKeywords(eq(ID), eq(1L), anyList(), isNull()))
                    .thenReturn(TestSnapshots.readyForExploration(ID, 2));

            mockMvc.perform(post("/api/v1/sessions/{id}/keywords", ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"expected_version\": 1, \"keywords\": [\"heat\", \"sleep\"]}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.keywords[0].text").value("keyword-1"))
                    .andExpect(jsonPath("$.keywords[0].status").value("USER_DRAFT"));

            verify(editor).addKeywords(ID, 1L, List.of("heat", "sleep"), null);
        }

        @Test
        @DisplayName("PUT /keywords/{keyword} passes the new text and status")
        void updateKeyword() throws Exception {
            when(editor.updateKeyword(ID, 3L, "heat", "urban heat", ItemStatus.LOCKED))
                    .thenReturn(TestSnapshots.readyForExploration(ID, 1));

            mockMvc.perform(put("/api/v1/sessions/{id}/keywords/{keyword}", ID, "heat")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"expected_version\": 3, \"text\": \"urban heat\", \"status\": \"LOCKED\"}"))
                    .andExpect(status().isOk());

            verify(editor).updateKeyword(ID, 3L, "heat", "urban heat", ItemStatus.LOCKED);
        }

        @Test
        @DisplayName("editing a locked item returns 409 and a missing one 404")
        void itemErrors() throws Exception {
            when(editor.updateScopeElement(ID, 3L, "Geography", null, "Asia", null))
                    .thenThrow(new ItemLockedException("Scope element 'Geography' is locked"));
            when(editor.updateKeyword(ID, 3L, "noise", null, ItemStatus.ARCHIVED))
                    .thenThrow(new ItemNotFoundException("Keyword 'noise' not found in session s-1"));

            mockMvc.perform(put("/api/v1/sessions/{id}/scope-elements/{name}", ID, "Geography")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"expected_version\": 3, \"description\": \"Asia\"}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value("ITEM_LOCKED"));
            mockMvc.perform(put("/api/v1/sessions/{id}/keywords/{keyword}", ID, "noise")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"expected_version\": 3, \"status\": \"ARCHIVED\"}"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("NOT_FOUND"));
        }

        @Test
        @DisplayName("edits without an expected version return 400")
        void missingVersion() throws Exception {
            mockMvc.perform(post("/api/v1/sessions/{id}/reflections", ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"text\": \"thoughts\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value(containsString("expected_version")));
        }
    }

    // ── Chat ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("chat")
    class ChatTests {

        @Test
        @DisplayName("POST /chat returns 202 with the acceptance of the reply task")
        void sendMessage() throws Exception {
            when(chatService.sendMessage(ID, "Where do I start?", "c-1")).thenReturn(new TaskAcceptance("c-1", ID,
                    "EXPLORER_CHAT", Lane.STREAM, Instant.parse("2026-01-01T00:00:00Z"), false));

            mockMvc.perform(post("/api/v1/sessions/{id}/chat", ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(new ChatMessageRequest("Where do I start?", "c-1"))))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.task_type").value("EXPLORER_CHAT"))
                    .andExpect(jsonPath("$.lane").value("STREAM"));
        }

        @Test
        @DisplayName("POST /chat in a phase without a chat agent returns 409")
        void unavailable() throws Exception {
            when(chatService.sendMessage(eq(ID), eq("hello"), anyString()))
                    .thenThrow(new ChatUnavailableException("No chat agent is available in phase EXPLORATION"));

            mockMvc.perform(post("/api/v1/sessions/{id}/chat", ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"user_message\": \"hello\"}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value("CHAT_UNAVAILABLE"));
        }

        @Test
        @DisplayName("GET /chat/history returns the conversation in order")
        void history() throws Exception {
            Instant at = Instant.parse("2026-01-01T00:00:00Z");
            when(chatService.history(ID)).thenReturn(List.of(
                    new ChatEntry(1, Author.USER, "user", "Where do I start?", at),
                    new ChatEntry(2, Author.AGENT, "EXPLORER_CHAT", "With your question.", at)));

            mockMvc.perform(get("/api/v1/sessions/{id}/chat/history", ID))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$", hasSize(2)))
                    .andExpect(jsonPath("$[0].sequence_number").value(1))
                    .andExpect(jsonPath("$[1].author").value("AGENT"));
        }
    }

    // ── Tasks ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("tasks")
    class TaskTests {

        private TaskAcceptance acceptance(boolean replayed) {
            return new TaskAcceptance("k-1", ID, "KEYWORD_EXTRACTION", Lane.DEFAULT,
                    Instant.parse("2026-01-01T00:00:00Z"), replayed);
        }

        @Test
        @DisplayName("POST /tasks returns 202 with the acceptance")
        void submit() throws Exception {
            when(dispatcher.submit(any(AgentTaskRequest.class))).thenReturn(acceptance(false));

            mockMvc.perform(post("/api/v1/sessions/{id}/tasks", ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(new TaskSubmissionRequest("keyword-extraction",
                                    Map.of("question", "heat"), "k-1", null))))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.idempotency_key").value("k-1"))
                    .andExpect(jsonPath("$.task_type").value("KEYWORD_EXTRACTION"))
                    .andExpect(jsonPath("$.replayed").value(false));

            ArgumentCaptor<AgentTaskRequest> captor = ArgumentCaptor.forClass(AgentTaskRequest.class);
            verify(dispatcher).submit(captor.capture());
            assertEquals(ID, captor.getValue().sessionId());
            assertEquals("heat", captor.getValue().payload().get("question"));
        }

        @Test
        @DisplayName("a key is generated when the client sends none")
        void generatedKey() throws Exception {
            when(dispatcher.submit(any(AgentTaskRequest.class))).thenReturn(acceptance(false));

            mockMvc.perform(post("/api/v1/sessions/{id}/tasks", ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"task_type\": \"keyword-extraction\", \"payload\": {\"q\": \"x\"}}"))
                    .andExpect(status().isAccepted());

            ArgumentCaptor<AgentTaskRequest> captor = ArgumentCaptor.forClass(AgentTaskRequest.class);
            verify(dispatcher).submit(captor.capture());
            assertFalse(captor.getValue().idempotencyKey().isBlank());
        }

        @Test
        @DisplayName("a duplicate in-flight task returns 409")
        void duplicate() throws Exception {
            when(dispatcher.submit(any(AgentTaskRequest.class)))
                    .thenThrow(new DuplicateInFlightException("already running"));

            mockMvc.perform(post("/api/v1/sessions/{id}/tasks", ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"task_type\": \"keyword-extraction\", \"payload\": {\"q\": \"x\"}}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value("DUPLICATE_IN_FLIGHT"));
        }

        @Test
        @DisplayName("an unknown task type returns 400")
        void unknownType() throws Exception {
            when(dispatcher.submit(any(AgentTaskRequest.class)))
                    .thenThrow(new TaskTypeUnknownException("No agent role configured"));

            mockMvc.perform(post("/api/v1/sessions/{id}/tasks", ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"task_type\": \"mystery\", \"payload\": {\"q\": \"x\"}}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("TASK_TYPE_UNKNOWN"));
        }

        @Test
        @DisplayName("a saturated lane returns 503")
        void saturated() throws Exception {
            when(dispatcher.submit(any(AgentTaskRequest.class)))
                    .thenThrow(new LaneSaturatedException("Lane DEFAULT is saturated; retry later"));

            mockMvc.perform(post("/api/v1/sessions/{id}/tasks", ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"task_type\": \"keyword-extraction\", \"payload\": {\"q\": \"x\"}}"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.code").value("LANE_SATURATED"));
        }

        @Test
        @DisplayName("a missing task type returns 400")
        void missingType() throws Exception {
            mockMvc.perform(post("/api/v1/sessions/{id}/tasks", ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"payload\": {\"q\": \"x\"}}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("DELETE /tasks/{key} returns 204 or 404")
        void cancel() throws Exception {
            when(dispatcher.cancel(ID, "k-1")).thenReturn(true);

            mockMvc.perform(delete("/api/v1/sessions/{id}/tasks/{key}", ID, "k-1"))
                    .andExpect(status().isNoContent());
            mockMvc.perform(delete("/api/v1/sessions/{id}/tasks/{key}", ID, "k-2"))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("GET /task-failures lists recorded failures")
        void failures() throws Exception {
            when(store.get(ID)).thenReturn(TestSnapshots.fresh(ID, "q"));
            when(reconciler.failuresFor(ID)).thenReturn(List.of(new TaskFailure("k-1", "FEASIBILITY_SCORING",
                    "STALE", "Research question changed", 1, Instant.parse("2026-01-01T00:00:00Z"))));

            mockMvc.perform(get("/api/v1/sessions/{id}/task-failures", ID))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].reason").value("STALE"))
                    .andExpect(jsonPath("$[0].task_type").value("FEASIBILITY_SCORING"));
        }
    }

    @Test
    @DisplayName("GET /events opens an SSE stream")
    void events() throws Exception {
        when(sseStreamingService.createEmitter(ID)).thenReturn(new SseEmitter(60_000L));

        mockMvc.perform(get("/api/v1/sessions/{id}/events", ID).accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(request().asyncStarted());
    }
}
