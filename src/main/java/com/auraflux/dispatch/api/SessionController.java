package com.auraflux.dispatch.api;

import com.auraflux.core.dispatch.AgentTaskRequest;
import com.auraflux.core.dispatch.TaskAcceptance;
import com.auraflux.core.dispatch.TaskDispatcher;
import com.auraflux.core.engine.ChatService;
import com.auraflux.core.engine.PhaseStateMachine;
import com.auraflux.core.engine.SessionEditor;
import com.auraflux.core.gate.GateDecision;
import com.auraflux.core.model.ChatEntry;
import com.auraflux.core.model.Phase;
import com.auraflux.core.model.SessionSnapshot;
import com.auraflux.core.reconcile.ResultReconciler;
import com.auraflux.core.reconcile.TaskFailure;
import com.auraflux.core.state.SessionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for research sessions: reads, user edits, phase transitions, agent tasks and
 * the event stream.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final SessionStateStore store;
    private final SessionEditor editor;
    private final PhaseStateMachine stateMachine;
    private final TaskDispatcher dispatcher;
    private final ResultReconciler reconciler;
    private final ChatService chatService;
    private final SseStreamingService sseStreamingService;

    public SessionController(SessionStateStore store, SessionEditor editor, PhaseStateMachine stateMachine,
                             TaskDispatcher dispatcher, ResultReconciler reconciler, ChatService chatService,
                             SseStreamingService sseStreamingService) {
        this.store = store;
        this.editor = editor;
        this.stateMachine = stateMachine;
        this.dispatcher = dispatcher;
        this.reconciler = reconciler;
        this.chatService = chatService;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/sessions: Start a session in INITIATION.
     */
    @PostMapping
    public ResponseEntity<SessionSnapshot> createSession(@RequestBody(required = false) CreateSessionRequest request) {
        SessionSnapshot created = editor.createSession(request != null ? request.question() : null);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{id}")
    public SessionSnapshot getSession(@PathVariable String id) {
        return store.get(id);
    }

    /**
     * GET /api/v1/sessions/{id}/history: Every committed version, oldest first.
     */
    @GetMapping("/{id}/history")
    public List<SessionSnapshot> getHistory(@PathVariable String id) {
        store.get(id);
        return store.history(id);
    }

    // ── Phase transitions ────────────────────────────────────────────────

    @PostMapping("/{id}/transitions")
    public SessionSnapshot requestTransition(@PathVariable String id, @RequestBody TransitionRequest request) {
        if (request.targetPhase() == null || request.expectedVersion() == null) {
            throw new IllegalArgumentException("target_phase and expected_version are required");
        }
        return stateMachine.requestTransition(id, request.targetPhase(), request.expectedVersion());
    }

    /**
     * GET /api/v1/sessions/{id}/gate?target=EXPLORATION: Readiness checklist without transitioning.
     */
    @GetMapping("/{id}/gate")
    public GateDecision previewGate(@PathVariable String id, @RequestParam Phase target) {
        return stateMachine.preview(id, target);
    }

    // ── User edits ───────────────────────────────────────────────────────

    @PutMapping("/{id}/question")
    public SessionSnapshot editQuestion(@PathVariable String id, @RequestBody SessionEditRequest request) {
        return editor.editQuestion(id, request.requiredVersion(), request.text());
    }

    @PostMapping("/{id}/question/lock")
    public SessionSnapshot lockQuestion(@PathVariable String id, @RequestBody SessionEditRequest request) {
        return editor.lockQuestion(id, request.requiredVersion());
    }

    @PostMapping("/{id}/question/unlock")
    public SessionSnapshot unlockQuestion(@PathVariable String id, @RequestBody SessionEditRequest request) {
        return editor.unlockQuestion(id, request.requiredVersion());
    }

    @PostMapping("/{id}/keywords")
    public SessionSnapshot addKeywords(@PathVariable String id, @RequestBody SessionEditRequest request) {
        return editor.addKeywords(id, request.requiredVersion(),
                request.keywords() != null ? request.keywords() : List.of(), request.status());
    }

    /**
     * PUT /api/v1/sessions/{id}/keywords/{keyword}: Rename a keyword ({@code text}) and/or set its status.
     */
    @PutMapping("/{id}/keywords/{keyword}")
    public SessionSnapshot updateKeyword(@PathVariable String id, @PathVariable String keyword,
                                         @RequestBody SessionEditRequest request) {
        return editor.updateKeyword(id, request.requiredVersion(), keyword, request.text(), request.status());
    }

    @PostMapping("/{id}/scope-elements")
    public SessionSnapshot addScopeElements(@PathVariable String id, @RequestBody SessionEditRequest request) {
        return editor.addScopeElements(id, request.requiredVersion(),
                request.scopeElements() != null ? request.scopeElements() : List.of());
    }

    @PutMapping("/{id}/scope-elements/{name}")
    public SessionSnapshot updateScopeElement(@PathVariable String id, @PathVariable String name,
                                              @RequestBody SessionEditRequest request) {
        return editor.updateScopeElement(id, request.requiredVersion(), name, request.name(),
                request.description(), request.status());
    }

    @PostMapping("/{id}/reflections")
    public SessionSnapshot addReflection(@PathVariable String id, @RequestBody SessionEditRequest request) {
        return editor.addReflection(id, request.requiredVersion(), request.text());
    }

    // ── Agent tasks ──────────────────────────────────────────────────────

    /**
     * POST /api/v1/sessions/{id}/tasks: Queue an agent task. Returns 202 before generation starts.
     */
    @PostMapping("/{id}/tasks")
    public ResponseEntity<TaskAcceptance> submitTask(@PathVariable String id,
                                                     @RequestBody TaskSubmissionRequest request) {
        if (request.taskType() == null || request.taskType().isBlank()) {
            throw new IllegalArgumentException("task_type is required");
        }
        String key = request.idempotencyKey() != null && !request.idempotencyKey().isBlank()
                ? request.idempotencyKey()
                : UUID.randomUUID().toString();
        TaskAcceptance acceptance = dispatcher.submit(
                new AgentTaskRequest(request.taskType(), id, key, request.payload(), request.lane()));
        return ResponseEntity.accepted().body(acceptance);
    }

    @DeleteMapping("/{id}/tasks/{key}")
    public ResponseEntity<Void> cancelTask(@PathVariable String id, @PathVariable String key) {
        if (!dispatcher.cancel(id, key)) {
            log.debug("Cancel of {} for session {} found no in-flight task", key, id);
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/task-failures")
    public List<TaskFailure> getTaskFailures(@PathVariable String id) {
        store.get(id);
        return reconciler.failuresFor(id);
    }

    // ── Chat ─────────────────────────────────────────────────────────────

    /**
     * POST /api/v1/sessions/{id}/chat: Record a user message and queue the chat agent's reply,
     * which streams on the session's event stream.
     */
    @PostMapping("/{id}/chat")
    public ResponseEntity<TaskAcceptance> sendChatMessage(@PathVariable String id,
                                                          @RequestBody ChatMessageRequest request) {
        String key = request.idempotencyKey() != null && !request.idempotencyKey().isBlank()
                ? request.idempotencyKey()
                : UUID.randomUUID().toString();
        return ResponseEntity.accepted().body(chatService.sendMessage(id, request.message(), key));
    }

    @GetMapping("/{id}/chat/history")
    public List<ChatEntry> getChatHistory(@PathVariable String id) {
        return chatService.history(id);
    }

    // ── Event stream ─────────────────────────────────────────────────────

    /**
     * GET /api/v1/sessions/{id}/events: SSE stream of state snapshots and task output.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable String id) {
        return sseStreamingService.createEmitter(id);
    }
}
