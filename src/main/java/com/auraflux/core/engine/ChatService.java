package com.auraflux.core.engine;

import com.auraflux.core.dispatch.AgentTaskRequest;
import com.auraflux.core.dispatch.TaskAcceptance;
import com.auraflux.core.dispatch.TaskDispatcher;
import com.auraflux.core.error.ChatUnavailableException;
import com.auraflux.core.error.SessionClosedException;
import com.auraflux.core.model.Author;
import com.auraflux.core.model.ChatEntry;
import com.auraflux.core.model.SessionSnapshot;
import com.auraflux.core.state.SessionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Conversation between the user and the chat agent of the session's current phase.
 * <p>
 * A user message is appended to the chat history and then answered by a streaming agent task.
 * The agent's reply reaches the history when its result is reconciled; tokens reach subscribers
 * on the stream channel as they are generated.
 */
@Service
public class ChatService {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);

    static final String USER_NAME = "user";

    private final SessionStateStore store;
    private final TaskDispatcher dispatcher;
    private final ChatProperties properties;

    public ChatService(SessionStateStore store, TaskDispatcher dispatcher, ChatProperties properties) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.properties = properties;
    }

    /**
     * Records the user's message and queues the chat agent's reply.
     * <p>
     * A key that was already submitted is replayed without appending the message again. If the
     * reply cannot be queued the message stays in the history.
     *
     * @throws ChatUnavailableException if the current phase has no chat agent
     * @throws SessionClosedException   if the session is closed
     */
    public TaskAcceptance sendMessage(String sessionId, String message, String idempotencyKey) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("user_message must not be blank");
        }
        SessionSnapshot snapshot = store.get(sessionId);
        if (snapshot.isClosed()) {
            throw new SessionClosedException("Session " + sessionId + " is closed");
        }
        String taskType = chatAgentFor(snapshot);
        var request = new AgentTaskRequest(taskType, sessionId, idempotencyKey,
                Map.of("user_message", message.trim()), null);

        if (dispatcher.hasSeen(idempotencyKey)) {
            log.debug("Chat message {} for session {} was already recorded", idempotencyKey, sessionId);
            return dispatcher.submit(request);
        }
        SessionSnapshot committed = store.update(sessionId, "chat.user_message", s -> {
            if (s.isClosed()) {
                throw new SessionClosedException("Session " + sessionId + " is closed");
            }
            return s.withChatEntry(Author.USER, USER_NAME, message.trim(), Instant.now());
        });
        log.info("Session {} chat message {} recorded (version {})", sessionId,
                committed.chatHistory().size(), committed.version());
        return dispatcher.submit(request);
    }

    public List<ChatEntry> history(String sessionId) {
        return store.get(sessionId).chatHistory();
    }

    private String chatAgentFor(SessionSnapshot snapshot) {
        String taskType = properties.getAgents().get(snapshot.phase());
        if (taskType == null || taskType.isBlank()) {
            throw new ChatUnavailableException("No chat agent is available in phase " + snapshot.phase());
        }
        return taskType;
    }
}
