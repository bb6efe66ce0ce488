package com.auraflux.core.dispatch;

import com.auraflux.core.agent.AgentRoleConfig;
import com.auraflux.core.agent.ResultKind;
import com.auraflux.core.model.ChatEntry;
import com.auraflux.core.model.SessionSnapshot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Session context handed to agents next to the caller's payload: the research question and the
 * locked keywords and scope elements, plus the tail of the conversation for chat roles. Keys the
 * caller set explicitly win.
 */
final class TaskContext {

    /** Most recent chat messages passed to a chat agent. */
    static final int CHAT_WINDOW = 20;

    private TaskContext() {}

    static Map<String, Object> enrich(SessionSnapshot snapshot, AgentRoleConfig role, Map<String, Object> payload) {
        var enriched = new LinkedHashMap<String, Object>();
        enriched.put("research_question", snapshot.question().text());
        enriched.put("locked_keywords", snapshot.lockedKeywords());
        enriched.put("locked_scope_elements", snapshot.lockedScopeElements().stream()
                .map(e -> Map.of("name", e.name(), "description", e.description()))
                .toList());
        if (role.resultKind() == ResultKind.CHAT_REPLY) {
            List<ChatEntry> history = snapshot.chatHistory();
            enriched.put("chat_history", history.subList(Math.max(0, history.size() - CHAT_WINDOW), history.size())
                    .stream()
                    .map(TaskContext::chatLine)
                    .toList());
        }
        enriched.putAll(payload);
        return enriched;
    }

    private static Map<String, Object> chatLine(ChatEntry entry) {
        var line = new LinkedHashMap<String, Object>();
        line.put("sequence_number", entry.sequenceNumber());
        line.put("role", entry.author().name().toLowerCase(Locale.ROOT));
        line.put("name", entry.name() == null ? "" : entry.name());
        line.put("content", entry.content() == null ? "" : entry.content());
        return line;
    }
}
