package com.auraflux.core.delivery;

import com.auraflux.core.model.SessionSnapshot;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A message pushed to session subscribers.
 *
 * @param channel        STATE or STREAM
 * @param eventType      e.g. "phase.transitioned", "resync", "task.chunk", "task.status"
 * @param sessionId      the session this message belongs to
 * @param version        session version for state messages (nullable for stream messages)
 * @param taskType       task type for stream messages (nullable for state messages)
 * @param idempotencyKey task key for stream messages (nullable for state messages)
 * @param payload        message body
 * @param timestamp      when the message was created
 */
public record PushMessage(
    Channel channel,
    String eventType,
    String sessionId,
    Long version,
    String taskType,
    String idempotencyKey,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String RESYNC = "resync";
    public static final String TASK_STATUS = "task.status";
    public static final String TASK_CHUNK = "task.chunk";

    public static PushMessage state(SessionSnapshot snapshot, String cause) {
        return new PushMessage(Channel.STATE, cause, snapshot.sessionId(), snapshot.version(),
                null, null, Map.of("snapshot", snapshot), Instant.now());
    }

    public static PushMessage resync(String sessionId, long latestVersion) {
        return new PushMessage(Channel.STATE, RESYNC, sessionId, latestVersion,
                null, null, Map.of("reason", "state buffer overflow; re-fetch the session"), Instant.now());
    }

    public static PushMessage stream(String sessionId, String taskType, String idempotencyKey,
                                     String eventType, Map<String, Object> payload) {
        return new PushMessage(Channel.STREAM, eventType, sessionId, null,
                taskType, idempotencyKey, payload, Instant.now());
    }

    public boolean isResync() {
        return RESYNC.equals(eventType);
    }
}
