package com.auraflux.dispatch.api;

import com.auraflux.core.delivery.Channel;
import com.auraflux.core.delivery.DeliveryChannelRouter;
import com.auraflux.core.delivery.DeliveryProperties;
import com.auraflux.core.delivery.PushMessage;
import com.auraflux.core.state.SessionStateStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link DeliveryChannelRouter} subscriptions to {@link SseEmitter} instances.
 * <p>
 * Each connection becomes one router subscriber. State messages are sent as {@code state} events
 * (or {@code resync} after a state buffer overflow), task chunks and status notices as
 * {@code stream} events. The current snapshot is sent right after connecting so the client never
 * starts from an empty view. Heartbeat comments keep idle connections open through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    static final String STATE_EVENT = "state";
    static final String STREAM_EVENT = "stream";

    private final DeliveryChannelRouter router;
    private final SessionStateStore store;
    private final long timeoutMs;
    private final long heartbeatIntervalSeconds;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(DeliveryChannelRouter router, SessionStateStore store, DeliveryProperties properties) {
        this(router, store, properties.getEmitterTimeoutMs(), properties.getHeartbeatIntervalSeconds());
    }

    SseStreamingService(DeliveryChannelRouter router, SessionStateStore store, long timeoutMs,
                        long heartbeatIntervalSeconds) {
        this.router = router;
        this.store = store;
        this.timeoutMs = timeoutMs;
        this.heartbeatIntervalSeconds = Math.max(1, heartbeatIntervalSeconds);
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                heartbeatIntervalSeconds, heartbeatIntervalSeconds, TimeUnit.SECONDS);
        log.info("SSE heartbeat scheduler started (interval={}s)", heartbeatIntervalSeconds);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    /**
     * Creates an emitter streaming the given session's channels.
     *
     * @throws com.auraflux.core.error.SessionNotFoundException if the session does not exist
     */
    public SseEmitter createEmitter(String sessionId) {
        store.get(sessionId);
        SseEmitter emitter = new SseEmitter(timeoutMs);

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send connect comment for session {}: {}", sessionId, e.getMessage());
        }

        DeliveryChannelRouter.Subscription subscription = router.subscribe(sessionId, message -> send(emitter, message));
        var registration = new EmitterRegistration(sessionId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for session {}", sessionId);
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for session {}", sessionId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for session {}: {}", sessionId, ex.getMessage());
            cleanup(registration);
        });

        // Read after subscribing: a commit racing the connect is then either in this snapshot or
        // pushed to the subscription, and the router drops the older of the two.
        router.sendSnapshot(subscription, store.get(sessionId));
        log.info("SSE emitter created for session {} (timeout={}ms)", sessionId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Heartbeat failed for session {}; closing subscription: {}",
                        registration.sessionId, e.getMessage());
                cleanup(registration);
            }
        }
    }

    /**
     * Sends one router message. Failures propagate so the router detaches the subscriber.
     */
    static void send(SseEmitter emitter, PushMessage message) throws IOException {
        SseEmitter.SseEventBuilder event = SseEmitter.event()
                .name(eventName(message))
                .data(eventData(message));
        if (message.channel() == Channel.STATE && message.version() != null) {
            event.id(String.valueOf(message.version()));
        }
        emitter.send(event);
    }

    static String eventName(PushMessage message) {
        if (message.isResync()) {
            return PushMessage.RESYNC;
        }
        return message.channel() == Channel.STATE ? STATE_EVENT : STREAM_EVENT;
    }

    static Map<String, Object> eventData(PushMessage message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("session_id", message.sessionId());
        data.put("event", message.eventType());
        if (message.version() != null) {
            data.put("version", message.version());
        }
        if (message.taskType() != null) {
            data.put("task_type", message.taskType());
        }
        if (message.idempotencyKey() != null) {
            data.put("idempotency_key", message.idempotencyKey());
        }
        data.putAll(message.payload());
        data.put("timestamp", message.timestamp().toString());
        return data;
    }

    private void cleanup(EmitterRegistration registration) {
        if (activeRegistrations.remove(registration)) {
            registration.subscription.unsubscribe();
            log.debug("Cleaned up SSE registration for session {}", registration.sessionId);
        }
    }

    private record EmitterRegistration(
            String sessionId,
            SseEmitter emitter,
            DeliveryChannelRouter.Subscription subscription
    ) {}
}
