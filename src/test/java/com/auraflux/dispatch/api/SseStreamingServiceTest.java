package com.auraflux.dispatch.api;

import com.auraflux.core.delivery.DeliveryChannelRouter;
import com.auraflux.core.delivery.PushMessage;
import com.auraflux.core.delivery.SubscriberSink;
import com.auraflux.core.error.SessionNotFoundException;
import com.auraflux.core.model.SessionSnapshot;
import com.auraflux.core.state.InMemorySessionRepository;
import com.auraflux.core.state.SessionStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link SseStreamingService}.
 */
class SseStreamingServiceTest {

    private DeliveryChannelRouter router;
    private DeliveryChannelRouter.Subscription subscription;
    private SessionStateStore store;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        router = mock(DeliveryChannelRouter.class);
        subscription = mock(DeliveryChannelRouter.Subscription.class);
        when(router.subscribe(anyString(), any())).thenReturn(subscription);
        store = new SessionStateStore(new InMemorySessionRepository(), List.of(), 5);
        service = new SseStreamingService(router, store, 60_000L, 15L);
    }

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitterTests {

        @Test
        @DisplayName("subscribes to the session and sends its current snapshot")
        void subscribesAndSendsSnapshot() {
            SessionSnapshot session = store.create("q");

            SseEmitter emitter = service.createEmitter(session.sessionId());

            assertNotNull(emitter);
            verify(router).subscribe(eq(session.sessionId()), any());
            verify(router).sendSnapshot(subscription, session);
            assertEquals(1, service.activeEmitterCount());
        }

        @Test
        @DisplayName("a commit that lands while subscribing is part of the connect snapshot")
        void commitDuringSubscribe() {
            SessionSnapshot session = store.create("q");
            when(router.subscribe(anyString(), any())).thenAnswer(invocation -> {
                store.update(session.sessionId(), "user.edit", s -> s.withKeywordsAdded(List.of("heat")));
                return subscription;
            });

            service.createEmitter(session.sessionId());

            var sent = ArgumentCaptor.forClass(SessionSnapshot.class);
            verify(router).sendSnapshot(eq(subscription), sent.capture());
            assertEquals(2, sent.getValue().version());
            assertTrue(sent.getValue().hasKeyword("heat"));
        }

        @Test
        @DisplayName("each connection gets its own emitter")
        void emitterPerConnection() {
            SessionSnapshot session = store.create("q");

            assertNotSame(service.createEmitter(session.sessionId()), service.createEmitter(session.sessionId()));
            assertEquals(2, service.activeEmitterCount());
        }

        @Test
        @DisplayName("an unknown session is rejected before subscribing")
        void unknownSession() {
            assertThrows(SessionNotFoundException.class, () -> service.createEmitter("missing"));
            verify(router, never()).subscribe(anyString(), any());
            assertEquals(0, service.activeEmitterCount());
        }

        @Test
        @DisplayName("the subscriber sink forwards messages to the emitter")
        void sinkForwards() throws Exception {
            SessionSnapshot session = store.create("q");
            service.createEmitter(session.sessionId());
            ArgumentCaptor<SubscriberSink> sink = ArgumentCaptor.forClass(SubscriberSink.class);
            verify(router).subscribe(eq(session.sessionId()), sink.capture());

            assertDoesNotThrow(() -> sink.getValue().deliver(PushMessage.state(session, "session.snapshot")));
        }
    }

    @Nested
    @DisplayName("event mapping")
    class EventMappingTests {

        @Test
        @DisplayName("state, resync and stream messages map to distinct event names")
        void eventNames() {
            SessionSnapshot session = store.create("q");

            assertEquals("state", SseStreamingService.eventName(PushMessage.state(session, "question.edited")));
            assertEquals("resync", SseStreamingService.eventName(PushMessage.resync(session.sessionId(), 4)));
            assertEquals("stream", SseStreamingService.eventName(PushMessage.stream(session.sessionId(),
                    "REFLECTION_PROMPT", "k-1", PushMessage.TASK_CHUNK, Map.of("seq", 1L, "chunk", "Hi"))));
        }

        @Test
        @DisplayName("state data carries the version and the snapshot")
        void stateData() {
            SessionSnapshot session = store.create("q");

            Map<String, Object> data = SseStreamingService.eventData(PushMessage.state(session, "session.created"));

            assertEquals(session.sessionId(), data.get("session_id"));
            assertEquals("session.created", data.get("event"));
            assertEquals(1L, data.get("version"));
            assertEquals(session, data.get("snapshot"));
            assertFalse(data.containsKey("task_type"));
        }

        @Test
        @DisplayName("stream data carries the task identity and the payload")
        void streamData() {
            Map<String, Object> data = SseStreamingService.eventData(PushMessage.stream("s-1",
                    "REFLECTION_PROMPT", "k-1", PushMessage.TASK_CHUNK, Map.of("seq", 3L, "chunk", "sleep")));

            assertEquals("REFLECTION_PROMPT", data.get("task_type"));
            assertEquals("k-1", data.get("idempotency_key"));
            assertEquals(3L, data.get("seq"));
            assertEquals("sleep", data.get("chunk"));
            assertFalse(data.containsKey("version"));
            assertNotNull(data.get("timestamp"));
        }
    }
}
