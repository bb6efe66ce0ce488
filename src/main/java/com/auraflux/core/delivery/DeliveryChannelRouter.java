package com.auraflux.core.delivery;

import com.auraflux.core.metrics.AurafluxMetrics;
import com.auraflux.core.model.SessionSnapshot;
import com.auraflux.core.state.SessionCommitListener;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Routes pushed messages to the live subscribers of each session.
 * <p>
 * Every subscriber owns two independent bounded buffers, one per {@link Channel}, drained by a
 * shared delivery pool so a slow connection never blocks a publisher. Overflow policy differs per
 * channel: the stream buffer drops its oldest message, while the state buffer is discarded and
 * replaced by a single resync signal telling the client to re-fetch the authoritative snapshot.
 * <p>
 * State messages are published from {@link #onCommit} while the store still holds the session's
 * write lock, so each subscriber receives them in version order.
 */
@Service
public class DeliveryChannelRouter implements SessionCommitListener {

    private static final Logger log = LoggerFactory.getLogger(DeliveryChannelRouter.class);

    private final int streamBufferSize;
    private final int stateBufferSize;
    private final Executor deliveryExecutor;
    private final ExecutorService ownedExecutor;
    private final AurafluxMetrics metrics;

    /** Live subscribers keyed by sessionId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Subscriber>> subscribers = new ConcurrentHashMap<>();

    @Autowired
    public DeliveryChannelRouter(DeliveryProperties properties, AurafluxMetrics metrics) {
        this(properties, metrics, newDeliveryPool(properties.getDeliveryThreads()));
    }

    DeliveryChannelRouter(DeliveryProperties properties, AurafluxMetrics metrics, Executor deliveryExecutor) {
        this.streamBufferSize = Math.max(1, properties.getStreamBufferSize());
        this.stateBufferSize = Math.max(1, properties.getStateBufferSize());
        this.metrics = metrics;
        this.deliveryExecutor = deliveryExecutor;
        this.ownedExecutor = deliveryExecutor instanceof ExecutorService es ? es : null;
    }

    private static ExecutorService newDeliveryPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "delivery-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Registers a subscriber for a session's state and stream channels.
     *
     * @return a handle used to detach the subscriber
     */
    public Subscription subscribe(String sessionId, SubscriberSink sink) {
        var subscriber = new Subscriber(sessionId, sink);
        subscribers.compute(sessionId, (k, subs) -> {
            var list = subs != null ? subs : new CopyOnWriteArrayList<Subscriber>();
            list.add(subscriber);
            return list;
        });
        log.debug("Subscriber {} attached to session {}", subscriber.id, sessionId);
        return subscriber;
    }

    /**
     * Pushes a message on the channel it declares. Sessions without subscribers drop it.
     */
    public void publish(String sessionId, PushMessage message) {
        List<Subscriber> subs = subscribers.get(sessionId);
        if (subs == null || subs.isEmpty()) {
            log.debug("No subscribers for session {}; dropping {} message {}", sessionId,
                    message.channel(), message.eventType());
            return;
        }
        for (Subscriber subscriber : subs) {
            subscriber.offer(message);
        }
    }

    public void publishStream(String sessionId, String taskType, String idempotencyKey,
                              String eventType, Map<String, Object> payload) {
        publish(sessionId, PushMessage.stream(sessionId, taskType, idempotencyKey, eventType, payload));
    }

    @Override
    public void onCommit(SessionSnapshot snapshot, String cause) {
        publish(snapshot.sessionId(), PushMessage.state(snapshot, cause));
    }

    /**
     * Sends an initial snapshot to one subscriber only, e.g. right after it connects.
     */
    public void sendSnapshot(Subscription subscription, SessionSnapshot snapshot) {
        if (subscription instanceof Subscriber subscriber) {
            subscriber.offer(PushMessage.state(snapshot, "session.snapshot"));
        }
    }

    public int subscriberCount(String sessionId) {
        List<Subscriber> subs = subscribers.get(sessionId);
        return subs == null ? 0 : subs.size();
    }

    private void detach(Subscriber subscriber) {
        subscribers.computeIfPresent(subscriber.sessionId, (k, subs) -> {
            subs.remove(subscriber);
            return subs.isEmpty() ? null : subs;
        });
    }

    /**
     * Handle for a registered subscriber.
     */
    public interface Subscription {

        String id();

        String sessionId();

        boolean isOpen();

        void unsubscribe();
    }

    private final class Subscriber implements Subscription {

        private final String id = UUID.randomUUID().toString();
        private final String sessionId;
        private final SubscriberSink sink;

        private final Deque<PushMessage> streamBuffer = new ArrayDeque<>();
        private final Deque<PushMessage> stateBuffer = new ArrayDeque<>();
        private final AtomicBoolean draining = new AtomicBoolean(false);
        private volatile boolean open = true;

        /** Highest state version accepted into the buffer, guarded by this. */
        private long lastStateVersion = Long.MIN_VALUE;

        private Subscriber(String sessionId, SubscriberSink sink) {
            this.sessionId = sessionId;
            this.sink = sink;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public String sessionId() {
            return sessionId;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void unsubscribe() {
            if (!open) {
                return;
            }
            open = false;
            synchronized (this) {
                streamBuffer.clear();
                stateBuffer.clear();
            }
            detach(this);
            log.debug("Subscriber {} detached from session {}", id, sessionId);
        }

        void offer(PushMessage message) {
            if (!open) {
                return;
            }
            synchronized (this) {
                if (message.channel() == Channel.STREAM) {
                    offerStream(message);
                } else if (!offerState(message)) {
                    return;
                }
            }
            scheduleDrain();
        }

        private void offerStream(PushMessage message) {
            if (streamBuffer.size() >= streamBufferSize) {
                PushMessage dropped = streamBuffer.pollFirst();
                metrics.recordStreamMessageDropped();
                log.debug("Stream buffer full for subscriber {}; dropped {} of task {}",
                        id, dropped.eventType(), dropped.idempotencyKey());
            }
            streamBuffer.addLast(message);
        }

        private boolean offerState(PushMessage message) {
            long version = message.version() != null ? message.version() : lastStateVersion;
            if (version <= lastStateVersion && !message.isResync()) {
                log.debug("Subscriber {} already has version {}; skipping version {}", id, lastStateVersion, version);
                return false;
            }
            lastStateVersion = Math.max(lastStateVersion, version);
            if (stateBuffer.size() >= stateBufferSize) {
                stateBuffer.clear();
                stateBuffer.addLast(PushMessage.resync(sessionId, version));
                metrics.recordResync();
                log.warn("State buffer overflow for subscriber {} on session {}; issuing resync at version {}",
                        id, sessionId, version);
                return true;
            }
            stateBuffer.addLast(message);
            return true;
        }

        private synchronized PushMessage next() {
            PushMessage state = stateBuffer.pollFirst();
            return state != null ? state : streamBuffer.pollFirst();
        }

        private synchronized boolean hasPending() {
            return !stateBuffer.isEmpty() || !streamBuffer.isEmpty();
        }

        private void scheduleDrain() {
            if (open && draining.compareAndSet(false, true)) {
                deliveryExecutor.execute(this::drain);
            }
        }

        private void drain() {
            try {
                PushMessage message;
                while (open && (message = next()) != null) {
                    try {
                        sink.deliver(message);
                    } catch (IOException | IllegalStateException e) {
                        log.debug("Delivery to subscriber {} failed ({}); disconnecting", id, e.getMessage());
                        unsubscribe();
                        return;
                    }
                }
            } finally {
                draining.set(false);
                if (open && hasPending()) {
                    scheduleDrain();
                }
            }
        }
    }
}
