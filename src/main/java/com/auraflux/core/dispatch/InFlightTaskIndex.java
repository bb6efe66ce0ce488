package com.auraflux.core.dispatch;

import com.auraflux.core.agent.AgentRoleConfig;
import com.auraflux.core.error.DuplicateInFlightException;
import com.auraflux.core.model.SessionSnapshot;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Future;

/**
 * Idempotency table shared by the dispatcher and the reconciler.
 * <p>
 * Holds one entry per in-flight key and enforces at most one in-flight task per
 * (session, task type). Keys whose results were reconciled keep their acceptance for a TTL so
 * resubmissions replay it; cancelled keys are remembered for a TTL so late results are discarded.
 * All check-and-set operations are atomic.
 */
@Component
public class InFlightTaskIndex {

    private final Duration completedTtl;
    private final Duration cancelledTtl;
    private final Clock clock;

    private final Map<String, Entry> byKey = new HashMap<>();
    private final Map<String, String> bySlot = new HashMap<>();
    private final Map<String, Expiring<TaskAcceptance>> completed = new LinkedHashMap<>();
    private final Map<String, Expiring<TaskAcceptance>> cancelled = new LinkedHashMap<>();

    @Autowired
    public InFlightTaskIndex(DispatcherProperties properties) {
        this(Duration.ofSeconds(properties.getCompletedKeyTtlSeconds()),
                Duration.ofSeconds(properties.getCancelledKeyTtlSeconds()), Clock.systemUTC());
    }

    InFlightTaskIndex(Duration completedTtl, Duration cancelledTtl, Clock clock) {
        this.completedTtl = completedTtl;
        this.cancelledTtl = cancelledTtl;
        this.clock = clock;
    }

    /**
     * Registers {@code request} as in flight, or returns the replayable acceptance of an earlier
     * submission with the same key.
     *
     * @param request    request with its lane resolved
     * @param role       the task type's role
     * @param dispatchedAgainst session snapshot the task is dispatched against
     * @throws DuplicateInFlightException if the key, or another task of the same type for the
     *                                    same session, is already in flight
     */
    public synchronized Acquisition acquire(AgentTaskRequest request, AgentRoleConfig role,
                                            SessionSnapshot dispatchedAgainst) {
        Instant now = clock.instant();
        purgeExpired(now);
        String key = request.idempotencyKey();

        if (byKey.containsKey(key)) {
            throw new DuplicateInFlightException("Task with idempotency key " + key + " is already in flight");
        }
        Expiring<TaskAcceptance> done = completed.get(key);
        if (done != null) {
            return new Acquisition(done.value().asReplay(), null);
        }
        Expiring<TaskAcceptance> dropped = cancelled.get(key);
        if (dropped != null) {
            return new Acquisition(dropped.value().asReplay(), null);
        }
        String slot = slot(request.sessionId(), role.taskType());
        String holder = bySlot.get(slot);
        if (holder != null) {
            throw new DuplicateInFlightException("A " + role.taskType() + " task (" + holder
                    + ") is already in flight for session " + request.sessionId());
        }

        var acceptance = new TaskAcceptance(key, request.sessionId(), role.taskType(), request.lane(), now, false);
        var entry = new Entry(request, role, dispatchedAgainst, acceptance, slot);
        byKey.put(key, entry);
        bySlot.put(slot, key);
        return new Acquisition(acceptance, entry);
    }

    public synchronized Optional<Entry> get(String idempotencyKey) {
        return Optional.ofNullable(byKey.get(idempotencyKey));
    }

    /**
     * Removes the in-flight entry after its result was reconciled and caches its acceptance.
     */
    public synchronized Optional<Entry> complete(String idempotencyKey) {
        Entry entry = remove(idempotencyKey);
        if (entry != null) {
            completed.put(idempotencyKey, new Expiring<>(entry.acceptance(), clock.instant().plus(completedTtl)));
        }
        return Optional.ofNullable(entry);
    }

    /**
     * Takes an in-flight entry for reconciliation, exactly like {@link #complete}, unless it was
     * cancelled or already taken. Check and removal are one step, so a result and a cancel of the
     * same key can never both win.
     *
     * @return the entry, or empty if the key is no longer in flight
     */
    public synchronized Optional<Entry> claim(String idempotencyKey) {
        Entry entry = byKey.get(idempotencyKey);
        if (entry == null || entry.cancelled) {
            return Optional.empty();
        }
        return complete(idempotencyKey);
    }

    /**
     * Removes an entry that never started, e.g. because its lane rejected it. The key may be
     * resubmitted immediately.
     */
    public synchronized void abandon(String idempotencyKey) {
        remove(idempotencyKey);
    }

    /**
     * Marks an in-flight entry cancelled and releases its markers.
     */
    public synchronized Optional<Entry> cancel(String idempotencyKey) {
        Entry entry = remove(idempotencyKey);
        if (entry != null) {
            entry.cancelled = true;
            cancelled.put(idempotencyKey, new Expiring<>(entry.acceptance(), clock.instant().plus(cancelledTtl)));
        }
        return Optional.ofNullable(entry);
    }

    public synchronized List<Entry> cancelSession(String sessionId) {
        var keys = new ArrayList<String>();
        byKey.forEach((key, entry) -> {
            if (entry.request().sessionId().equals(sessionId)) {
                keys.add(key);
            }
        });
        var removed = new ArrayList<Entry>();
        for (String key : keys) {
            cancel(key).ifPresent(removed::add);
        }
        return removed;
    }

    public synchronized boolean wasCancelled(String idempotencyKey) {
        purgeExpired(clock.instant());
        return cancelled.containsKey(idempotencyKey);
    }

    /**
     * Whether the key is in flight or still remembered as reconciled or cancelled.
     */
    public synchronized boolean isKnown(String idempotencyKey) {
        purgeExpired(clock.instant());
        return byKey.containsKey(idempotencyKey) || completed.containsKey(idempotencyKey)
                || cancelled.containsKey(idempotencyKey);
    }

    public synchronized int inFlightCount() {
        return byKey.size();
    }

    public synchronized List<Entry> inFlightFor(String sessionId) {
        var result = new ArrayList<Entry>();
        for (Entry entry : byKey.values()) {
            if (entry.request().sessionId().equals(sessionId)) {
                result.add(entry);
            }
        }
        return result;
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private Entry remove(String idempotencyKey) {
        Entry entry = byKey.remove(idempotencyKey);
        if (entry != null) {
            bySlot.remove(entry.slot, idempotencyKey);
        }
        return entry;
    }

    private void purgeExpired(Instant now) {
        completed.values().removeIf(e -> !e.expiresAt().isAfter(now));
        cancelled.values().removeIf(e -> !e.expiresAt().isAfter(now));
    }

    private static String slot(String sessionId, String taskType) {
        return sessionId + "/" + taskType;
    }

    private record Expiring<T>(T value, Instant expiresAt) {}

    /**
     * Result of {@link #acquire}: a fresh entry to execute, or a replayed acceptance.
     */
    public record Acquisition(TaskAcceptance acceptance, Entry entry) {

        public boolean isReplay() {
            return entry == null;
        }
    }

    /**
     * One in-flight task. The snapshot it was dispatched against is the staleness basis for
     * non-commutative results.
     */
    public static final class Entry {

        private final AgentTaskRequest request;
        private final AgentRoleConfig role;
        private final SessionSnapshot dispatchedAgainst;
        private final TaskAcceptance acceptance;
        private final String slot;
        private volatile Future<?> future;
        private volatile boolean cancelled;

        private Entry(AgentTaskRequest request, AgentRoleConfig role, SessionSnapshot dispatchedAgainst,
                      TaskAcceptance acceptance, String slot) {
            this.request = request;
            this.role = role;
            this.dispatchedAgainst = dispatchedAgainst;
            this.acceptance = acceptance;
            this.slot = slot;
        }

        public AgentTaskRequest request() {
            return request;
        }

        public AgentRoleConfig role() {
            return role;
        }

        public SessionSnapshot dispatchedAgainst() {
            return dispatchedAgainst;
        }

        public TaskAcceptance acceptance() {
            return acceptance;
        }

        public boolean isCancelled() {
            return cancelled;
        }

        void attach(Future<?> future) {
            this.future = future;
            if (cancelled) {
                future.cancel(true);
            }
        }

        void interrupt() {
            Future<?> current = future;
            if (current != null) {
                current.cancel(true);
            }
        }
    }
}
