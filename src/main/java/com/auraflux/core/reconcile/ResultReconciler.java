package com.auraflux.core.reconcile;

import com.auraflux.core.agent.ResultKind;
import com.auraflux.core.delivery.DeliveryChannelRouter;
import com.auraflux.core.delivery.PushMessage;
import com.auraflux.core.dispatch.AgentTaskResult;
import com.auraflux.core.dispatch.InFlightTaskIndex;
import com.auraflux.core.error.StaleResultException;
import com.auraflux.core.error.UnknownRequestException;
import com.auraflux.core.error.VersionConflictException;
import com.auraflux.core.logging.MdcContext;
import com.auraflux.core.metrics.AurafluxMetrics;
import com.auraflux.core.model.SessionSnapshot;
import com.auraflux.core.state.SessionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * Applies finished task results to their sessions.
 * <p>
 * This is the only path by which agent output reaches session state, and every write goes through
 * the {@link SessionStateStore}. Commutative results are merged into whatever version is current.
 * Non-commutative results are re-checked, inside the same commit, against the snapshot the task was
 * dispatched against and rejected as stale when the session moved on in a conflicting way. The
 * state push to subscribers happens through the store's commit listener; task status goes out on
 * the stream channel.
 */
@Service
public class ResultReconciler {

    private static final Logger log = LoggerFactory.getLogger(ResultReconciler.class);

    private final SessionStateStore store;
    private final InFlightTaskIndex index;
    private final TaskFailureLog failures;
    private final DeliveryChannelRouter router;
    private final AurafluxMetrics metrics;

    public ResultReconciler(SessionStateStore store, InFlightTaskIndex index, TaskFailureLog failures,
                            DeliveryChannelRouter router, AurafluxMetrics metrics) {
        this.store = store;
        this.index = index;
        this.failures = failures;
        this.router = router;
        this.metrics = metrics;
    }

    /**
     * @throws UnknownRequestException if the key is neither in flight nor recently cancelled
     * @throws StaleResultException    if a non-commutative result no longer fits the session; the
     *                                 session is left unchanged
     */
    public Reconciliation reconcile(AgentTaskResult result) {
        String key = result.idempotencyKey();
        Optional<InFlightTaskIndex.Entry> found = index.get(key);
        if (found.isEmpty() || found.get().isCancelled()) {
            if (found.isPresent() || index.wasCancelled(key)) {
                return discard(key);
            }
            metrics.recordReconciliation("unknown");
            throw new UnknownRequestException("No in-flight task with idempotency key " + key);
        }

        InFlightTaskIndex.Entry entry = found.get();
        MdcContext.setTask(result.sessionId(), result.taskType(), key, entry.request().lane().name());
        try {
            if (!result.isSuccess()) {
                if (index.claim(key).isEmpty()) {
                    return discard(key);
                }
                recordFailure(entry, String.valueOf(result.failureKind()), result.error(), result.attempt());
                return Reconciliation.FAILURE_RECORDED;
            }
            return apply(entry, result);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Records a result that could not be reconciled at all, so its key is released and the
     * failure is still reported. Does nothing if the key is no longer in flight.
     */
    public void recordUnreconciled(AgentTaskResult result, String message) {
        index.claim(result.idempotencyKey()).ifPresent(entry ->
                recordFailure(entry, "ERROR", message, result.attempt()));
    }

    public List<TaskFailure> failuresFor(String sessionId) {
        return failures.forSession(sessionId);
    }

    private Reconciliation apply(InFlightTaskIndex.Entry entry, AgentTaskResult result) {
        String key = result.idempotencyKey();
        ResultKind kind = entry.role().resultKind();
        UnaryOperator<SessionSnapshot> mutation;
        try {
            mutation = ResultMutations.forResult(kind, entry.role().taskType(), result.payload());
        } catch (IllegalArgumentException e) {
            if (index.claim(key).isEmpty()) {
                return discard(key);
            }
            recordFailure(entry, "PERMANENT", "Malformed " + kind + " result: " + e.getMessage(), result.attempt());
            return Reconciliation.FAILURE_RECORDED;
        }

        SessionSnapshot basis = entry.dispatchedAgainst();
        String cause = "task.applied:" + entry.role().taskType();
        // The key is claimed under the session lock, so a cancel either lands first and the
        // mutation turns into a no-op, or finds nothing left to cancel.
        AtomicBoolean claimed = new AtomicBoolean(false);
        SessionSnapshot committed;
        try {
            committed = store.update(result.sessionId(), cause, current -> {
                if (!claimed.get()) {
                    if (index.claim(key).isEmpty()) {
                        return current;
                    }
                    claimed.set(true);
                }
                ResultMutations.staleness(kind, basis, current).ifPresent(reason -> {
                    throw new StaleResultException(key, reason);
                });
                return mutation.apply(current);
            });
        } catch (StaleResultException e) {
            recordFailure(entry, "STALE", e.getMessage(), result.attempt());
            log.warn("Stale {} result {} for session {}: {}", kind, key, result.sessionId(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            if (!claimed.get() && index.claim(key).isEmpty()) {
                return discard(key);
            }
            String reason = e instanceof VersionConflictException ? "CONFLICT" : "ERROR";
            recordFailure(entry, reason, "Result could not be committed: " + e.getMessage(), result.attempt());
            return Reconciliation.FAILURE_RECORDED;
        }
        if (!claimed.get()) {
            return discard(key);
        }

        metrics.recordReconciliation("applied");
        log.info("Applied {} result {} to session {} at version {}", kind, key,
                result.sessionId(), committed.version());
        var details = new LinkedHashMap<String, Object>();
        details.put("version", committed.version());
        details.put("attempts", result.attempt());
        publishStatus(entry, "completed", details);
        return Reconciliation.APPLIED;
    }

    private Reconciliation discard(String idempotencyKey) {
        metrics.recordReconciliation("discarded");
        log.info("Discarding result of cancelled task {}", idempotencyKey);
        return Reconciliation.DISCARDED;
    }

    /**
     * Records a failure of a task whose key the caller already claimed.
     */
    private void recordFailure(InFlightTaskIndex.Entry entry, String reason, String message, int attempts) {
        var request = entry.request();
        failures.record(request.sessionId(), new TaskFailure(request.idempotencyKey(), request.taskType(),
                reason, message, attempts, Instant.now()));
        boolean stale = "STALE".equals(reason);
        metrics.recordReconciliation(stale ? "stale" : "failed");
        if (!stale) {
            log.warn("Task {} ({}) failed after {} attempt(s): {}", request.idempotencyKey(), reason, attempts, message);
        }
        var details = new LinkedHashMap<String, Object>();
        details.put("reason", reason);
        details.put("error", message == null ? "" : message);
        details.put("attempts", attempts);
        publishStatus(entry, stale ? "stale" : "failed", details);
    }

    private void publishStatus(InFlightTaskIndex.Entry entry, String status, Map<String, Object> details) {
        var request = entry.request();
        var payload = new LinkedHashMap<String, Object>(details);
        payload.put("status", status);
        router.publishStream(request.sessionId(), request.taskType(), request.idempotencyKey(), PushMessage.TASK_STATUS, payload);
    }
}
