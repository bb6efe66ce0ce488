package com.auraflux.core.dispatch;

import com.auraflux.core.agent.AgentRoleConfig;
import com.auraflux.core.agent.AgentRoleConfigSource;
import com.auraflux.core.agent.AgentTaskRunner;
import com.auraflux.core.delivery.DeliveryChannelRouter;
import com.auraflux.core.delivery.PushMessage;
import com.auraflux.core.error.AurafluxException;
import com.auraflux.core.error.LaneSaturatedException;
import com.auraflux.core.error.SessionClosedException;
import com.auraflux.core.error.TaskTypeUnknownException;
import com.auraflux.core.logging.MdcContext;
import com.auraflux.core.metrics.AurafluxMetrics;
import com.auraflux.core.model.SessionSnapshot;
import com.auraflux.core.reconcile.ResultReconciler;
import com.auraflux.core.state.SessionStateStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Accepts agent task requests and runs them on per-lane worker pools.
 * <p>
 * Submission never blocks on generation: it validates the request, registers the idempotency key
 * in the {@link InFlightTaskIndex}, queues the task on its lane and returns. Each lane has its own
 * bounded queue, so a saturated streaming lane never delays request/response tasks. Transient
 * failures are retried on the same lane with exponential backoff; the final result of a task is
 * handed to the {@link ResultReconciler}, which is the only component that writes task output into
 * the session.
 * <p>
 * Lifecycle notices ({@code accepted}, {@code running}, {@code retrying}, {@code cancelled}) are
 * published as {@code task.status} messages on the stream channel.
 */
@Service
public class TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    private final SessionStateStore store;
    private final AgentRoleConfigSource roles;
    private final InFlightTaskIndex index;
    private final AgentTaskRunner runner;
    private final ResultReconciler reconciler;
    private final DeliveryChannelRouter router;
    private final AurafluxMetrics metrics;

    private final Map<Lane, ExecutorService> lanes;
    private final ScheduledExecutorService retryScheduler;

    @Autowired
    public TaskDispatcher(SessionStateStore store, AgentRoleConfigSource roles, InFlightTaskIndex index,
                          AgentTaskRunner runner, ResultReconciler reconciler, DeliveryChannelRouter router,
                          AurafluxMetrics metrics, DispatcherProperties properties) {
        this(store, roles, index, runner, reconciler, router, metrics, newLanePools(properties),
                Executors.newSingleThreadScheduledExecutor(daemonFactory("task-retry")));
    }

    TaskDispatcher(SessionStateStore store, AgentRoleConfigSource roles, InFlightTaskIndex index,
                   AgentTaskRunner runner, ResultReconciler reconciler, DeliveryChannelRouter router,
                   AurafluxMetrics metrics, Map<Lane, ExecutorService> lanes,
                   ScheduledExecutorService retryScheduler) {
        this.store = store;
        this.roles = roles;
        this.index = index;
        this.runner = runner;
        this.reconciler = reconciler;
        this.router = router;
        this.metrics = metrics;
        this.lanes = new EnumMap<>(lanes);
        this.retryScheduler = retryScheduler;
    }

    private static Map<Lane, ExecutorService> newLanePools(DispatcherProperties properties) {
        var pools = new EnumMap<Lane, ExecutorService>(Lane.class);
        for (Lane lane : Lane.values()) {
            DispatcherProperties.LaneSettings settings = properties.lane(lane);
            int size = Math.max(1, settings.getPoolSize());
            pools.put(lane, new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS,
                    new ArrayBlockingQueue<>(Math.max(1, settings.getQueueCapacity())),
                    daemonFactory("lane-" + lane.name().toLowerCase(Locale.ROOT))));
            log.info("Lane {} started with {} worker(s), queue capacity {}", lane, size, settings.getQueueCapacity());
        }
        return pools;
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @PreDestroy
    void shutdown() {
        retryScheduler.shutdownNow();
        for (ExecutorService pool : lanes.values()) {
            pool.shutdownNow();
        }
    }

    /**
     * Convenience for callers without their own key: a random idempotency key is generated.
     */
    public TaskAcceptance submit(String sessionId, String taskType, Map<String, Object> payload) {
        return submit(new AgentTaskRequest(taskType, sessionId, UUID.randomUUID().toString(), payload, null));
    }

    /**
     * Validates and queues a task. Returns without waiting for generation.
     * <p>
     * A resubmission of a key that is already reconciled (or cancelled) returns the original
     * acceptance with {@code replayed = true} and runs nothing.
     *
     * @throws com.auraflux.core.error.DuplicateInFlightException if the key or the session's slot
     *                                                           for this task type is in flight
     * @throws TaskTypeUnknownException  if no role is configured for the task type
     * @throws com.auraflux.core.error.SessionNotFoundException if the session does not exist
     * @throws SessionClosedException    if the session is closed
     * @throws LaneSaturatedException    if the lane's queue is full
     */
    public TaskAcceptance submit(AgentTaskRequest request) {
        if (request.idempotencyKey() == null || request.idempotencyKey().isBlank()) {
            throw new IllegalArgumentException("idempotency key must not be blank");
        }
        AgentRoleConfig role = roles.find(request.taskType()).orElseThrow(() ->
                new TaskTypeUnknownException("No agent role configured for task type '" + request.taskType() + "'"));
        SessionSnapshot snapshot = store.get(request.sessionId());
        if (snapshot.isClosed()) {
            throw new SessionClosedException("Session " + request.sessionId() + " is closed");
        }

        Lane lane = request.lane() != null ? request.lane() : role.lane();
        AgentTaskRequest resolved = new AgentTaskRequest(role.taskType(), request.sessionId(),
                request.idempotencyKey(), TaskContext.enrich(snapshot, role, request.payload()), lane);

        InFlightTaskIndex.Acquisition acquisition;
        try {
            acquisition = index.acquire(resolved, role, snapshot);
        } catch (AurafluxException e) {
            metrics.recordSubmission(lane.name(), "duplicate");
            throw e;
        }
        if (acquisition.isReplay()) {
            metrics.recordSubmission(lane.name(), "replayed");
            log.info("Replaying acceptance of {} for session {}", request.idempotencyKey(), request.sessionId());
            return acquisition.acceptance();
        }

        InFlightTaskIndex.Entry entry = acquisition.entry();
        try {
            entry.attach(lanes.get(lane).submit(() -> execute(entry, 1)));
        } catch (RejectedExecutionException e) {
            index.abandon(resolved.idempotencyKey());
            metrics.recordSubmission(lane.name(), "saturated");
            log.warn("Lane {} is saturated; rejected {} for session {}", lane, role.taskType(), request.sessionId());
            throw new LaneSaturatedException("Lane " + lane + " is saturated; retry later");
        }

        metrics.recordSubmission(lane.name(), "accepted");
        log.info("Accepted {} task {} for session {} on lane {}", role.taskType(), resolved.idempotencyKey(),
                request.sessionId(), lane);
        publishStatus(resolved, "accepted", Map.of("lane", lane.name()));
        return acquisition.acceptance();
    }

    /**
     * Whether a submission with this key is in flight or would be replayed.
     */
    public boolean hasSeen(String idempotencyKey) {
        return index.isKnown(idempotencyKey);
    }

    /**
     * Cancels one in-flight task of a session. A late result for the key is discarded.
     *
     * @return false if no such task is in flight for the session
     */
    public boolean cancel(String sessionId, String idempotencyKey) {
        var entry = index.get(idempotencyKey)
                .filter(e -> e.request().sessionId().equals(sessionId));
        if (entry.isEmpty()) {
            return false;
        }
        return index.cancel(idempotencyKey).map(e -> {
            e.interrupt();
            log.info("Cancelled task {} for session {}", idempotencyKey, sessionId);
            publishStatus(e.request(), "cancelled", Map.of());
            return true;
        }).orElse(false);
    }

    /**
     * Cancels every in-flight task of a session, e.g. when it is closed.
     *
     * @return the number of tasks cancelled
     */
    public int cancelAll(String sessionId, String reason) {
        List<InFlightTaskIndex.Entry> cancelled = index.cancelSession(sessionId);
        for (InFlightTaskIndex.Entry entry : cancelled) {
            entry.interrupt();
            publishStatus(entry.request(), "cancelled", Map.of("reason", reason));
        }
        if (!cancelled.isEmpty()) {
            log.info("Cancelled {} in-flight task(s) for session {} ({})", cancelled.size(), sessionId, reason);
        }
        return cancelled.size();
    }

    // ── Worker side ──────────────────────────────────────────────────────

    void execute(InFlightTaskIndex.Entry entry, int attempt) {
        AgentTaskRequest request = entry.request();
        MdcContext.setTask(request.sessionId(), request.taskType(), request.idempotencyKey(), request.lane().name());
        try {
            if (entry.isCancelled()) {
                log.debug("Task {} was cancelled before attempt {}", request.idempotencyKey(), attempt);
                return;
            }
            publishStatus(request, "running", Map.of("attempt", attempt));
            AgentTaskResult result = runner.run(request, entry.role(), attempt);
            if (entry.isCancelled()) {
                log.info("Discarding result of cancelled task {}", request.idempotencyKey());
                return;
            }
            RetryPolicy policy = entry.role().retryPolicy();
            if (result.isTransientFailure() && policy.allowsAnotherAttempt(attempt)) {
                scheduleRetry(entry, attempt, policy.backoffAfter(attempt), result.error());
                return;
            }
            deliver(result);
        } finally {
            MdcContext.clear();
        }
    }

    private void scheduleRetry(InFlightTaskIndex.Entry entry, int failedAttempt, long delayMs, String error) {
        AgentTaskRequest request = entry.request();
        metrics.recordRetry(request.taskType());
        log.info("Retrying {} in {}ms (attempt {} failed: {})", request.idempotencyKey(), delayMs, failedAttempt, error);
        var details = new LinkedHashMap<String, Object>();
        details.put("attempt", failedAttempt + 1);
        details.put("delay_ms", delayMs);
        details.put("error", error == null ? "" : error);
        publishStatus(request, "retrying", details);
        try {
            retryScheduler.schedule(() -> requeue(entry, failedAttempt + 1), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Retry scheduler unavailable; giving up on {}", request.idempotencyKey());
            deliver(AgentTaskResult.failure(request, FailureKind.TRANSIENT,
                    "Retry could not be scheduled after: " + error, failedAttempt));
        }
    }

    private void requeue(InFlightTaskIndex.Entry entry, int attempt) {
        if (entry.isCancelled()) {
            return;
        }
        try {
            entry.attach(lanes.get(entry.request().lane()).submit(() -> execute(entry, attempt)));
        } catch (RejectedExecutionException e) {
            log.warn("Lane {} saturated while retrying {}", entry.request().lane(), entry.request().idempotencyKey());
            deliver(AgentTaskResult.failure(entry.request(), FailureKind.TRANSIENT,
                    "Lane " + entry.request().lane() + " saturated while retrying", attempt - 1));
        }
    }

    private void deliver(AgentTaskResult result) {
        try {
            reconciler.reconcile(result);
        } catch (AurafluxException e) {
            log.warn("Result of {} not applied ({}): {}", result.idempotencyKey(), e.code(), e.getMessage());
            reconciler.recordUnreconciled(result, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Reconciliation of {} failed unexpectedly; releasing its slot", result.idempotencyKey(), e);
            reconciler.recordUnreconciled(result, "Reconciliation failed: " + e.getMessage());
        }
    }

    private void publishStatus(AgentTaskRequest request, String status, Map<String, Object> details) {
        var payload = new LinkedHashMap<String, Object>(details);
        payload.put("status", status);
        router.publishStream(request.sessionId(), request.taskType(), request.idempotencyKey(), PushMessage.TASK_STATUS, payload);
    }
}
