package com.auraflux.core.engine;

import com.auraflux.core.dispatch.TaskDispatcher;
import com.auraflux.core.error.GateDeniedException;
import com.auraflux.core.gate.GateDecision;
import com.auraflux.core.gate.GateEvaluator;
import com.auraflux.core.logging.MdcContext;
import com.auraflux.core.metrics.AurafluxMetrics;
import com.auraflux.core.model.Phase;
import com.auraflux.core.model.SessionSnapshot;
import com.auraflux.core.state.SessionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives sessions through the phase sequence.
 * <p>
 * The gate is evaluated inside the store's commit, against the very snapshot the transition is
 * applied to, so a concurrent edit can never slip between the check and the phase change.
 */
@Service
public class PhaseStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PhaseStateMachine.class);

    static final String TRANSITION_CAUSE = "phase.transitioned";

    private final SessionStateStore store;
    private final GateEvaluator gate;
    private final TaskDispatcher dispatcher;
    private final AurafluxMetrics metrics;

    public PhaseStateMachine(SessionStateStore store, GateEvaluator gate, TaskDispatcher dispatcher,
                             AurafluxMetrics metrics) {
        this.store = store;
        this.gate = gate;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
    }

    /**
     * Moves the session to {@code target} if it is still at {@code expectedVersion} and the gate
     * allows it. Closing a session cancels its in-flight tasks.
     *
     * @throws com.auraflux.core.error.SessionNotFoundException if the session does not exist
     * @throws com.auraflux.core.error.VersionConflictException if the session moved past
     *                                                          {@code expectedVersion}
     * @throws GateDeniedException if the gate denies the transition; the session is unchanged
     */
    public SessionSnapshot requestTransition(String sessionId, Phase target, long expectedVersion) {
        MdcContext.setSession(sessionId);
        try {
            SessionSnapshot committed;
            try {
                committed = store.commit(sessionId, expectedVersion, TRANSITION_CAUSE, current -> {
                    GateDecision decision = gate.evaluate(current, target);
                    if (!decision.allowed()) {
                        throw new GateDeniedException(decision.from(), decision.target(), decision.reasons());
                    }
                    return current.withPhase(target);
                });
            } catch (GateDeniedException e) {
                metrics.recordTransition(target.name(), false);
                log.warn("Transition {} -> {} denied for session {}: {}", e.from(), target, sessionId, e.reasons());
                throw e;
            }

            metrics.recordTransition(target.name(), true);
            log.info("Session {} transitioned to {} at version {}", sessionId, target, committed.version());
            if (committed.isClosed()) {
                dispatcher.cancelAll(sessionId, "session closed");
            }
            return committed;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Read-only gate check against the latest snapshot, for rendering a readiness checklist.
     */
    public GateDecision preview(String sessionId, Phase target) {
        return gate.evaluate(store.get(sessionId), target);
    }
}
