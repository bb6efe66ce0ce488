package com.auraflux.core.state;

import com.auraflux.core.model.SessionSnapshot;

/**
 * Notified after every committed mutation, while the session's write lock is still held, so
 * notifications for one session are observed in version order.
 * <p>
 * Implementations must not block.
 */
@FunctionalInterface
public interface SessionCommitListener {

    /**
     * @param snapshot the newly committed snapshot
     * @param cause    short event name describing the mutation, e.g. "phase.transitioned"
     */
    void onCommit(SessionSnapshot snapshot, String cause);
}
