package com.auraflux.core.reconcile;

/**
 * What {@link ResultReconciler#reconcile} did with a result.
 */
public enum Reconciliation {
    /** The result payload was committed to the session. */
    APPLIED,
    /** The task failed; the failure was recorded and announced. */
    FAILURE_RECORDED,
    /** The task had been cancelled; the result was dropped. */
    DISCARDED
}
