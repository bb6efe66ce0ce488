package com.auraflux.core.model;

/**
 * Phases of the Information Search Process, in their forward order.
 * <p>
 * {@link #CLOSED} is terminal. Which edges between phases are legal is decided by
 * {@link com.auraflux.core.gate.GateEvaluator}, not by this enum.
 */
public enum Phase {
    INITIATION,
    EXPLORATION,
    FORMULATION,
    COLLECTION,
    PRESENTATION,
    CLOSED;

    public boolean isTerminal() {
        return this == CLOSED;
    }
}
