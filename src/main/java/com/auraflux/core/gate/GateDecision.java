package com.auraflux.core.gate;

import com.auraflux.core.model.Phase;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of evaluating a phase transition against a snapshot.
 *
 * @param from    phase of the evaluated snapshot
 * @param target  requested phase
 * @param allowed true when every rule of the declared edge holds
 * @param reasons every unmet condition, in rule declaration order; empty when allowed
 */
public record GateDecision(
    Phase from,
    Phase target,
    boolean allowed,
    List<String> reasons
) implements Serializable {

    public GateDecision {
        reasons = List.copyOf(reasons);
    }

    static GateDecision allow(Phase from, Phase target) {
        return new GateDecision(from, target, true, List.of());
    }

    static GateDecision deny(Phase from, Phase target, List<String> reasons) {
        return new GateDecision(from, target, false, reasons);
    }
}
