package com.auraflux.core.error;

import com.auraflux.core.model.Phase;

import java.util.List;

/**
 * A phase transition was refused. {@link #reasons()} lists every unmet condition.
 */
public class GateDeniedException extends AurafluxException {

    private final Phase from;
    private final Phase target;
    private final List<String> reasons;

    public GateDeniedException(Phase from, Phase target, List<String> reasons) {
        super("Transition " + from + " -> " + target + " denied: " + String.join("; ", reasons));
        this.from = from;
        this.target = target;
        this.reasons = List.copyOf(reasons);
    }

    public Phase from() {
        return from;
    }

    public Phase target() {
        return target;
    }

    public List<String> reasons() {
        return reasons;
    }

    @Override
    public String code() {
        return "GATE_DENIED";
    }
}
