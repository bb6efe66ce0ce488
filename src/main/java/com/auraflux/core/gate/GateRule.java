package com.auraflux.core.gate;

import com.auraflux.core.model.SessionSnapshot;

import java.util.Optional;

/**
 * One condition of a phase transition. Must be a pure function of the snapshot.
 */
@FunctionalInterface
interface GateRule {

    /**
     * @return the unmet-condition message, or empty when the rule holds
     */
    Optional<String> check(SessionSnapshot snapshot);
}
