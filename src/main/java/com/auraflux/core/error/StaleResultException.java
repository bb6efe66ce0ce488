package com.auraflux.core.error;

/**
 * A non-commutative task result could not be applied because the session changed in an
 * incompatible way after the task was dispatched. Requires manual resolution.
 */
public class StaleResultException extends AurafluxException {

    private final String idempotencyKey;

    public StaleResultException(String idempotencyKey, String message) {
        super(message);
        this.idempotencyKey = idempotencyKey;
    }

    public String idempotencyKey() {
        return idempotencyKey;
    }

    @Override
    public String code() {
        return "STALE_RESULT";
    }
}
