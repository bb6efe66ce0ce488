package com.auraflux.core.error;

/**
 * Thrown when a task of the same type is already running for the session, or the same idempotency key is still in flight. Callers should wait for the running task rather than resubmit.
 */
public class DuplicateInFlightException extends AurafluxException {

    public DuplicateInFlightException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "DUPLICATE_IN_FLIGHT";
    }
}
