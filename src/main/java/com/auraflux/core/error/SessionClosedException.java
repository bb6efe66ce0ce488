package com.auraflux.core.error;

/**
 * Thrown when mutating or dispatching work for a session that reached the terminal phase.
 */
public class SessionClosedException extends AurafluxException {

    public SessionClosedException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "SESSION_CLOSED";
    }
}
