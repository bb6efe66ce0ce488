package com.auraflux.core.error;

/**
 * Thrown when no session exists for the requested id.
 */
public class SessionNotFoundException extends AurafluxException {

    public SessionNotFoundException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "NOT_FOUND";
    }
}
