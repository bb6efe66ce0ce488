package com.auraflux.core.error;

/**
 * Base of the synchronous error taxonomy. Each subclass carries a stable machine-readable code
 * that the API layer returns to clients.
 */
public abstract class AurafluxException extends RuntimeException {

    protected AurafluxException(String message) {
        super(message);
    }

    protected AurafluxException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String code();
}
