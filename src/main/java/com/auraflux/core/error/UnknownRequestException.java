package com.auraflux.core.error;

/**
 * Thrown when a result arrives for an idempotency key that has no in-flight request.
 */
public class UnknownRequestException extends AurafluxException {

    public UnknownRequestException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "UNKNOWN_REQUEST";
    }
}
