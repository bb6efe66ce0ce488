package com.auraflux.core.error;

/**
 * Thrown when a keyword or scope element named in an edit does not exist in the session.
 */
public class ItemNotFoundException extends AurafluxException {

    public ItemNotFoundException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "NOT_FOUND";
    }
}
