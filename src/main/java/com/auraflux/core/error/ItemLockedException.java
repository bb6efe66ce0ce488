package com.auraflux.core.error;

/**
 * Thrown when changing the text of a locked keyword or scope element without unlocking it.
 */
public class ItemLockedException extends AurafluxException {

    public ItemLockedException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "ITEM_LOCKED";
    }
}
