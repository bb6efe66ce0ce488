package com.auraflux.core.error;

/**
 * Thrown when a chat message is sent in a phase that has no chat agent.
 */
public class ChatUnavailableException extends AurafluxException {

    public ChatUnavailableException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "CHAT_UNAVAILABLE";
    }
}
