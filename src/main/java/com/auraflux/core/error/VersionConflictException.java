package com.auraflux.core.error;

/**
 * Optimistic-concurrency loss: the caller's expected version is not the current one.
 * Retryable after re-reading the session.
 */
public class VersionConflictException extends AurafluxException {

    private final String sessionId;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String sessionId, long expectedVersion, long actualVersion) {
        super("Session " + sessionId + " is at version " + actualVersion + ", expected " + expectedVersion);
        this.sessionId = sessionId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String sessionId() {
        return sessionId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long actualVersion() {
        return actualVersion;
    }

    @Override
    public String code() {
        return "VERSION_CONFLICT";
    }
}
