package com.auraflux.core.agent;

import com.auraflux.core.dispatch.FailureKind;

/**
 * Thrown by a {@link GenerationService} when a task could not produce a result.
 */
public class GenerationException extends RuntimeException {

    private final FailureKind kind;

    public GenerationException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GenerationException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static GenerationException transientFailure(String message, Throwable cause) {
        return new GenerationException(FailureKind.TRANSIENT, message, cause);
    }

    public static GenerationException permanentFailure(String message) {
        return new GenerationException(FailureKind.PERMANENT, message);
    }

    public FailureKind kind() {
        return kind;
    }
}
