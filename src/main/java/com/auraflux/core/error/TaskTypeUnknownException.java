package com.auraflux.core.error;

/**
 * Thrown when no agent role is configured for a task type.
 */
public class TaskTypeUnknownException extends AurafluxException {

    public TaskTypeUnknownException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "TASK_TYPE_UNKNOWN";
    }
}
