package com.auraflux.core.dispatch;

public enum TaskOutcome {
    SUCCESS,
    FAILURE
}
