package com.auraflux.core.error;

/**
 * Thrown when a lane's queue is full. Retryable once the lane drains.
 */
public class LaneSaturatedException extends AurafluxException {

    public LaneSaturatedException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "LANE_SATURATED";
    }
}
