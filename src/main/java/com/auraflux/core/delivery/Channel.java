package com.auraflux.core.delivery;

/**
 * The two logical push channels of a subscriber.
 */
public enum Channel {
    /** Best-effort incremental task output, ordered per task. */
    STREAM,
    /** Reliable snapshot notifications, ordered by session version. */
    STATE
}
