package com.auraflux.core.dispatch;

/**
 * Independent execution tracks, each with its own worker pool and queue.
 */
public enum Lane {
    /** Request/response-shaped agent tasks. */
    DEFAULT,
    /** Tasks that emit incremental output on the stream channel. */
    STREAM
}
