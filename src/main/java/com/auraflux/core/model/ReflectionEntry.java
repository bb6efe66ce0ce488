package com.auraflux.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * An append-only reflection log entry.
 */
public record ReflectionEntry(
    Instant timestamp,
    Author author,
    String text
) implements Serializable {}
