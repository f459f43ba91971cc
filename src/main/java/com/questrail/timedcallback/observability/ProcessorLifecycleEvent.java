package com.questrail.timedcallback.observability;

import java.time.Instant;

/**
 * Record describing a processor joining or leaving the registry.
 */
public record ProcessorLifecycleEvent(
    Instant timestamp,
    Kind kind,
    String owner,
    int drained
) {
    public enum Kind {
        REGISTERED,
        CLOSED
    }
}
