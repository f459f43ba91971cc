package com.questrail.timedcallback.observability;

import java.time.Instant;

/**
 * Record describing a forced drain of a processor.
 *
 * @param drained  events removed by the drain
 * @param released handles actually released (the rest were erased or gated by liveness)
 */
public record DrainEvent(
    Instant timestamp,
    String owner,
    int drained,
    int released
) {
    /**
     * Checks whether any handle was dropped without release.
     */
    public boolean hasUnreleased() {
        return released < drained;
    }
}
