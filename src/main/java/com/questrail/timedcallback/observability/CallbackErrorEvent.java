package com.questrail.timedcallback.observability;

import java.time.Instant;

/**
 * Record representing a failure raised while running a callback or driving a tick.
 *
 * <p>{@code handle} is {@code -1} when the failure is not tied to one callback.</p>
 */
public record CallbackErrorEvent(
    Instant timestamp,
    int handle,
    String message,
    Throwable cause
) {
    public static final int NO_HANDLE = -1;
}
