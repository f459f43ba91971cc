package com.questrail.timedcallback.time;

/**
 * Cancellable
 * =============================================================================
 * Handle returned by a {@link TickSource} for a running periodic tick.
 */
public interface Cancellable
{
    /**
     * Stop future ticks. A tick already in progress is not interrupted.
     *
     * @return {@code true} if this call stopped the ticks; {@code false} if they
     *         were already stopped
     */
    boolean cancel();
}
