package com.questrail.timedcallback.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source used to measure elapsed time between ticks.
 *
 * <h2>Binding invariant</h2>
 * Elapsed time fed to the scheduler MUST come from a monotonic source.
 * Wall-clock time ({@code Instant.now()}) may jump and is used only for
 * observability timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick value in nanoseconds.
     * Values are only meaningful as differences.
     */
    long nowNanos();
}
