package com.questrail.timedcallback.time;

import java.time.Duration;

/**
 * TickSource
 * =============================================================================
 * Port for something that can call a task periodically on a single thread.
 *
 * <h2>Binding invariants</h2>
 * <ul>
 *   <li>Ticks for one registration never overlap; the next tick starts only
 *       after the previous one returned.</li>
 *   <li>The period is a target, not a measurement. Callers measure real
 *       elapsed time with a {@link MonotonicClock}.</li>
 * </ul>
 *
 * <p>Implementations may be backed by a JDK scheduled executor, a Netty event
 * executor, or a deterministic test source.</p>
 */
public interface TickSource
{
    /**
     * Starts calling {@code tick} every {@code period}, first after one period.
     *
     * @return handle that stops the ticks
     */
    Cancellable scheduleAtFixedRate(Duration period, Runnable tick);

    /**
     * Releases threads owned by this source. Sources that do not own their
     * threads do nothing.
     */
    default void shutdown()
    {
    }
}
