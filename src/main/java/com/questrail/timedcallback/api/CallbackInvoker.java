package com.questrail.timedcallback.api;

/**
 * CallbackInvoker
 * =============================================================================
 * Boundary to the scripting runtime that owns callback bodies and the handle
 * reference table.
 *
 * <p>The scheduler never interprets a handle. It only hands it back to this
 * port when the callback is due, and releases it once the callback will
 * never fire again.</p>
 *
 * <h2>Reentrancy</h2>
 * {@link #invoke(int, long, int, Object)} runs on the tick thread while the
 * engine lock is held. The callback body may call back into the scheduler
 * (schedule, cancel, change state, close a processor). A callback that cancels
 * its own handle sees the instance that was already rescheduled for its next
 * run, never the one currently executing. Scheduling on a processor that has
 * been closed meanwhile is dropped without an error.
 *
 * <h2>Release gating</h2>
 * Before calling {@link #release(int)} the scheduler checks
 * {@link #isSystemLive()} and {@link #hasActiveContext()}. If either reports
 * {@code false} the handle is dropped without release, because the table it
 * points into no longer exists.
 */
public interface CallbackInvoker
{
    /**
     * Runs the callback body identified by {@code handle}.
     *
     * @param handle          callback handle
     * @param delayUsed       the delay, in milliseconds, that elapsed before this run
     * @param repeatsToReport remaining executions including this one, or {@code 0}
     *                        for a callback that repeats forever
     * @param owner           the domain object the callback belongs to, or
     *                        {@code null} for a global callback
     */
    void invoke(int handle, long delayUsed, int repeatsToReport, Object owner);

    /**
     * Permanently invalidates {@code handle}. Called at most once per handle,
     * and only while both liveness probes report {@code true}.
     */
    void release(int handle);

    /**
     * Returns {@code false} once the hosting engine has begun shutting down.
     */
    boolean isSystemLive();

    /**
     * Returns {@code false} when the scripting context that issued the
     * handles has been torn down.
     */
    boolean hasActiveContext();
}
