/**
 * Timed Callback Core
 * =============================================================================
 *
 * The scheduler itself: {@link com.questrail.timedcallback.core.ScheduledEvent}
 * records, the per-owner {@link com.questrail.timedcallback.core.EventProcessor}
 * and the {@link com.questrail.timedcallback.core.EventRegistry} that tracks
 * processors across threads.
 *
 * <h2>Time</h2>
 * Time here is logical. Each processor accumulates the elapsed values passed to
 * {@code advance}; nothing in this package reads a clock. "Due" means the slot's
 * due time is at or before the processor's clock.
 *
 * <h2>Handle release</h2>
 * A handle is released exactly once, when the event holding it leaves its
 * processor for good (final run, abort, or drain). It is never released for an
 * {@link com.questrail.timedcallback.api.EventState#ERASED} event, for an
 * event whose handle has been rebound to a newer event, or when the
 * {@link com.questrail.timedcallback.api.CallbackInvoker} reports that the
 * system or its scripting context is gone.
 */
package com.questrail.timedcallback.core;
