package com.questrail.timedcallback.api;

/**
 * Lifecycle state of a single scheduled callback.
 */
public enum EventState
{
    /**
     * Execute normally when due, then reschedule or expire according to the
     * remaining repeat count.
     */
    RUN,

    /**
     * Skip execution. The event still occupies its timeline slot and is
     * removed (and its handle released) once its due time is reached.
     */
    ABORT,

    /**
     * Already logically gone. The scheduler never releases the handle of an
     * erased event; either it was released already or the scripting context
     * frees it itself.
     */
    ERASED
}
