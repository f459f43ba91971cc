package com.questrail.timedcallback.api;

/**
 * Selects which processors a registry-level cancellation reaches.
 */
public enum CancelScope
{
    /** Only the global processor (events with no owning domain object). */
    GLOBAL_ONLY,

    /** The global processor and every registered owner processor. */
    ALL_PROCESSORS
}
