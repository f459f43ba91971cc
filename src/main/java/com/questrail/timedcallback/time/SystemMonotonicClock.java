package com.questrail.timedcallback.time;

/**
 * SystemMonotonicClock
 * =============================================================================
 * {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>Unaffected by NTP, DST or manual clock changes, which makes it the only
 * acceptable production source for tick elapsed time.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
