package com.questrail.timedcallback.config;

import java.time.Duration;
import java.util.Objects;

/**
 * TickPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for the tick driver.
 *
 * <p>This controls only <em>when</em> processors are advanced and by how much
 * at most. It has no say over due-time ordering, repeat counts or
 * cancellation, which belong to the processors.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>tickInterval</b>: Target period between ticks. Every registered
 *       processor is advanced once per tick.</li>
 *   <li><b>maxElapsedPerTick</b>: Upper bound on the elapsed time handed to
 *       one tick. After a long stall (debugger, host suspend, GC) the excess is
 *       dropped instead of firing the whole backlog in a single pass.
 *       {@link Duration#ZERO} disables the bound.</li>
 * </ul>
 */
public record TickPolicy(
        Duration tickInterval,
        Duration maxElapsedPerTick
) {
    public TickPolicy {
        Objects.requireNonNull(tickInterval, "tickInterval");
        Objects.requireNonNull(maxElapsedPerTick, "maxElapsedPerTick");

        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must be positive");
        }
        if (maxElapsedPerTick.isNegative()) {
            throw new IllegalArgumentException("maxElapsedPerTick must be non-negative");
        }
    }

    /**
     * Policy with the given interval and no elapsed-time bound.
     */
    public static TickPolicy withTickInterval(Duration tickInterval) {
        return new TickPolicy(tickInterval, Duration.ZERO);
    }

    /**
     * Defaults: 50ms ticks, at most 1s of elapsed time per tick.
     */
    public static TickPolicy defaults() {
        return new TickPolicy(Duration.ofMillis(50), Duration.ofSeconds(1));
    }

    /**
     * Applies {@link #maxElapsedPerTick()} to a measured elapsed value.
     */
    public long clampElapsedMillis(long elapsedMillis) {
        if (maxElapsedPerTick.isZero()) {
            return elapsedMillis;
        }
        return Math.min(elapsedMillis, maxElapsedPerTick.toMillis());
    }
}
