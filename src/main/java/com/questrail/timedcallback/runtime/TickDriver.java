package com.questrail.timedcallback.runtime;

import com.questrail.timedcallback.config.TickPolicy;
import com.questrail.timedcallback.core.EventRegistry;
import com.questrail.timedcallback.observability.CallbackErrorEvent;
import com.questrail.timedcallback.observability.NullObservabilitySink;
import com.questrail.timedcallback.observability.TimedCallbackObservabilitySink;
import com.questrail.timedcallback.time.Cancellable;
import com.questrail.timedcallback.time.MonotonicClock;
import com.questrail.timedcallback.time.TickSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * TickDriver
 * =============================================================================
 * Turns periodic ticks into {@link EventRegistry#advanceAll(long)} calls.
 *
 * <h2>Purpose</h2>
 * Processors know nothing about real time; they only accumulate the elapsed
 * values they are given. This driver is the single place where real,
 * monotonic time becomes logical scheduler time:
 * <ul>
 *   <li>measures the time since the previous tick with a {@link MonotonicClock}</li>
 *   <li>carries sub-millisecond remainders into the next tick so no time is lost</li>
 *   <li>bounds one tick's elapsed time per {@link TickPolicy#maxElapsedPerTick()}</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * All ticks run on the {@link TickSource}'s single thread. Callbacks therefore
 * run on that thread, one at a time. Other threads may schedule, cancel or
 * close processors concurrently; the registry's engine lock serializes them.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   driver.start()  → begins ticking
 *   driver.stop()   → stops future ticks; an in-flight tick finishes
 * </pre>
 *
 * <h2>Failure handling</h2>
 * Nothing thrown during a tick escapes it: a fixed-rate task that throws is
 * never run again. Failures go to the observability sink.
 */
public final class TickDriver {

    private static final Logger log = LoggerFactory.getLogger(TickDriver.class);

    private final EventRegistry registry;
    private final TickSource tickSource;
    private final MonotonicClock clock;
    private final TickPolicy tickPolicy;
    private final TimedCallbackObservabilitySink observabilitySink;
    private final Supplier<Instant> wallClock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong tickCount = new AtomicLong();
    private volatile Cancellable ticks;

    // Tick thread only, after start() publishes them.
    private long lastTickNanos;
    private long carryNanos;

    public TickDriver(EventRegistry registry,
                      TickSource tickSource,
                      MonotonicClock clock,
                      TickPolicy tickPolicy,
                      TimedCallbackObservabilitySink observabilitySink,
                      Supplier<Instant> wallClock)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.tickSource = Objects.requireNonNull(tickSource, "tickSource");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.tickPolicy = Objects.requireNonNull(tickPolicy, "tickPolicy");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Starts ticking.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            lastTickNanos = clock.nowNanos();
            carryNanos = 0L;
            ticks = tickSource.scheduleAtFixedRate(tickPolicy.tickInterval(), this::tick);
            log.debug("Tick driver started at {} intervals", tickPolicy.tickInterval());
        }
    }

    /**
     * Stops future ticks. Does not wait for a tick already in progress.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Cancellable current = ticks;
            if (current != null) {
                current.cancel();
                ticks = null;
            }
            log.debug("Tick driver stopped after {} ticks", tickCount.get());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Number of ticks that reached the registry.
     */
    public long tickCount() {
        return tickCount.get();
    }

    private void tick() {
        if (!running.get()) {
            return;
        }
        try {
            long now = clock.nowNanos();
            long elapsedNanos = (now - lastTickNanos) + carryNanos;
            lastTickNanos = now;

            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(elapsedNanos);
            carryNanos = elapsedNanos - TimeUnit.MILLISECONDS.toNanos(elapsedMillis);

            long applied = tickPolicy.clampElapsedMillis(elapsedMillis);
            if (applied < elapsedMillis) {
                log.warn("Tick stalled for {}ms; advancing by {}ms and dropping the rest", elapsedMillis, applied);
            }

            registry.advanceAll(applied);
            tickCount.incrementAndGet();
        } catch (Exception e) {
            observabilitySink.onError(new CallbackErrorEvent(
                    wallClock.get(),
                    CallbackErrorEvent.NO_HANDLE,
                    "Tick processing error",
                    e
            ));
        }
    }
}
