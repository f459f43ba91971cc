package com.questrail.timedcallback.time;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorTickSource
 * =============================================================================
 * {@link TickSource} backed by a {@link ScheduledExecutorService}.
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> own the provided executor unless it
 * was created through {@link #singleThreaded(String)}. Callers that pass their
 * own executor are responsible for shutting it down.</p>
 *
 * <h2>Failure behavior</h2>
 * <p>A {@code ScheduledExecutorService} silently stops a fixed-rate task whose
 * run throws. Tick tasks must therefore not let exceptions escape; the
 * {@code TickDriver} reports and swallows them.</p>
 *
 * <h2>Precision</h2>
 * <p>Ticks may run late under load, never early. Late ticks are not
 * compensated here; the driver measures elapsed time instead.</p>
 */
public final class ScheduledExecutorTickSource implements TickSource {

    private final ScheduledExecutorService executor;
    private final boolean ownsExecutor;

    /**
     * Creates a tick source backed by the given executor, which stays owned by the caller.
     */
    public ScheduledExecutorTickSource(ScheduledExecutorService executor) {
        this(executor, false);
    }

    private ScheduledExecutorTickSource(ScheduledExecutorService executor, boolean ownsExecutor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Creates a tick source with its own single daemon thread named {@code threadName}.
     */
    public static ScheduledExecutorTickSource singleThreaded(String threadName) {
        Objects.requireNonNull(threadName, "threadName");
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
        return new ScheduledExecutorTickSource(executor, true);
    }

    @Override
    public Cancellable scheduleAtFixedRate(Duration period, Runnable tick) {
        Objects.requireNonNull(period, "period");
        Objects.requireNonNull(tick, "tick");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be > 0");
        }

        long periodNanos = period.toNanos();
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(tick, periodNanos, periodNanos, TimeUnit.NANOSECONDS);
        return new ScheduledFutureCancellable(future);
    }

    @Override
    public void shutdown() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Adapter from {@link ScheduledFuture} to {@link Cancellable}.
     */
    private static final class ScheduledFutureCancellable implements Cancellable {
        private final ScheduledFuture<?> future;

        private ScheduledFutureCancellable(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            // Do not interrupt a tick that is draining callbacks.
            return future.cancel(false);
        }
    }
}
