package com.questrail.timedcallback.time.netty;

import com.questrail.timedcallback.time.Cancellable;
import com.questrail.timedcallback.time.TickSource;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyEventLoopTickSource
 * =============================================================================
 * Netty-backed implementation of the {@link TickSource} port.
 *
 * <h2>Architectural Role</h2>
 * Lets a host that already runs on Netty drive scheduler ticks from one of its
 * event executors, so callbacks run on a thread the host already serializes
 * work on. Hosts without Netty use the JDK-backed source instead.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code EventExecutor}, {@code ScheduledFuture}) MUST NOT
 * escape this package. Callers see only {@link TickSource} and
 * {@link Cancellable}.
 *
 * <h2>Lifecycle</h2>
 * - {@link #dedicated(String)} creates and owns a single-thread executor;
 *   {@link #shutdown()} shuts it down gracefully.
 * - {@link #NettyEventLoopTickSource(EventExecutor)} borrows a host executor;
 *   {@link #shutdown()} leaves it running.
 */
public final class NettyEventLoopTickSource implements TickSource
{
    private static final Logger log = LoggerFactory.getLogger(NettyEventLoopTickSource.class);

    private final EventExecutor executor;
    private final boolean ownsExecutor;

    /**
     * Tick on a host-owned executor.
     */
    public NettyEventLoopTickSource(EventExecutor executor)
    {
        this(executor, false);
    }

    private NettyEventLoopTickSource(EventExecutor executor, boolean ownsExecutor)
    {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Tick on a dedicated daemon executor thread named after {@code poolName}.
     */
    public static NettyEventLoopTickSource dedicated(String poolName)
    {
        Objects.requireNonNull(poolName, "poolName");
        return new NettyEventLoopTickSource(
                new DefaultEventExecutor(new DefaultThreadFactory(poolName, true)),
                true);
    }

    @Override
    public Cancellable scheduleAtFixedRate(Duration period, Runnable tick)
    {
        Objects.requireNonNull(period, "period");
        Objects.requireNonNull(tick, "tick");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be > 0");
        }

        long periodNanos = period.toNanos();
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(tick, periodNanos, periodNanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void shutdown()
    {
        if (!ownsExecutor) {
            return;
        }
        Future<?> terminated = executor.shutdownGracefully(0, 5, TimeUnit.SECONDS);
        if (!terminated.awaitUninterruptibly(6, TimeUnit.SECONDS)) {
            log.warn("Tick executor did not terminate within 6s; leaving daemon thread behind");
        }
    }

    /**
     * Returns {@code true} if the calling thread is this source's executor thread.
     */
    public boolean inTickThread()
    {
        return executor.inEventLoop();
    }
}
