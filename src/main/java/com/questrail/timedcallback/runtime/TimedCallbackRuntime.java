package com.questrail.timedcallback.runtime;

import com.questrail.timedcallback.api.CallbackInvoker;
import com.questrail.timedcallback.api.EventState;
import com.questrail.timedcallback.config.TimedCallbackConfig;
import com.questrail.timedcallback.core.EventProcessor;
import com.questrail.timedcallback.core.EventRegistry;
import com.questrail.timedcallback.observability.Slf4jObservabilitySink;
import com.questrail.timedcallback.observability.TimedCallbackObservabilitySink;
import com.questrail.timedcallback.time.MonotonicClock;
import com.questrail.timedcallback.time.ScheduledExecutorTickSource;
import com.questrail.timedcallback.time.SystemMonotonicClock;
import com.questrail.timedcallback.time.TickSource;
import com.questrail.timedcallback.time.netty.NettyEventLoopTickSource;

import java.time.Instant;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.function.Supplier;

/**
 * TimedCallbackRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one engine's timed callbacks.
 *
 * <p>Owns the {@link EventRegistry} (and through it the global processor), the
 * {@link TickSource} and the {@link TickDriver}. Domain objects obtain their
 * processors from {@link #newProcessor(Object)} and close them themselves.</p>
 *
 * <h2>Shutdown order</h2>
 * {@link #stop()} stops ticking, waits for the tick thread to go idle, and only
 * then shuts the registry down, so teardown never races a drain in progress.
 */
public final class TimedCallbackRuntime {
    private static final String TICK_THREAD_NAME = "timed-callback-tick";

    private final EventRegistry registry;
    private final TickDriver driver;
    private final TickSource tickSource;

    private TimedCallbackRuntime(EventRegistry registry, TickDriver driver, TickSource tickSource) {
        this.registry = registry;
        this.driver = driver;
        this.tickSource = tickSource;
    }

    public void start() {
        driver.start();
    }

    public void stop() {
        driver.stop();
        tickSource.shutdown();
        registry.shutdown();
    }

    public EventRegistry registry() {
        return registry;
    }

    public EventProcessor globalProcessor() {
        return registry.globalProcessor();
    }

    public EventProcessor newProcessor(Object owner) {
        return registry.newProcessor(owner);
    }

    /**
     * Marks every pending callback erased ahead of a scripting context reload.
     * The context frees its own handles, so none of them is released by the
     * scheduler afterwards; the erased slots are swept by later ticks.
     */
    public void discardForContextReload() {
        registry.setStates(EventState.ERASED);
    }

    public long tickCount() {
        return driver.tickCount();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private CallbackInvoker invoker;
        private TimedCallbackConfig config = TimedCallbackConfig.defaults();
        private TimedCallbackObservabilitySink observabilitySink = new Slf4jObservabilitySink();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private Supplier<Instant> wallClock = Instant::now;
        private TickSource tickSource;

        public Builder withInvoker(CallbackInvoker invoker) {
            this.invoker = invoker;
            return this;
        }

        public Builder withConfig(TimedCallbackConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(TimedCallbackObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(Supplier<Instant> wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Overrides the tick source selected by the configuration.
         */
        public Builder withTickSource(TickSource tickSource) {
            this.tickSource = tickSource;
            return this;
        }

        public TimedCallbackRuntime build() {
            Objects.requireNonNull(invoker, "invoker");
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");

            // 1. Delay source, optionally reproducible
            SplittableRandom random = config.randomSeed().isPresent()
                    ? new SplittableRandom(config.randomSeed().getAsLong())
                    : new SplittableRandom();

            // 2. Registry (creates the global processor)
            EventRegistry registry = new EventRegistry(invoker, random, observabilitySink, wallClock);

            // 3. Tick source
            TickSource source = tickSource;
            if (source == null) {
                source = config.useNettyTicks()
                        ? NettyEventLoopTickSource.dedicated(TICK_THREAD_NAME)
                        : ScheduledExecutorTickSource.singleThreaded(TICK_THREAD_NAME);
            }

            // 4. Driver
            TickDriver driver = new TickDriver(
                    registry,
                    source,
                    clock,
                    config.tickPolicy(),
                    observabilitySink,
                    wallClock
            );

            return new TimedCallbackRuntime(registry, driver, source);
        }
    }
}
