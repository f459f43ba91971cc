package com.questrail.timedcallback.time;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tick source that ticks only when a test calls {@link #fire()}.
 *
 * Runs ticks on the calling thread, in registration order.
 */
public final class DeterministicTickSource implements TickSource {

    private final List<Registration> registrations = new ArrayList<>();
    private boolean shutdown;

    @Override
    public Cancellable scheduleAtFixedRate(Duration period, Runnable tick) {
        Registration registration = new Registration(period, tick);
        registrations.add(registration);
        return registration;
    }

    /**
     * Run one tick of every active registration.
     */
    public void fire() {
        for (Registration registration : new ArrayList<>(registrations)) {
            if (!registration.cancelled.get()) {
                registration.tick.run();
            }
        }
    }

    /**
     * Advance {@code clock} by {@code millis}, then tick once.
     */
    public void advanceAndFire(ManualMonotonicClock clock, long millis) {
        clock.advanceMillis(millis);
        fire();
    }

    public int activeRegistrations() {
        return (int) registrations.stream().filter(r -> !r.cancelled.get()).count();
    }

    public Duration lastPeriod() {
        return registrations.isEmpty() ? null : registrations.get(registrations.size() - 1).period;
    }

    @Override
    public void shutdown() {
        shutdown = true;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    private static final class Registration implements Cancellable {
        private final Duration period;
        private final Runnable tick;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        private Registration(Duration period, Runnable tick) {
            this.period = period;
            this.tick = tick;
        }

        @Override
        public boolean cancel() {
            return cancelled.compareAndSet(false, true);
        }
    }
}
