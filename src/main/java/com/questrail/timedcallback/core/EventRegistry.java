package com.questrail.timedcallback.core;

import com.questrail.timedcallback.api.CallbackInvoker;
import com.questrail.timedcallback.api.CancelScope;
import com.questrail.timedcallback.api.EventState;
import com.questrail.timedcallback.observability.NullObservabilitySink;
import com.questrail.timedcallback.observability.ProcessorLifecycleEvent;
import com.questrail.timedcallback.observability.TimedCallbackObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;

/**
 * EventRegistry
 * =============================================================================
 * Tracks every live {@link EventProcessor} of one engine instance and owns the
 * global processor used for callbacks that have no owning domain object.
 *
 * <h2>Ownership</h2>
 * <ul>
 *   <li>Owner processors belong to their domain objects. The registry keeps a
 *       non-owning membership record from {@link #newProcessor(Object)} until
 *       the processor is closed.</li>
 *   <li>The global processor belongs to the registry for its whole lifetime
 *       and is closed by {@link #shutdown()}.</li>
 * </ul>
 *
 * <h2>Locks</h2>
 * Two locks, never conflated:
 * <ol>
 *   <li><b>membership lock</b>, taken through {@link RegistrationGuard}, guards
 *       registration, deregistration, broadcasts and teardown;</li>
 *   <li><b>engine lock</b>, shared by every processor of this registry, guards
 *       all timeline and lookup mutation.</li>
 * </ol>
 * The membership lock is always the outer lock. Code running with the engine
 * lock already held (callbacks on the tick thread) does not wait on the
 * membership lock at all; it works against the copy-on-write membership set
 * directly. No thread can therefore hold the engine lock while waiting for the
 * membership lock.
 *
 * <h2>Threading</h2>
 * Processors may be created and closed from any thread, concurrently with each
 * other and with the thread driving {@link #advanceAll(long)}.
 */
public final class EventRegistry
{
    private static final Logger log = LoggerFactory.getLogger(EventRegistry.class);

    private final ReentrantLock membershipLock = new ReentrantLock();
    private final ReentrantLock engineLock = new ReentrantLock();

    private final Set<EventProcessor> processors = new CopyOnWriteArraySet<>();

    private final CallbackInvoker invoker;
    private final RandomGenerator random;
    private final TimedCallbackObservabilitySink observabilitySink;
    private final Supplier<Instant> wallClock;

    private final EventProcessor globalProcessor;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    /**
     * Creates a registry.
     *
     * @param invoker           scripting runtime boundary
     * @param random            source for delay draws; only used under the engine lock
     * @param observabilitySink receives lifecycle, drain and error events
     * @param wallClock         timestamps for observability only
     */
    public EventRegistry(CallbackInvoker invoker,
                         RandomGenerator random,
                         TimedCallbackObservabilitySink observabilitySink,
                         Supplier<Instant> wallClock)
    {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.random = Objects.requireNonNull(random, "random");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.globalProcessor = new EventProcessor(this, null);
    }

    public EventRegistry(CallbackInvoker invoker)
    {
        this(invoker, new SplittableRandom(), NullObservabilitySink.INSTANCE, Instant::now);
    }

    // -------------------------------------------------------------------------
    // Membership
    // -------------------------------------------------------------------------

    /**
     * Creates and registers a processor for {@code owner}.
     *
     * @throws IllegalStateException after {@link #shutdown()}
     */
    public EventProcessor newProcessor(Object owner)
    {
        Objects.requireNonNull(owner, "owner");

        EventProcessor processor;
        try (RegistrationGuard guard = membershipGuard()) {
            if (shutdown.get()) {
                throw new IllegalStateException("EventRegistry has shut down");
            }
            processor = new EventProcessor(this, owner);
            processors.add(processor);
        }

        observabilitySink.onProcessorLifecycle(new ProcessorLifecycleEvent(
                wallClock.get(),
                ProcessorLifecycleEvent.Kind.REGISTERED,
                String.valueOf(owner),
                0
        ));
        return processor;
    }

    /**
     * Deregisters and drains {@code processor}. Called by {@link EventProcessor#close()}.
     */
    void close(EventProcessor processor)
    {
        if (processor == globalProcessor) {
            log.debug("Ignoring close of the global processor; it is closed by shutdown()");
            return;
        }

        int drained;
        try (RegistrationGuard guard = membershipGuard()) {
            processors.remove(processor);
            engineLock.lock();
            try {
                drained = processor.closeLocked();
            } finally {
                engineLock.unlock();
            }
        }

        if (drained >= 0) {
            observabilitySink.onProcessorLifecycle(new ProcessorLifecycleEvent(
                    wallClock.get(),
                    ProcessorLifecycleEvent.Kind.CLOSED,
                    processor.owner().map(String::valueOf).orElse("global"),
                    drained
            ));
        }
    }

    public EventProcessor globalProcessor()
    {
        return globalProcessor;
    }

    public int registeredProcessorCount()
    {
        return processors.size();
    }

    public boolean isShutdown()
    {
        return shutdown.get();
    }

    // -------------------------------------------------------------------------
    // Broadcasts
    // -------------------------------------------------------------------------

    /**
     * Sets the state of every live event in every registered processor and in
     * the global processor.
     */
    public void setStates(EventState state)
    {
        Objects.requireNonNull(state, "state");

        try (RegistrationGuard guard = membershipGuard()) {
            for (EventProcessor processor : processors) {
                processor.setStates(state);
            }
            globalProcessor.setStates(state);
        }
    }

    /**
     * Sets the state of the event bound to {@code handle} wherever it lives.
     */
    public void setState(int handle, EventState state)
    {
        Objects.requireNonNull(state, "state");

        try (RegistrationGuard guard = membershipGuard()) {
            for (EventProcessor processor : processors) {
                processor.setState(handle, state);
            }
            globalProcessor.setState(handle, state);
        }
    }

    /**
     * Cancels {@code handle} lazily: the callback will not run again and its
     * handle is released once its due time is reached.
     */
    public void cancel(int handle, CancelScope scope)
    {
        Objects.requireNonNull(scope, "scope");
        if (scope == CancelScope.ALL_PROCESSORS) {
            setState(handle, EventState.ABORT);
        } else {
            globalProcessor.setState(handle, EventState.ABORT);
        }
    }

    /**
     * Cancels every callback in {@code scope} lazily.
     */
    public void cancelAll(CancelScope scope)
    {
        Objects.requireNonNull(scope, "scope");
        if (scope == CancelScope.ALL_PROCESSORS) {
            setStates(EventState.ABORT);
        } else {
            globalProcessor.setStates(EventState.ABORT);
        }
    }

    // -------------------------------------------------------------------------
    // Ticking
    // -------------------------------------------------------------------------

    /**
     * Advances the global processor and then every registered processor by
     * {@code elapsed}.
     *
     * <p>Iterates a snapshot of the membership without holding the membership
     * lock, so registration from other threads is not blocked for the length
     * of a tick. A processor closed after the snapshot was taken is skipped
     * by its own closed check.</p>
     */
    public void advanceAll(long elapsed)
    {
        globalProcessor.advance(elapsed);
        for (EventProcessor processor : processors) {
            processor.advance(elapsed);
        }
    }

    // -------------------------------------------------------------------------
    // Teardown
    // -------------------------------------------------------------------------

    /**
     * Drains every registered processor and the global processor, then closes
     * the global processor. Processors still registered stay open; their
     * owners close them. Idempotent.
     */
    public void shutdown()
    {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }

        int remaining;
        try (RegistrationGuard guard = membershipGuard()) {
            engineLock.lock();
            try {
                for (EventProcessor processor : processors) {
                    processor.drainAll();
                }
                globalProcessor.closeLocked();
                remaining = processors.size();
            } finally {
                engineLock.unlock();
            }
        }

        if (remaining > 0) {
            log.warn("EventRegistry shut down with {} owner processors still registered", remaining);
        } else {
            log.debug("EventRegistry shut down");
        }
    }

    // -------------------------------------------------------------------------
    // Shared collaborators for processors
    // -------------------------------------------------------------------------

    ReentrantLock engineLock()
    {
        return engineLock;
    }

    CallbackInvoker invoker()
    {
        return invoker;
    }

    RandomGenerator random()
    {
        return random;
    }

    TimedCallbackObservabilitySink observabilitySink()
    {
        return observabilitySink;
    }

    Supplier<Instant> wallClock()
    {
        return wallClock;
    }

    private RegistrationGuard membershipGuard()
    {
        if (engineLock.isHeldByCurrentThread()) {
            return RegistrationGuard.unguarded();
        }
        return RegistrationGuard.acquire(membershipLock);
    }
}
