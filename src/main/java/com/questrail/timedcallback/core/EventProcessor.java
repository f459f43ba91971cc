package com.questrail.timedcallback.core;

import com.questrail.timedcallback.api.CallbackInvoker;
import com.questrail.timedcallback.api.EventState;
import com.questrail.timedcallback.observability.CallbackErrorEvent;
import com.questrail.timedcallback.observability.DrainEvent;
import com.questrail.timedcallback.observability.TimedCallbackObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;

/**
 * EventProcessor
 * =============================================================================
 * Per-owner collection of {@link ScheduledEvent}s driven by a logical clock.
 *
 * <h2>Structures</h2>
 * <ul>
 *   <li><b>events</b>: the owning table, keyed by the event's stable id. An event
 *       is live exactly while it is in this table.</li>
 *   <li><b>timeline</b>: secondary index ordered by absolute due time, then by
 *       insertion sequence (FIFO among equal due times). Values are event ids.</li>
 *   <li><b>lookup</b>: secondary index from callback handle to event id. Holds
 *       only events whose state is not {@link EventState#ERASED}.</li>
 * </ul>
 *
 * <p>Every event in the owning table occupies exactly one timeline slot. The
 * one exception is an event executing its final run: it is unlinked from all
 * three structures before its callback is invoked and discarded afterwards.</p>
 *
 * <h2>Cancellation</h2>
 * Cancellation is lazy. Setting {@link EventState#ABORT} or
 * {@link EventState#ERASED} does not unlink the timeline slot; the event is
 * skipped and removed when {@link #advance(long)} reaches its due time. Only
 * {@link #drainAll()} (and {@link #close()}) remove events early.
 *
 * <h2>Threading</h2>
 * Every operation takes the engine lock shared by all processors of the same
 * {@link EventRegistry}. Callbacks run inline on the thread calling
 * {@link #advance(long)} with that lock held; the lock is reentrant so a
 * callback may call back into any processor.
 *
 * <h2>Lifecycle</h2>
 * Owner processors are created by {@link EventRegistry#newProcessor(Object)}
 * and closed by their owner. The global processor is created, owned and
 * closed by the registry.
 */
public final class EventProcessor implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(EventProcessor.class);

    /**
     * Timeline slot: absolute due time, then insertion sequence.
     */
    record TimelineKey(long dueTime, long sequence) implements Comparable<TimelineKey>
    {
        @Override
        public int compareTo(TimelineKey o)
        {
            int byDue = Long.compare(dueTime, o.dueTime);
            return byDue != 0 ? byDue : Long.compare(sequence, o.sequence);
        }
    }

    private final EventRegistry registry;
    private final ReentrantLock engineLock;
    private final CallbackInvoker invoker;
    private final RandomGenerator random;
    private final TimedCallbackObservabilitySink observabilitySink;
    private final Supplier<Instant> wallClock;

    /**
     * Non-owning back-reference. {@code null} for the global processor.
     */
    private final Object owner;

    private final Map<Long, ScheduledEvent> events = new HashMap<>();
    private final NavigableMap<TimelineKey, Long> timeline = new TreeMap<>();
    private final Map<Integer, Long> lookup = new HashMap<>();

    private long clock;
    private long nextEventId;
    private long nextSequence;
    private volatile boolean closed;

    EventProcessor(EventRegistry registry, Object owner)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.engineLock = registry.engineLock();
        this.invoker = registry.invoker();
        this.random = registry.random();
        this.observabilitySink = registry.observabilitySink();
        this.wallClock = registry.wallClock();
        this.owner = owner;
    }

    // -------------------------------------------------------------------------
    // Scheduling
    // -------------------------------------------------------------------------

    /**
     * Schedules {@code handle} to fire after a delay drawn from
     * {@code [minDelay, maxDelay]}, {@code repeats} times ({@code 0} = forever).
     *
     * <p>If {@code handle} already has a live entry in this processor, that
     * entry is unlinked and replaced. The handle is not released, since the
     * replacement still uses it.</p>
     *
     * <p>A processor that is closed, or whose registry has shut down, drops
     * the request and returns {@code false}. Callbacks that reschedule while
     * their owner is being torn down therefore need no special handling.</p>
     *
     * @return {@code true} if the event was accepted
     * @throws IllegalArgumentException on a negative bound or repeat count, on
     *         {@code minDelay > maxDelay}, or on a forever-repeating event with
     *         {@code maxDelay == 0}
     */
    public boolean schedule(int handle, long minDelay, long maxDelay, int repeats)
    {
        if (minDelay < 0 || maxDelay < 0) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        if (minDelay > maxDelay) {
            throw new IllegalArgumentException("minDelay must be <= maxDelay");
        }
        if (repeats < 0) {
            throw new IllegalArgumentException("repeats must be >= 0");
        }
        if (repeats == 0 && maxDelay == 0) {
            throw new IllegalArgumentException("a forever-repeating event needs maxDelay > 0");
        }

        engineLock.lock();
        try {
            if (closed || registry.isShutdown()) {
                log.debug("Dropping schedule of handle {} on {}: no longer accepting events", handle, describeOwner());
                return false;
            }

            // Draw before touching any structure.
            ScheduledEvent event = new ScheduledEvent(nextEventId++, handle, minDelay, maxDelay, repeats);
            event.drawDelay(random);

            Long prior = lookup.get(handle);
            if (prior != null) {
                supersede(prior);
            }

            events.put(event.id(), event);
            insert(event);
            return true;
        } finally {
            engineLock.unlock();
        }
    }

    /**
     * Advances the logical clock by {@code elapsed} and runs every event whose
     * due time has been reached, in due-time order.
     *
     * <p>A repeating event is put back on the timeline <em>before</em> its
     * callback runs, so a callback that cancels its own handle cancels the
     * next run. Entries made due by that reschedule (zero delay) are picked
     * up in the same pass.</p>
     *
     * <p>A callback that throws is reported to the observability sink; the
     * drain carries on with the next entry.</p>
     */
    public void advance(long elapsed)
    {
        if (elapsed < 0) {
            throw new IllegalArgumentException("elapsed must be >= 0");
        }

        engineLock.lock();
        try {
            if (closed) {
                return;
            }
            clock = saturatedAdd(clock, elapsed);

            Map.Entry<TimelineKey, Long> head;
            while ((head = timeline.firstEntry()) != null && head.getKey().dueTime() <= clock) {
                timeline.remove(head.getKey());

                ScheduledEvent event = events.get(head.getValue());
                if (event == null) {
                    throw new IllegalStateException(
                            "Timeline slot " + head.getKey() + " of " + describeOwner() + " refers to a missing event");
                }
                event.setTimelineKey(null);

                if (event.state() != EventState.ERASED) {
                    unindex(event);
                }

                if (event.state() == EventState.RUN) {
                    long delayUsed = event.delay();
                    boolean remove = event.isFinalRun();
                    if (remove) {
                        events.remove(event.id());
                    } else {
                        // Reschedule first so self-cancellation hits the next run.
                        link(event);
                    }

                    runCallback(event, delayUsed, event.consumeRepeat());

                    if (!remove) {
                        continue;
                    }
                } else {
                    events.remove(event.id());
                }

                // Final run done, or aborted/erased.
                discard(event);
            }
        } finally {
            engineLock.unlock();
        }
    }

    // -------------------------------------------------------------------------
    // State changes
    // -------------------------------------------------------------------------

    /**
     * Sets the state of every live event. {@link EventState#ERASED} also
     * empties the lookup index at once; timeline slots are swept by the next
     * {@link #advance(long)}.
     *
     * <p>{@code ERASED} is terminal: erased events are not revived.</p>
     */
    public void setStates(EventState state)
    {
        Objects.requireNonNull(state, "state");

        engineLock.lock();
        try {
            if (closed) {
                return;
            }
            for (ScheduledEvent event : events.values()) {
                if (event.state() != EventState.ERASED) {
                    event.setState(state);
                }
            }
            if (state == EventState.ERASED) {
                lookup.clear();
            }
        } finally {
            engineLock.unlock();
        }
    }

    /**
     * Sets the state of the live event bound to {@code handle}. Unknown
     * handles are ignored.
     */
    public void setState(int handle, EventState state)
    {
        Objects.requireNonNull(state, "state");

        engineLock.lock();
        try {
            if (closed) {
                return;
            }
            Long id = lookup.get(handle);
            if (id == null) {
                return;
            }
            events.get(id).setState(state);
            if (state == EventState.ERASED) {
                lookup.remove(handle);
            }
        } finally {
            engineLock.unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Teardown
    // -------------------------------------------------------------------------

    /**
     * Removes every event regardless of due time or state, releasing each
     * handle that is still the scheduler's to release. Leaves the processor
     * empty but open.
     */
    public void drainAll()
    {
        engineLock.lock();
        try {
            drainLocked();
        } finally {
            engineLock.unlock();
        }
    }

    /**
     * Drains this processor and removes it from its registry. Idempotent.
     *
     * <p>Closing the global processor is ignored; the registry closes it
     * during {@link EventRegistry#shutdown()}.</p>
     */
    @Override
    public void close()
    {
        registry.close(this);
    }

    /**
     * Drains and marks closed. Caller holds the engine lock.
     *
     * @return events drained, or {@code -1} if already closed
     */
    int closeLocked()
    {
        if (closed) {
            return -1;
        }
        int drained = drainLocked();
        closed = true;
        return drained;
    }

    private int drainLocked()
    {
        List<ScheduledEvent> pending = new ArrayList<>(timeline.size());
        for (Map.Entry<TimelineKey, Long> slot : timeline.entrySet()) {
            ScheduledEvent event = events.get(slot.getValue());
            if (event == null) {
                throw new IllegalStateException(
                        "Timeline slot " + slot.getKey() + " of " + describeOwner() + " refers to a missing event");
            }
            pending.add(event);
        }

        timeline.clear();
        events.clear();
        lookup.clear();

        int released = 0;
        for (ScheduledEvent event : pending) {
            event.setTimelineKey(null);
            if (discard(event)) {
                released++;
            }
        }

        if (!pending.isEmpty()) {
            observabilitySink.onDrain(new DrainEvent(wallClock.get(), describeOwner(), pending.size(), released));
        }
        return pending.size();
    }

    // -------------------------------------------------------------------------
    // Queries
    // -------------------------------------------------------------------------

    /**
     * Returns {@code true} while {@code handle} has a live, non-erased entry
     * here. Aborted entries count until their due time is reached.
     */
    public boolean isScheduled(int handle)
    {
        engineLock.lock();
        try {
            return lookup.containsKey(handle);
        } finally {
            engineLock.unlock();
        }
    }

    /**
     * Returns the state of the live entry for {@code handle}, if any.
     */
    public Optional<EventState> stateOf(int handle)
    {
        engineLock.lock();
        try {
            Long id = lookup.get(handle);
            return id == null ? Optional.empty() : Optional.of(events.get(id).state());
        } finally {
            engineLock.unlock();
        }
    }

    /**
     * Returns the absolute logical due time of the entry for {@code handle}, if any.
     */
    public OptionalLong dueTime(int handle)
    {
        engineLock.lock();
        try {
            Long id = lookup.get(handle);
            if (id == null) {
                return OptionalLong.empty();
            }
            TimelineKey key = events.get(id).timelineKey();
            return key == null ? OptionalLong.empty() : OptionalLong.of(key.dueTime());
        } finally {
            engineLock.unlock();
        }
    }

    /**
     * Number of occupied timeline slots, including aborted and erased events
     * that have not yet been swept.
     */
    public int pendingCount()
    {
        engineLock.lock();
        try {
            return timeline.size();
        } finally {
            engineLock.unlock();
        }
    }

    /**
     * Current logical time of this processor.
     */
    public long clock()
    {
        engineLock.lock();
        try {
            return clock;
        } finally {
            engineLock.unlock();
        }
    }

    public Optional<Object> owner()
    {
        return Optional.ofNullable(owner);
    }

    public boolean isGlobal()
    {
        return owner == null;
    }

    public boolean isClosed()
    {
        return closed;
    }

    /**
     * Verifies that the owning table and both indexes agree.
     *
     * @throws IllegalStateException describing the first inconsistency found
     */
    public void assertConsistent()
    {
        engineLock.lock();
        try {
            if (timeline.size() != events.size()) {
                throw new IllegalStateException(
                        "timeline has " + timeline.size() + " slots but " + events.size() + " events are owned");
            }
            for (Map.Entry<TimelineKey, Long> slot : timeline.entrySet()) {
                ScheduledEvent event = events.get(slot.getValue());
                if (event == null) {
                    throw new IllegalStateException("timeline slot " + slot.getKey() + " refers to a missing event");
                }
                if (!slot.getKey().equals(event.timelineKey())) {
                    throw new IllegalStateException(event + " is linked to " + event.timelineKey()
                            + " but occupies " + slot.getKey());
                }
            }
            for (Map.Entry<Integer, Long> entry : lookup.entrySet()) {
                ScheduledEvent event = events.get(entry.getValue());
                if (event == null) {
                    throw new IllegalStateException("lookup entry for handle " + entry.getKey() + " refers to a missing event");
                }
                if (event.handle() != entry.getKey()) {
                    throw new IllegalStateException("lookup entry for handle " + entry.getKey() + " refers to " + event);
                }
                if (event.state() == EventState.ERASED) {
                    throw new IllegalStateException("lookup holds erased " + event);
                }
            }
        } finally {
            engineLock.unlock();
        }
    }

    @Override
    public String toString()
    {
        return "EventProcessor{" + describeOwner() + "}";
    }

    // -------------------------------------------------------------------------
    // Internals (engine lock held)
    // -------------------------------------------------------------------------

    private void link(ScheduledEvent event)
    {
        event.drawDelay(random);
        insert(event);
    }

    /**
     * Puts {@code event} on the timeline at its already drawn delay.
     */
    private void insert(ScheduledEvent event)
    {
        TimelineKey key = new TimelineKey(saturatedAdd(clock, event.delay()), nextSequence++);
        timeline.put(key, event.id());
        event.setTimelineKey(key);
        lookup.put(event.handle(), event.id());
    }

    private void unindex(ScheduledEvent event)
    {
        lookup.remove(event.handle(), event.id());
    }

    /**
     * Drops a live event whose handle is being rebound. No release.
     */
    private void supersede(long id)
    {
        ScheduledEvent old = events.remove(id);
        if (old == null) {
            throw new IllegalStateException("lookup of " + describeOwner() + " refers to missing event " + id);
        }
        TimelineKey key = old.timelineKey();
        if (key != null) {
            timeline.remove(key);
            old.setTimelineKey(null);
        }
        unindex(old);
        old.setState(EventState.ERASED);
    }

    private void runCallback(ScheduledEvent event, long delayUsed, int repeatsToReport)
    {
        try {
            invoker.invoke(event.handle(), delayUsed, repeatsToReport, owner);
        } catch (RuntimeException e) {
            observabilitySink.onError(new CallbackErrorEvent(
                    wallClock.get(),
                    event.handle(),
                    "callback raised an exception on " + describeOwner(),
                    e
            ));
        }
    }

    /**
     * Final step for an event leaving the processor. Releases the handle
     * unless it is erased, rebound to another live event, or the scripting
     * context is gone, then marks the event erased so it can never be
     * released twice.
     *
     * @return {@code true} if the handle was released
     */
    private boolean discard(ScheduledEvent event)
    {
        boolean released = false;
        if (event.state() != EventState.ERASED
                && !isRebound(event)
                && invoker.isSystemLive()
                && invoker.hasActiveContext()) {
            try {
                invoker.release(event.handle());
                released = true;
            } catch (RuntimeException e) {
                observabilitySink.onError(new CallbackErrorEvent(
                        wallClock.get(),
                        event.handle(),
                        "handle release failed on " + describeOwner(),
                        e
                ));
            }
        }
        event.setState(EventState.ERASED);
        return released;
    }

    private boolean isRebound(ScheduledEvent event)
    {
        Long current = lookup.get(event.handle());
        return current != null && current != event.id();
    }

    /**
     * Both operands are non-negative; sums past {@code Long.MAX_VALUE} pin to it.
     */
    private static long saturatedAdd(long a, long b)
    {
        return b > Long.MAX_VALUE - a ? Long.MAX_VALUE : a + b;
    }

    private String describeOwner()
    {
        return owner == null ? "global" : String.valueOf(owner);
    }
}
