package com.questrail.timedcallback.core;

import com.questrail.timedcallback.api.EventState;

import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * ScheduledEvent
 * -----------------------------------------------------------------------------
 * One pending callback, exclusively owned by a single {@link EventProcessor}.
 *
 * <p>Instances are created by {@link EventProcessor#schedule(int, long, long, int)}
 * and are only mutated while the engine lock is held. The {@code id} is stable
 * for the lifetime of the event, including across reschedules; the processor's
 * timeline and lookup index refer to events by this id only.</p>
 *
 * <h2>Repeat counting</h2>
 * {@code repeatsRemaining == 0} means "repeat forever". {@code 1} means the
 * next execution is the final one.
 */
public final class ScheduledEvent
{
    private final long id;
    private final int handle;
    private final long minDelay;
    private final long maxDelay;

    private long delay;
    private int repeatsRemaining;
    private EventState state = EventState.RUN;

    /**
     * Timeline slot currently holding this event, or {@code null} when the
     * event is not on the timeline (executing its final run, or discarded).
     */
    private EventProcessor.TimelineKey timelineKey;

    ScheduledEvent(long id, int handle, long minDelay, long maxDelay, int repeats)
    {
        this.id = id;
        this.handle = handle;
        this.minDelay = minDelay;
        this.maxDelay = maxDelay;
        this.repeatsRemaining = repeats;
    }

    /**
     * Sets {@link #delay()} to a value drawn uniformly from
     * {@code [minDelay, maxDelay]}, or exactly {@code minDelay} when the bounds
     * are equal.
     */
    void drawDelay(RandomGenerator random)
    {
        Objects.requireNonNull(random, "random");
        if (minDelay == maxDelay) {
            delay = minDelay;
        } else if (maxDelay < Long.MAX_VALUE) {
            // Upper bound is exclusive.
            delay = random.nextLong(minDelay, maxDelay + 1);
        } else {
            // maxDelay + 1 would overflow; shift the range down by one instead.
            delay = random.nextLong(minDelay - 1, maxDelay) + 1;
        }
    }

    /**
     * Returns the count to report for the run about to happen and consumes
     * one execution. Forever-repeating events report {@code 0} and are not
     * decremented.
     */
    int consumeRepeat()
    {
        int report = repeatsRemaining;
        if (repeatsRemaining != 0) {
            repeatsRemaining--;
        }
        return report;
    }

    boolean isFinalRun()
    {
        return repeatsRemaining == 1;
    }

    void setState(EventState state)
    {
        this.state = Objects.requireNonNull(state, "state");
    }

    EventProcessor.TimelineKey timelineKey()
    {
        return timelineKey;
    }

    void setTimelineKey(EventProcessor.TimelineKey timelineKey)
    {
        this.timelineKey = timelineKey;
    }

    long id()
    {
        return id;
    }

    public int handle()
    {
        return handle;
    }

    public long minDelay()
    {
        return minDelay;
    }

    public long maxDelay()
    {
        return maxDelay;
    }

    /**
     * The delay drawn at the most recent (re)schedule.
     */
    public long delay()
    {
        return delay;
    }

    public int repeatsRemaining()
    {
        return repeatsRemaining;
    }

    public EventState state()
    {
        return state;
    }

    @Override
    public String toString()
    {
        return "ScheduledEvent{handle=" + handle
                + ", delay=" + delay
                + ", range=[" + minDelay + ", " + maxDelay + "]"
                + ", repeatsRemaining=" + repeatsRemaining
                + ", state=" + state + "}";
    }
}
