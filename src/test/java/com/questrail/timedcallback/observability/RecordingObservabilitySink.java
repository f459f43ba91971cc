package com.questrail.timedcallback.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements TimedCallbackObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onProcessorLifecycle(ProcessorLifecycleEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onDrain(DrainEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(CallbackErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<CallbackErrorEvent> getErrors() {
        return events.stream()
            .filter(e -> e instanceof CallbackErrorEvent)
            .map(e -> (CallbackErrorEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<DrainEvent> getDrains() {
        return events.stream()
            .filter(e -> e instanceof DrainEvent)
            .map(e -> (DrainEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<ProcessorLifecycleEvent> getLifecycle() {
        return events.stream()
            .filter(e -> e instanceof ProcessorLifecycleEvent)
            .map(e -> (ProcessorLifecycleEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
