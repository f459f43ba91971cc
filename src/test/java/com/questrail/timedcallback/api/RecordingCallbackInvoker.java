package com.questrail.timedcallback.api;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Test double for the scripting runtime.
 *
 * Records every invocation and release, lets a test attach an action that
 * runs inside a given handle's callback, and exposes the liveness probes as
 * switches.
 */
public final class RecordingCallbackInvoker implements CallbackInvoker {

    public record Invocation(int handle, long delayUsed, int repeatsToReport, Object owner) {
    }

    private final List<Invocation> invocations = new ArrayList<>();
    private final List<Integer> releases = new ArrayList<>();
    private final Map<Integer, Consumer<Invocation>> actions = new HashMap<>();

    private volatile boolean systemLive = true;
    private volatile boolean activeContext = true;

    @Override
    public void invoke(int handle, long delayUsed, int repeatsToReport, Object owner) {
        Invocation invocation = new Invocation(handle, delayUsed, repeatsToReport, owner);
        Consumer<Invocation> action;
        synchronized (this) {
            invocations.add(invocation);
            action = actions.get(handle);
        }
        if (action != null) {
            action.accept(invocation);
        }
    }

    @Override
    public synchronized void release(int handle) {
        releases.add(handle);
    }

    @Override
    public boolean isSystemLive() {
        return systemLive;
    }

    @Override
    public boolean hasActiveContext() {
        return activeContext;
    }

    /**
     * Run {@code action} inside every invocation of {@code handle}.
     */
    public synchronized void onInvoke(int handle, Consumer<Invocation> action) {
        actions.put(handle, action);
    }

    public void setSystemLive(boolean systemLive) {
        this.systemLive = systemLive;
    }

    public void setActiveContext(boolean activeContext) {
        this.activeContext = activeContext;
    }

    public synchronized List<Invocation> invocations() {
        return new ArrayList<>(invocations);
    }

    public synchronized List<Integer> invokedHandles() {
        return invocations.stream().map(Invocation::handle).collect(Collectors.toList());
    }

    public synchronized List<Integer> reportedRepeats(int handle) {
        return invocations.stream()
                .filter(i -> i.handle() == handle)
                .map(Invocation::repeatsToReport)
                .collect(Collectors.toList());
    }

    public synchronized List<Integer> releases() {
        return new ArrayList<>(releases);
    }

    public synchronized long releaseCount(int handle) {
        return releases.stream().filter(h -> h == handle).count();
    }
}
