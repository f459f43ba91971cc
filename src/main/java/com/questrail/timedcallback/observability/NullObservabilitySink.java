package com.questrail.timedcallback.observability;

/**
 * No-op implementation of TimedCallbackObservabilitySink.
 */
public final class NullObservabilitySink implements TimedCallbackObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onProcessorLifecycle(ProcessorLifecycleEvent event) {}

    @Override
    public void onDrain(DrainEvent event) {}

    @Override
    public void onError(CallbackErrorEvent event) {}
}
