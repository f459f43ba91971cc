package com.questrail.timedcallback.observability;

/**
 * Receives scheduler observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface TimedCallbackObservabilitySink {
    /**
     * Called when a processor is registered with, or closed and removed from, the registry.
     * @param event the lifecycle event details
     */
    void onProcessorLifecycle(ProcessorLifecycleEvent event);

    /**
     * Called after a processor has been force-drained.
     * @param event the drain summary
     */
    void onDrain(DrainEvent event);

    /**
     * Called when a callback or a tick fails.
     * @param event the error event
     */
    void onError(CallbackErrorEvent event);
}
