package com.questrail.timedcallback.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of TimedCallbackObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jObservabilitySink implements TimedCallbackObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jObservabilitySink.class);

    @Override
    public void onProcessorLifecycle(ProcessorLifecycleEvent event) {
        if (event.kind() == ProcessorLifecycleEvent.Kind.REGISTERED) {
            log.debug("Processor registered for {}", event.owner());
        } else {
            log.debug("Processor closed for {} ({} pending events drained)",
                event.owner(),
                event.drained());
        }
    }

    @Override
    public void onDrain(DrainEvent event) {
        if (event.drained() == 0) {
            return;
        }
        if (event.hasUnreleased()) {
            log.info("Drained {} events for {}; {} handles released, {} left to the scripting context",
                event.drained(),
                event.owner(),
                event.released(),
                event.drained() - event.released());
        } else {
            log.info("Drained {} events for {}", event.drained(), event.owner());
        }
    }

    @Override
    public void onError(CallbackErrorEvent event) {
        if (event.handle() == CallbackErrorEvent.NO_HANDLE) {
            log.error("Timed callback error: {}", event.message(), event.cause());
        } else {
            log.error("Timed callback {} failed: {}", event.handle(), event.message(), event.cause());
        }
    }
}
