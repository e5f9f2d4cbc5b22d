package com.questrail.mdoc.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of MdocObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jMdocObservabilitySink implements MdocObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jMdocObservabilitySink.class);

    @Override
    public void onTransportStateTransition(TransportStateTransitionEvent event) {
        if (event.isTerminal()) {
            log.info("{} transport ({}): {} -> {}",
                event.transport(), event.role(), event.oldState(), event.newState());
        } else {
            log.debug("{} transport ({}): {} -> {}",
                event.transport(), event.role(), event.oldState(), event.newState());
        }
    }

    @Override
    public void onSessionEvent(SessionObservabilityEvent event) {
        log.info("Session {} ({}): {}", event.kind(), event.role(), event.detail());
    }

    @Override
    public void onError(MdocErrorEvent event) {
        log.error("mdoc error: {}", event.message(), event.cause());
    }
}
