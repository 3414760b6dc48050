package com.questrail.mdoc.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of LinkObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jLinkObservabilitySink implements LinkObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jLinkObservabilitySink.class);

    @Override
    public void onStateTransition(LinkStateTransitionEvent event) {
        if (event.isPhaseChange()) {
            log.info("mdoc link {}: Phase {} -> {}",
                event.newState().deviceId(),
                event.oldState().phase(),
                event.newState().phase());
        }
        if (event.isModeChange()) {
            log.info("mdoc link {}: Mode {} -> {}",
                event.newState().deviceId(),
                event.oldState().mode(),
                event.newState().mode());
        }
        if (log.isTraceEnabled()) {
            log.trace("mdoc link event {} -> {}", event.triggeringEvent(), event.resultingIntents());
        }
    }

    @Override
    public void onWarning(LinkWarningEvent event) {
        log.warn("mdoc link {}: {}", event.deviceId(), event.message());
    }

    @Override
    public void onError(LinkErrorEvent event) {
        log.error("mdoc link error ({}): {}", event.kind(), event.message(), event.cause());
    }
}
