package com.questrail.mdoc.observability;

/**
 * Main interface for receiving link observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface LinkObservabilitySink {
    /**
     * Called after every event the link state machine processed.
     * @param event the transition details
     */
    void onStateTransition(LinkStateTransitionEvent event);

    /**
     * Called for degraded but non-fatal conditions (MTU fallback, ident
     * mismatch, short chunk).
     * @param event the warning
     */
    void onWarning(LinkWarningEvent event);

    /**
     * Called when an error or anomaly occurs in the transport stack.
     * @param event the error event
     */
    void onError(LinkErrorEvent event);
}
