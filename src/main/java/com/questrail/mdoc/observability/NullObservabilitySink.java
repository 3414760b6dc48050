package com.questrail.mdoc.observability;

/**
 * No-op implementation of LinkObservabilitySink.
 */
public final class NullObservabilitySink implements LinkObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(LinkStateTransitionEvent event) {}

    @Override
    public void onWarning(LinkWarningEvent event) {}

    @Override
    public void onError(LinkErrorEvent event) {}
}
