package com.questrail.mdoc.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements LinkObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(LinkStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onWarning(LinkWarningEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(LinkErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<LinkStateTransitionEvent> getStateTransitions() {
        return ofType(LinkStateTransitionEvent.class);
    }

    public synchronized List<LinkWarningEvent> getWarnings() {
        return ofType(LinkWarningEvent.class);
    }

    public synchronized List<LinkErrorEvent> getErrors() {
        return ofType(LinkErrorEvent.class);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
