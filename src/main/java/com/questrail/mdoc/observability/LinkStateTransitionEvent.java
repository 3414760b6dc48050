package com.questrail.mdoc.observability;

import com.questrail.mdoc.transport.internal.events.LinkEvent;
import com.questrail.mdoc.transport.internal.state.LinkIntents;
import com.questrail.mdoc.transport.internal.state.LinkState;

import java.time.Instant;

/**
 * Record representing one step of the link state machine.
 */
public record LinkStateTransitionEvent(
    Instant timestamp,
    LinkState oldState,
    LinkState newState,
    LinkEvent triggeringEvent,
    LinkIntents resultingIntents
) {
    /**
     * Checks if the link phase changed during this transition.
     */
    public boolean isPhaseChange() {
        return oldState.phase() != newState.phase();
    }

    /**
     * Checks if the transport mode changed (GATT to socket).
     */
    public boolean isModeChange() {
        return oldState.mode() != newState.mode();
    }
}
