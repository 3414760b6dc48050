package com.questrail.mdoc.transport.internal.events;

import java.time.Instant;

/**
 * LinkTimerEvent
 * -----------------------------------------------------------------------------
 * Expiry of a timer armed by the executor. A timer that fires after the
 * phase it guarded has ended is ignored by the reducer.
 */
public sealed interface LinkTimerEvent extends LinkEvent
        permits LinkTimerEvent.MtuTimeout, LinkTimerEvent.LingerElapsed
{
    /** No MTU callback arrived within the negotiation timeout. */
    final class MtuTimeout extends LinkEvent.Base implements LinkTimerEvent {
        public MtuTimeout(Instant timestamp) {
            super(timestamp);
        }
    }

    /** The shutdown grace period after the outbound queue drained has passed. */
    final class LingerElapsed extends LinkEvent.Base implements LinkTimerEvent {
        public LingerElapsed(Instant timestamp) {
            super(timestamp);
        }
    }
}
