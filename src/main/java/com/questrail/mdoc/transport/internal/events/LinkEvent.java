package com.questrail.mdoc.transport.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * LinkEvent
 * -----------------------------------------------------------------------------
 * Marker interface for every input processed by the link state machine.
 *
 * <h2>Role in the architecture</h2>
 * The link is modeled as an event-driven, actor-style system. State changes
 * happen only in response to {@link LinkEvent}s, processed one at a time.
 * Events come from three places:
 * <ul>
 *   <li>GATT and L2CAP port callbacks ({@link GattEvent}, {@link L2capEvent})</li>
 *   <li>Application requests ({@link LinkRequestEvent})</li>
 *   <li>Timers armed by the executor ({@link LinkTimerEvent})</li>
 * </ul>
 *
 * Events are immutable and carry only what is needed to advance state.
 */
public interface LinkEvent
{
    /**
     * Time at which the event was observed. Used for tracing only; deadlines
     * are computed on the monotonic clock.
     */
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements LinkEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName();
        }
    }
}
