package com.questrail.mdoc.transport.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * L2capEvent
 * -----------------------------------------------------------------------------
 * Lifecycle and traffic of the connection-oriented socket path.
 *
 * <p>The channel handle itself stays with the executor; the reducer only
 * learns that the socket is up, down or carried a message.</p>
 */
public sealed interface L2capEvent extends LinkEvent
        permits L2capEvent.Connected,
                L2capEvent.ConnectFailed,
                L2capEvent.MessageReceived,
                L2capEvent.Closed
{
    final class Connected extends LinkEvent.Base implements L2capEvent {
        public Connected(Instant timestamp) {
            super(timestamp);
        }
    }

    final class ConnectFailed extends LinkEvent.Base implements L2capEvent {
        private final Throwable cause;

        public ConnectFailed(Instant timestamp, Throwable cause) {
            super(timestamp);
            this.cause = cause;
        }

        public Throwable cause() {
            return cause;
        }
    }

    /** One whole, length-delimited message. */
    final class MessageReceived extends LinkEvent.Base implements L2capEvent {
        private final byte[] message;

        public MessageReceived(Instant timestamp, byte[] message) {
            super(timestamp);
            this.message = Objects.requireNonNull(message, "message").clone();
        }

        public byte[] message() {
            return message.clone();
        }
    }

    final class Closed extends LinkEvent.Base implements L2capEvent {
        private final Throwable cause;

        public Closed(Instant timestamp, Throwable cause) {
            super(timestamp);
            this.cause = cause;
        }

        /** Failure cause, or {@code null} for an orderly close. */
        public Throwable cause() {
            return cause;
        }
    }
}
