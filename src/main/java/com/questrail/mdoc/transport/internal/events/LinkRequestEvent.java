package com.questrail.mdoc.transport.internal.events;

import com.questrail.mdoc.api.PeerCandidate;

import java.time.Instant;
import java.util.Objects;

/**
 * LinkRequestEvent
 * -----------------------------------------------------------------------------
 * Application calls on {@link com.questrail.mdoc.api.ProximityTransport},
 * turned into events so they are serialized with port callbacks.
 */
public sealed interface LinkRequestEvent extends LinkEvent
        permits LinkRequestEvent.ConnectRequested,
                LinkRequestEvent.SendRequested,
                LinkRequestEvent.RawWriteRequested,
                LinkRequestEvent.DisconnectRequested,
                LinkRequestEvent.TerminationRequested
{
    final class ConnectRequested extends LinkEvent.Base implements LinkRequestEvent {
        private final PeerCandidate peer;

        public ConnectRequested(Instant timestamp, PeerCandidate peer) {
            super(timestamp);
            this.peer = Objects.requireNonNull(peer, "peer");
        }

        public PeerCandidate peer() {
            return peer;
        }
    }

    /** A whole message to chunk and send. Empty means orderly shutdown. */
    final class SendRequested extends LinkEvent.Base implements LinkRequestEvent {
        private final byte[] message;

        public SendRequested(Instant timestamp, byte[] message) {
            super(timestamp);
            this.message = Objects.requireNonNull(message, "message").clone();
        }

        public byte[] message() {
            return message.clone();
        }

        public boolean isShutdownSentinel() {
            return message.length == 0;
        }

        @Override
        public String toString() {
            return "SendRequested[" + message.length + " bytes]";
        }
    }

    /** An already-framed chunk written as-is to Client2Server. */
    final class RawWriteRequested extends LinkEvent.Base implements LinkRequestEvent {
        private final byte[] chunk;

        public RawWriteRequested(Instant timestamp, byte[] chunk) {
            super(timestamp);
            this.chunk = Objects.requireNonNull(chunk, "chunk").clone();
        }

        public byte[] chunk() {
            return chunk.clone();
        }
    }

    final class DisconnectRequested extends LinkEvent.Base implements LinkRequestEvent {
        public DisconnectRequested(Instant timestamp) {
            super(timestamp);
        }
    }

    final class TerminationRequested extends LinkEvent.Base implements LinkRequestEvent {
        public TerminationRequested(Instant timestamp) {
            super(timestamp);
        }
    }
}
