package com.questrail.mdoc.transport.internal.state;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Entry of the outbound write queue.
 *
 * <p>A whole message is queued as one {@link Chunks} entry that is consumed
 * chunk by chunk, so advancing the queue never copies the chunk list.</p>
 */
public sealed interface OutboundWrite permits OutboundWrite.Chunks, OutboundWrite.Sentinel
{
    /**
     * Characteristic writes still to be issued, starting at {@code next}.
     */
    record Chunks(UUID characteristic, List<byte[]> values, int next) implements OutboundWrite {
        public Chunks {
            Objects.requireNonNull(characteristic, "characteristic");
            values = List.copyOf(values);
            if (next < 0 || next >= values.size()) {
                throw new IllegalArgumentException("next out of range: " + next);
            }
        }

        public static Chunks of(UUID characteristic, List<byte[]> values) {
            return new Chunks(characteristic, values, 0);
        }

        public byte[] head() {
            return values.get(next);
        }

        /** Remaining entry after the head has been written, or {@code null} if none. */
        public Chunks advance() {
            return next + 1 < values.size() ? new Chunks(characteristic, values, next + 1) : null;
        }

        public int remaining() {
            return values.size() - next;
        }
    }

    /** Orderly shutdown marker. Never written to the peer. */
    record Sentinel() implements OutboundWrite {}
}
