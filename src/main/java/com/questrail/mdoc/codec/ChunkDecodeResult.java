package com.questrail.mdoc.codec;

import java.util.Objects;

/**
 * Outcome of feeding one chunk to a {@link ChunkDecoder}.
 */
public sealed interface ChunkDecodeResult
        permits ChunkDecodeResult.Partial,
                ChunkDecodeResult.Complete,
                ChunkDecodeResult.Shutdown,
                ChunkDecodeResult.Invalid
{
    /** More chunks are needed; keep {@code pending} for the next call. */
    record Partial(ChunkReassembly pending) implements ChunkDecodeResult {
        public Partial {
            Objects.requireNonNull(pending, "pending");
        }
    }

    /** A whole message was reassembled. The reassembly restarts empty. */
    record Complete(byte[] message) implements ChunkDecodeResult {
        public Complete {
            Objects.requireNonNull(message, "message");
        }
    }

    /** The peer sent the zero-length shutdown sentinel. */
    record Shutdown() implements ChunkDecodeResult {}

    /** The chunk violates the framing rules. */
    record Invalid(String reason) implements ChunkDecodeResult {
        public Invalid {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
