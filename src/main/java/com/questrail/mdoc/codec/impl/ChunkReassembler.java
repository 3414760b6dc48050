package com.questrail.mdoc.codec.impl;

import com.questrail.mdoc.codec.ChunkDecodeResult;
import com.questrail.mdoc.codec.ChunkDecoder;
import com.questrail.mdoc.codec.ChunkReassembly;

import java.util.Objects;

/**
 * Stateful reassembler for callers that receive chunks outside the link
 * state machine (reader-side rigs, diagnostics).
 *
 * <p>Not thread-safe. After an {@link ChunkDecodeResult.Invalid} result the
 * stream is unusable and every further call returns the same failure.</p>
 */
public final class ChunkReassembler
{
    private final ChunkDecoder decoder;
    private ChunkReassembly pending = ChunkReassembly.empty();
    private ChunkDecodeResult.Invalid failure;

    public ChunkReassembler() {
        this(new DefaultChunkDecoder());
    }

    public ChunkReassembler(ChunkDecoder decoder) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    public ChunkDecodeResult accept(byte[] chunk) {
        if (failure != null) {
            return failure;
        }

        ChunkDecodeResult result = decoder.decode(pending, chunk);
        if (result instanceof ChunkDecodeResult.Partial partial) {
            pending = partial.pending();
        }
        else if (result instanceof ChunkDecodeResult.Invalid invalid) {
            failure = invalid;
            pending = ChunkReassembly.empty();
        }
        else {
            pending = ChunkReassembly.empty();
        }
        return result;
    }

    /** Payload bytes held for the message currently being reassembled. */
    public int pendingBytes() {
        return pending.size();
    }
}
