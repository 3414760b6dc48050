package com.questrail.mdoc.codec.impl;

import com.questrail.mdoc.codec.ChunkDecodeResult;
import com.questrail.mdoc.codec.ChunkDecoder;
import com.questrail.mdoc.codec.ChunkReassembly;

import java.util.Objects;

/**
 * Default {@link ChunkDecoder}.
 *
 * <p>A lone {@code [0x00]} with nothing accumulated is the shutdown sentinel.
 * The same chunk arriving after partial payloads simply terminates the
 * message that is being reassembled.</p>
 */
public final class DefaultChunkDecoder implements ChunkDecoder
{
    @Override
    public ChunkDecodeResult decode(ChunkReassembly pending, byte[] chunk) {
        Objects.requireNonNull(pending, "pending");
        Objects.requireNonNull(chunk, "chunk");

        if (chunk.length == 0) {
            return new ChunkDecodeResult.Invalid("Empty chunk, expected a marker byte");
        }

        byte marker = chunk[0];
        if (marker != ChunkFraming.MORE_FOLLOWS && marker != ChunkFraming.LAST_CHUNK) {
            return new ChunkDecodeResult.Invalid(
                    String.format("Invalid chunk marker 0x%02x", marker & 0xff));
        }

        ChunkReassembly next = pending.append(chunk, 1, chunk.length - 1);

        if (marker == ChunkFraming.MORE_FOLLOWS) {
            return new ChunkDecodeResult.Partial(next);
        }

        if (next.size() == 0 && pending.isEmpty()) {
            return new ChunkDecodeResult.Shutdown();
        }

        return new ChunkDecodeResult.Complete(next.join());
    }
}
