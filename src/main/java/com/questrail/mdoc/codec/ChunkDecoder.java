package com.questrail.mdoc.codec;

/**
 * ChunkDecoder
 * -----------------------------------------------------------------------------
 * Folds one received chunk into a partial reassembly.
 *
 * <p>The decoder holds no state of its own. The caller passes the
 * reassembly produced by the previous call (or {@link ChunkReassembly#empty()})
 * and keeps whatever the result carries forward.</p>
 *
 * <p>An {@link ChunkDecodeResult.Invalid} result is fatal for the connection;
 * the decoder does not try to resynchronise.</p>
 */
public interface ChunkDecoder
{
    ChunkDecodeResult decode(ChunkReassembly pending, byte[] chunk);
}
